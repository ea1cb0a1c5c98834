package org.carball.sentinel.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.UnsupportedStatement;
import net.sf.jsqlparser.statement.alter.Alter;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.create.schema.CreateSchema;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.view.AlterView;
import net.sf.jsqlparser.statement.create.view.CreateView;
import net.sf.jsqlparser.statement.drop.Drop;

import java.util.regex.Pattern;

/**
 * Tells schema-definition statements apart from queries.
 *
 * <p>JSqlParser is tried first. Engine-specific DDL it cannot parse, or only accepts as an
 * {@link UnsupportedStatement} (e.g. reflection or VDS statements), falls back to a leading-keyword check.
 */
@Slf4j
public final class StatementClassifier {

    private static final Pattern LEADING_COMMENTS = Pattern.compile("^(\\s*(--[^\\n]*\\n|/\\*.*?\\*/))*\\s*", Pattern.DOTALL);

    private static final Pattern DDL_PREFIX = Pattern.compile(
            "^(CREATE|ALTER|DROP|TRUNCATE)\\b", Pattern.CASE_INSENSITIVE);

    private StatementClassifier() {
        // Utility class - prevent instantiation
    }

    public static boolean isSchemaDefinition(String sql) {
        if (sql == null || sql.isBlank()) {
            return false;
        }
        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            if (isRecognizedDdl(statement)) {
                return true;
            }
            if (statement instanceof UnsupportedStatement) {
                log.debug("Falling back to keyword classification, statement not supported by the parser");
            }
            return hasDdlPrefix(sql);
        } catch (JSQLParserException e) {
            log.debug("Falling back to keyword classification, statement not parseable: {}", e.getMessage());
            return hasDdlPrefix(sql);
        }
    }

    private static boolean isRecognizedDdl(Statement statement) {
        return statement instanceof CreateTable
                || statement instanceof CreateView
                || statement instanceof AlterView
                || statement instanceof Alter
                || statement instanceof Drop
                || statement instanceof CreateIndex
                || statement instanceof CreateSchema;
    }

    static boolean hasDdlPrefix(String sql) {
        String body = LEADING_COMMENTS.matcher(sql).replaceFirst("");
        return DDL_PREFIX.matcher(body).find();
    }
}
