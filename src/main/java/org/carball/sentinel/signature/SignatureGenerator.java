package org.carball.sentinel.signature;

import org.carball.sentinel.config.ThresholdConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes SQL text into a literal-free canonical form and derives a {@link Signature} from it.
 *
 * <p>Tokenization rule: a string literal is a single-quoted run in which a doubled quote ({@code ''})
 * or a backslash-escaped character does not terminate the literal. Double-quoted text is an
 * identifier and is kept. Numeric literals are integers, decimals (including a leading-dot form such
 * as {@code .5}) and exponent forms that are not glued to an identifier character ({@code t1},
 * {@code col_2}, {@code t.1} stay intact). Literals inside comments are replaced like any other.
 *
 * <p>Signatures are the SHA-256 digest of the normalized text, hex encoded and truncated to the
 * configured length. Shorter signatures increase the chance that unrelated queries collide;
 * collisions are not detected.
 */
public class SignatureGenerator {

    public static final String PLACEHOLDER = "?";

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^'\\\\]|''|\\\\.)*'", Pattern.DOTALL);

    private static final Pattern NUMERIC_LITERAL = Pattern.compile(
            "(?<![A-Za-z0-9_$.])\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?(?![A-Za-z0-9_$])"
                    + "|(?<![A-Za-z0-9_$])\\.\\d+(?:[eE][+-]?\\d+)?(?![A-Za-z0-9_$])");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int signatureLength;

    public SignatureGenerator() {
        this(ThresholdConfig.createDefaults().getSignatureLength());
    }

    public SignatureGenerator(int signatureLength) {
        if (signatureLength < ThresholdConfig.MIN_SIGNATURE_LENGTH || signatureLength > ThresholdConfig.MAX_SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("Signature length must be between "
                    + ThresholdConfig.MIN_SIGNATURE_LENGTH + " and " + ThresholdConfig.MAX_SIGNATURE_LENGTH
                    + ", got " + signatureLength);
        }
        this.signatureLength = signatureLength;
    }

    public Signature computeSignature(String sql) {
        String normalized = normalize(sql);
        return new Signature(digest(normalized).substring(0, signatureLength));
    }

    /**
     * Returns the canonical form used for hashing.
     */
    public String normalize(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("SQL text must not be blank");
        }
        String normalized = stripStringLiterals(sql);
        normalized = NUMERIC_LITERAL.matcher(normalized).replaceAll(PLACEHOLDER);
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();
        return normalized.toUpperCase(Locale.ROOT);
    }

    /**
     * Replaces string literals only, keeping case, numbers and layout.
     */
    public static String stripStringLiterals(String sql) {
        return STRING_LITERAL.matcher(sql).replaceAll(PLACEHOLDER);
    }

    public int getSignatureLength() {
        return signatureLength;
    }

    private static String digest(String normalized) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
