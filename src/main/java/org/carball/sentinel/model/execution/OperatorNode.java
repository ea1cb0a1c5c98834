package org.carball.sentinel.model.execution;

/**
 * One operator of an execution plan with its observed row counts. Row counts are null when unknown.
 */
public record OperatorNode(
        String operatorId,
        OperatorType type,
        Long inputRows,
        Long outputRows
) {}
