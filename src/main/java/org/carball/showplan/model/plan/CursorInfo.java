package org.carball.showplan.model.plan;

/**
 * Cursor attributes attached to every statement produced from one cursor operation.
 */
public record CursorInfo(
        String cursorName,
        String operationType,
        String actualType,
        String requestedType,
        String concurrency,
        boolean forwardOnly
) {}
