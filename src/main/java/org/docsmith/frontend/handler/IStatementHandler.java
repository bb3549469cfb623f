package org.docsmith.frontend.handler;

import org.docsmith.model.DocObject;

import java.util.List;

/**
 * Converts one kind of statement into documentation objects.
 * Implementations are stateless; everything they need is reachable through the context.
 */
@FunctionalInterface
public interface IStatementHandler {

    /**
     * Processes the current statement.
     *
     * @param context The view of the statement, the traversal state and the processing operations.
     * @return The objects produced, usually the return value of {@link HandlerContext#register}.
     *         Never {@code null}; return an empty list if nothing was produced.
     * @throws UndocumentableException if the statement cannot be documented.
     */
    List<? extends DocObject> process(HandlerContext context) throws UndocumentableException;
}
