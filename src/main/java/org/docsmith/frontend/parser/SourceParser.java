package org.docsmith.frontend.parser;

import org.docsmith.frontend.context.TraversalContext;

import java.util.List;

/**
 * The parser that feeds statements of one file to the handler layer.
 * Handlers re-enter it through {@code parseBlock} to process nested blocks.
 */
public interface SourceParser {

    /**
     * @return The file whose statements are being parsed.
     */
    String currentFile();

    /**
     * Processes a sequence of statements under the given context.
     * @param statements The statements, in source order.
     * @param context    The traversal context to process them in.
     */
    void parse(List<Statement> statements, TraversalContext context);
}
