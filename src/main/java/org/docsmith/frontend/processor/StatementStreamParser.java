package org.docsmith.frontend.processor;

import org.docsmith.frontend.context.TraversalContext;
import org.docsmith.frontend.parser.SourceParser;
import org.docsmith.frontend.parser.Statement;
import org.docsmith.model.DocObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Default {@link SourceParser}: hands the statements of one file to a
 * {@link StatementProcessor} one after the other, depth first.
 */
public class StatementStreamParser implements SourceParser {

    private final String file;
    private final StatementProcessor processor;

    /**
     * @param file      The file the statements come from.
     * @param processor The processor to dispatch statements to.
     */
    public StatementStreamParser(String file, StatementProcessor processor) {
        this.file = file;
        this.processor = processor;
    }

    @Override
    public String currentFile() {
        return file;
    }

    @Override
    public void parse(List<Statement> statements, TraversalContext context) {
        parseStatements(statements, context);
    }

    /**
     * Parses top-level statements and collects what the handlers returned for them.
     * Objects produced inside nested blocks are registered but not returned.
     * @param statements The statements.
     * @param context    The traversal context of this file.
     * @return The objects returned for the given statements.
     */
    public List<DocObject> parseStatements(List<Statement> statements, TraversalContext context) {
        List<DocObject> produced = new ArrayList<>();
        for (Statement statement : statements) {
            produced.addAll(processor.process(statement, context, this));
        }
        return produced;
    }
}
