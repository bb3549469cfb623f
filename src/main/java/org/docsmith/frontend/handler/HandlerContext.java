package org.docsmith.frontend.handler;

import org.docsmith.diagnostics.DiagnosticsEngine;
import org.docsmith.frontend.context.BlockOptions;
import org.docsmith.frontend.lexer.Token;
import org.docsmith.frontend.literal.KindFilter;
import org.docsmith.frontend.literal.LiteralExtractor;
import org.docsmith.frontend.literal.LiteralListParser;
import org.docsmith.frontend.literal.LiteralValue;
import org.docsmith.frontend.parser.Statement;
import org.docsmith.model.DocObject;
import org.docsmith.model.DocRegistry;
import org.docsmith.model.NamespaceObject;
import org.docsmith.model.Scope;
import org.docsmith.model.Visibility;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * What a handler sees while it processes one statement.
 * This interface decouples handlers from the concrete statement processor.
 */
public interface HandlerContext {

    /**
     * @return The statement being processed.
     */
    Statement statement();

    /**
     * @return The file the statement comes from.
     */
    String currentFile();

    NamespaceObject namespace();

    void setNamespace(NamespaceObject namespace);

    DocObject owner();

    void setOwner(DocObject owner);

    Visibility visibility();

    void setVisibility(Visibility visibility);

    Scope scope();

    void setScope(Scope scope);

    /**
     * Registers a produced object: resolves its references, stamps file, line,
     * source and docstring, marks it dynamic when registered inside a
     * non-namespace body and stores it in the registry.
     *
     * @param object The object.
     * @param <T>    The object type.
     * @return The same object, for chaining.
     */
    <T extends DocObject> T register(T object);

    /**
     * Like {@link #register(DocObject)}, but lets the handler adjust the object after
     * its references are checked and before provenance is stamped.
     *
     * @param object     The object.
     * @param customizer Callback applied to the object.
     * @param <T>        The object type.
     * @return The same object, for chaining.
     */
    <T extends DocObject> T register(T object, Consumer<? super T> customizer);

    /**
     * Registers several objects.
     * @param objects The objects.
     * @return The objects in the given order.
     */
    List<DocObject> register(DocObject... objects);

    /**
     * Parses the nested block of the current statement. When a namespace is given the
     * namespace, visibility and scope are switched for the block and restored afterwards.
     *
     * @param options Where the block lives.
     */
    void parseBlock(BlockOptions options);

    /**
     * Parses the nested block in the current namespace.
     */
    default void parseBlock() {
        parseBlock(BlockOptions.defaults());
    }

    /**
     * @return The registry of all documentation objects.
     */
    DocRegistry registry();

    /**
     * @return The diagnostics engine of the run.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * @see LiteralExtractor#extract(Token, KindFilter...)
     */
    default Optional<LiteralValue> extractLiteral(Token token, KindFilter... filters) {
        return LiteralExtractor.extract(token, filters);
    }

    /**
     * @see LiteralListParser#parse(List, KindFilter...)
     */
    default List<LiteralValue> extractLiteralList(List<Token> tokens, KindFilter... filters) {
        return LiteralListParser.parse(tokens, filters);
    }
}
