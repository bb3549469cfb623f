package org.docsmith.frontend.processor;

import org.docsmith.diagnostics.DiagnosticsEngine;
import org.docsmith.frontend.context.BlockOptions;
import org.docsmith.frontend.context.TraversalContext;
import org.docsmith.frontend.handler.HandlerContext;
import org.docsmith.frontend.handler.HandlerDescriptor;
import org.docsmith.frontend.handler.HandlerRegistry;
import org.docsmith.frontend.handler.UndocumentableException;
import org.docsmith.frontend.handler.UnimplementedHandlerException;
import org.docsmith.frontend.parser.SourceParser;
import org.docsmith.frontend.parser.Statement;
import org.docsmith.model.DocObject;
import org.docsmith.model.DocRegistry;
import org.docsmith.model.NamespaceObject;
import org.docsmith.model.Scope;
import org.docsmith.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs the matching handlers for each statement and post-processes what they produce.
 * <p>
 * Unrecognized statements are skipped silently. A handler that was declared without a
 * processing routine, or that rejects its statement as undocumentable, only loses
 * that one statement; the traversal carries on.
 */
public class StatementProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(StatementProcessor.class);

    private final HandlerRegistry handlers;
    private final String family;
    private final DocRegistry registry;
    private final ForwardReferenceResolver resolver;
    private final DiagnosticsEngine diagnostics;

    /**
     * Creates a processor for the default handler family.
     * @param handlers    The handler registry.
     * @param registry    Receives every registered object.
     * @param resolver    Checks references of registered objects.
     * @param diagnostics Receives handler failures.
     */
    public StatementProcessor(HandlerRegistry handlers, DocRegistry registry,
                              ForwardReferenceResolver resolver, DiagnosticsEngine diagnostics) {
        this(handlers, HandlerRegistry.DEFAULT_FAMILY, registry, resolver, diagnostics);
    }

    /**
     * Creates a processor for one handler family.
     * @param handlers    The handler registry.
     * @param family      The family whose handlers are dispatched to.
     * @param registry    Receives every registered object.
     * @param resolver    Checks references of registered objects.
     * @param diagnostics Receives handler failures.
     */
    public StatementProcessor(HandlerRegistry handlers, String family, DocRegistry registry,
                              ForwardReferenceResolver resolver, DiagnosticsEngine diagnostics) {
        this.handlers = handlers;
        this.family = family;
        this.registry = registry;
        this.resolver = resolver;
        this.diagnostics = diagnostics;
    }

    /**
     * Processes one statement.
     * @param statement The statement.
     * @param context   The traversal state; handlers may change it.
     * @param parser    The parser of the current file, used to recurse into nested blocks.
     * @return Everything the matching handlers returned, in handler order.
     */
    public List<DocObject> process(Statement statement, TraversalContext context, SourceParser parser) {
        List<HandlerDescriptor> matching = handlers.select(family, statement);
        if (matching.isEmpty()) {
            LOG.trace("No handler for statement at {}:{}", parser.currentFile(), statement.line());
            return List.of();
        }

        List<DocObject> produced = new ArrayList<>();
        for (HandlerDescriptor descriptor : matching) {
            Invocation invocation = new Invocation(descriptor.name(), statement, context, parser);
            try {
                produced.addAll(descriptor.process(invocation));
            } catch (UnimplementedHandlerException e) {
                LOG.error("{}:{}: {}", parser.currentFile(), statement.line(), e.getMessage());
                diagnostics.reportUnimplemented(descriptor.name(), e.getMessage(), parser.currentFile(), statement.line());
            } catch (UndocumentableException e) {
                LOG.warn("in {}: Undocumentable {}\n\tin file '{}':{}",
                        descriptor.name(), e.getMessage(), parser.currentFile(), statement.line());
                diagnostics.reportUndocumentable(descriptor.name(), statement.text(), "Undocumentable " + e.getMessage(),
                        parser.currentFile(), statement.line());
            }
        }
        return produced;
    }

    /**
     * The view a single handler gets of a single statement.
     */
    private final class Invocation implements HandlerContext {

        private final String handler;
        private final Statement statement;
        private final TraversalContext context;
        private final SourceParser parser;

        Invocation(String handler, Statement statement, TraversalContext context, SourceParser parser) {
            this.handler = handler;
            this.statement = statement;
            this.context = context;
            this.parser = parser;
        }

        @Override
        public Statement statement() {
            return statement;
        }

        @Override
        public String currentFile() {
            return parser.currentFile();
        }

        @Override public NamespaceObject namespace() { return context.namespace(); }
        @Override public void setNamespace(NamespaceObject namespace) { context.setNamespace(namespace); }
        @Override public DocObject owner() { return context.owner(); }
        @Override public void setOwner(DocObject owner) { context.setOwner(owner); }
        @Override public Visibility visibility() { return context.visibility(); }
        @Override public void setVisibility(Visibility visibility) { context.setVisibility(visibility); }
        @Override public Scope scope() { return context.scope(); }
        @Override public void setScope(Scope scope) { context.setScope(scope); }

        @Override
        public <T extends DocObject> T register(T object) {
            return register(object, o -> { });
        }

        @Override
        public <T extends DocObject> T register(T object, Consumer<? super T> customizer) {
            resolver.verifyLoaded(object, handler, parser.currentFile(), statement.line());
            customizer.accept(object);
            stamp(object);
            registry.register(object);
            return object;
        }

        @Override
        public List<DocObject> register(DocObject... objects) {
            List<DocObject> registered = new ArrayList<>(objects.length);
            for (DocObject object : objects) {
                registered.add(register(object));
            }
            return registered;
        }

        private void stamp(DocObject object) {
            String file = parser.currentFile();
            int line = statement.line();
            if (object instanceof NamespaceObject) {
                // Namespaces are reopened; only a documented opening moves their location.
                if (statement.hasDocstring()) {
                    object.setFile(file);
                    object.setLine(line);
                } else {
                    if (object.file() == null) {
                        object.setFile(file);
                    }
                    if (object.line() == null) {
                        object.setLine(line);
                    }
                }
            } else {
                object.setFile(file);
                object.setLine(line);
                if (object.source() == null) {
                    object.setSource(statement);
                }
            }
            if (statement.hasDocstring()) {
                object.setDocstring(statement.docstring());
            }
            object.setDynamic(context.isDynamic());
        }

        @Override
        public void parseBlock(BlockOptions options) {
            TraversalContext.Frame saved = null;
            if (options.namespace() != null) {
                saved = context.snapshot();
                context.setNamespace(options.namespace());
                context.setVisibility(Visibility.PUBLIC);
                context.setScope(options.scope());
            }
            context.setOwner(options.owner() != null ? options.owner() : context.namespace());
            try {
                if (statement.hasBlock()) {
                    parser.parse(statement.block(), context);
                }
            } finally {
                if (saved != null) {
                    // The owner returns to the namespace, not to whatever owned the block statement.
                    context.restore(saved.ownedByNamespace());
                }
            }
        }

        @Override
        public DocRegistry registry() {
            return registry;
        }

        @Override
        public DiagnosticsEngine getDiagnostics() {
            return diagnostics;
        }
    }
}
