package org.docsmith;

import com.typesafe.config.Config;
import org.docsmith.config.HandlerSettings;
import org.docsmith.diagnostics.DiagnosticsEngine;
import org.docsmith.frontend.context.TraversalContext;
import org.docsmith.frontend.handler.HandlerRegistry;
import org.docsmith.frontend.parser.Statement;
import org.docsmith.frontend.processor.ForwardReferenceResolver;
import org.docsmith.frontend.processor.StatementProcessor;
import org.docsmith.frontend.processor.StatementStreamParser;
import org.docsmith.model.DocObject;
import org.docsmith.model.DocRegistry;
import org.docsmith.model.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the handler layer over a set of already tokenized files.
 * <p>
 * Files are parsed in the given order. When a handler references an object that
 * is not known yet, the engine parses the next pending file before the reference
 * is retried, so a definition in a later file can still be found.
 */
public class DocumentationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentationEngine.class);

    private final DocRegistry registry = new DocRegistry();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final StatementProcessor processor;

    private final Map<String, List<Statement>> sources = new LinkedHashMap<>();
    private final Deque<String> pending = new ArrayDeque<>();

    /**
     * @param handlers The handlers to dispatch to.
     * @param settings The handler settings.
     */
    public DocumentationEngine(HandlerRegistry handlers, HandlerSettings settings) {
        ForwardReferenceResolver resolver =
                new ForwardReferenceResolver(registry, settings, this::loadNextPending, diagnostics);
        this.processor = new StatementProcessor(handlers, registry, resolver, diagnostics);
    }

    /**
     * Creates an engine with the handlers discovered on the classpath.
     * @param config The loaded configuration.
     * @return A new engine.
     */
    public static DocumentationEngine fromConfig(Config config) {
        HandlerRegistry handlers = HandlerRegistry.discover(Thread.currentThread().getContextClassLoader());
        return new DocumentationEngine(handlers, HandlerSettings.fromConfig(config));
    }

    /**
     * Parses a set of files. Files already parsed by an earlier call are parsed again.
     * @param files Statements per file name, in the preferred parse order.
     */
    public void parseAll(Map<String, List<Statement>> files) {
        sources.putAll(files);
        pending.addAll(files.keySet());
        while (!pending.isEmpty()) {
            parseFile(pending.poll());
        }
    }

    /**
     * Parses a single file.
     * @param file       The file name.
     * @param statements Its statements.
     * @return The objects returned for the top-level statements.
     */
    public List<DocObject> parse(String file, List<Statement> statements) {
        sources.put(file, statements);
        pending.remove(file);
        return parseFile(file);
    }

    private List<DocObject> parseFile(String file) {
        List<Statement> statements = sources.get(file);
        LOG.debug("Parsing {} ({} statements)", file, statements.size());
        StatementStreamParser parser = new StatementStreamParser(file, processor);
        return parser.parseStatements(statements, new TraversalContext(registry.root()));
    }

    private boolean loadNextPending(Reference.Unresolved missing, int attempt) {
        String next = pending.poll();
        if (next == null) {
            return false;
        }
        LOG.debug("Parsing {} early while looking for {} (attempt {})", next, missing.path(), attempt);
        parseFile(next);
        return true;
    }

    /**
     * @return The registry of documentation objects built so far.
     */
    public DocRegistry getRegistry() {
        return registry;
    }

    /**
     * @return The diagnostics collected so far.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
