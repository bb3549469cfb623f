package org.docsmith.frontend.processor;

import org.docsmith.config.HandlerSettings;
import org.docsmith.diagnostics.DiagnosticsEngine;
import org.docsmith.model.DocObject;
import org.docsmith.model.DocRegistry;
import org.docsmith.model.NamespaceObject;
import org.docsmith.model.Reference;
import org.docsmith.model.ReferenceHolder.ReferenceRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checks the namespace and superclass references of an object about to be registered.
 * <p>
 * A reference to an object that was not parsed yet is retried a bounded number of
 * times, each retry preceded by a {@link LoadOrderRecovery} attempt. When retries are
 * exhausted the reference is deferred in the {@link DocRegistry} and a warning is
 * emitted, unless it names a well-known built-in. Nothing is thrown.
 */
public class ForwardReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardReferenceResolver.class);

    /**
     * Outcome of checking one reference.
     */
    public enum Resolution {
        /** The reference already pointed at a known object. */
        ALREADY_RESOLVED,
        /** The target was found, possibly after recovery, and the reference rewritten. */
        RESOLVED,
        /** The target is a well-known built-in; left as is without a diagnostic. */
        BUILTIN,
        /** The target is unknown; the reference was deferred and a warning emitted. */
        SPECULATIVE,
        /** Load-order checking is disabled. */
        SKIPPED
    }

    private final DocRegistry registry;
    private final HandlerSettings settings;
    private final LoadOrderRecovery recovery;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param registry    The registry used to look targets up and to defer references.
     * @param settings    Retry limit, built-ins and the on/off switch.
     * @param recovery    Called before each retry.
     * @param diagnostics Receives the warnings for unresolved references.
     */
    public ForwardReferenceResolver(DocRegistry registry, HandlerSettings settings,
                                    LoadOrderRecovery recovery, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.settings = settings;
        this.recovery = recovery;
        this.diagnostics = diagnostics;
    }

    /**
     * Checks every reference the object holds.
     * @param object      The object about to be registered.
     * @param handler     The handler registering the object, reported with any warning.
     * @param currentFile The file being parsed.
     * @param line        The line of the statement that produced the object.
     * @return The outcome per reference role.
     */
    public Map<ReferenceRole, Resolution> verifyLoaded(DocObject object, String handler, String currentFile, int line) {
        Map<ReferenceRole, Resolution> outcome = new EnumMap<>(ReferenceRole.class);
        for (Map.Entry<ReferenceRole, Reference> entry : object.references().entrySet()) {
            outcome.put(entry.getKey(), resolve(object, entry.getKey(), entry.getValue(), handler, currentFile, line));
        }
        return outcome;
    }

    private Resolution resolve(DocObject holder, ReferenceRole role, Reference reference,
                               String handler, String currentFile, int line) {
        if (!settings.loadOrderErrors()) {
            return Resolution.SKIPPED;
        }
        if (!(reference instanceof Reference.Unresolved missing)) {
            return Resolution.ALREADY_RESOLVED;
        }

        Optional<DocObject> target = registry.lookup(missing.path());
        int retries = 0;
        while (target.isEmpty() && retries < settings.maxRetries()) {
            retries++;
            LOG.debug("{} {} referenced by {} is not loaded yet, retry {}/{}",
                    missing.type(), missing.path(), holder.name(), retries, settings.maxRetries());
            if (!recovery.recover(missing, retries)) {
                break;
            }
            target = registry.lookup(missing.path());
        }

        if (target.isPresent()) {
            DocObject resolved = target.get();
            holder.rewriteReference(role, Reference.to(resolved));
            if (role == ReferenceRole.NAMESPACE && resolved instanceof NamespaceObject ns) {
                ns.addChild(holder);
            }
            return Resolution.RESOLVED;
        }

        if (settings.isBuiltin(missing.path())) {
            LOG.debug("Leaving built-in {} {} unresolved", missing.type(), missing.path());
            return Resolution.BUILTIN;
        }

        registry.defer(missing.path(), holder, role);
        LOG.warn("The {} {} has not yet been recognized.", missing.type(), missing.path());
        LOG.warn("If this class/method is part of your source tree, this will affect your documentation results.");
        LOG.warn("You can correct this issue by loading the source file for this object before `{}'", currentFile);
        diagnostics.reportUnresolved(handler, missing.type(), missing.path(), currentFile, line);
        return Resolution.SPECULATIVE;
    }
}
