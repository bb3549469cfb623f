package org.docsmith.model;

import org.docsmith.model.ReferenceHolder.ReferenceRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Path-keyed store of all documentation objects produced during a run.
 * <p>
 * References that could not be resolved when their holder was registered can be
 * deferred here; they are rewritten as soon as an object with the awaited path
 * is registered.
 */
public class DocRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DocRegistry.class);

    private RootObject root = new RootObject();
    private final Map<String, DocObject> objects = new LinkedHashMap<>();
    private final Map<String, List<DeferredReference>> deferred = new LinkedHashMap<>();

    /**
     * A reference waiting for its target to appear.
     * @param holder The object holding the reference.
     * @param role   The role of the reference on the holder.
     */
    public record DeferredReference(DocObject holder, ReferenceRole role) {}

    /**
     * @return The root namespace.
     */
    public RootObject root() {
        return root;
    }

    /**
     * Stores an object under its path, links it into its namespace and adopts any
     * references that were waiting for this path. An object previously stored at the
     * same path is dropped from the index and from its namespace.
     * @param object The object to store.
     */
    public void register(DocObject object) {
        String path = object.path();
        DocObject previous = objects.put(path, object);
        if (previous != null && previous != object) {
            LOG.debug("Replacing {} with a new definition", previous);
            if (previous.namespace() instanceof Reference.Resolved resolved
                    && resolved.target() instanceof NamespaceObject parent) {
                parent.removeChild(previous);
            }
        }
        if (object.namespace() instanceof Reference.Resolved resolved
                && resolved.target() instanceof NamespaceObject parent) {
            parent.addChild(object);
        }
        adoptDeferred(object);
    }

    /**
     * Looks up an object by path. The empty path denotes the root.
     * @param path The path.
     * @return The object if known.
     */
    public Optional<DocObject> lookup(String path) {
        if (path == null) {
            return Optional.empty();
        }
        if (path.isEmpty()) {
            return Optional.of(root);
        }
        return Optional.ofNullable(objects.get(path));
    }

    /**
     * Records that a reference of {@code holder} waits for an object at {@code path}.
     * @param path   The awaited path.
     * @param holder The object holding the reference.
     * @param role   The role of the reference.
     */
    public void defer(String path, DocObject holder, ReferenceRole role) {
        deferred.computeIfAbsent(path, p -> new ArrayList<>()).add(new DeferredReference(holder, role));
    }

    /**
     * @param path The awaited path.
     * @return The references still waiting for that path.
     */
    public List<DeferredReference> deferredFor(String path) {
        return Collections.unmodifiableList(deferred.getOrDefault(path, List.of()));
    }

    /**
     * @return All registered objects in registration order, the root excluded.
     */
    public Collection<DocObject> all() {
        return Collections.unmodifiableCollection(objects.values());
    }

    /**
     * Removes all objects and deferred references and starts over with an empty root.
     */
    public void clear() {
        root = new RootObject();
        objects.clear();
        deferred.clear();
    }

    private void adoptDeferred(DocObject target) {
        List<DeferredReference> waiting = deferred.remove(target.path());
        if (waiting == null) {
            return;
        }
        for (DeferredReference ref : waiting) {
            ref.holder().rewriteReference(ref.role(), Reference.to(target));
            if (ref.role() == ReferenceRole.NAMESPACE && target instanceof NamespaceObject ns) {
                ns.addChild(ref.holder());
            }
            LOG.debug("Resolved deferred {} reference of {} to {}", ref.role(), ref.holder(), target);
        }
    }
}
