package org.docsmith.frontend.context;

import org.docsmith.model.DocObject;
import org.docsmith.model.NamespaceObject;
import org.docsmith.model.Scope;
import org.docsmith.model.Visibility;

import java.util.Objects;

/**
 * Mutable state of one parse: where the statement being handled lives.
 * <p>
 * {@code namespace} is the nearest enclosing module or class, {@code owner} the
 * nearest enclosing container of any kind. They differ only inside bodies that
 * are not namespaces themselves, such as a method body. Handlers change the
 * context in place (e.g. a {@code private} statement sets the visibility);
 * block recursion saves and restores it with {@link #snapshot()} and
 * {@link #restore(Frame)}.
 */
public class TraversalContext {

    private NamespaceObject namespace;
    private DocObject owner;
    private Visibility visibility;
    private Scope scope;

    /**
     * Saved state of a context.
     * @param namespace  The namespace.
     * @param owner      The owner.
     * @param visibility The visibility.
     * @param scope      The scope.
     */
    public record Frame(NamespaceObject namespace, DocObject owner, Visibility visibility, Scope scope) {

        /**
         * @return This frame with the owner reset to its namespace.
         */
        public Frame ownedByNamespace() {
            return new Frame(namespace, namespace, visibility, scope);
        }
    }

    /**
     * Creates a context positioned at the top of a file.
     * @param root The namespace statements start in, usually the registry root.
     */
    public TraversalContext(NamespaceObject root) {
        this.namespace = Objects.requireNonNull(root, "root");
        this.owner = root;
        this.visibility = Visibility.PUBLIC;
        this.scope = Scope.INSTANCE;
    }

    /**
     * @return The current state.
     */
    public Frame snapshot() {
        return new Frame(namespace, owner, visibility, scope);
    }

    /**
     * Restores a previously saved state.
     * @param frame The saved state.
     */
    public void restore(Frame frame) {
        this.namespace = frame.namespace();
        this.owner = frame.owner();
        this.visibility = frame.visibility();
        this.scope = frame.scope();
    }

    /**
     * @return {@code true} while inside a body that is not itself a namespace.
     */
    public boolean isDynamic() {
        return owner != namespace;
    }

    public NamespaceObject namespace() { return namespace; }
    public void setNamespace(NamespaceObject namespace) { this.namespace = Objects.requireNonNull(namespace, "namespace"); }
    public DocObject owner() { return owner; }
    public void setOwner(DocObject owner) { this.owner = Objects.requireNonNull(owner, "owner"); }
    public Visibility visibility() { return visibility; }
    public void setVisibility(Visibility visibility) { this.visibility = Objects.requireNonNull(visibility, "visibility"); }
    public Scope scope() { return scope; }
    public void setScope(Scope scope) { this.scope = Objects.requireNonNull(scope, "scope"); }

    @Override
    public String toString() {
        return String.format("TraversalContext[namespace=%s, owner=%s, visibility=%s, scope=%s]",
                namespace, owner, visibility, scope);
    }
}
