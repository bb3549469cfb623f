package org.docsmith.frontend.context;

import org.docsmith.model.DocObject;
import org.docsmith.model.NamespaceObject;
import org.docsmith.model.Scope;

import java.util.Objects;

/**
 * How a handler wants the nested block of its statement to be parsed.
 *
 * @param namespace The namespace to enter, or {@code null} to stay in the current one.
 * @param scope     The scope inside the block; only applied when a namespace is entered.
 * @param owner     The owner inside the block, or {@code null} to use the namespace.
 */
public record BlockOptions(
        NamespaceObject namespace,
        Scope scope,
        DocObject owner
) {

    public BlockOptions {
        Objects.requireNonNull(scope, "scope");
    }

    /**
     * @return Options that keep the current namespace and reset the owner to it.
     */
    public static BlockOptions defaults() {
        return new BlockOptions(null, Scope.INSTANCE, null);
    }

    /**
     * @param namespace The namespace to enter.
     * @return Options entering the namespace in instance scope.
     */
    public static BlockOptions inNamespace(NamespaceObject namespace) {
        return new BlockOptions(namespace, Scope.INSTANCE, null);
    }

    /**
     * @param namespace The namespace to enter.
     * @param scope     The scope inside the block.
     * @return Options entering the namespace in the given scope.
     */
    public static BlockOptions inNamespace(NamespaceObject namespace, Scope scope) {
        return new BlockOptions(namespace, scope, null);
    }

    /**
     * @param owner The owner of the block, e.g. the method whose body is parsed.
     * @return Options keeping the namespace but changing the owner.
     */
    public static BlockOptions ownedBy(DocObject owner) {
        return new BlockOptions(null, Scope.INSTANCE, owner);
    }
}
