package org.docsmith.frontend.context;

import org.docsmith.model.ClassObject;
import org.docsmith.model.MethodObject;
import org.docsmith.model.Reference;
import org.docsmith.model.RootObject;
import org.docsmith.model.Scope;
import org.docsmith.model.Visibility;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TraversalContext} and {@link BlockOptions}.
 */
public class TraversalContextTest {

    /**
     * Verifies the state of a fresh context: in the root, owned by the root, public instance scope.
     */
    @Test
    @Tag("unit")
    void testInitialState() {
        RootObject root = new RootObject();
        TraversalContext context = new TraversalContext(root);

        assertThat(context.namespace()).isSameAs(root);
        assertThat(context.owner()).isSameAs(root);
        assertThat(context.visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(context.scope()).isEqualTo(Scope.INSTANCE);
        assertThat(context.isDynamic()).isFalse();
    }

    /**
     * Verifies that a snapshot survives later changes and restores every field.
     */
    @Test
    @Tag("unit")
    void testSnapshotAndRestore() {
        RootObject root = new RootObject();
        TraversalContext context = new TraversalContext(root);
        TraversalContext.Frame saved = context.snapshot();

        ClassObject foo = new ClassObject(Reference.to(root), "Foo");
        MethodObject bar = new MethodObject(Reference.to(foo), "bar", Scope.INSTANCE);
        context.setNamespace(foo);
        context.setOwner(bar);
        context.setVisibility(Visibility.PRIVATE);
        context.setScope(Scope.CLASS);
        assertThat(context.isDynamic()).isTrue();

        context.restore(saved);

        assertThat(context.snapshot()).isEqualTo(saved);
        assertThat(context.isDynamic()).isFalse();
    }

    /**
     * Verifies that a frame can be reset to be owned by its own namespace.
     */
    @Test
    @Tag("unit")
    void testFrameOwnedByNamespace() {
        RootObject root = new RootObject();
        MethodObject main = new MethodObject(Reference.to(root), "main", Scope.INSTANCE);
        TraversalContext.Frame frame = new TraversalContext.Frame(root, main, Visibility.PRIVATE, Scope.CLASS);

        assertThat(frame.ownedByNamespace())
                .isEqualTo(new TraversalContext.Frame(root, root, Visibility.PRIVATE, Scope.CLASS));
    }

    /**
     * Verifies that the context refuses {@code null} state.
     */
    @Test
    @Tag("unit")
    void testRejectsNull() {
        TraversalContext context = new TraversalContext(new RootObject());

        assertThatThrownBy(() -> context.setNamespace(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> context.setVisibility(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new BlockOptions(null, null, null)).isInstanceOf(NullPointerException.class);
    }

    /**
     * Verifies the factory methods of {@link BlockOptions}.
     */
    @Test
    @Tag("unit")
    void testBlockOptionFactories() {
        RootObject root = new RootObject();
        ClassObject foo = new ClassObject(Reference.to(root), "Foo");

        assertThat(BlockOptions.defaults()).isEqualTo(new BlockOptions(null, Scope.INSTANCE, null));
        assertThat(BlockOptions.inNamespace(foo, Scope.CLASS)).isEqualTo(new BlockOptions(foo, Scope.CLASS, null));
        assertThat(BlockOptions.ownedBy(foo).namespace()).isNull();
        assertThat(BlockOptions.ownedBy(foo).owner()).isSameAs(foo);
    }
}
