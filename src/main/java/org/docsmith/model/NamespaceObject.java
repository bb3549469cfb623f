package org.docsmith.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A documentation object that can contain other objects (module, class or the root).
 * Namespaces may be opened several times; each opening adds to the same object.
 */
public abstract class NamespaceObject extends DocObject {

    private final List<DocObject> children = new ArrayList<>();

    protected NamespaceObject(Reference namespace, String name) {
        super(namespace, name);
    }

    /**
     * Adds a child. A child already present at the same path is replaced in place,
     * so a redefinition keeps the position of the first definition.
     * @param child The child to add.
     */
    public void addChild(DocObject child) {
        String path = child.path();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).path().equals(path)) {
                children.set(i, child);
                return;
            }
        }
        children.add(child);
    }

    /**
     * Removes this exact child if present.
     * @param child The child to remove.
     * @return {@code true} if it was a child.
     */
    public boolean removeChild(DocObject child) {
        return children.removeIf(existing -> existing == child);
    }

    /**
     * @return The children in insertion order.
     */
    public List<DocObject> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Finds a direct child by name.
     * @param name The simple name.
     * @return The child if present.
     */
    public Optional<DocObject> child(String name) {
        return children.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
