package org.docsmith.model;

import org.docsmith.frontend.parser.Statement;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of all documentation objects. An object is identified by its path,
 * built from the path of its namespace and its own name.
 * <p>
 * Provenance ({@code file}, {@code line}, {@code source}), the docstring and the
 * {@code dynamic} flag are filled in when a handler registers the object.
 */
public abstract class DocObject implements ReferenceHolder {

    /** Separator between a namespace path and a nested name. */
    public static final String NAMESPACE_SEPARATOR = "::";

    private final String name;
    private Reference namespace;
    private String file;
    private Integer line;
    private String docstring;
    private Statement source;
    private boolean dynamic;

    /**
     * @param namespace Reference to the lexical container, {@code null} only for the root.
     * @param name      The simple name.
     */
    protected DocObject(Reference namespace, String name) {
        this.namespace = namespace;
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * @return A short type name such as "class" or "method".
     */
    public abstract String type();

    /**
     * @return The separator placed between the namespace path and this object's name.
     */
    protected String separator() {
        return NAMESPACE_SEPARATOR;
    }

    /**
     * @return The fully qualified path of this object.
     */
    public String path() {
        String parent = namespace == null ? "" : namespace.path();
        return parent.isEmpty() ? name : parent + separator() + name;
    }

    @Override
    public Map<ReferenceRole, Reference> references() {
        Map<ReferenceRole, Reference> refs = new EnumMap<>(ReferenceRole.class);
        if (namespace != null) {
            refs.put(ReferenceRole.NAMESPACE, namespace);
        }
        return refs;
    }

    @Override
    public void rewriteReference(ReferenceRole role, Reference reference) {
        if (role != ReferenceRole.NAMESPACE) {
            throw new IllegalArgumentException(type() + " " + path() + " holds no " + role + " reference");
        }
        this.namespace = reference;
    }

    public String name() { return name; }
    public Reference namespace() { return namespace; }
    public String file() { return file; }
    public void setFile(String file) { this.file = file; }
    public Integer line() { return line; }
    public void setLine(Integer line) { this.line = line; }
    public String docstring() { return docstring; }
    public void setDocstring(String docstring) { this.docstring = docstring; }
    public Statement source() { return source; }
    public void setSource(Statement source) { this.source = source; }
    public boolean isDynamic() { return dynamic; }
    public void setDynamic(boolean dynamic) { this.dynamic = dynamic; }

    @Override
    public String toString() {
        return type() + " " + path();
    }
}
