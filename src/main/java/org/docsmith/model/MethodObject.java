package org.docsmith.model;

/**
 * A method. Instance methods use {@code #} as path separator, class methods {@code .}.
 */
public class MethodObject extends DocObject {

    private final Scope scope;
    private Visibility visibility = Visibility.PUBLIC;

    public MethodObject(Reference namespace, String name, Scope scope) {
        super(namespace, name);
        this.scope = scope;
    }

    @Override
    public String type() {
        return "method";
    }

    @Override
    protected String separator() {
        return scope == Scope.CLASS ? "." : "#";
    }

    @Override
    public String path() {
        String parent = namespace() == null ? "" : namespace().path();
        return parent + separator() + name();
    }

    public Scope scope() {
        return scope;
    }

    public Visibility visibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }
}
