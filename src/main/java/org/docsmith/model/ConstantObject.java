package org.docsmith.model;

/**
 * A constant together with the source text of its value.
 */
public class ConstantObject extends DocObject {

    private final String value;

    public ConstantObject(Reference namespace, String name, String value) {
        super(namespace, name);
        this.value = value;
    }

    @Override
    public String type() {
        return "constant";
    }

    public String value() {
        return value;
    }
}
