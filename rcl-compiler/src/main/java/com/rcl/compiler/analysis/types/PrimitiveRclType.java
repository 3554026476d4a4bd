package com.rcl.compiler.analysis.types;

/**
 * 原子类型: Null, Bool, Int, String
 */
public final class PrimitiveRclType extends RclType {

    private final String name;

    PrimitiveRclType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isAtom() {
        return true;
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(RclTypeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveRclType)) return false;
        return name.equals(((PrimitiveRclType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
