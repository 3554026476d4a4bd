package com.rcl.compiler.analysis.types;

/**
 * 集合类型: Set[T]
 */
public final class SetRclType extends RclType {

    private final RclType element;

    public SetRclType(RclType element) {
        this.element = element;
    }

    public RclType getElement() {
        return element;
    }

    @Override
    public String toDisplayString() {
        return "Set[" + element.toDisplayString() + "]";
    }

    @Override
    public <R> R accept(RclTypeVisitor<R> visitor) {
        return visitor.visitSet(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetRclType)) return false;
        return element.equals(((SetRclType) o).element);
    }

    @Override
    public int hashCode() {
        return 31 * element.hashCode() + 2;
    }
}
