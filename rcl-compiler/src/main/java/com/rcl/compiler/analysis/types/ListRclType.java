package com.rcl.compiler.analysis.types;

/**
 * 列表类型: List[T]
 */
public final class ListRclType extends RclType {

    private final RclType element;

    public ListRclType(RclType element) {
        this.element = element;
    }

    public RclType getElement() {
        return element;
    }

    @Override
    public String toDisplayString() {
        return "List[" + element.toDisplayString() + "]";
    }

    @Override
    public <R> R accept(RclTypeVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListRclType)) return false;
        return element.equals(((ListRclType) o).element);
    }

    @Override
    public int hashCode() {
        return 31 * element.hashCode() + 1;
    }
}
