package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;

/**
 * 静态类型检查对外的结果。
 *
 * <p>{@link Kind#TYPE}：类型在静态已知，这是能推断出的最具体类型。
 * {@link Kind#DEFER}：无法静态检查，需要运行时检查；运行时检查通过后值符合返回的类型。</p>
 */
public final class Typed {

    public enum Kind {
        TYPE, DEFER
    }

    private final Kind kind;
    private final RclType type;

    private Typed(Kind kind, RclType type) {
        this.kind = kind;
        this.type = type;
    }

    public static Typed type(RclType type) {
        return new Typed(Kind.TYPE, type);
    }

    public static Typed defer(RclType type) {
        return new Typed(Kind.DEFER, type);
    }

    public Kind getKind() {
        return kind;
    }

    public RclType getType() {
        return type;
    }

    public boolean isDeferred() {
        return kind == Kind.DEFER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Typed)) return false;
        Typed that = (Typed) o;
        return kind == that.kind && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return (kind == Kind.TYPE ? "Type(" : "Defer(") + type.toDisplayString() + ")";
    }
}
