package com.rcl.compiler.analysis.types;

/**
 * 动态类型：静态未知，类型检查推迟到运行时。
 */
public final class DynamicType extends RclType {

    public static final DynamicType INSTANCE = new DynamicType();

    private DynamicType() {
    }

    @Override
    public String toDisplayString() {
        return "Dynamic";
    }

    @Override
    public <R> R accept(RclTypeVisitor<R> visitor) {
        return visitor.visitDynamic(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DynamicType;
    }

    @Override
    public int hashCode() {
        return -1;
    }
}
