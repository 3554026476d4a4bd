package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;

/**
 * 类型要求中可以出现的类型形状（不携带上下文）。
 *
 * <p>要求总是完全具体的，不会出现 Dynamic。形状之间有全序：先比较变体标签
 * （Bool &lt; Int &lt; Null &lt; String &lt; List &lt; Set &lt; Dict &lt; Function），
 * 再逐字段比较，只用于在有序容器中获得确定的位置。</p>
 */
public abstract class ReqType implements Comparable<ReqType> {

    static final int TAG_BOOL = 0;
    static final int TAG_INT = 1;
    static final int TAG_NULL = 2;
    static final int TAG_STRING = 3;
    static final int TAG_LIST = 4;
    static final int TAG_SET = 5;
    static final int TAG_DICT = 6;
    static final int TAG_FUNCTION = 7;

    ReqType() {
    }

    /** 变体标签，排序的第一关键字 */
    abstract int tag();

    /** 与同标签的另一个形状逐字段比较 */
    abstract int compareFields(ReqType other);

    /**
     * 返回满足此要求的值所具有的最具体类型。
     * 需要深度遍历整个形状。
     */
    public abstract RclType toType();

    public abstract <R> R accept(ReqTypeVisitor<R> visitor);

    @Override
    public final int compareTo(ReqType other) {
        int c = Integer.compare(tag(), other.tag());
        if (c != 0) return c;
        return compareFields(other);
    }

    @Override
    public String toString() {
        return toType().toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
