package com.rcl.compiler.analysis.types;

/**
 * 推断类型（实际类型）的基类。
 *
 * <p>由外部类型推断产生，描述表达式的类型；{@link DynamicType} 表示静态未知、
 * 需要到运行时才能确定的类型。所有实例不可变，子树可以自由共享。</p>
 */
public abstract class RclType {

    /** Null、Bool、Int、String 为原子类型 */
    public boolean isAtom() {
        return false;
    }

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    /** 接受 RclTypeVisitor 进行类型分派 */
    public abstract <R> R accept(RclTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
