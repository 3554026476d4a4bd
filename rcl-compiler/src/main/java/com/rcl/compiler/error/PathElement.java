package com.rcl.compiler.error;

import java.util.Objects;

/**
 * 错误路径上的一个元素：列表/集合中的位置，或字典中的键。
 */
public final class PathElement {

    public enum Kind {
        INDEX, KEY
    }

    private final Kind kind;
    private final int index;
    private final String key;

    private PathElement(Kind kind, int index, String key) {
        this.kind = kind;
        this.index = index;
        this.key = key;
    }

    /** 列表或集合中的位置（集合的位置仅用于定位，没有语义顺序） */
    public static PathElement index(int index) {
        return new PathElement(Kind.INDEX, index, null);
    }

    /** 字典中的键，{@code renderedKey} 是键按 RCL 语法渲染后的文本 */
    public static PathElement key(String renderedKey) {
        return new PathElement(Kind.KEY, -1, renderedKey);
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathElement)) return false;
        PathElement that = (PathElement) o;
        return kind == that.kind && index == that.index && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index, key);
    }

    @Override
    public String toString() {
        return kind == Kind.INDEX ? "[" + index + "]" : "[" + key + "]";
    }
}
