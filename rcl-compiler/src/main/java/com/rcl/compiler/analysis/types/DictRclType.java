package com.rcl.compiler.analysis.types;

import java.util.Objects;

/**
 * 字典类型: Dict[K, V]
 */
public final class DictRclType extends RclType {

    private final RclType key;
    private final RclType value;

    public DictRclType(RclType key, RclType value) {
        this.key = key;
        this.value = value;
    }

    public RclType getKey() {
        return key;
    }

    public RclType getValue() {
        return value;
    }

    @Override
    public String toDisplayString() {
        return "Dict[" + key.toDisplayString() + ", " + value.toDisplayString() + "]";
    }

    @Override
    public <R> R accept(RclTypeVisitor<R> visitor) {
        return visitor.visitDict(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictRclType)) return false;
        DictRclType that = (DictRclType) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }
}
