package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;

import java.util.Objects;

/**
 * 字典类型要求: Dict[K, V]，键和值各自独立检查。
 */
public final class DictReq extends ReqType {

    private final ReqType key;
    private final ReqType value;

    public DictReq(ReqType key, ReqType value) {
        this.key = key;
        this.value = value;
    }

    public ReqType getKey() {
        return key;
    }

    public ReqType getValue() {
        return value;
    }

    @Override
    int tag() {
        return TAG_DICT;
    }

    @Override
    int compareFields(ReqType other) {
        DictReq that = (DictReq) other;
        int c = key.compareTo(that.key);
        if (c != 0) return c;
        return value.compareTo(that.value);
    }

    @Override
    public RclType toType() {
        return RclTypes.dictOf(key.toType(), value.toType());
    }

    @Override
    public <R> R accept(ReqTypeVisitor<R> visitor) {
        return visitor.visitDict(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictReq)) return false;
        DictReq that = (DictReq) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, TAG_DICT);
    }
}
