package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;

/**
 * 集合类型要求: Set[T]
 */
public final class SetReq extends ReqType {

    private final ReqType element;

    public SetReq(ReqType element) {
        this.element = element;
    }

    public ReqType getElement() {
        return element;
    }

    @Override
    int tag() {
        return TAG_SET;
    }

    @Override
    int compareFields(ReqType other) {
        return element.compareTo(((SetReq) other).element);
    }

    @Override
    public RclType toType() {
        return RclTypes.setOf(element.toType());
    }

    @Override
    public <R> R accept(ReqTypeVisitor<R> visitor) {
        return visitor.visitSet(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SetReq && ((SetReq) o).element.equals(element);
    }

    @Override
    public int hashCode() {
        return 31 * element.hashCode() + TAG_SET;
    }
}
