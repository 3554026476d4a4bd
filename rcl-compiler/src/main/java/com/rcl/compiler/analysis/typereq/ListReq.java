package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;

/**
 * 列表类型要求: List[T]
 */
public final class ListReq extends ReqType {

    private final ReqType element;

    public ListReq(ReqType element) {
        this.element = element;
    }

    public ReqType getElement() {
        return element;
    }

    @Override
    int tag() {
        return TAG_LIST;
    }

    @Override
    int compareFields(ReqType other) {
        return element.compareTo(((ListReq) other).element);
    }

    @Override
    public RclType toType() {
        return RclTypes.listOf(element.toType());
    }

    @Override
    public <R> R accept(ReqTypeVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListReq && ((ListReq) o).element.equals(element);
    }

    @Override
    public int hashCode() {
        return 31 * element.hashCode() + TAG_LIST;
    }
}
