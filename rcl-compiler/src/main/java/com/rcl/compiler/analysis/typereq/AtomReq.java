package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;

/**
 * 原子类型要求: Bool, Int, Null, String
 */
public final class AtomReq extends ReqType {

    public enum Kind {
        BOOL(TAG_BOOL, RclTypes.BOOL),
        INT(TAG_INT, RclTypes.INT),
        NULL(TAG_NULL, RclTypes.NULL),
        STRING(TAG_STRING, RclTypes.STRING);

        final int tag;
        final RclType type;

        Kind(int tag, RclType type) {
            this.tag = tag;
            this.type = type;
        }
    }

    public static final AtomReq BOOL = new AtomReq(Kind.BOOL);
    public static final AtomReq INT = new AtomReq(Kind.INT);
    public static final AtomReq NULL = new AtomReq(Kind.NULL);
    public static final AtomReq STRING = new AtomReq(Kind.STRING);

    private final Kind kind;

    private AtomReq(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    int tag() {
        return kind.tag;
    }

    @Override
    int compareFields(ReqType other) {
        return 0;
    }

    @Override
    public RclType toType() {
        return kind.type;
    }

    @Override
    public <R> R accept(ReqTypeVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AtomReq && ((AtomReq) o).kind == kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
