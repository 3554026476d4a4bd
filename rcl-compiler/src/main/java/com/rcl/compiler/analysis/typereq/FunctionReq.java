package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数类型要求: (A1, A2) -> R
 */
public final class FunctionReq extends ReqType {

    private final List<ReqType> args;
    private final ReqType result;

    public FunctionReq(List<ReqType> args, ReqType result) {
        this.args = Collections.unmodifiableList(new ArrayList<ReqType>(args));
        this.result = result;
    }

    public List<ReqType> getArgs() {
        return args;
    }

    public ReqType getResult() {
        return result;
    }

    @Override
    int tag() {
        return TAG_FUNCTION;
    }

    @Override
    int compareFields(ReqType other) {
        FunctionReq that = (FunctionReq) other;
        // 参数按字典序比较，较短的前缀排在前面
        int n = Math.min(args.size(), that.args.size());
        for (int i = 0; i < n; i++) {
            int c = args.get(i).compareTo(that.args.get(i));
            if (c != 0) return c;
        }
        int c = Integer.compare(args.size(), that.args.size());
        if (c != 0) return c;
        return result.compareTo(that.result);
    }

    @Override
    public RclType toType() {
        List<RclType> argTypes = new ArrayList<RclType>(args.size());
        for (ReqType arg : args) {
            argTypes.add(arg.toType());
        }
        return RclTypes.functionOf(argTypes, result.toType());
    }

    @Override
    public <R> R accept(ReqTypeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionReq)) return false;
        FunctionReq that = (FunctionReq) o;
        return args.equals(that.args) && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(args, result, TAG_FUNCTION);
    }
}
