package com.rcl.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数类型: (P1, P2) -> R
 */
public final class FunctionRclType extends RclType {

    private final List<RclType> args;
    private final RclType result;

    public FunctionRclType(List<RclType> args, RclType result) {
        this.args = Collections.unmodifiableList(new ArrayList<RclType>(args));
        this.result = result;
    }

    public List<RclType> getArgs() {
        return args;
    }

    public RclType getResult() {
        return result;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i).toDisplayString());
        }
        sb.append(") -> ");
        sb.append(result.toDisplayString());
        return sb.toString();
    }

    @Override
    public <R> R accept(RclTypeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionRclType)) return false;
        FunctionRclType that = (FunctionRclType) o;
        return args.equals(that.args) && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(args, result);
    }
}
