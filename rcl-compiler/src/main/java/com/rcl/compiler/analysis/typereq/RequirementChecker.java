package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.DictRclType;
import com.rcl.compiler.analysis.types.DynamicType;
import com.rcl.compiler.analysis.types.FunctionRclType;
import com.rcl.compiler.analysis.types.ListRclType;
import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;
import com.rcl.compiler.analysis.types.SetRclType;

import java.util.ArrayList;
import java.util.List;

/**
 * 静态结构比较：判断实际类型是否满足类型要求。
 *
 * <p>结果只取决于输入，同样的输入总是得到同样形状的 {@link TypeDiff}。
 * 只要实际类型在被检查的位置上是 Dynamic，该位置的结果就是推迟而不是错误。</p>
 */
public final class RequirementChecker {

    public static final RequirementChecker DEFAULT = new RequirementChecker(ArgumentComparison.STRICT_EQUALITY);

    private final ArgumentComparison argumentComparison;

    public RequirementChecker(ArgumentComparison argumentComparison) {
        this.argumentComparison = argumentComparison;
    }

    /**
     * 比较要求与实际类型。NONE 总是 Ok。
     */
    public TypeDiff check(TypeReq req, RclType type) {
        ReqType shape = req.getReqType();
        if (shape == null) return TypeDiff.ok(type);
        return checkShape(req, shape, type);
    }

    private TypeDiff checkShape(TypeReq req, ReqType shape, RclType type) {
        // 有要求但类型未知，只能推迟到运行时检查
        if (type instanceof DynamicType) return TypeDiff.defer(shape.toType());
        return shape.accept(new ShapeComparison(req, type));
    }

    private TypeDiff checkInner(TypeReq outer, ReqType inner, RclType type) {
        return checkShape(outer.narrow(inner), inner, type);
    }

    /** OK 或 DEFER 结果携带的类型 */
    private static RclType resolvedType(TypeDiff diff) {
        return diff.getKind() == TypeDiff.Kind.OK
                ? ((TypeDiff.Ok) diff).getType()
                : ((TypeDiff.Defer) diff).getType();
    }

    private final class ShapeComparison implements ReqTypeVisitor<TypeDiff> {
        private final TypeReq req;
        private final RclType type;

        ShapeComparison(TypeReq req, RclType type) {
            this.req = req;
            this.type = type;
        }

        private TypeDiff mismatch() {
            return TypeDiff.error(req, type);
        }

        @Override
        public TypeDiff visitAtom(AtomReq atom) {
            if (atom.toType().equals(type)) return TypeDiff.ok(type);
            return mismatch();
        }

        @Override
        public TypeDiff visitList(ListReq list) {
            if (!(type instanceof ListRclType)) return mismatch();
            TypeDiff elem = checkInner(req, list.getElement(), ((ListRclType) type).getElement());
            switch (elem.getKind()) {
                case OK: return TypeDiff.ok(type);
                case DEFER: return TypeDiff.defer(RclTypes.listOf(resolvedType(elem)));
                default: return TypeDiff.list(elem);
            }
        }

        @Override
        public TypeDiff visitSet(SetReq set) {
            if (!(type instanceof SetRclType)) return mismatch();
            TypeDiff elem = checkInner(req, set.getElement(), ((SetRclType) type).getElement());
            switch (elem.getKind()) {
                case OK: return TypeDiff.ok(type);
                case DEFER: return TypeDiff.defer(RclTypes.setOf(resolvedType(elem)));
                default: return TypeDiff.set(elem);
            }
        }

        @Override
        public TypeDiff visitDict(DictReq dict) {
            if (!(type instanceof DictRclType)) return mismatch();
            DictRclType dictType = (DictRclType) type;
            TypeDiff keyDiff = checkInner(req, dict.getKey(), dictType.getKey());
            TypeDiff valueDiff = checkInner(req, dict.getValue(), dictType.getValue());

            if (keyDiff.getKind() == TypeDiff.Kind.OK && valueDiff.getKind() == TypeDiff.Kind.OK) {
                return TypeDiff.ok(type);
            }
            if (keyDiff.isResolved() && valueDiff.isResolved()) {
                return TypeDiff.defer(RclTypes.dictOf(resolvedType(keyDiff), resolvedType(valueDiff)));
            }
            // 两侧都保留，便于指出错误位于键还是值
            return TypeDiff.dict(keyDiff, valueDiff);
        }

        @Override
        public TypeDiff visitFunction(FunctionReq fn) {
            if (!(type instanceof FunctionRclType)) return mismatch();
            FunctionRclType fnType = (FunctionRclType) type;

            // 参数数量不同，直接报错，不进入内部也不推迟
            if (fn.getArgs().size() != fnType.getArgs().size()) return mismatch();

            List<TypeDiff> argDiffs = new ArrayList<TypeDiff>(fn.getArgs().size());
            boolean argsMatch = true;
            for (int i = 0; i < fn.getArgs().size(); i++) {
                TypeDiff argDiff = argumentComparison.compare(
                        req.narrow(fn.getArgs().get(i)), fnType.getArgs().get(i));
                if (argDiff.getKind() != TypeDiff.Kind.OK) argsMatch = false;
                argDiffs.add(argDiff);
            }

            TypeDiff resultDiff = checkInner(req, fn.getResult(), fnType.getResult());
            // 运行时不检查函数值，参数不匹配不能推迟
            if (!argsMatch) return TypeDiff.function(argDiffs, resultDiff);

            switch (resultDiff.getKind()) {
                case OK:
                    return TypeDiff.ok(type);
                case DEFER:
                    return TypeDiff.defer(RclTypes.functionOf(fnType.getArgs(), resolvedType(resultDiff)));
                default:
                    return TypeDiff.function(argDiffs, resultDiff);
            }
        }
    }
}
