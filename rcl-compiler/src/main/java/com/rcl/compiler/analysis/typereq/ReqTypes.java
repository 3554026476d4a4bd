package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.DictRclType;
import com.rcl.compiler.analysis.types.DynamicType;
import com.rcl.compiler.analysis.types.FunctionRclType;
import com.rcl.compiler.analysis.types.ListRclType;
import com.rcl.compiler.analysis.types.PrimitiveRclType;
import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypeVisitor;
import com.rcl.compiler.analysis.types.SetRclType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 预定义类型要求常量和工厂方法。
 */
public final class ReqTypes {

    private ReqTypes() {}

    public static final AtomReq BOOL = AtomReq.BOOL;
    public static final AtomReq INT = AtomReq.INT;
    public static final AtomReq NULL = AtomReq.NULL;
    public static final AtomReq STRING = AtomReq.STRING;

    public static ListReq listOf(ReqType elem) {
        return new ListReq(elem);
    }

    public static SetReq setOf(ReqType elem) {
        return new SetReq(elem);
    }

    public static DictReq dictOf(ReqType key, ReqType value) {
        return new DictReq(key, value);
    }

    public static FunctionReq functionOf(List<ReqType> args, ReqType result) {
        return new FunctionReq(args, result);
    }

    public static FunctionReq functionOf(ReqType result, ReqType... args) {
        return new FunctionReq(Arrays.asList(args), result);
    }

    /**
     * 把完全具体的类型转换为类型要求，是 {@link ReqType#toType()} 的逆操作。
     *
     * @throws IllegalArgumentException 类型中包含 Dynamic
     */
    public static ReqType fromType(RclType type) {
        return type.accept(FROM_TYPE);
    }

    private static final RclTypeVisitor<ReqType> FROM_TYPE = new RclTypeVisitor<ReqType>() {
        @Override
        public ReqType visitPrimitive(PrimitiveRclType type) {
            switch (type.getName()) {
                case "Bool": return BOOL;
                case "Int": return INT;
                case "Null": return NULL;
                case "String": return STRING;
                default: throw new IllegalArgumentException("未知的原子类型: " + type.getName());
            }
        }

        @Override
        public ReqType visitList(ListRclType type) {
            return listOf(type.getElement().accept(this));
        }

        @Override
        public ReqType visitSet(SetRclType type) {
            return setOf(type.getElement().accept(this));
        }

        @Override
        public ReqType visitDict(DictRclType type) {
            return dictOf(type.getKey().accept(this), type.getValue().accept(this));
        }

        @Override
        public ReqType visitFunction(FunctionRclType type) {
            List<ReqType> args = new ArrayList<ReqType>(type.getArgs().size());
            for (RclType arg : type.getArgs()) {
                args.add(arg.accept(this));
            }
            return functionOf(args, type.getResult().accept(this));
        }

        @Override
        public ReqType visitDynamic(DynamicType type) {
            throw new IllegalArgumentException("类型要求中不能出现 Dynamic");
        }
    };
}
