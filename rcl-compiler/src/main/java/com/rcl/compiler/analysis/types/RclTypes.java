package com.rcl.compiler.analysis.types;

import java.util.Arrays;
import java.util.List;

/**
 * 预定义类型常量和工厂方法。
 */
public final class RclTypes {

    private RclTypes() {}

    // 原子类型
    public static final PrimitiveRclType NULL = new PrimitiveRclType("Null");
    public static final PrimitiveRclType BOOL = new PrimitiveRclType("Bool");
    public static final PrimitiveRclType INT = new PrimitiveRclType("Int");
    public static final PrimitiveRclType STRING = new PrimitiveRclType("String");

    // 特殊类型
    public static final DynamicType DYNAMIC = DynamicType.INSTANCE;

    /** 创建 List[elem] 类型 */
    public static ListRclType listOf(RclType elem) {
        return new ListRclType(elem);
    }

    /** 创建 Set[elem] 类型 */
    public static SetRclType setOf(RclType elem) {
        return new SetRclType(elem);
    }

    /** 创建 Dict[key, value] 类型 */
    public static DictRclType dictOf(RclType key, RclType value) {
        return new DictRclType(key, value);
    }

    /** 创建函数类型 */
    public static FunctionRclType functionOf(List<RclType> args, RclType result) {
        return new FunctionRclType(args, result);
    }

    public static FunctionRclType functionOf(RclType result, RclType... args) {
        return new FunctionRclType(Arrays.asList(args), result);
    }

    /** 根据类型名查找原子类型和 Dynamic，未知名称返回 null */
    public static RclType fromName(String name) {
        switch (name) {
            case "Null": return NULL;
            case "Bool": return BOOL;
            case "Int": return INT;
            case "String": return STRING;
            case "Dynamic": return DYNAMIC;
            default: return null;
        }
    }
}
