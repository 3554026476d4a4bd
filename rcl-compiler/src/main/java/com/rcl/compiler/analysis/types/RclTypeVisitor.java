package com.rcl.compiler.analysis.types;

/**
 * RclType 访问者接口，用于替代 instanceof 分派。
 */
public interface RclTypeVisitor<R> {
    R visitPrimitive(PrimitiveRclType type);
    R visitList(ListRclType type);
    R visitSet(SetRclType type);
    R visitDict(DictRclType type);
    R visitFunction(FunctionRclType type);
    R visitDynamic(DynamicType type);
}
