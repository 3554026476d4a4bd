package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;

/**
 * 函数参数位置上的比较规则。
 *
 * <p>真正泛化的做法应当允许参数逆变：不是实际参数类型满足要求，而是要求是实际参数类型的子类型。
 * 目前还没有反向的子类型判断，因此默认使用 {@link #STRICT_EQUALITY}，它可能拒绝一些类型安全的程序，
 * 但不会错误地接受不安全的程序。替换规则时只需换掉这里的实现，调用点不受影响。</p>
 */
public interface ArgumentComparison {

    /**
     * 比较参数位置上的要求与实际参数类型。
     *
     * @return {@link TypeDiff.Ok} 或 {@link TypeDiff.Error}，不会推迟
     */
    TypeDiff compare(TypeReq argReq, RclType argType);

    /** 投影后的要求与实际参数类型结构完全相等 */
    ArgumentComparison STRICT_EQUALITY = (argReq, argType) ->
            argReq.toType().equals(argType)
                    ? TypeDiff.ok(argType)
                    : TypeDiff.error(argReq, argType);
}
