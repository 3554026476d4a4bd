package com.rcl.compiler.analysis.typereq;

/**
 * TypeDiff 访问者接口。
 */
public interface TypeDiffVisitor<R> {
    R visitOk(TypeDiff.Ok diff);
    R visitDefer(TypeDiff.Defer diff);
    R visitError(TypeDiff.Error diff);
    R visitList(TypeDiff.ListDiff diff);
    R visitSet(TypeDiff.SetDiff diff);
    R visitDict(TypeDiff.DictDiff diff);
    R visitFunction(TypeDiff.FunctionDiff diff);
}
