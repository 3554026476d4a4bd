package com.rcl.compiler.analysis.typereq;

/**
 * ReqType 访问者接口，每个消费点都必须处理全部变体。
 */
public interface ReqTypeVisitor<R> {
    R visitAtom(AtomReq req);
    R visitList(ListReq req);
    R visitSet(SetReq req);
    R visitDict(DictReq req);
    R visitFunction(FunctionReq req);
}
