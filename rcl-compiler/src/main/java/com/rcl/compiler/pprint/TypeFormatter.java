package com.rcl.compiler.pprint;

import com.rcl.compiler.analysis.types.RclType;

/**
 * 类型的诊断渲染
 */
public final class TypeFormatter {

    private TypeFormatter() {}

    public static Doc format(RclType type) {
        return Doc.text(type.toDisplayString());
    }

    /**
     * 顶层类型不匹配的正文：先给出期望类型，再给出实际类型。
     */
    public static Doc reportTypeMismatch(RclType expected, RclType actual) {
        return Doc.concat(
                "期望此类型：",
                Doc.HARD_BREAK, Doc.HARD_BREAK,
                Doc.indent(format(expected)),
                Doc.HARD_BREAK, Doc.HARD_BREAK,
                "但实际类型为：",
                Doc.HARD_BREAK, Doc.HARD_BREAK,
                Doc.indent(format(actual)));
    }
}
