package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.PathElement;
import com.rcl.compiler.error.RclError;
import com.rcl.compiler.pprint.Doc;
import com.rcl.compiler.pprint.TypeFormatter;
import com.rcl.compiler.pprint.ValueFormatter;
import rcl.runtime.RclBool;
import rcl.runtime.RclDict;
import rcl.runtime.RclInt;
import rcl.runtime.RclList;
import rcl.runtime.RclNull;
import rcl.runtime.RclSet;
import rcl.runtime.RclString;
import rcl.runtime.RclValue;

import java.util.Map;

/**
 * 动态类型检查：静态检查推迟时，在得到实际值后检查值是否符合类型要求。
 *
 * <p>与静态检查的结构一一对应。出错时错误路径从最内层开始累积列表位置和字典键，
 * 最终报告能精确指出复合值内部出错的位置。检查通过时没有任何副作用。</p>
 */
public final class ValueChecker {

    private ValueChecker() {}

    /**
     * 检查值是否符合类型形状。
     *
     * @throws RclError 值不符合要求
     */
    public static void check(ReqType shape, Span at, RclValue value) {
        shape.accept(new ValueMatch(at, value));
    }

    /** 通用的不匹配错误：并排给出期望的类型和实际的值 */
    static RclError mismatch(ReqType shape, Span at, RclValue value) {
        return at.error("类型不匹配。")
                .withBody(Doc.concat(
                        "期望符合此类型的值：",
                        Doc.HARD_BREAK, Doc.HARD_BREAK,
                        Doc.indent(TypeFormatter.format(shape.toType())),
                        Doc.HARD_BREAK, Doc.HARD_BREAK,
                        "但得到此值：",
                        Doc.HARD_BREAK, Doc.HARD_BREAK,
                        Doc.indent(ValueFormatter.format(value))));
    }

    private static final class ValueMatch implements ReqTypeVisitor<Void> {
        private final Span at;
        private final RclValue value;

        ValueMatch(Span at, RclValue value) {
            this.at = at;
            this.value = value;
        }

        @Override
        public Void visitAtom(AtomReq req) {
            boolean matches;
            switch (req.getKind()) {
                case BOOL: matches = value instanceof RclBool; break;
                case INT: matches = value instanceof RclInt; break;
                case NULL: matches = value instanceof RclNull; break;
                case STRING: matches = value instanceof RclString; break;
                default: matches = false;
            }
            if (!matches) throw mismatch(req, at, value);
            return null;
        }

        @Override
        public Void visitList(ListReq req) {
            if (!(value instanceof RclList)) throw mismatch(req, at, value);
            int i = 0;
            for (RclValue elem : (RclList) value) {
                try {
                    check(req.getElement(), at, elem);
                } catch (RclError err) {
                    throw err.withPathElement(PathElement.index(i));
                }
                i++;
            }
            return null;
        }

        @Override
        public Void visitSet(SetReq req) {
            if (!(value instanceof RclSet)) throw mismatch(req, at, value);
            int i = 0;
            for (RclValue elem : (RclSet) value) {
                try {
                    check(req.getElement(), at, elem);
                } catch (RclError err) {
                    // 集合没有严格意义上的下标，但迭代有顺序，报告位置以说明这是嵌套错误
                    throw err.withPathElement(PathElement.index(i));
                }
                i++;
            }
            return null;
        }

        @Override
        public Void visitDict(DictReq req) {
            if (!(value instanceof RclDict)) throw mismatch(req, at, value);
            for (Map.Entry<RclValue, RclValue> entry : ((RclDict) value).getEntries().entrySet()) {
                PathElement key = PathElement.key(ValueFormatter.toRcl(entry.getKey()));
                try {
                    check(req.getKey(), at, entry.getKey());
                    check(req.getValue(), at, entry.getValue());
                } catch (RclError err) {
                    throw err.withPathElement(key);
                }
            }
            return null;
        }

        @Override
        public Void visitFunction(FunctionReq req) {
            // 运行时不检查函数值，任何值都不满足函数要求
            throw mismatch(req, at, value);
        }
    }
}
