package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.pprint.Doc;
import com.rcl.compiler.pprint.TypeFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * 嵌套类型错误的渲染。
 *
 * <p>先打印实际类型，每个不匹配的位置换成编号占位符（?1、?2 …），再逐个说明占位符处
 * 期望的类型和实际的类型。例如要求 Dict[String, Int]、实际 Dict[String, Bool] 时渲染为：</p>
 * <pre>
 * 实际类型在标记处不满足要求：
 *
 *   Dict[String, ?1]
 *
 * ?1 处期望此类型：
 *   ...
 * </pre>
 */
public final class TypeDiffRenderer {

    private TypeDiffRenderer() {}

    public static Doc render(TypeDiff diff) {
        Placeholders placeholders = new Placeholders();
        String shape = diff.accept(placeholders);

        List<Doc> parts = new ArrayList<Doc>();
        parts.add(Doc.text("实际类型在标记处不满足要求："));
        parts.add(Doc.HARD_BREAK);
        parts.add(Doc.HARD_BREAK);
        parts.add(Doc.indent(shape));
        for (int i = 0; i < placeholders.errors.size(); i++) {
            TypeDiff.Error error = placeholders.errors.get(i);
            parts.add(Doc.HARD_BREAK);
            parts.add(Doc.HARD_BREAK);
            parts.add(Doc.concat(placeholder(i), " 处", TypeFormatter.reportTypeMismatch(
                    error.getRequirement().toType(), error.getActual())));
        }
        return Doc.concat(parts);
    }

    /** 按出现顺序列出所有不匹配的位置 */
    public static List<TypeDiff.Error> collectErrors(TypeDiff diff) {
        Placeholders placeholders = new Placeholders();
        diff.accept(placeholders);
        return placeholders.errors;
    }

    private static String placeholder(int i) {
        return "?" + (i + 1);
    }

    /** 渲染实际类型，同时记录每个占位符对应的错误 */
    private static final class Placeholders implements TypeDiffVisitor<String> {
        final List<TypeDiff.Error> errors = new ArrayList<TypeDiff.Error>();

        @Override
        public String visitOk(TypeDiff.Ok diff) {
            return display(diff.getType());
        }

        @Override
        public String visitDefer(TypeDiff.Defer diff) {
            return display(diff.getType());
        }

        @Override
        public String visitError(TypeDiff.Error diff) {
            errors.add(diff);
            return placeholder(errors.size() - 1);
        }

        @Override
        public String visitList(TypeDiff.ListDiff diff) {
            return "List[" + diff.getElement().accept(this) + "]";
        }

        @Override
        public String visitSet(TypeDiff.SetDiff diff) {
            return "Set[" + diff.getElement().accept(this) + "]";
        }

        @Override
        public String visitDict(TypeDiff.DictDiff diff) {
            String key = diff.getKey().accept(this);
            String value = diff.getValue().accept(this);
            return "Dict[" + key + ", " + value + "]";
        }

        @Override
        public String visitFunction(TypeDiff.FunctionDiff diff) {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < diff.getArgs().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(diff.getArgs().get(i).accept(this));
            }
            sb.append(") -> ").append(diff.getResult().accept(this));
            return sb.toString();
        }

        private static String display(RclType type) {
            return type.toDisplayString();
        }
    }
}
