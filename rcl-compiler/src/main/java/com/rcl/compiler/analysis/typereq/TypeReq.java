package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;
import com.rcl.compiler.pprint.TypeFormatter;
import rcl.runtime.RclValue;

import java.util.Objects;

/**
 * 类型要求。
 *
 * <p>{@link RclType} 是类型检查器推断出的类型，而 TypeReq 是类型检查器需要满足的要求。
 * 要求对应一个类型形状（{@link ReqType}），并额外携带<em>为什么</em>在此处期望这个类型的上下文：
 * 例如"因为这里有类型注解"或"因为条件必须是布尔值"。要求可以被所要求类型的子类型满足。</p>
 *
 * <p>实例不可变，可以被延迟检查节点长期持有并在多处共享。</p>
 */
public final class TypeReq {

    public enum Kind {
        /** 对类型没有要求，任何值都可以 */
        NONE,
        /** 由类型注解产生的要求 */
        ANNOTATION,
        /** 用作条件，要求 Bool */
        CONDITION,
        /** 由运算符产生的要求 */
        OPERATOR,
        /** 用作列表索引，要求 Int */
        INDEX_LIST
    }

    private static final TypeReq NONE = new TypeReq(Kind.NONE, null, null);
    private static final TypeReq CONDITION = new TypeReq(Kind.CONDITION, null, AtomReq.BOOL);
    private static final TypeReq INDEX_LIST = new TypeReq(Kind.INDEX_LIST, null, AtomReq.INT);

    private final Kind kind;
    private final Span span;
    private final ReqType reqType;

    private TypeReq(Kind kind, Span span, ReqType reqType) {
        this.kind = kind;
        this.span = span;
        this.reqType = reqType;
    }

    public static TypeReq none() {
        return NONE;
    }

    public static TypeReq annotation(Span span, ReqType reqType) {
        return new TypeReq(Kind.ANNOTATION, Objects.requireNonNull(span), Objects.requireNonNull(reqType));
    }

    public static TypeReq condition() {
        return CONDITION;
    }

    public static TypeReq operator(Span span, ReqType reqType) {
        return new TypeReq(Kind.OPERATOR, Objects.requireNonNull(span), Objects.requireNonNull(reqType));
    }

    public static TypeReq indexList() {
        return INDEX_LIST;
    }

    public Kind getKind() {
        return kind;
    }

    /** ANNOTATION 与 OPERATOR 的源码位置，其余为 null */
    public Span getSpan() {
        return span;
    }

    /** 返回此要求所要求的类型形状，NONE 返回 null */
    public ReqType getReqType() {
        return reqType;
    }

    /** 返回满足此要求的任意值所具有的最精确类型 */
    public RclType toType() {
        return reqType == null ? RclTypes.DYNAMIC : reqType.toType();
    }

    /**
     * 保留原因与位置，把形状替换为内部的某个子形状。
     * 嵌套的类型错误借此保留最初的上下文。
     */
    TypeReq narrow(ReqType inner) {
        if (inner.equals(reqType)) return this;
        switch (kind) {
            case ANNOTATION:
            case OPERATOR:
                return new TypeReq(kind, span, inner);
            default:
                throw new IllegalStateException("要求 " + kind + " 没有可以进入的复合类型");
        }
    }

    /**
     * 静态检查给定类型是否为所要求类型的子类型，返回完整的比较结果。
     */
    public TypeDiff check(RclType type) {
        return RequirementChecker.DEFAULT.check(this, type);
    }

    /**
     * 静态检查给定类型是否为所要求类型的子类型。
     *
     * @param at   报告错误时使用的位置（被检查的表达式）
     * @param type 推断出的实际类型
     * @return 静态已知的类型，或需要运行时检查的类型
     * @throws RclError 静态即可确定类型不匹配
     */
    public Typed checkType(Span at, RclType type) {
        return checkType(at, type, RequirementChecker.DEFAULT);
    }

    public Typed checkType(Span at, RclType type, RequirementChecker checker) {
        // 没有要求时不做比较
        if (reqType == null) return Typed.type(type);

        TypeDiff diff = checker.check(this, type);
        switch (diff.getKind()) {
            case OK:
                return Typed.type(((TypeDiff.Ok) diff).getType());
            case DEFER:
                return Typed.defer(((TypeDiff.Defer) diff).getType());
            case ERROR: {
                // 顶层类型错误，用简单格式报告
                TypeDiff.Error error = (TypeDiff.Error) diff;
                RclError err = at.error("类型不匹配。")
                        .withBody(TypeFormatter.reportTypeMismatch(
                                error.getRequirement().toType(), error.getActual()));
                throw addContext(err);
            }
            default: {
                // 错误嵌套在类型内部：先打印类型本身，出错的部分用占位符代替，再逐个解释占位符
                RclError err = at.error("类型内部存在不匹配。")
                        .withBody(TypeDiffRenderer.render(diff));
                throw addContext(err);
            }
        }
    }

    /**
     * 动态检查给定值是否符合所要求的类型。NONE 接受任何值。
     *
     * @throws RclError 值不符合要求，错误路径指向出错的位置
     */
    public void checkValue(Span at, RclValue value) {
        if (reqType == null) return;
        ValueChecker.check(reqType, at, value);
    }

    /**
     * 解释类型错误的原因。
     *
     * @throws IllegalStateException NONE 不可能导致错误；运算符只定义在原子类型上
     */
    public RclError addContext(RclError error) {
        switch (kind) {
            case NONE:
                throw new IllegalStateException("没有类型要求时不可能产生类型错误");
            case ANNOTATION:
                return error.withNote(span, "期望的类型在此处指定。");
            case CONDITION:
                return error.withHelp("不存在隐式转换，条件必须是布尔值。");
            case OPERATOR: {
                RclType type = reqType.toType();
                if (!type.isAtom()) {
                    throw new IllegalStateException("运算符只定义在原子类型上，实际要求为 " + type.toDisplayString());
                }
                return error.withNote(span, "由于此运算符，期望 " + type.toDisplayString() + "。");
            }
            case INDEX_LIST:
                return error.withHelp("列表索引必须是整数。");
            default:
                throw new IllegalStateException("未知的类型要求: " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeReq)) return false;
        TypeReq that = (TypeReq) o;
        return kind == that.kind && Objects.equals(span, that.span) && Objects.equals(reqType, that.reqType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, span, reqType);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NONE: return "None";
            case CONDITION: return "Condition";
            case INDEX_LIST: return "IndexList";
            case ANNOTATION: return "Annotation(" + span + ", " + reqType + ")";
            default: return "Operator(" + span + ", " + reqType + ")";
        }
    }
}
