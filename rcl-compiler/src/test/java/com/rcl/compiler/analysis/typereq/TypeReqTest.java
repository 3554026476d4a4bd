package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclTypes;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;
import rcl.runtime.RclInt;
import rcl.runtime.RclString;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 类型要求测试：静态检查的对外结果、错误上下文与内部不变量。
 */
class TypeReqTest {

    private static final Span ANNOTATION_SPAN = new Span("config.rcl", 1, 8, 7, 3);
    private static final Span EXPR_SPAN = new Span("config.rcl", 3, 9, 30, 5);
    private static final Span OPERATOR_SPAN = new Span("config.rcl", 2, 5, 15, 1);

    private static TypeReq annotation(ReqType shape) {
        return TypeReq.annotation(ANNOTATION_SPAN, shape);
    }

    // ============ checkType ============

    @Nested
    @DisplayName("checkType 结果")
    class CheckTypeResults {

        @Test
        @DisplayName("满足要求时返回静态已知的类型")
        void okGivesType() {
            assertEquals(Typed.type(RclTypes.INT), annotation(ReqTypes.INT).checkType(EXPR_SPAN, RclTypes.INT));
        }

        @Test
        @DisplayName("推迟时返回需要运行时检查的类型")
        void deferGivesDefer() {
            Typed typed = annotation(ReqTypes.listOf(ReqTypes.INT))
                    .checkType(EXPR_SPAN, RclTypes.listOf(RclTypes.DYNAMIC));
            assertTrue(typed.isDeferred());
            assertEquals(RclTypes.listOf(RclTypes.INT), typed.getType());
        }

        @Test
        @DisplayName("没有要求时原样返回类型，不做比较")
        void noneReturnsTypeUnchanged() {
            assertEquals(Typed.type(RclTypes.DYNAMIC), TypeReq.none().checkType(EXPR_SPAN, RclTypes.DYNAMIC));
        }

        @Test
        @DisplayName("顶层不匹配报告期望类型与实际类型")
        void flatMismatch() {
            RclError err = assertThrows(RclError.class,
                    () -> annotation(ReqTypes.INT).checkType(EXPR_SPAN, RclTypes.STRING));
            assertEquals("类型不匹配。", err.getRawMessage());
            assertEquals(EXPR_SPAN, err.getSpan());
            assertEquals("期望此类型：\n\n  Int\n\n但实际类型为：\n\n  String", err.getBody().toString());
            assertEquals(1, err.getNotes().size());
            assertEquals(ANNOTATION_SPAN, err.getNotes().get(0).getSpan());
            assertEquals("期望的类型在此处指定。", err.getNotes().get(0).getText().toString());
        }

        @Test
        @DisplayName("嵌套不匹配用占位符渲染并附加上下文")
        void nestedMismatch() {
            RclError err = assertThrows(RclError.class,
                    () -> annotation(ReqTypes.dictOf(ReqTypes.STRING, ReqTypes.INT))
                            .checkType(EXPR_SPAN, RclTypes.dictOf(RclTypes.STRING, RclTypes.BOOL)));
            assertEquals("类型内部存在不匹配。", err.getRawMessage());
            assertTrue(err.getBody().toString().contains("Dict[String, ?1]"));
            assertEquals(1, err.getNotes().size());
        }

        @Test
        @DisplayName("函数参数数量不同在顶层报告")
        void functionArityMismatchIsFlat() {
            RclError err = assertThrows(RclError.class,
                    () -> annotation(ReqTypes.functionOf(ReqTypes.INT, ReqTypes.INT))
                            .checkType(EXPR_SPAN, RclTypes.functionOf(RclTypes.INT, RclTypes.INT, RclTypes.INT)));
            assertEquals("类型不匹配。", err.getRawMessage());
        }

        @Test
        @DisplayName("可以指定自定义的比较器")
        void customChecker() {
            RequirementChecker lenient = new RequirementChecker((argReq, argType) -> TypeDiff.ok(argType));
            Typed typed = annotation(ReqTypes.functionOf(ReqTypes.INT, ReqTypes.INT))
                    .checkType(EXPR_SPAN, RclTypes.functionOf(RclTypes.INT, RclTypes.STRING), lenient);
            assertEquals(Typed.type(RclTypes.functionOf(RclTypes.INT, RclTypes.STRING)), typed);
        }
    }

    // ============ 错误上下文 ============

    @Nested
    @DisplayName("错误上下文")
    class Context {

        @Test
        @DisplayName("条件要求给出帮助")
        void condition() {
            RclError err = assertThrows(RclError.class,
                    () -> TypeReq.condition().checkType(EXPR_SPAN, RclTypes.INT));
            assertEquals("不存在隐式转换，条件必须是布尔值。", err.getHelp());
            assertTrue(err.getNotes().isEmpty());
        }

        @Test
        @DisplayName("列表索引要求给出帮助")
        void indexList() {
            RclError err = assertThrows(RclError.class,
                    () -> TypeReq.indexList().checkType(EXPR_SPAN, RclTypes.STRING));
            assertEquals("列表索引必须是整数。", err.getHelp());
        }

        @Test
        @DisplayName("运算符要求在运算符处附加说明")
        void operator() {
            RclError err = assertThrows(RclError.class,
                    () -> TypeReq.operator(OPERATOR_SPAN, ReqTypes.INT).checkType(EXPR_SPAN, RclTypes.STRING));
            assertEquals(OPERATOR_SPAN, err.getNotes().get(0).getSpan());
            assertEquals("由于此运算符，期望 Int。", err.getNotes().get(0).getText().toString());
        }

        @Test
        @DisplayName("没有要求时不可能产生错误")
        void noneViolatesInvariant() {
            assertThrows(IllegalStateException.class,
                    () -> TypeReq.none().addContext(EXPR_SPAN.error("类型不匹配。")));
        }

        @Test
        @DisplayName("运算符要求必须是原子类型")
        void compoundOperatorViolatesInvariant() {
            TypeReq req = TypeReq.operator(OPERATOR_SPAN, ReqTypes.listOf(ReqTypes.INT));
            assertThrows(IllegalStateException.class,
                    () -> req.addContext(EXPR_SPAN.error("类型不匹配。")));
        }
    }

    // ============ 其它 ============

    @Nested
    @DisplayName("投影与内部形状")
    class Shapes {

        @Test
        @DisplayName("要求投影为类型")
        void toType() {
            assertEquals(RclTypes.DYNAMIC, TypeReq.none().toType());
            assertEquals(RclTypes.BOOL, TypeReq.condition().toType());
            assertEquals(RclTypes.INT, TypeReq.indexList().toType());
            assertEquals(RclTypes.setOf(RclTypes.STRING), annotation(ReqTypes.setOf(ReqTypes.STRING)).toType());
        }

        @Test
        @DisplayName("进入内部形状时保留原因与位置")
        void narrowKeepsContext() {
            TypeReq inner = annotation(ReqTypes.listOf(ReqTypes.INT)).narrow(ReqTypes.INT);
            assertEquals(annotation(ReqTypes.INT), inner);
        }

        @Test
        @DisplayName("原子要求没有内部形状")
        void narrowAtomicRequirement() {
            assertSame(TypeReq.condition(), TypeReq.condition().narrow(ReqTypes.BOOL));
            assertThrows(IllegalStateException.class, () -> TypeReq.condition().narrow(ReqTypes.INT));
        }

        @Test
        @DisplayName("动态检查：没有要求时接受任何值")
        void checkValue() {
            assertDoesNotThrow(() -> TypeReq.none().checkValue(EXPR_SPAN, RclString.of("a")));
            assertDoesNotThrow(() -> annotation(ReqTypes.INT).checkValue(EXPR_SPAN, RclInt.of(1)));
            assertThrows(RclError.class, () -> annotation(ReqTypes.INT).checkValue(EXPR_SPAN, RclString.of("a")));
        }
    }
}
