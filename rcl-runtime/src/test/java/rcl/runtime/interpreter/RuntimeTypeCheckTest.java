package rcl.runtime.interpreter;

import com.rcl.compiler.analysis.typereq.ReqTypes;
import com.rcl.compiler.analysis.typereq.TypeReq;
import com.rcl.compiler.analysis.typereq.Typed;
import com.rcl.compiler.analysis.types.RclTypes;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.PathElement;
import com.rcl.compiler.error.RclError;
import rcl.runtime.RclValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * 延迟的运行时类型检查测试：静态推迟后对实际值检查。
 */
class RuntimeTypeCheckTest {

    private static final Span ANNOTATION = new Span("config.rcl", 1, 8, 7, 16);
    private static final Span EXPR = new Span("config.rcl", 1, 27, 26, 14);

    private final TypeReq stringToInt = TypeReq.annotation(ANNOTATION,
            ReqTypes.dictOf(ReqTypes.STRING, ReqTypes.INT));

    private RuntimeTypeCheck deferredCheck() {
        Typed typed = stringToInt.checkType(EXPR, RclTypes.DYNAMIC);
        return RuntimeTypeCheck.deferred(stringToInt, EXPR, typed);
    }

    @Test
    @DisplayName("静态推迟后保存要求、位置与投影类型")
    void capturesDeferredCheck() {
        RuntimeTypeCheck check = deferredCheck();
        assertThat(check.getRequirement()).isEqualTo(stringToInt);
        assertThat(check.getSpan()).isEqualTo(EXPR);
        assertThat(check.getType()).isEqualTo(RclTypes.dictOf(RclTypes.STRING, RclTypes.INT));
    }

    @Test
    @DisplayName("静态已知的类型不能创建运行时检查")
    void rejectsResolvedType() {
        Typed typed = stringToInt.checkType(EXPR, RclTypes.dictOf(RclTypes.STRING, RclTypes.INT));
        assertThatThrownBy(() -> RuntimeTypeCheck.deferred(stringToInt, EXPR, typed))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("检查通过时原样返回值")
    void passesValueThrough() {
        RclValue value = RclValue.fromJava(Collections.singletonMap("a", 1));
        assertThat(deferredCheck().apply(value)).isSameAs(value);
    }

    @Test
    @DisplayName("Dict[String, Int] 对 {\"a\": true} 失败，路径指向键 \"a\"")
    void failurePointsAtKey() {
        RclValue value = RclValue.fromJava(Collections.singletonMap("a", true));
        assertThatThrownBy(() -> deferredCheck().apply(value))
                .isInstanceOfSatisfying(RclError.class, err -> {
                    assertThat(err.getSpan()).isEqualTo(EXPR);
                    assertThat(err.getPath()).containsExactly(PathElement.key("\"a\""));
                    assertThat(err.getMessage()).contains("位于: [\"a\"]").contains("但得到此值：");
                });
    }

    @Test
    @DisplayName("列表第 2 个元素出错")
    void listFailure() {
        TypeReq req = TypeReq.annotation(ANNOTATION, ReqTypes.listOf(ReqTypes.INT));
        RuntimeTypeCheck check = RuntimeTypeCheck.deferred(req, EXPR,
                req.checkType(EXPR, RclTypes.listOf(RclTypes.DYNAMIC)));
        assertThatThrownBy(() -> check.apply(RclValue.fromJava(Arrays.asList(0, 1, null))))
                .isInstanceOfSatisfying(RclError.class,
                        err -> assertThat(err.getPath()).containsExactly(PathElement.index(2)));
    }
}
