package rcl.runtime.stdlib;

import com.rcl.compiler.analysis.typereq.ReqTypes;
import com.rcl.compiler.analysis.typereq.TypeReq;
import com.rcl.compiler.analysis.typereq.Typed;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;
import rcl.runtime.RclBuiltinFunction;
import rcl.runtime.RclDict;
import rcl.runtime.RclInt;
import rcl.runtime.RclString;
import rcl.runtime.RclValue;
import rcl.runtime.interpreter.DocumentLoader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * 标准库注册表测试
 */
class StdlibRegistryTest {

    private static final Span AT = new Span("main.rcl", 1, 1, 0, 30);

    @TempDir
    Path tempDir;

    private StdlibRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        Files.write(tempDir.resolve("hello.txt"), "你好\n".getBytes(StandardCharsets.UTF_8));
        registry = StdlibRegistry.standard(new DocumentLoader(tempDir));
    }

    // ============ 注册 ============

    @Nested
    @DisplayName("注册")
    class Registration {

        @Test
        @DisplayName("标准注册表包含 read_file_utf8")
        void standardFunctions() {
            StdlibFunction f = registry.get("read_file_utf8");
            assertThat(f).isNotNull();
            assertThat(f.getArity()).isEqualTo(1);
            assertThat(f.getType().toDisplayString()).isEqualTo("(String) -> String");
            assertThat(registry.getAll()).extracting(func -> func.name).containsExactly("read_file_utf8");
        }

        @Test
        @DisplayName("未注册的名称返回 null")
        void unknownName() {
            assertThat(registry.get("no_such_function")).isNull();
        }

        @Test
        @DisplayName("重复注册报错")
        void duplicate() {
            StdlibFunction again = new StdlibFunction("read_file_utf8",
                    ReqTypes.functionOf(ReqTypes.STRING, ReqTypes.STRING), (at, args) -> args.get(0));
            assertThatThrownBy(() -> registry.register(again))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ============ 调用 ============

    @Nested
    @DisplayName("调用")
    class Calls {

        @Test
        @DisplayName("读取 UTF-8 文件")
        void readFile() {
            RclValue result = registry.get("read_file_utf8")
                    .call(AT, Collections.<RclValue>singletonList(RclString.of("hello.txt")));
            assertThat(result).isEqualTo(RclString.of("你好\n"));
        }

        @Test
        @DisplayName("参数数量不符")
        void wrongArity() {
            assertThatThrownBy(() -> registry.get("read_file_utf8").call(AT, Collections.<RclValue>emptyList()))
                    .isInstanceOfSatisfying(RclError.class, err -> assertThat(err.getRawMessage())
                            .isEqualTo("函数 'std.read_file_utf8' 需要 1 个参数，实际传入 0 个。"));
        }

        @Test
        @DisplayName("参数类型不符时指出是第几个参数")
        void wrongArgumentType() {
            assertThatThrownBy(() -> registry.get("read_file_utf8")
                    .call(AT, Collections.<RclValue>singletonList(RclInt.of(1))))
                    .isInstanceOfSatisfying(RclError.class, err -> {
                        assertThat(err.getRawMessage()).isEqualTo("类型不匹配。");
                        assertThat(err.getHelp()).isEqualTo("'std.read_file_utf8' 的第 1 个参数必须是 String。");
                    });
        }

        @Test
        @DisplayName("文件不存在")
        void missingFile() {
            assertThatThrownBy(() -> registry.get("read_file_utf8")
                    .call(AT, Collections.<RclValue>singletonList(RclString.of("missing.txt"))))
                    .isInstanceOf(RclError.class)
                    .hasMessageContaining("文件不存在");
        }
    }

    // ============ std 字典 ============

    @Nested
    @DisplayName("std 字典")
    class StdDict {

        @Test
        @DisplayName("导出为内置函数值并可以调用")
        void exportsBuiltins() {
            RclDict std = registry.toDict(AT);
            RclValue f = std.get(RclString.of("read_file_utf8"));
            assertThat(f).isInstanceOf(RclBuiltinFunction.class);

            RclBuiltinFunction builtin = (RclBuiltinFunction) f;
            assertThat(builtin.getArity()).isEqualTo(1);
            assertThat(builtin.call(Collections.<RclValue>singletonList(RclString.of("hello.txt"))))
                    .isEqualTo(RclString.of("你好\n"));
        }

        @Test
        @DisplayName("通过 std 调用出错时定位在给定位置")
        void builtinErrorsUseGivenSpan() {
            Span stdRef = new Span("main.rcl", 3, 10, 52, 3);
            RclBuiltinFunction builtin = (RclBuiltinFunction) registry.toDict(stdRef)
                    .get(RclString.of("read_file_utf8"));
            assertThatThrownBy(() -> builtin.call(Collections.<RclValue>singletonList(RclInt.of(7))))
                    .isInstanceOfSatisfying(RclError.class,
                            err -> assertThat(err.getSpan()).isEqualTo(stdRef));
        }

        @Test
        @DisplayName("内置函数的签名类型在静态检查中满足自身的要求")
        void signatureTypeFitsStatically() {
            StdlibFunction f = registry.get("read_file_utf8");
            TypeReq req = TypeReq.annotation(AT, f.signature);
            assertThat(req.checkType(AT, f.getType())).isEqualTo(Typed.type(f.getType()));
        }

        @Test
        @DisplayName("运行时不检查函数值，内置函数值不满足推迟的函数要求")
        void builtinValueRejectedAtRuntime() {
            RclValue f = registry.toDict(AT).get(RclString.of("read_file_utf8"));
            TypeReq req = TypeReq.annotation(AT, ReqTypes.functionOf(ReqTypes.INT, ReqTypes.INT));
            assertThatThrownBy(() -> req.checkValue(AT, f))
                    .isInstanceOfSatisfying(RclError.class,
                            err -> assertThat(err.getRawMessage()).isEqualTo("类型不匹配。"));
        }
    }
}
