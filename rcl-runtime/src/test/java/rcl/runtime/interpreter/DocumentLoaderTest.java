package rcl.runtime.interpreter;

import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * 文档加载器测试
 */
class DocumentLoaderTest {

    private static final Span AT = new Span("main.rcl", 2, 5, 12, 30);

    @TempDir
    Path tempDir;

    private DocumentLoader loader;

    @BeforeEach
    void setUp() {
        loader = new DocumentLoader(tempDir);
    }

    @Test
    @DisplayName("相对路径按基准目录解析")
    void resolvesRelativePaths() throws Exception {
        Files.write(tempDir.resolve("data.txt"), "内容".getBytes(StandardCharsets.UTF_8));
        assertThat(loader.resolve("sub/../data.txt")).isEqualTo(tempDir.resolve("data.txt").toAbsolutePath().normalize());
        assertThat(loader.loadUtf8("data.txt", AT)).isEqualTo("内容");
    }

    @Test
    @DisplayName("绝对路径保持不变")
    void absolutePaths() throws Exception {
        Path file = tempDir.resolve("abs.txt");
        Files.write(file, "x".getBytes(StandardCharsets.UTF_8));
        assertThat(loader.loadUtf8(file.toAbsolutePath().toString(), AT)).isEqualTo("x");
    }

    @Test
    @DisplayName("文件不存在时在调用位置报错")
    void missingFile() {
        assertThatThrownBy(() -> loader.loadUtf8("missing.txt", AT))
                .isInstanceOfSatisfying(RclError.class, err -> {
                    assertThat(err.getRawMessage()).startsWith("文件不存在");
                    assertThat(err.getSpan()).isEqualTo(AT);
                });
    }

    @Test
    @DisplayName("非法 UTF-8 报错")
    void invalidUtf8() throws Exception {
        Files.write(tempDir.resolve("bad.txt"), new byte[]{(byte) 0xC3, (byte) 0x28});
        assertThatThrownBy(() -> loader.loadUtf8("bad.txt", AT))
                .isInstanceOf(RclError.class)
                .hasMessageContaining("文件不是合法的 UTF-8");
    }

    @Test
    @DisplayName("同一路径只读取一次")
    void caches() throws Exception {
        Path file = tempDir.resolve("cached.txt");
        Files.write(file, "first".getBytes(StandardCharsets.UTF_8));
        assertThat(loader.loadUtf8("cached.txt", AT)).isEqualTo("first");

        Files.write(file, "second".getBytes(StandardCharsets.UTF_8));
        assertThat(loader.loadUtf8("cached.txt", AT)).isEqualTo("first");
        assertThat(new DocumentLoader(tempDir).loadUtf8("cached.txt", AT)).isEqualTo("second");
    }

    @Test
    @DisplayName("清空缓存后重新读取文件")
    void clearDropsCache() throws Exception {
        Path file = tempDir.resolve("changing.txt");
        Files.write(file, "old".getBytes(StandardCharsets.UTF_8));
        assertThat(loader.loadUtf8("changing.txt", AT)).isEqualTo("old");

        Files.write(file, "new".getBytes(StandardCharsets.UTF_8));
        loader.clear();
        assertThat(loader.loadUtf8("changing.txt", AT)).isEqualTo("new");
    }
}
