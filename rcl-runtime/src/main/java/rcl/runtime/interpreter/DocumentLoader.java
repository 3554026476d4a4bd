package rcl.runtime.interpreter;

import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * 文档加载器：按基准目录解析相对路径，读取 UTF-8 文本。
 *
 * <p>同一路径只读取一次，之后直接返回缓存内容。缓存不会自动失效，
 * 长期存活的加载器在文件可能变化时应调用 {@link #clear()}。</p>
 */
public class DocumentLoader {

    private static final Logger LOG = Logger.getLogger(DocumentLoader.class.getName());

    private final Path baseDir;
    private final Map<Path, String> cache = new ConcurrentHashMap<>();

    public DocumentLoader(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /** 相对路径按基准目录解析，绝对路径保持不变 */
    public Path resolve(String path) {
        return baseDir.resolve(path).normalize();
    }

    /**
     * 读取 UTF-8 文件内容
     *
     * @param at 报告错误时使用的位置（发起读取的调用）
     * @throws RclError 文件不存在、无法读取或不是合法的 UTF-8
     */
    public String loadUtf8(String path, Span at) {
        Path resolved = resolve(path);
        String cached = cache.get(resolved);
        if (cached != null) return cached;

        String content;
        try {
            byte[] bytes = Files.readAllBytes(resolved);
            content = StandardCharsets.UTF_8.newDecoder()
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (NoSuchFileException e) {
            throw at.error("文件不存在: " + resolved);
        } catch (CharacterCodingException e) {
            throw at.error("文件不是合法的 UTF-8: " + resolved);
        } catch (IOException e) {
            RclError err = at.error("无法读取文件 " + resolved + ": " + e.getMessage());
            err.initCause(e);
            throw err;
        }

        LOG.fine("已加载 " + resolved + "（" + content.length() + " 个字符）");
        cache.put(resolved, content);
        return content;
    }

    /** 丢弃所有缓存内容，之后的读取重新访问文件 */
    public void clear() {
        cache.clear();
    }
}
