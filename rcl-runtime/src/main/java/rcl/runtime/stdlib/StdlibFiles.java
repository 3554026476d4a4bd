package rcl.runtime.stdlib;

import com.rcl.compiler.analysis.typereq.ReqTypes;
import com.rcl.compiler.ast.Span;
import rcl.runtime.RclString;
import rcl.runtime.RclValue;
import rcl.runtime.interpreter.DocumentLoader;

import java.util.List;

/**
 * 文件相关的 stdlib 函数：read_file_utf8。
 */
final class StdlibFiles {

    private StdlibFiles() {}

    static void register(StdlibRegistry registry, DocumentLoader loader) {
        registry.register(new StdlibFunction(
                "read_file_utf8",
                ReqTypes.functionOf(ReqTypes.STRING, ReqTypes.STRING),
                (at, args) -> readFileUtf8(loader, at, args)));
    }

    /** read_file_utf8(path: String) -> String */
    static RclValue readFileUtf8(DocumentLoader loader, Span at, List<RclValue> args) {
        // 签名检查已保证参数是字符串
        String path = ((RclString) args.get(0)).getValue();
        return RclString.of(loader.loadUtf8(path, at));
    }
}
