package com.rcl.cli;

import com.rcl.compiler.analysis.typereq.ReqType;
import com.rcl.compiler.analysis.typereq.TypeReq;
import com.rcl.compiler.analysis.typereq.Typed;
import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;
import com.rcl.compiler.parser.TypeParser;
import com.rcl.compiler.pprint.PrintConfig;
import rcl.runtime.RclValue;
import rcl.runtime.interpreter.RuntimeTypeCheck;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 类型检查执行器：先静态检查，推迟时再对实际值做运行时检查。
 */
public class CheckRunner {

    private static final Logger LOG = Logger.getLogger(CheckRunner.class.getName());

    private static final String TYPE_SOURCE = "<type>";
    private static final String EXPECTED_SOURCE = "<expected>";
    private static final String ACTUAL_SOURCE = "<actual>";

    private final PrintConfig config;
    private final PrintWriter out;
    private final PrintWriter err;

    public CheckRunner(PrintConfig config, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    static PrintConfig printConfig(int indentSize, boolean useTabs) {
        PrintConfig config = new PrintConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        return config;
    }

    /**
     * 检查 JSON 文档是否符合类型
     *
     * @return 进程退出码，0 表示通过
     */
    public int checkFile(String filePath, String typeSource) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }

        try {
            ReqType shape = TypeParser.parseReqType(typeSource, TYPE_SOURCE);
            TypeReq req = TypeReq.annotation(TypeParser.spanOf(typeSource, TYPE_SOURCE), shape);

            String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            Span docSpan = new Span(path.toString(), 1, 1, 0, json.length());
            RclValue value = JsonValueReader.read(json, docSpan);

            // 文档内容在静态阶段未知，静态检查总是推迟
            Typed typed = req.checkType(docSpan, RclTypes.DYNAMIC);
            LOG.fine("静态检查 " + path + ": " + typed);
            if (typed.isDeferred()) {
                RuntimeTypeCheck.deferred(req, docSpan, typed).apply(value);
            }

            out.println("ok");
            return 0;
        } catch (RclError e) {
            err.println(e.render(config));
            return 1;
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + ": " + e.getMessage());
            return 1;
        }
    }

    /**
     * 静态检查实际类型是否满足期望类型，打印 ok / defer 及结果类型
     *
     * @return 进程退出码，0 表示满足或需要运行时检查
     */
    public int checkSubtype(String expectedSource, String actualSource) {
        try {
            ReqType shape = TypeParser.parseReqType(expectedSource, EXPECTED_SOURCE);
            RclType actual = TypeParser.parseType(actualSource, ACTUAL_SOURCE);
            TypeReq req = TypeReq.annotation(TypeParser.spanOf(expectedSource, EXPECTED_SOURCE), shape);

            Typed typed = req.checkType(TypeParser.spanOf(actualSource, ACTUAL_SOURCE), actual);
            LOG.fine("静态检查 " + shape + " <- " + actual + ": " + typed);
            out.println((typed.isDeferred() ? "defer: " : "ok: ") + typed.getType().toDisplayString());
            return 0;
        } catch (RclError e) {
            err.println(e.render(config));
            return 1;
        }
    }
}
