package com.rcl.compiler.error;

import com.rcl.compiler.ast.Span;
import com.rcl.compiler.pprint.Doc;
import com.rcl.compiler.pprint.PrintConfig;
import rcl.runtime.RclException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 报告给用户的错误。
 *
 * <p>以构建器方式逐步补充信息，最后直接抛出：</p>
 * <pre>
 * throw span.error("类型不匹配。")
 *         .withBody(body)
 *         .withNote(annotationSpan, "期望的类型在此处指定。");
 * </pre>
 *
 * <p>路径元素从最内层开始累积：内层检查先添加自己的位置，外层捕获后再添加外层位置，
 * 因此 {@link #getPath()} 的第一个元素是离出错点最近的那一个。</p>
 */
public class RclError extends RclException {

    /** 附加在其它源码位置上的说明 */
    public static final class Note {
        private final Span span;
        private final Doc text;

        Note(Span span, Doc text) {
            this.span = span;
            this.text = text;
        }

        public Span getSpan() { return span; }
        public Doc getText() { return text; }
    }

    private final Span span;
    private Doc body;
    private final List<Note> notes = new ArrayList<Note>();
    private String help;
    private final List<PathElement> path = new ArrayList<PathElement>();

    private RclError(Span span, String message) {
        super(message);
        this.span = span;
    }

    public static RclError at(Span span, String message) {
        return new RclError(span, message);
    }

    public RclError withBody(Doc body) {
        this.body = body;
        return this;
    }

    public RclError withBody(String body) {
        return withBody(Doc.text(body));
    }

    public RclError withNote(Span at, Doc text) {
        notes.add(new Note(at, text));
        return this;
    }

    public RclError withNote(Span at, String text) {
        return withNote(at, Doc.text(text));
    }

    public RclError withHelp(String help) {
        this.help = help;
        return this;
    }

    public RclError withPathElement(PathElement element) {
        path.add(element);
        return this;
    }

    public Span getSpan() {
        return span;
    }

    public Doc getBody() {
        return body;
    }

    public List<Note> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public String getHelp() {
        return help;
    }

    /** 路径元素，最内层在前 */
    public List<PathElement> getPath() {
        return Collections.unmodifiableList(path);
    }

    /** 返回不含位置、正文和说明的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return render(new PrintConfig());
    }

    /**
     * 渲染完整诊断
     *
     * 输出格式类似:
     * 错误: 类型不匹配。
     *   --> config.rcl:3:9
     *   位于: [1]["a"]
     *
     *   期望此类型：
     *   ...
     * 注意 (config.rcl:1:8): 期望的类型在此处指定。
     * 帮助: ...
     */
    public String render(PrintConfig config) {
        String indent = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        sb.append("错误: ").append(getRawMessage());

        if (span != null && span.getLine() > 0) {
            sb.append('\n').append(indent).append("--> ").append(span);
        }
        if (!path.isEmpty()) {
            sb.append('\n').append(indent).append("位于: ").append(formatPath());
        }
        if (body != null) {
            sb.append("\n\n");
            sb.append(Doc.indent(body).render(config));
        }
        for (Note note : notes) {
            sb.append('\n').append("注意");
            if (note.span != null && note.span.getLine() > 0) {
                sb.append(" (").append(note.span).append(')');
            }
            sb.append(": ").append(note.text.render(config));
        }
        if (help != null) {
            sb.append('\n').append("帮助: ").append(help);
        }
        return sb.toString();
    }

    /** 按从外到内的顺序渲染路径 */
    public String formatPath() {
        StringBuilder sb = new StringBuilder();
        for (int i = path.size() - 1; i >= 0; i--) {
            sb.append(path.get(i));
        }
        return sb.toString();
    }
}
