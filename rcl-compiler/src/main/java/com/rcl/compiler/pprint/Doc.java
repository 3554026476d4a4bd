package com.rcl.compiler.pprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 可渲染的诊断文档。
 *
 * <p>由文本、强制换行、缩进块和拼接四种节点组成。缩进只在行首输出文本时生效，
 * 因此空行不会带行尾空白。</p>
 */
public abstract class Doc {

    /** 强制换行 */
    public static final Doc HARD_BREAK = new HardBreak();

    private static final Doc EMPTY = new Concat(Collections.<Doc>emptyList());

    public static Doc empty() {
        return EMPTY;
    }

    public static Doc text(String text) {
        return new Text(text);
    }

    /**
     * 拼接多个片段，片段可以是 Doc 或任意对象（按 toString 转为文本）。
     */
    public static Doc concat(Object... parts) {
        List<Doc> docs = new ArrayList<Doc>(parts.length);
        for (Object part : parts) {
            docs.add(part instanceof Doc ? (Doc) part : text(String.valueOf(part)));
        }
        return new Concat(docs);
    }

    public static Doc concat(List<Doc> parts) {
        return new Concat(new ArrayList<Doc>(parts));
    }

    /** 缩进一层 */
    public static Doc indent(Object... parts) {
        return new Indent(concat(parts));
    }

    public String render(PrintConfig config) {
        Renderer r = new Renderer(config.getIndentString());
        renderTo(r);
        return r.sb.toString();
    }

    abstract void renderTo(Renderer r);

    @Override
    public String toString() {
        return render(new PrintConfig());
    }

    // ============ 节点 ============

    static final class Text extends Doc {
        private final String text;

        Text(String text) {
            this.text = text;
        }

        @Override
        void renderTo(Renderer r) {
            String[] lines = text.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) r.newline();
                r.write(lines[i]);
            }
        }
    }

    static final class HardBreak extends Doc {
        @Override
        void renderTo(Renderer r) {
            r.newline();
        }
    }

    static final class Indent extends Doc {
        private final Doc inner;

        Indent(Doc inner) {
            this.inner = inner;
        }

        @Override
        void renderTo(Renderer r) {
            r.level++;
            inner.renderTo(r);
            r.level--;
        }
    }

    static final class Concat extends Doc {
        private final List<Doc> parts;

        Concat(List<Doc> parts) {
            this.parts = parts;
        }

        @Override
        void renderTo(Renderer r) {
            for (Doc part : parts) {
                part.renderTo(r);
            }
        }
    }

    static final class Renderer {
        final StringBuilder sb = new StringBuilder();
        final String indentUnit;
        int level;
        boolean atLineStart = true;

        Renderer(String indentUnit) {
            this.indentUnit = indentUnit;
        }

        void write(String s) {
            if (s.isEmpty()) return;
            if (atLineStart) {
                for (int i = 0; i < level; i++) {
                    sb.append(indentUnit);
                }
                atLineStart = false;
            }
            sb.append(s);
        }

        void newline() {
            sb.append('\n');
            atLineStart = true;
        }
    }
}
