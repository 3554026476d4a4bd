package com.rcl.compiler.ast;

import com.rcl.compiler.error.RclError;

import java.util.Objects;

/**
 * 源码位置信息
 *
 * <p>只支持复制与相等比较，用于把诊断锚定到源码。</p>
 */
public final class Span {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public static final Span UNKNOWN = new Span("<unknown>", 0, 0, 0, 0);

    public Span(String file, int line, int column, int offset, int length) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    /** 以此位置为锚点创建错误 */
    public RclError error(String message) {
        return RclError.at(this, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span that = (Span) o;
        return line == that.line && column == that.column
                && offset == that.offset && length == that.length
                && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column, offset, length);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
