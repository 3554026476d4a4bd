package com.rcl.compiler.parser;

import com.rcl.compiler.analysis.typereq.ReqType;
import com.rcl.compiler.analysis.typereq.ReqTypes;
import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.analysis.types.RclTypes;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型注解解析器
 *
 * <p>语法：</p>
 * <pre>
 * type := "Null" | "Bool" | "Int" | "String" | "Dynamic"
 *       | "List" "[" type "]"
 *       | "Set" "[" type "]"
 *       | "Dict" "[" type "," type "]"
 *       | "(" [type ("," type)* [","]] ")" "->" type
 * </pre>
 */
public final class TypeParser {

    private final String source;
    private final String file;
    private final boolean allowDynamic;
    private int pos;

    private TypeParser(String source, String file, boolean allowDynamic) {
        this.source = source;
        this.file = file;
        this.allowDynamic = allowDynamic;
    }

    /**
     * 解析实际类型，允许出现 Dynamic
     */
    public static RclType parseType(String source, String file) {
        return new TypeParser(source, file, true).parseAll();
    }

    /**
     * 解析类型要求的形状，Dynamic 不允许出现在要求中
     */
    public static ReqType parseReqType(String source, String file) {
        return ReqTypes.fromType(new TypeParser(source, file, false).parseAll());
    }

    /** 整个源码的位置，用于把类型注解作为要求的来源 */
    public static Span spanOf(String source, String file) {
        return new Span(file, 1, 1, 0, source.length());
    }

    private RclType parseAll() {
        skipWhitespace();
        RclType type = parseTypeExpr();
        skipWhitespace();
        if (pos < source.length()) {
            throw error(pos, source.length() - pos, "类型之后出现多余的内容。");
        }
        return type;
    }

    private RclType parseTypeExpr() {
        skipWhitespace();
        if (peek() == '(') {
            return parseFunction();
        }

        int start = pos;
        String name = readIdentifier();
        if (name.isEmpty()) {
            throw error(start, Math.min(1, source.length() - start), "此处期望一个类型。");
        }

        switch (name) {
            case "List": {
                expect('[');
                RclType elem = parseTypeExpr();
                expect(']');
                return RclTypes.listOf(elem);
            }
            case "Set": {
                expect('[');
                RclType elem = parseTypeExpr();
                expect(']');
                return RclTypes.setOf(elem);
            }
            case "Dict": {
                expect('[');
                RclType key = parseTypeExpr();
                expect(',');
                RclType value = parseTypeExpr();
                expect(']');
                return RclTypes.dictOf(key, value);
            }
            default: {
                RclType type = RclTypes.fromName(name);
                if (type == null) {
                    throw error(start, name.length(), "未知类型 '" + name + "'。");
                }
                if (type == RclTypes.DYNAMIC && !allowDynamic) {
                    throw error(start, name.length(), "类型要求中不能使用 Dynamic。")
                            .withHelp("要求必须是完全具体的类型。");
                }
                return type;
            }
        }
    }

    private RclType parseFunction() {
        expect('(');
        List<RclType> args = new ArrayList<RclType>();
        skipWhitespace();
        while (peek() != ')') {
            args.add(parseTypeExpr());
            skipWhitespace();
            if (peek() == ',') {
                pos++;
                skipWhitespace();
            } else if (peek() != ')') {
                throw error(pos, 1, "此处期望 ',' 或 ')'。");
            }
        }
        expect(')');
        expect("->");
        RclType result = parseTypeExpr();
        return RclTypes.functionOf(args, result);
    }

    // ============ 字符扫描 ============

    private char peek() {
        return pos < source.length() ? source.charAt(pos) : '\0';
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private String readIdentifier() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private void expect(char c) {
        skipWhitespace();
        if (peek() != c) {
            throw error(pos, pos < source.length() ? 1 : 0, "此处期望 '" + c + "'。");
        }
        pos++;
    }

    private void expect(String s) {
        skipWhitespace();
        if (!source.startsWith(s, pos)) {
            throw error(pos, pos < source.length() ? 1 : 0, "此处期望 '" + s + "'。");
        }
        pos += s.length();
    }

    private RclError error(int offset, int length, String message) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return RclError.at(new Span(file, line, column, offset, length), message);
    }
}
