package com.rcl.compiler.pprint;

import rcl.runtime.RclBuiltinFunction;
import rcl.runtime.RclDict;
import rcl.runtime.RclList;
import rcl.runtime.RclSet;
import rcl.runtime.RclString;
import rcl.runtime.RclValue;

import java.util.Map;

/**
 * 以 RCL 语法渲染运行时值: null, true, 42, "a", [1, 2], {1, 2}, {"a": 1}
 */
public final class ValueFormatter {

    private ValueFormatter() {}

    public static Doc format(RclValue value) {
        return Doc.text(toRcl(value));
    }

    public static String toRcl(RclValue value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    private static void append(StringBuilder sb, RclValue value) {
        if (value instanceof RclString) {
            appendString(sb, ((RclString) value).getValue());
        } else if (value instanceof RclList) {
            sb.append('[');
            boolean first = true;
            for (RclValue elem : (RclList) value) {
                if (!first) sb.append(", ");
                first = false;
                append(sb, elem);
            }
            sb.append(']');
        } else if (value instanceof RclSet) {
            RclSet set = (RclSet) value;
            // 空的 {} 是字典
            if (set.size() == 0) {
                sb.append("std.empty_set");
                return;
            }
            sb.append('{');
            boolean first = true;
            for (RclValue elem : set) {
                if (!first) sb.append(", ");
                first = false;
                append(sb, elem);
            }
            sb.append('}');
        } else if (value instanceof RclDict) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<RclValue, RclValue> entry : ((RclDict) value).getEntries().entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                append(sb, entry.getKey());
                sb.append(": ");
                append(sb, entry.getValue());
            }
            sb.append('}');
        } else if (value instanceof RclBuiltinFunction) {
            sb.append("std.").append(((RclBuiltinFunction) value).getName());
        } else {
            // null / Bool / Int
            sb.append(value.toString());
        }
    }

    private static void appendString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u{%x}", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }
}
