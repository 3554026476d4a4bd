package com.rcl.compiler.pprint;

import rcl.runtime.RclBuiltinFunction;
import rcl.runtime.RclInt;
import rcl.runtime.RclNull;
import rcl.runtime.RclSet;
import rcl.runtime.RclString;
import rcl.runtime.RclValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 运行时值的 RCL 语法渲染测试
 */
class ValueFormatterTest {

    @Test
    @DisplayName("原子值")
    void atoms() {
        assertEquals("null", ValueFormatter.toRcl(RclNull.NULL));
        assertEquals("true", ValueFormatter.toRcl(RclValue.fromJava(true)));
        assertEquals("-5", ValueFormatter.toRcl(RclInt.of(-5)));
    }

    @Test
    @DisplayName("字符串加引号并转义")
    void strings() {
        assertEquals("\"a\\\"b\\n\"", ValueFormatter.toRcl(RclString.of("a\"b\n")));
    }

    @Test
    @DisplayName("复合值")
    void compound() {
        Map<String, Object> dict = new LinkedHashMap<String, Object>();
        dict.put("a", Arrays.asList(1, 2));
        dict.put("b", null);
        assertEquals("{\"a\": [1, 2], \"b\": null}", ValueFormatter.toRcl(RclValue.fromJava(dict)));
        assertEquals("{1, \"x\"}", ValueFormatter.toRcl(RclSet.of(RclInt.of(1), RclString.of("x"))));
    }

    @Test
    @DisplayName("空集合与内置函数")
    void emptySetAndBuiltin() {
        assertEquals("std.empty_set", ValueFormatter.toRcl(RclSet.of()));
        assertEquals("std.read_file_utf8",
                ValueFormatter.toRcl(new RclBuiltinFunction("read_file_utf8", 1, args -> args.get(0))));
    }
}
