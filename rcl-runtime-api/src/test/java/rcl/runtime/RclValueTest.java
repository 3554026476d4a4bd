package rcl.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * 运行时值测试
 */
class RclValueTest {

    @Test
    @DisplayName("Java 原子值转换")
    void fromJavaAtoms() {
        assertThat(RclValue.fromJava(null)).isSameAs(RclNull.NULL);
        assertThat(RclValue.fromJava(42)).isEqualTo(RclInt.of(42));
        assertThat(RclValue.fromJava(42L)).isEqualTo(RclInt.of(42));
        assertThat(RclValue.fromJava(true)).isSameAs(RclBool.TRUE);
        assertThat(RclValue.fromJava("a")).isEqualTo(RclString.of("a"));
    }

    @Test
    @DisplayName("Java 集合转换")
    void fromJavaCollections() {
        assertThat(RclValue.fromJava(Arrays.asList(1, "x")))
                .isEqualTo(RclList.of(RclInt.of(1), RclString.of("x")));
        assertThat(RclValue.fromJava(new LinkedHashSet<Object>(Arrays.asList(1, 2))))
                .isEqualTo(RclSet.of(RclInt.of(1), RclInt.of(2)));

        Map<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("k", Arrays.asList(true));
        RclValue dict = RclValue.fromJava(map);
        assertThat(dict).isInstanceOf(RclDict.class);
        assertThat(((RclDict) dict).get(RclString.of("k"))).isEqualTo(RclList.of(RclBool.TRUE));
    }

    @Test
    @DisplayName("不支持的 Java 对象")
    void fromJavaUnsupported() {
        assertThatThrownBy(() -> RclValue.fromJava(1.5))
                .isInstanceOf(RclException.class)
                .hasMessageContaining("java.lang.Double");
    }

    @Test
    @DisplayName("集合去重且与顺序无关地相等")
    void setSemantics() {
        assertThat(RclSet.of(RclInt.of(1), RclInt.of(1)).size()).isEqualTo(1);
        assertThat(RclSet.of(RclInt.of(1), RclInt.of(2))).isEqualTo(RclSet.of(RclInt.of(2), RclInt.of(1)));
    }

    @Test
    @DisplayName("小整数缓存")
    void intCache() {
        assertThat(RclInt.of(5)).isSameAs(RclInt.of(5));
        assertThat(RclInt.of(1000)).isEqualTo(RclInt.of(1000));
        assertThat(RclInt.of(1000).getValue()).isEqualTo(1000L);
    }

    @Test
    @DisplayName("内置函数")
    void builtin() {
        RclBuiltinFunction f = new RclBuiltinFunction("first", 1, args -> args.get(0));
        assertThat(f.getTypeName()).isEqualTo("Function");
        assertThat(f.call(Arrays.<RclValue>asList(RclString.of("v")))).isEqualTo(RclString.of("v"));
    }
}
