package rcl.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RCL 运行时值的基类
 *
 * <p>值的种类固定为 Null、Bool、Int、String、List、Set、Dict 和内置函数，
 * 所有值在构造后不可变，可在多个检查之间安全共享。</p>
 */
public abstract class RclValue {

    /**
     * 将 Java 值转换为 RclValue
     *
     * @param javaValue Java 对象
     * @return 对应的 RclValue
     */
    public static RclValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return RclNull.NULL;
        }
        if (javaValue instanceof RclValue) {
            return (RclValue) javaValue;
        }
        if (javaValue instanceof Integer || javaValue instanceof Long) {
            return RclInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Boolean) {
            return RclBool.of((Boolean) javaValue);
        }
        if (javaValue instanceof String) {
            return RclString.of((String) javaValue);
        }
        if (javaValue instanceof List) {
            List<RclValue> elements = new ArrayList<RclValue>();
            for (Object item : (List<?>) javaValue) {
                elements.add(fromJava(item));
            }
            return new RclList(elements);
        }
        if (javaValue instanceof Set) {
            List<RclValue> elements = new ArrayList<RclValue>();
            for (Object item : (Collection<?>) javaValue) {
                elements.add(fromJava(item));
            }
            return new RclSet(elements);
        }
        if (javaValue instanceof Map) {
            Map<RclValue, RclValue> entries = new LinkedHashMap<RclValue, RclValue>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) javaValue).entrySet()) {
                entries.put(fromJava(entry.getKey()), fromJava(entry.getValue()));
            }
            return new RclDict(entries);
        }
        throw new RclException("无法将 Java 对象转换为 RclValue: " + javaValue.getClass().getName());
    }

    /**
     * 获取值的类型名称（如 "Int"、"List"），用于诊断消息
     */
    public abstract String getTypeName();

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
