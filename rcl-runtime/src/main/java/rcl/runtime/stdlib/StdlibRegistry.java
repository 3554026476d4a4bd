package rcl.runtime.stdlib;

import com.rcl.compiler.ast.Span;
import rcl.runtime.RclDict;
import rcl.runtime.RclString;
import rcl.runtime.RclValue;
import rcl.runtime.interpreter.DocumentLoader;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 标准库函数注册表。
 *
 * <p>求值器通过 {@link #toDict(Span)} 得到 {@code std} 字典；类型检查器通过
 * {@link StdlibFunction#getType()} 得到每个内置函数的签名。</p>
 */
public final class StdlibRegistry {

    private final Map<String, StdlibFunction> registry = new LinkedHashMap<>();

    /**
     * 创建包含全部标准库函数的注册表
     *
     * @param loader read_file_utf8 等文件函数使用的加载器
     */
    public static StdlibRegistry standard(DocumentLoader loader) {
        StdlibRegistry registry = new StdlibRegistry();
        StdlibFiles.register(registry, loader);
        return registry;
    }

    public void register(StdlibFunction func) {
        if (registry.containsKey(func.name)) {
            throw new IllegalArgumentException("标准库函数重复注册: " + func.name);
        }
        registry.put(func.name, func);
    }

    /** 按名称查找 stdlib 函数，不存在返回 null */
    public StdlibFunction get(String name) {
        return registry.get(name);
    }

    /** 获取所有已注册的 stdlib 函数 */
    public Collection<StdlibFunction> getAll() {
        return Collections.unmodifiableCollection(registry.values());
    }

    /**
     * 名称 → 内置函数值的字典，即运行时的 std
     *
     * @param at 内置函数调用出错时报告的位置
     */
    public RclDict toDict(Span at) {
        Map<RclValue, RclValue> builtins = new LinkedHashMap<>();
        for (StdlibFunction func : registry.values()) {
            builtins.put(RclString.of(func.name), func.toValue(at));
        }
        return new RclDict(builtins);
    }
}
