package rcl.runtime;

import java.util.List;
import java.util.function.Function;

/**
 * 内置函数值（如 std.read_file_utf8）。
 *
 * <p>函数值只按名称比较；{@code impl} 负责参数检查与执行。</p>
 */
public final class RclBuiltinFunction extends RclValue {

    private final String name;
    private final int arity;
    private final Function<List<RclValue>, RclValue> impl;

    public RclBuiltinFunction(String name, int arity, Function<List<RclValue>, RclValue> impl) {
        this.name = name;
        this.arity = arity;
        this.impl = impl;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public RclValue call(List<RclValue> args) {
        return impl.apply(args);
    }

    @Override
    public String getTypeName() {
        return "Function";
    }

    @Override
    public String toString() {
        return "<builtin " + name + ">";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclBuiltinFunction && ((RclBuiltinFunction) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
