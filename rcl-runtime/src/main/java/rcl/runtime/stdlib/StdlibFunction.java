package rcl.runtime.stdlib;

import com.rcl.compiler.analysis.typereq.FunctionReq;
import com.rcl.compiler.analysis.typereq.ValueChecker;
import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;
import rcl.runtime.RclBuiltinFunction;
import rcl.runtime.RclValue;

import java.util.List;

/**
 * 带类型签名的标准库函数。
 *
 * <p>调用前先按签名检查参数数量和每个参数的值，实现因此可以直接假定参数类型正确。
 * 签名也以 {@link RclType} 形式对外提供，供类型检查器使用。</p>
 */
public final class StdlibFunction {

    /** 函数实现，参数已通过签名检查 */
    @FunctionalInterface
    public interface Impl {
        RclValue call(Span at, List<RclValue> args);
    }

    /** 函数名，如 "read_file_utf8" */
    public final String name;

    /** 类型签名 */
    public final FunctionReq signature;

    private final Impl impl;

    public StdlibFunction(String name, FunctionReq signature, Impl impl) {
        this.name = name;
        this.signature = signature;
        this.impl = impl;
    }

    public int getArity() {
        return signature.getArgs().size();
    }

    /** 函数类型，如 (String) -> String */
    public RclType getType() {
        return signature.toType();
    }

    /**
     * 检查参数后调用函数
     *
     * @throws RclError 参数数量或类型不符，或函数执行失败
     */
    public RclValue call(Span at, List<RclValue> args) {
        if (args.size() != getArity()) {
            throw at.error("函数 'std." + name + "' 需要 " + getArity()
                    + " 个参数，实际传入 " + args.size() + " 个。");
        }
        for (int i = 0; i < args.size(); i++) {
            try {
                ValueChecker.check(signature.getArgs().get(i), at, args.get(i));
            } catch (RclError err) {
                throw err.withHelp("'std." + name + "' 的第 " + (i + 1) + " 个参数必须是 "
                        + signature.getArgs().get(i) + "。");
            }
        }
        return impl.call(at, args);
    }

    /**
     * 转换为运行时的内置函数值
     *
     * @param at 通过该值调用时报告错误的位置，通常是求值器引用 std 的位置
     */
    public RclBuiltinFunction toValue(Span at) {
        return new RclBuiltinFunction(name, getArity(), args -> call(at, args));
    }
}
