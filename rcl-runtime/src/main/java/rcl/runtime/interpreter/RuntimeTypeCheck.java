package rcl.runtime.interpreter;

import com.rcl.compiler.analysis.typereq.TypeReq;
import com.rcl.compiler.analysis.typereq.Typed;
import com.rcl.compiler.analysis.types.RclType;
import com.rcl.compiler.ast.Span;
import com.rcl.compiler.error.RclError;
import rcl.runtime.RclValue;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 延迟的运行时类型检查节点。
 *
 * <p>静态检查返回 {@link Typed.Kind#DEFER} 时创建，持有要求、位置和推迟的类型，
 * 直到求值得到实际值后再执行动态检查。检查只执行一次，没有重试。</p>
 */
public final class RuntimeTypeCheck {

    private static final Logger LOG = Logger.getLogger(RuntimeTypeCheck.class.getName());

    private final TypeReq requirement;
    private final Span span;
    private final RclType type;

    private RuntimeTypeCheck(TypeReq requirement, Span span, RclType type) {
        this.requirement = requirement;
        this.span = span;
        this.type = type;
    }

    /**
     * 为推迟的静态检查结果创建检查节点
     *
     * @throws IllegalArgumentException 结果不是推迟的
     */
    public static RuntimeTypeCheck deferred(TypeReq requirement, Span span, Typed typed) {
        if (!typed.isDeferred()) {
            throw new IllegalArgumentException("静态已知的类型不需要运行时检查: " + typed);
        }
        return new RuntimeTypeCheck(requirement, span, typed.getType());
    }

    public TypeReq getRequirement() {
        return requirement;
    }

    public Span getSpan() {
        return span;
    }

    /** 检查通过后值所具有的类型 */
    public RclType getType() {
        return type;
    }

    /**
     * 对实际值执行检查，通过时原样返回值
     *
     * @throws RclError 值不符合要求
     */
    public RclValue apply(RclValue value) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("运行时检查 " + span + ": 期望 " + type.toDisplayString() + "，值类型 " + value.getTypeName());
        }
        requirement.checkValue(span, value);
        return value;
    }
}
