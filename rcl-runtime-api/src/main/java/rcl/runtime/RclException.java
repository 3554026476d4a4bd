package rcl.runtime;

/**
 * 值模型层抛出的异常，例如 {@link RclValue#fromJava(Object)} 遇到无法表示的 Java 对象。
 *
 * <p>此模块不知道源码位置，消息只描述出了什么问题。
 * 需要定位到源码的类型错误使用其子类 {@code RclError}。</p>
 */
public class RclException extends RuntimeException {

    public RclException(String message) {
        super(message);
    }

    public RclException(String message, Throwable cause) {
        super(message, cause);
    }
}
