package rcl.runtime;

/**
 * RCL Bool 值
 */
public final class RclBool extends RclValue {

    /** true 常量 */
    public static final RclBool TRUE = new RclBool(true);

    /** false 常量 */
    public static final RclBool FALSE = new RclBool(false);

    private final boolean value;

    private RclBool(boolean value) {
        this.value = value;
    }

    /**
     * 获取布尔值实例
     */
    public static RclBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Bool";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclBool && ((RclBool) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
