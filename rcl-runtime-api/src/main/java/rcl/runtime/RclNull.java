package rcl.runtime;

/**
 * RCL null 值
 */
public final class RclNull extends RclValue {

    /** 唯一的 null 实例 */
    public static final RclNull NULL = new RclNull();

    private RclNull() {
    }

    @Override
    public String getTypeName() {
        return "Null";
    }

    @Override
    public String toString() {
        return "null";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclNull;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}
