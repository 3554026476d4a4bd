package rcl.runtime;

/**
 * RCL Int 值（64 位有符号整数）
 */
public final class RclInt extends RclValue {

    // 小整数缓存
    private static final RclInt[] CACHE = new RclInt[256];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RclInt(i - 128);
        }
    }

    private final long value;

    private RclInt(long value) {
        this.value = value;
    }

    public static RclInt of(long value) {
        if (value >= -128 && value < 128) {
            return CACHE[(int) value + 128];
        }
        return new RclInt(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclInt && ((RclInt) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
