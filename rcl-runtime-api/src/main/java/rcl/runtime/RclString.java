package rcl.runtime;

/**
 * RCL String 值
 */
public final class RclString extends RclValue {

    private static final RclString EMPTY = new RclString("");

    private final String value;

    private RclString(String value) {
        this.value = value;
    }

    public static RclString of(String value) {
        if (value.isEmpty()) return EMPTY;
        return new RclString(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclString && ((RclString) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
