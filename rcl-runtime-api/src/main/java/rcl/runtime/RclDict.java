package rcl.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RCL Dict 值（不可变映射，保留插入顺序）
 */
public final class RclDict extends RclValue {

    private final Map<RclValue, RclValue> entries;

    public RclDict(Map<RclValue, RclValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<RclValue, RclValue>(entries));
    }

    public Map<RclValue, RclValue> getEntries() {
        return entries;
    }

    public RclValue get(RclValue key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String getTypeName() {
        return "Dict";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<RclValue, RclValue> entry : entries.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclDict && ((RclDict) o).entries.equals(entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
