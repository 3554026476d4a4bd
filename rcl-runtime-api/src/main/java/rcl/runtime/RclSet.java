package rcl.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * RCL Set 值（不可变集合，保留插入顺序）
 *
 * <p>迭代顺序仅用于诊断时给出元素位置，没有语义上的保证。</p>
 */
public final class RclSet extends RclValue implements Iterable<RclValue> {

    private final Set<RclValue> elements;

    public RclSet(Iterable<RclValue> values) {
        Set<RclValue> set = new LinkedHashSet<RclValue>();
        for (RclValue v : values) {
            set.add(v);
        }
        this.elements = Collections.unmodifiableSet(set);
    }

    public static RclSet of(RclValue... values) {
        return new RclSet(Arrays.asList(values));
    }

    public Set<RclValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public Iterator<RclValue> iterator() {
        return elements.iterator();
    }

    @Override
    public String getTypeName() {
        return "Set";
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<String>();
        for (RclValue v : elements) {
            parts.add(v.toString());
        }
        return "{" + String.join(", ", parts) + "}";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclSet && ((RclSet) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
