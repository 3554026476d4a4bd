package rcl.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * RCL List 值（不可变列表）
 */
public final class RclList extends RclValue implements Iterable<RclValue> {

    private final List<RclValue> elements;

    public RclList(List<RclValue> values) {
        this.elements = Collections.unmodifiableList(new ArrayList<RclValue>(values));
    }

    public static RclList of(RclValue... values) {
        return new RclList(Arrays.asList(values));
    }

    public List<RclValue> getElements() {
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
        return "List";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).toString());
        }
        sb.append("]");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RclList && ((RclList) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
