package net.tvcatalog.support.pagination;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ordered list of sort keys for one listing. The last key is expected to be unique per row
 * (usually the primary identifier) so no two rows compare equal.
 *
 * @param <R> row type
 */
public final class OrderSpec<R> {

    private final List<OrderKey<R>> keys;
    private final Set<String> keyNames;

    private OrderSpec(List<OrderKey<R>> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("OrderSpec requires at least one key");
        }
        Set<String> names = new LinkedHashSet<>();
        for (OrderKey<R> key : keys) {
            if (!names.add(key.name())) {
                throw new IllegalArgumentException("Duplicate order key name: " + key.name());
            }
        }
        this.keys = List.copyOf(keys);
        this.keyNames = Set.copyOf(names);
    }

    @SafeVarargs
    public static <R> OrderSpec<R> of(OrderKey<R>... keys) {
        return new OrderSpec<>(List.of(keys));
    }

    public static <R> OrderSpec<R> of(List<OrderKey<R>> keys) {
        return new OrderSpec<>(new ArrayList<>(keys));
    }

    public List<OrderKey<R>> keys() {
        return keys;
    }

    public Set<String> keyNames() {
        return keyNames;
    }

    /**
     * Reads every key's sortable value from {@code row}, keyed by name in spec order.
     */
    public Map<String, Object> valuesOf(R row) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (OrderKey<R> key : keys) {
            values.put(key.name(), key.valueOf(row));
        }
        return values;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("OrderSpec[");
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(keys.get(i).name()).append(' ').append(keys.get(i).direction().sql().toLowerCase(Locale.ROOT));
        }
        return sb.append(']').toString();
    }
}
