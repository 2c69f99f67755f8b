package net.tvcatalog.support.pagination;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * One sort key of an {@link OrderSpec}.
 *
 * @param name stable key name written into continuation tokens
 * @param expression SQL expression the store orders and filters by
 * @param direction configured sort direction
 * @param valueExtractor reads the sortable value from a row; must agree with {@code expression}
 * @param storeValueMapper converts a value decoded from a token into the value bound against {@code expression}
 * @param <R> row type
 */
public record OrderKey<R>(String name,
                          String expression,
                          SortDirection direction,
                          Function<R, Object> valueExtractor,
                          UnaryOperator<Object> storeValueMapper) {

    public OrderKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(valueExtractor, "valueExtractor");
        storeValueMapper = storeValueMapper == null ? UnaryOperator.identity() : storeValueMapper;
        if (name.isBlank()) {
            throw new IllegalArgumentException("Order key name must not be blank");
        }
    }

    public static <R> OrderKey<R> of(String name, String expression, SortDirection direction,
                                     Function<R, Object> valueExtractor) {
        return new OrderKey<>(name, expression, direction, valueExtractor, null);
    }

    public static <R> OrderKey<R> of(String name, String expression, SortDirection direction,
                                     Function<R, Object> valueExtractor, UnaryOperator<Object> storeValueMapper) {
        return new OrderKey<>(name, expression, direction, valueExtractor, storeValueMapper);
    }

    public Object valueOf(R row) {
        return valueExtractor.apply(row);
    }

    public Object toStoreValue(Object sortValue) {
        return storeValueMapper.apply(sortValue);
    }
}
