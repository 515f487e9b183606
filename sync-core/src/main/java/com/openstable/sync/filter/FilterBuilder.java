package com.openstable.sync.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fluent builder for {@link FilterDescriptor}.
 *
 * <pre>
 * FilterDescriptor filter = FilterBuilder.on("rentable-units")
 *         .eq("stable_id", stableId)
 *         .eq("available", true)
 *         .build();
 * </pre>
 *
 * Nested groups are built from sub-builders obtained with {@link #where()}.
 */
public class FilterBuilder {

    private final String collection;
    private final List<FilterExpression> expressions = new ArrayList<>();

    private FilterBuilder(String collection) {
        this.collection = collection;
    }

    public static FilterBuilder on(String collection) {
        return new FilterBuilder(collection);
    }

    /**
     * Builder for a group member; it has no collection and is only passed to {@link #and} or {@link #or}.
     */
    public static FilterBuilder where() {
        return new FilterBuilder(null);
    }

    public FilterBuilder eq(String column, Object value) {
        return add(column, FilterOperator.EQ, value);
    }

    public FilterBuilder neq(String column, Object value) {
        return add(column, FilterOperator.NEQ, value);
    }

    public FilterBuilder gt(String column, Object value) {
        return add(column, FilterOperator.GT, value);
    }

    public FilterBuilder gte(String column, Object value) {
        return add(column, FilterOperator.GTE, value);
    }

    public FilterBuilder lt(String column, Object value) {
        return add(column, FilterOperator.LT, value);
    }

    public FilterBuilder lte(String column, Object value) {
        return add(column, FilterOperator.LTE, value);
    }

    public FilterBuilder in(String column, List<?> values) {
        return add(column, FilterOperator.IN, List.copyOf(values));
    }

    public FilterBuilder in(String column, Object... values) {
        return in(column, Arrays.asList(values));
    }

    public FilterBuilder like(String column, String pattern) {
        return add(column, FilterOperator.LIKE, pattern);
    }

    public FilterBuilder ilike(String column, String pattern) {
        return add(column, FilterOperator.ILIKE, pattern);
    }

    /**
     * {@code is.null}, {@code is.true} or {@code is.false}.
     */
    public FilterBuilder is(String column, Boolean value) {
        return add(column, FilterOperator.IS, value == null ? "null" : value.toString());
    }

    public FilterBuilder and(FilterBuilder... members) {
        return group(false, members);
    }

    public FilterBuilder or(FilterBuilder... members) {
        return group(true, members);
    }

    public FilterDescriptor build() {
        if (collection == null) {
            throw new IllegalStateException("Group member builders cannot be built on their own");
        }
        return new FilterDescriptor(collection, expressions);
    }

    private FilterBuilder add(String column, FilterOperator operator, Object value) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Filter column must not be blank");
        }
        expressions.add(new FilterExpression.Condition(column, operator, value));
        return this;
    }

    private FilterBuilder group(boolean any, FilterBuilder... members) {
        List<FilterExpression> groupMembers = new ArrayList<>();
        for (FilterBuilder member : members) {
            groupMembers.add(member.asExpression());
        }
        if (!groupMembers.isEmpty()) {
            expressions.add(new FilterExpression.Group(any, groupMembers));
        }
        return this;
    }

    private FilterExpression asExpression() {
        if (expressions.size() == 1) {
            return expressions.get(0);
        }
        return new FilterExpression.Group(false, expressions);
    }
}
