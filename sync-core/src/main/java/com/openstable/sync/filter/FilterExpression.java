package com.openstable.sync.filter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Node of a filter: a single column condition or an AND/OR group of nodes.
 */
public sealed interface FilterExpression {

    /**
     * Renders the node in the feed's query-string form, e.g. {@code status=eq.ACTIVE}.
     */
    String render();

    /**
     * Evaluates the node against a raw row. Missing columns read as null.
     */
    boolean test(Map<String, Object> row);

    record Condition(String column, FilterOperator operator, Object value) implements FilterExpression {

        @Override
        public String render() {
            return column + "=" + operator.token() + "." + renderValue();
        }

        private String renderValue() {
            if (operator == FilterOperator.IN && value instanceof List<?> values) {
                return values.stream().map(String::valueOf).collect(Collectors.joining(",", "(", ")"));
            }
            return String.valueOf(value);
        }

        @Override
        public boolean test(Map<String, Object> row) {
            return FilterMatcher.matches(row.get(column), operator, value);
        }
    }

    record Group(boolean any, List<FilterExpression> members) implements FilterExpression {

        public Group {
            members = List.copyOf(members);
        }

        @Override
        public String render() {
            return members.stream()
                    .map(FilterExpression::render)
                    .collect(Collectors.joining(",", any ? "or(" : "and(", ")"));
        }

        @Override
        public boolean test(Map<String, Object> row) {
            return any
                    ? members.stream().anyMatch(member -> member.test(row))
                    : members.stream().allMatch(member -> member.test(row));
        }
    }
}
