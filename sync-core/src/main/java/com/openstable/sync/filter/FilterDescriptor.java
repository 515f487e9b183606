package com.openstable.sync.filter;

import com.openstable.common.util.Constants;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable filter bound to a collection. Top-level expressions are combined with AND.
 * The descriptor is both sent to the transport (as a query string) and evaluated locally
 * against raw rows, so local and server filtering agree.
 */
public final class FilterDescriptor {

    private static final int HASH_LENGTH = 12;

    private final String collection;
    private final List<FilterExpression> expressions;

    FilterDescriptor(String collection, List<FilterExpression> expressions) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.expressions = List.copyOf(expressions);
    }

    /**
     * Matches every row of the collection.
     */
    public static FilterDescriptor all(String collection) {
        return new FilterDescriptor(collection, List.of());
    }

    public String collection() {
        return collection;
    }

    public List<FilterExpression> expressions() {
        return expressions;
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }

    public String toQueryString() {
        return expressions.stream().map(FilterExpression::render).collect(Collectors.joining(","));
    }

    public boolean matches(Map<String, Object> row) {
        if (row == null) {
            return false;
        }
        return expressions.stream().allMatch(expression -> expression.test(row));
    }

    /**
     * Short stable token identifying the filter, used in subscription ids.
     * Digest of the whole query string, so filters differing only in a value get different tokens.
     */
    public String hash() {
        if (isEmpty()) {
            return Constants.NO_FILTER_HASH;
        }
        return DigestUtils.md5DigestAsHex(toQueryString().getBytes(StandardCharsets.UTF_8))
                .substring(0, HASH_LENGTH);
    }

    /**
     * Key under which one transport channel is shared.
     */
    public String channelKey() {
        return isEmpty() ? collection : collection + "?" + toQueryString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterDescriptor other)) {
            return false;
        }
        return collection.equals(other.collection) && toQueryString().equals(other.toQueryString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, toQueryString());
    }

    @Override
    public String toString() {
        return channelKey();
    }
}
