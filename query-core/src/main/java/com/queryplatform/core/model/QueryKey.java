package com.queryplatform.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structural identifier of one cacheable fetch.
 *
 * <p>A key is an ordered list of parts, for example {@code QueryKey.of("user", 42, "posts")}.
 * Two keys are equal when their parts are equal in order, so keys built independently at
 * different call sites address the same cache entry. Parts must be non-null and should be
 * immutable value types (strings, numbers, enums, records).
 *
 * <p>{@link #asString()} joins the parts with {@code ':'} and is the form used for logging,
 * circuit-breaker scopes and persistence.
 */
public record QueryKey(List<Object> parts) {

    public QueryKey {
        Objects.requireNonNull(parts, "parts");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("QueryKey must have at least one part");
        }
        for (Object part : parts) {
            Objects.requireNonNull(part, "QueryKey parts must not be null");
        }
        parts = List.copyOf(parts);
    }

    public static QueryKey of(Object first, Object... rest) {
        Object[] all = new Object[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return new QueryKey(Arrays.asList(all));
    }

    /**
     * Parses the {@code ':'}-joined string form back into a key of string parts.
     */
    public static QueryKey parse(String key) {
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("QueryKey string must not be blank");
        }
        return new QueryKey(List.of((Object[]) key.split(":", -1)));
    }

    /**
     * Returns a new key with {@code more} appended, e.g. {@code USERS.with(42)}.
     */
    public QueryKey with(Object... more) {
        Object[] all = parts.toArray(new Object[parts.size() + more.length]);
        System.arraycopy(more, 0, all, parts.size(), more.length);
        return new QueryKey(Arrays.asList(all));
    }

    /**
     * Whether every part of {@code prefix} matches the leading parts of this key.
     */
    public boolean startsWith(QueryKey prefix) {
        if (prefix.parts.size() > parts.size()) {
            return false;
        }
        return parts.subList(0, prefix.parts.size()).equals(prefix.parts);
    }

    public String asString() {
        return parts.stream().map(String::valueOf).collect(Collectors.joining(":"));
    }

    @Override
    public String toString() {
        return asString();
    }
}
