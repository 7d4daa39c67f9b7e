package com.queryplatform.core.cache;

import com.queryplatform.core.error.QueryPlatformException;
import com.queryplatform.core.model.QueryKey;

/**
 * A typed lookup found a value of a different runtime type under the key.
 */
public class CacheTypeMismatchException extends QueryPlatformException {
    private final QueryKey key;
    private final Class<?> expected;
    private final Class<?> actual;

    public CacheTypeMismatchException(QueryKey key, Class<?> expected, Class<?> actual) {
        super("CacheStore", "key=" + key + " holds " + actual.getName()
            + " but " + expected.getName() + " was requested");
        this.key      = key;
        this.expected = expected;
        this.actual   = actual;
    }

    public QueryKey getKey()        { return key; }
    public Class<?> getExpected()   { return expected; }
    public Class<?> getActual()     { return actual; }
}
