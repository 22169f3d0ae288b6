package com.fieldops.sync.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Declared dataset: its cache key, the payload type it is persisted as, the value
 * served when nothing at all is cached, and the function that measures a payload
 * for diagnostics.
 *
 * @param key          cache key, one entry per key
 * @param payloadType  Jackson type used to read the payload back from storage
 * @param emptyValue   well-formed empty payload
 * @param sizeFunction item count of a payload (assets, features, ...)
 */
public record DatasetType<T>(
    String key,
    TypeReference<T> payloadType,
    Supplier<T> emptyValue,
    ToIntFunction<T> sizeFunction
) {

    public T empty() {
        return emptyValue.get();
    }

    public int sizeOf(T payload) {
        return payload == null ? 0 : sizeFunction.applyAsInt(payload);
    }

    @Override
    public String toString() {
        return key;
    }
}
