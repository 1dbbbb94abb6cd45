// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc.internal;

import java.lang.reflect.Array;
import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Internal helpers shared by the RPC layer.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe mapper for JSON-RPC envelopes and results.
     * <p>
     * Floats are read as {@link java.math.BigDecimal} so BTC amounts and difficulty
     * keep the node's exact digits.
     */
    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    private RpcUtils() {
    }

    /**
     * Flattens JSON-RPC error data to a string.
     * <p>
     * Strings are returned as is; maps, arrays and iterables are searched for the
     * first nested value; anything else falls back to {@code toString()}.
     *
     * @param dataValue the error's {@code data} member
     * @return extracted data, or null if {@code dataValue} is null
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue.getClass().isArray()) {
            return extractFromArray(dataValue, dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    private static String extractFromArray(final Object array, final Object fallback) {
        final int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            final String extracted = extractErrorData(Array.get(array, i));
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    /**
     * Safely converts object to string, returning null for null inputs.
     */
    public static String stringValue(final Object value) {
        return value != null ? value.toString() : null;
    }
}
