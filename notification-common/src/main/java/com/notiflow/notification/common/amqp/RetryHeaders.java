package com.notiflow.notification.common.amqp;

import com.rabbitmq.client.LongString;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reading of the {@value #RETRY_COUNT} header.
 *
 * <p>The count is a non-negative integer sent either as a number or as a string of digits.
 * Anything else, including an absent header, counts as 0. Values beyond the int range
 * saturate so that the next hop can still be computed without overflow.
 */
public final class RetryHeaders {

    public static final String RETRY_COUNT = "x-retry-count";

    private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");
    private static final int MAX_COUNT = Integer.MAX_VALUE - 1;

    private RetryHeaders() {
    }

    public static int retryCount(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        return parseRetryCount(headers.get(RETRY_COUNT));
    }

    public static int parseRetryCount(Object raw) {
        if (raw == null) {
            return 0;
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            return saturate(((Number) raw).longValue());
        }
        if (raw instanceof Float || raw instanceof Double) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
                return 0;
            }
            return value > MAX_COUNT ? MAX_COUNT : saturate((long) value);
        }
        // AMQP string headers arrive as LongString, toString() yields the UTF-8 text
        if (raw instanceof CharSequence || raw instanceof LongString) {
            String text = raw.toString();
            if (!DIGITS.matcher(text).matches()) {
                return 0;
            }
            if (text.length() > 10) {
                return MAX_COUNT;
            }
            return saturate(Long.parseLong(text));
        }
        return 0;
    }

    private static int saturate(long value) {
        if (value < 0) {
            return 0;
        }
        return value > MAX_COUNT ? MAX_COUNT : (int) value;
    }
}
