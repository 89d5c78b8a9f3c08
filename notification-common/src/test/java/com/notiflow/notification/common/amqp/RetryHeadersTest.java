package com.notiflow.notification.common.amqp;

import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetryHeadersTest {

    @Test
    void testRetryCount_WhenHeadersMissing_ReturnsZero() {
        assertEquals(0, RetryHeaders.retryCount(null));
        assertEquals(0, RetryHeaders.retryCount(new HashMap<>()));
    }

    @Test
    void testParseRetryCount_AcceptsIntegralNumbers() {
        assertEquals(0, RetryHeaders.parseRetryCount(0));
        assertEquals(2, RetryHeaders.parseRetryCount(2));
        assertEquals(3, RetryHeaders.parseRetryCount(3L));
        assertEquals(4, RetryHeaders.parseRetryCount((short) 4));
        assertEquals(5, RetryHeaders.parseRetryCount(5.0d));
    }

    @Test
    void testParseRetryCount_AcceptsDigitStrings() {
        assertEquals(7, RetryHeaders.parseRetryCount("7"));
        assertEquals(7, RetryHeaders.parseRetryCount(LongStringHelper.asLongString("7")));
    }

    @Test
    void testParseRetryCount_InvalidValuesCountAsZero() {
        assertEquals(0, RetryHeaders.parseRetryCount(-1));
        assertEquals(0, RetryHeaders.parseRetryCount("-1"));
        assertEquals(0, RetryHeaders.parseRetryCount("1.5"));
        assertEquals(0, RetryHeaders.parseRetryCount(" 2"));
        assertEquals(0, RetryHeaders.parseRetryCount(""));
        assertEquals(0, RetryHeaders.parseRetryCount("abc"));
        assertEquals(0, RetryHeaders.parseRetryCount(1.5d));
        assertEquals(0, RetryHeaders.parseRetryCount(Double.NaN));
        assertEquals(0, RetryHeaders.parseRetryCount(true));
    }

    @Test
    void testParseRetryCount_HugeValuesSaturateBelowIntMax() {
        int max = Integer.MAX_VALUE - 1;
        assertEquals(max, RetryHeaders.parseRetryCount(Long.MAX_VALUE));
        assertEquals(max, RetryHeaders.parseRetryCount("99999999999999999999"));
        assertEquals(max, RetryHeaders.parseRetryCount(1e30));
        assertTrue(RetryHeaders.parseRetryCount(Long.MAX_VALUE) + 1 > 0);
    }

    @Test
    void testRetryCount_ReadsRetryHeader() {
        Map<String, Object> headers = Map.of(RetryHeaders.RETRY_COUNT, 2, "x-death", "ignored");
        assertEquals(2, RetryHeaders.retryCount(headers));
    }
}
