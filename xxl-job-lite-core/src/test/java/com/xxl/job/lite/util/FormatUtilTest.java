package com.xxl.job.lite.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FormatUtilTest {

    @Test
    void readableSize() {
        assertEquals("0b", FormatUtil.readableSize(0));
        assertEquals("1023b", FormatUtil.readableSize(1023));
        assertEquals("1.00kb", FormatUtil.readableSize(1024));
        assertEquals("1.50kb", FormatUtil.readableSize(1536));
        assertEquals("2.00mb", FormatUtil.readableSize(2L * 1024 * 1024));
        assertEquals("1.00gb", FormatUtil.readableSize(1024L * 1024 * 1024));
    }

    @Test
    void truncateDurationKeepsSeconds() {
        Duration d = Duration.ofMillis(1500).plusNanos(123_456);
        assertEquals(d, FormatUtil.truncateDuration(d));
    }

    @Test
    void truncateDurationToMillisAndMicros() {
        assertEquals(Duration.ofMillis(12), FormatUtil.truncateDuration(Duration.ofNanos(12_345_678)));
        assertEquals(Duration.ofNanos(35_000), FormatUtil.truncateDuration(Duration.ofNanos(35_678)));
    }

    @Test
    void readableDuration() {
        assertEquals("12ms", FormatUtil.readableDuration(Duration.ofNanos(12_345_678)));
        assertEquals("35µs", FormatUtil.readableDuration(Duration.ofNanos(35_678)));
        assertEquals("1.500s", FormatUtil.readableDuration(Duration.ofMillis(1500)));
    }
}
