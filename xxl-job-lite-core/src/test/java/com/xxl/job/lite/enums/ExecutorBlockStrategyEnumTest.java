package com.xxl.job.lite.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ExecutorBlockStrategyEnumTest {

    @Test
    void matchByName() {
        assertEquals(ExecutorBlockStrategyEnum.DISCARD_LATER,
                ExecutorBlockStrategyEnum.match("DISCARD_LATER", ExecutorBlockStrategyEnum.SERIAL_EXECUTION));
        assertEquals(ExecutorBlockStrategyEnum.COVER_EARLY,
                ExecutorBlockStrategyEnum.match("COVER_EARLY", null));
    }

    @Test
    void unknownOrMissingFallsBackToDefault() {
        assertEquals(ExecutorBlockStrategyEnum.SERIAL_EXECUTION,
                ExecutorBlockStrategyEnum.match(null, ExecutorBlockStrategyEnum.SERIAL_EXECUTION));
        assertEquals(ExecutorBlockStrategyEnum.SERIAL_EXECUTION,
                ExecutorBlockStrategyEnum.match("discard_later", ExecutorBlockStrategyEnum.SERIAL_EXECUTION));
        assertNull(ExecutorBlockStrategyEnum.match("", null));
    }
}
