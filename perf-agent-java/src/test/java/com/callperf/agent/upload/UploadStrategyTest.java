package com.callperf.agent.upload;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UploadStrategyTest {

    @Test
    void parsesConfigSpellings() {
        assertEquals(UploadStrategy.ON_EXIT, UploadStrategy.parse("on_exit"));
        assertEquals(UploadStrategy.REAL_TIME, UploadStrategy.parse("real-time"));
        assertEquals(UploadStrategy.BATCH, UploadStrategy.parse(" Batch "));
        assertEquals(UploadStrategy.MANUAL, UploadStrategy.parse("MANUAL"));
    }

    @Test
    void missingValueDefaultsToOnExit() {
        assertEquals(UploadStrategy.ON_EXIT, UploadStrategy.parse(null));
        assertEquals(UploadStrategy.ON_EXIT, UploadStrategy.parse(""));
    }

    @Test
    void unknownValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> UploadStrategy.parse("hourly"));
    }

    @Test
    void configNameRoundTripsThroughParse() {
        for (UploadStrategy s : UploadStrategy.values()) {
            assertEquals(s, UploadStrategy.parse(s.configName()));
        }
    }
}
