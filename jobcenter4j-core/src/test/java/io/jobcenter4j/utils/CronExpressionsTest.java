package io.jobcenter4j.utils;

import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronExpressionsTest {

    @Test
    void normalizeShouldPrependSecondsToFiveFieldCron() {
        assertEquals("0 */5 * * * ?", CronExpressions.normalize("*/5 * * * *"));
    }

    @Test
    void normalizeShouldReplaceWildcardDayOfMonthWhenDayOfWeekIsSet() {
        assertEquals("0 0 9 ? * MON-FRI", CronExpressions.normalize("0 9 * * MON-FRI"));
    }

    @Test
    void normalizeShouldKeepYearField() {
        assertEquals("0 0 12 1 1 ? 2030", CronExpressions.normalize("0 0 12 1 1 ? 2030"));
    }

    @Test
    void isValidShouldRejectMalformedExpressions() {
        assertTrue(CronExpressions.isValid("0 */10 * * * *"));
        assertFalse(CronExpressions.isValid("61 * * * *"));
        assertFalse(CronExpressions.isValid("every minute"));
        assertFalse(CronExpressions.isValid(""));
        assertFalse(CronExpressions.isValid(null));
    }

    @Test
    void isValidShouldRejectBothDayFields() {
        assertFalse(CronExpressions.isValid("0 9 1 * MON"));
    }

    @Test
    void parseShouldFailWithReadableMessage() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CronExpressions.parse("0 0 25 * * ?", ZoneOffset.UTC));
        assertTrue(e.getMessage().contains("0 0 25 * * ?"));
    }
}
