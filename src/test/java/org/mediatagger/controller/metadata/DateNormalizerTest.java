package org.mediatagger.controller.metadata;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class DateNormalizerTest {

    @Test
    public void testClockFormVariantsAreEquivalent() {
        assertTrue(DateNormalizer.matches("2025:03:27 15:18:07", "2025-03-27 15:18:07"));
        assertTrue(DateNormalizer.matches("2025:03:27 15:18:07", "2025:03:27 15:18:07-05:00"));
        assertTrue(DateNormalizer.matches("2025-03-27 15:18:07", "2025:03:27 15:18:07-05:00"));
    }

    @Test
    public void testSubSecondsAndIsoSeparatorIgnored() {
        assertTrue(DateNormalizer.matches("2025:03:27 15:18:07", "2025-03-27T15:18:07.32-05:00"));
        assertTrue(DateNormalizer.matches("2025:03:27 15:18:07", "2025:03:27 15:18:07.000Z"));
        assertTrue(DateNormalizer.matches("2025:03:27 15:18:07", "2025:03:27 15:18:07+0100"));
    }

    @Test
    public void testDifferentSecondsDoNotMatch() {
        assertFalse(DateNormalizer.matches("2025:03:27 15:18:07", "2025:03:27 15:18:08"));
        assertFalse(DateNormalizer.matches("2025:03:27 15:18:07", null));
        assertFalse(DateNormalizer.matches(null, null));
        assertFalse(DateNormalizer.matches("garbage", "garbage"));
    }

    @Test
    public void testFilenameForm() {
        assertEquals("2025_03_27", DateNormalizer.toFilenameForm("2025:03:27 15:18:07"));
        assertEquals("2025_03_27", DateNormalizer.toFilenameForm("2025-03-27T15:18:07-05:00"));
        assertNull(DateNormalizer.toFilenameForm(null));
    }

    @Test
    public void testNormalize() {
        assertEquals("2025:03:27 15:18:07", DateNormalizer.normalize("2025-03-27T15:18:07.32-05:00"));
        assertEquals("2024:07:04 00:00:00", DateNormalizer.normalize("2024-07-04"));
        assertEquals("2024:07:04 00:00:00", DateNormalizer.normalize("2024_07_04"));
        assertEquals("2023:12:24 18:30:00", DateNormalizer.normalize("2023-12-24T18:30"));
        assertNull(DateNormalizer.normalize("27.03.2025"));
        assertNull(DateNormalizer.normalize(""));
    }

    @Test
    public void testZeroQuickTimeDateIsAbsent() {
        assertNull(DateNormalizer.normalize("0000:00:00 00:00:00"));
    }
}
