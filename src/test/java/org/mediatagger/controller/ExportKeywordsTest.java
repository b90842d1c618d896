package org.mediatagger.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mediatagger.model.MediaMetadata;

public class ExportKeywordsTest {

    // Late evening in Chicago, already the next day in UTC.
    private final ExportKeywords exportKeywords = new ExportKeywords(
        Clock.fixed(Instant.parse("2025-04-02T03:30:00Z"), ZoneId.of("America/Chicago")));

    @Test
    public void testRatingKeywordBoundaries() {
        assertEquals("0-star", ExportKeywords.ratingKeyword(null));
        assertEquals("0-star", ExportKeywords.ratingKeyword(-1));
        assertEquals("0-star", ExportKeywords.ratingKeyword(0));
        assertEquals("0-star", ExportKeywords.ratingKeyword(1));
        assertEquals("1-star", ExportKeywords.ratingKeyword(2));
        assertEquals("4-star", ExportKeywords.ratingKeyword(5));
    }

    @Test
    public void testExportDayUsesClockZone() {
        assertEquals(List.of("Lightroom_Export", "Lightroom_Export_on_2025_04_01"),
            exportKeywords.exportKeywords());
    }

    @Test
    public void testKeywordsAppended() {
        MediaMetadata metadata = new MediaMetadata.Builder()
            .title("Sunset")
            .keywords(List.of("Beach", "Travel: Texas 2025"))
            .rating(5)
            .build();

        MediaMetadata tagged = exportKeywords.addTo(metadata);

        assertEquals(List.of("Beach", "Travel: Texas 2025", "4-star",
            "Lightroom_Export", "Lightroom_Export_on_2025_04_01"), tagged.getKeywords());
        assertEquals("Sunset", tagged.getTitle());
        assertEquals(Integer.valueOf(5), tagged.getRating());
    }

    @Test
    public void testExistingRatingKeywordReplaced() {
        MediaMetadata metadata = new MediaMetadata.Builder()
            .keywords(List.of("3-star", "Beach", "Lightroom_Export", "Lightroom_Export_on_2024_12_24"))
            .build();

        assertEquals(List.of("Beach", "Lightroom_Export_on_2024_12_24",
                "0-star", "Lightroom_Export", "Lightroom_Export_on_2025_04_01"),
            exportKeywords.addTo(metadata).getKeywords(),
            "an unrated file gets 0-star and earlier export days are kept");
    }

    @Test
    public void testAddingTwiceChangesNothing() {
        MediaMetadata metadata = new MediaMetadata.Builder().keywords(List.of("Beach")).rating(3).build();
        MediaMetadata once = exportKeywords.addTo(metadata);

        assertEquals(once.getKeywords(), exportKeywords.addTo(once).getKeywords());
    }
}
