package org.mediatagger.controller;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.mediatagger.model.MediaLocation;
import org.mediatagger.model.MediaMetadata;

public class FilenameGeneratorTest {

    private final FilenameGenerator generator = new FilenameGenerator("__LRE");

    private static MediaMetadata.Builder dated() {
        return new MediaMetadata.Builder().date("2025:03:27 15:18:07");
    }

    @Test
    public void testCleaning() {
        assertEquals("My_Photo_A_Nice_View", FilenameGenerator.clean("My Photo: A Nice/View?"));
        assertEquals("Family_(2024)_[draft]", FilenameGenerator.clean("  Family (2024) [draft] "));
        assertEquals("", FilenameGenerator.clean("{\"title\": \"json\"}"));
        assertEquals("", FilenameGenerator.clean("[1, 2]"));
        assertEquals("", FilenameGenerator.clean("?!?"));
        assertEquals("", FilenameGenerator.clean(null));
        assertEquals("Zürich", FilenameGenerator.clean("Zürich"));
    }

    @Test
    public void testCleaningTruncatesToFiftyCharacters() {
        String cleaned = FilenameGenerator.clean("a".repeat(49) + " " + "b".repeat(10));
        assertEquals("a".repeat(49), cleaned, "truncation must not leave a trailing underscore");
        assertEquals(50, FilenameGenerator.clean("c".repeat(80)).length());
    }

    @Test
    public void testFullName() {
        MediaMetadata metadata = dated()
            .title("Sunset at the Lake")
            .location(new MediaLocation("Zilker Park", "Austin", "Texas", "USA"))
            .build();
        assertEquals("2025_03_27_Sunset_at_the_Lake_Zilker_Park_Austin_USA__LRE.jpg",
            generator.generate(metadata, "IMG_0001.JPG", null));
    }

    @Test
    public void testCityAlreadyInTitleIsOmitted() {
        MediaMetadata metadata = dated()
            .title("Miami Beach Sunset")
            .location(new MediaLocation(null, "Miami", null, "USA"))
            .build();
        assertEquals("2025_03_27_Miami_Beach_Sunset_USA__LRE.jpg",
            generator.generate(metadata, "IMG_0001.jpg", null));
    }

    @Test
    public void testComponentRepeatingEarlierComponentIsOmitted() {
        MediaMetadata metadata = dated()
            .location(new MediaLocation("Rome Colosseum", "Rome", null, "Italy"))
            .build();
        assertEquals("2025_03_27_Rome_Colosseum_Italy__LRE.mov",
            generator.generate(metadata, "clip.MOV", null));
    }

    @Test
    public void testTextSpanningTwoComponentsIsKept() {
        MediaMetadata metadata = dated()
            .title("Sunset Lake")
            .location(new MediaLocation(null, "Lake Park", null, null))
            .build();
        assertEquals("2025_03_27_Sunset_Lake_Lake_Park__LRE.jpg",
            generator.generate(metadata, "IMG_0001.jpg", null));

        MediaMetadata split = dated()
            .title("Trip")
            .location(new MediaLocation("Old Town", "Bern", null, "Town_Bern"))
            .build();
        assertEquals("2025_03_27_Trip_Old_Town_Bern_Town_Bern__LRE.jpg",
            generator.generate(split, "IMG_0001.jpg", null));
    }

    @Test
    public void testSequence() {
        MediaMetadata metadata = dated().title("Sunset").build();
        assertEquals("2025_03_27_Sunset_2__LRE.jpg", generator.generate(metadata, "IMG_0001.jpg", 2));
    }

    @Test
    public void testNoDateFails() {
        MediaMetadata metadata = new MediaMetadata.Builder().title("Sunset").build();
        assertNull(generator.generate(metadata, "IMG_0001.jpg", null));
    }

    @Test
    public void testOnlyDateDegradesToStem() {
        MediaMetadata metadata = dated().title("{\"json\": true}").build();
        assertEquals("IMG_0001__LRE.jpg", generator.generate(metadata, "IMG_0001.JPG", null));
        assertEquals("IMG_0001_3__LRE.jpg", generator.generate(metadata, "IMG_0001.JPG", 3));
    }

    @Test
    public void testGenerationIsRepeatable() {
        MediaMetadata metadata = dated()
            .title("My Photo: A Nice/View?")
            .location(new MediaLocation("Park", "Austin", null, "USA"))
            .build();
        String first = generator.generate(metadata, "IMG_0001.jpg", 7);
        String second = generator.generate(metadata, "IMG_0001.jpg", 7);
        assertEquals(first, second);
    }
}
