package org.mediatagger.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class MediaLocationTest {

    @Test
    public void testOrElseFillsOnlyMissingComponents() {
        MediaLocation sidecar = new MediaLocation(null, "Austin", null, null);
        MediaLocation embedded = new MediaLocation("Zilker Park", "Dallas", "Texas", "USA");

        MediaLocation merged = sidecar.orElse(embedded);

        assertEquals(new MediaLocation("Zilker Park", "Austin", "Texas", "USA"), merged);
    }

    @Test
    public void testCombined() {
        assertEquals("Zilker Park, Austin, USA",
            new MediaLocation("Zilker Park", "Austin", "Texas", "USA").combined());
        assertEquals("Texas, Austin, USA",
            new MediaLocation(null, "Austin", "Texas", "USA").combined());
        assertEquals("Rome, Italy",
            new MediaLocation("Rome", "Rome", null, "Italy").combined());
        assertEquals("Italy", new MediaLocation(null, null, null, "Italy").combined());
        assertNull(MediaLocation.EMPTY.combined());
    }

    @Test
    public void testComponentsAreTrimmed() {
        MediaLocation location = new MediaLocation(" Zilker Park ", "", "  ", null);
        assertEquals("Zilker Park", location.location());
        assertNull(location.city());
        assertNull(location.state());
        assertFalse(location.isEmpty());
        assertTrue(new MediaLocation("", " ", null, "").isEmpty());
    }
}
