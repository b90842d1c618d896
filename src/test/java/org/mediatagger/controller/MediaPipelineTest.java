package org.mediatagger.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mediatagger.controller.metadata.SidecarReader;
import org.mediatagger.model.PipelineOutcome;
import org.mediatagger.model.PipelineState;

public class MediaPipelineTest {

    private static final String MARKER = "__LRE";
    private static final String EXPECTED_NAME =
        "2025_03_27_Sunset_at_the_Lake_Zilker_Park_Austin_USA__LRE.jpg";

    private static final Clock EXPORT_DAY =
        Clock.fixed(Instant.parse("2025-04-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempFolder;

    private FakeCodec codec;
    private RecordingFileOperations fileOps;

    private Path media;
    private Path sidecar;

    @BeforeEach
    public void setUp() throws IOException {
        codec = new FakeCodec();
        fileOps = new RecordingFileOperations();
        media = Files.writeString(tempFolder.resolve("IMG_0001.JPG"), "pixels");
        sidecar = Files.copy(MetadataAggregatorTest.resource("/sidecars/lightroom.xmp"),
            tempFolder.resolve("IMG_0001.xmp"));
        fileOps.sidecarToWatch = sidecar;
    }

    private MediaPipeline pipeline(FakeCodec withCodec) {
        return new MediaPipeline(
            withCodec,
            new MetadataAggregator(new SidecarReader(), withCodec),
            new FilenameGenerator(MARKER),
            new MetadataVerifier(),
            fileOps,
            new ExportKeywords(EXPORT_DAY),
            MARKER
        );
    }

    @Test
    public void testSuccessfulRun() {
        PipelineOutcome outcome = pipeline(codec).process(media);

        assertEquals(PipelineState.RENAMED, outcome.state());
        assertTrue(outcome.isSuccess());
        assertEquals(tempFolder.resolve(EXPECTED_NAME), outcome.path());
        assertTrue(Files.exists(outcome.path()));
        assertFalse(Files.exists(media));
        assertFalse(Files.exists(sidecar));
        assertEquals(List.of(media), codec.writes);
        assertEquals("Sunset at the Lake", codec.stored.get(media).get("XMP:Title"));
    }

    @Test
    public void testStillImageGetsRatingAndExportKeywords() {
        pipeline(codec).process(media);

        assertEquals("Places, USA, Austin, Travel: Texas 2025, 3-star,"
                + " Lightroom_Export, Lightroom_Export_on_2025_04_01",
            codec.stored.get(media).get("XMP:Subject"));
    }

    @Test
    public void testVideoGetsNoExportKeywords() throws IOException {
        Path clip = Files.writeString(tempFolder.resolve("clip.mov"), "frames");
        codec.embed(clip, "QuickTime:CreateDate", "2024:05:01 10:00:00")
            .embed(clip, "QuickTime:Keywords", "Rome");

        PipelineOutcome outcome = pipeline(codec).process(clip);

        assertEquals(PipelineState.RENAMED, outcome.state());
        assertEquals("Rome", codec.stored.get(clip).get("XMP:Subject"));
    }

    @Test
    public void testNoDateKeepsOriginalName() throws IOException {
        Path photo = Files.writeString(tempFolder.resolve("IMG_0003.jpg"), "pixels");
        Files.writeString(tempFolder.resolve("IMG_0003.xmp"),
            "<x:xmpmeta xmlns:x=\"adobe:ns:meta/\">"
                + "<rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\">"
                + "<rdf:Description xmlns:dc=\"http://purl.org/dc/elements/1.1/\">"
                + "<dc:title><rdf:Alt><rdf:li xml:lang=\"x-default\">Sunset</rdf:li></rdf:Alt></dc:title>"
                + "</rdf:Description></rdf:RDF></x:xmpmeta>");

        PipelineOutcome outcome = pipeline(codec).process(photo);

        assertEquals(PipelineState.RENAME_FAILED, outcome.state());
        assertEquals(photo, outcome.path());
        assertTrue(Files.exists(tempFolder.resolve("IMG_0003.jpg")));
        assertEquals(List.of(photo), codec.writes, "the metadata is still written");
        assertEquals("Sunset", codec.stored.get(photo).get("XMP:Title"));
        assertEquals(List.of("delete IMG_0003.xmp"), fileOps.calls, "no rename is requested");
        assertFalse(Files.exists(tempFolder.resolve("IMG_0003__LRE.jpg")));
    }

    @Test
    public void testSidecarDeletedBeforeRename() {
        pipeline(codec).process(media);

        assertEquals(List.of(
            "delete IMG_0001.xmp",
            "rename IMG_0001.JPG -> " + EXPECTED_NAME), fileOps.calls);
        assertEquals(Boolean.FALSE, fileOps.sidecarExistedAtRename,
            "the sidecar must be gone when the rename is requested");
    }

    @Test
    public void testDeleteFailureStillRenames() {
        fileOps.failDeletes = true;

        PipelineOutcome outcome = pipeline(codec).process(media);

        assertEquals(PipelineState.RENAMED, outcome.state());
        assertEquals(2, fileOps.calls.size(), "rename must be attempted after a failed delete");
        assertTrue(Files.exists(sidecar), "the sidecar is left orphaned");
        assertTrue(Files.exists(tempFolder.resolve(EXPECTED_NAME)));
    }

    @Test
    public void testAlreadyProcessedIsSkipped() throws IOException {
        Path done = Files.writeString(tempFolder.resolve("2025_03_27_Sunset__LRE.jpg"), "pixels");
        Path doneSidecar = Files.copy(sidecar, tempFolder.resolve("2025_03_27_Sunset__LRE.xmp"));

        PipelineOutcome outcome = pipeline(codec).process(done);

        assertEquals(PipelineState.SKIP, outcome.state());
        assertTrue(outcome.isSuccess());
        assertEquals(done, outcome.path());
        assertTrue(codec.writes.isEmpty(), "no codec writes for a processed file");
        assertTrue(codec.reads.isEmpty());
        assertTrue(fileOps.calls.isEmpty(), "no deletes or renames for a processed file");
        assertTrue(Files.exists(doneSidecar));
    }

    @Test
    public void testEmptyMetadataRenamesWithoutWriting() throws IOException {
        Path bare = Files.writeString(tempFolder.resolve("IMG_0002.jpg"), "pixels");

        PipelineOutcome outcome = pipeline(codec).process(bare);

        assertEquals(PipelineState.RENAMED, outcome.state());
        assertEquals(tempFolder.resolve("IMG_0002__LRE.jpg"), outcome.path());
        assertTrue(codec.writes.isEmpty(), "nothing to write means no write call");
        assertEquals(List.of("rename IMG_0002.jpg -> IMG_0002__LRE.jpg"), fileOps.calls);
    }

    @Test
    public void testWriteFailureLeavesEverythingInPlace() {
        codec.failWrites = true;

        PipelineOutcome outcome = pipeline(codec).process(media);

        assertEquals(PipelineState.WRITE_FAILED, outcome.state());
        assertFalse(outcome.isSuccess());
        assertEquals(media, outcome.path());
        assertTrue(Files.exists(media));
        assertTrue(Files.exists(sidecar));
        assertTrue(fileOps.calls.isEmpty());
    }

    @Test
    public void testVerifyFailureLeavesEverythingInPlace() {
        codec.readOverrides.put("XMP:Title", "Something else");
        codec.readOverrides.put("IPTC:ObjectName", "Something else");
        codec.readOverrides.put("IPTC:Headline", "Something else");
        codec.readOverrides.put("EXIF:XPTitle", "Something else");

        PipelineOutcome outcome = pipeline(codec).process(media);

        assertEquals(PipelineState.VERIFY_FAILED, outcome.state());
        assertEquals(media, outcome.path());
        assertTrue(Files.exists(media));
        assertTrue(Files.exists(sidecar));
        assertTrue(fileOps.calls.isEmpty());
    }

    @Test
    public void testRenameFailureKeepsOriginalName() {
        fileOps.failRenames = true;

        PipelineOutcome outcome = pipeline(codec).process(media);

        assertEquals(PipelineState.RENAME_FAILED, outcome.state());
        assertEquals(media, outcome.path());
        assertTrue(Files.exists(media));
        assertFalse(Files.exists(sidecar));
    }

    @Test
    public void testNameCollisionPicksSequence() throws IOException {
        Files.writeString(tempFolder.resolve(EXPECTED_NAME), "someone else");

        PipelineOutcome outcome = pipeline(codec).process(media);

        assertEquals(PipelineState.RENAMED, outcome.state());
        assertEquals(tempFolder.resolve("2025_03_27_Sunset_at_the_Lake_Zilker_Park_Austin_USA_1__LRE.jpg"),
            outcome.path());
    }

    @Test
    public void testExplicitSequence() {
        PipelineOutcome outcome = pipeline(codec).process(media, 5);

        assertEquals(tempFolder.resolve("2025_03_27_Sunset_at_the_Lake_Zilker_Park_Austin_USA_5__LRE.jpg"),
            outcome.path());
    }

    @Test
    public void testReprocessingIsSafe() {
        MediaPipeline pipeline = pipeline(codec);
        PipelineOutcome first = pipeline.process(media);
        PipelineOutcome second = pipeline.process(first.path());

        assertEquals(PipelineState.SKIP, second.state());
        assertEquals(first.path(), second.path());
        assertEquals(1, codec.writes.size());
    }

    @Test
    public void testUnexpectedExceptionIsReported() {
        FakeCodec throwing = new FakeCodec() {
            @Override
            public boolean writeTags(Path file, Map<String, String> tags) {
                throw new IllegalStateException("codec exploded");
            }
        };

        PipelineOutcome outcome = pipeline(throwing).process(media);

        assertEquals(PipelineState.WRITE_FAILED, outcome.state());
        assertTrue(Files.exists(media));
        assertTrue(Files.exists(sidecar));
    }
}
