package org.mediatagger.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mediatagger.controller.library.AssetLibrary;
import org.mediatagger.controller.library.FolderAssetLibrary;
import org.mediatagger.controller.metadata.SidecarReader;
import org.mediatagger.model.AlbumMapping;
import org.mediatagger.model.AlbumMappings;
import org.mediatagger.model.PipelineSettings;

public class FileTransferTest {

    private static final String PROCESSED = "2024_07_04_Reunion_Stuttgart__LRE.jpg";

    @TempDir
    Path tempFolder;

    private Path incoming;
    private Path destination;
    private Path libraryRoot;
    private PipelineSettings settings;
    private FakeCodec codec;
    private AlbumPathResolver resolver;

    @BeforeEach
    public void setUp() throws IOException {
        incoming = Files.createDirectories(tempFolder.resolve("incoming"));
        destination = tempFolder.resolve("sorted");
        libraryRoot = tempFolder.resolve("library");

        settings = new PipelineSettings();
        settings.setMinFileAgeSeconds(0);
        settings.setLockTimeoutSeconds(1);
        settings.setLibraryTimeoutSeconds(2);
        settings.addTransferDestination(incoming, destination);

        codec = new FakeCodec();
        AlbumMappings mappings = new AlbumMappings(List.of(
            new AlbumMapping("Family", List.of("02/Relatives/")),
            new AlbumMapping("Stuttgart", List.of("02/DE/Stuttgart"))
        ));
        resolver = new AlbumPathResolver(() -> mappings, "Categories");
    }

    private FileTransfer transfer(AssetLibrary library) {
        return new FileTransfer(settings, new MetadataAggregator(new SidecarReader(), codec), resolver, library);
    }

    @Test
    public void testTransferIntoLibrary() throws IOException {
        Path file = Files.writeString(incoming.resolve(PROCESSED), "pixels");
        Path moved = destination.resolve(PROCESSED);
        codec.embed(moved, "XMP:Title", "Reunion")
            .embed(moved, "XMP:Subject", "Family/")
            .embed(moved, "XMP:City", "Stuttgart");

        assertEquals(FileTransfer.Result.TRANSFERRED, transfer(new FolderAssetLibrary(libraryRoot)).transfer(file));

        assertFalse(Files.exists(file));
        assertTrue(Files.exists(moved));
        assertTrue(Files.exists(libraryRoot.resolve("02/Relatives/Reunion").resolve(PROCESSED)));
        assertTrue(Files.exists(libraryRoot.resolve("02/DE/Stuttgart").resolve(PROCESSED)));
    }

    @Test
    public void testUnprocessedFileStays() throws IOException {
        Path file = Files.writeString(incoming.resolve("IMG_0001.jpg"), "pixels");
        List<Path> imported = new ArrayList<>();

        assertEquals(FileTransfer.Result.NOT_ELIGIBLE, transfer((f, albums) -> imported.add(f)).transfer(file));

        assertTrue(Files.exists(file));
        assertTrue(imported.isEmpty());
    }

    @Test
    public void testNoDestinationConfigured() throws IOException {
        Path elsewhere = Files.createDirectories(tempFolder.resolve("elsewhere"));
        Path file = Files.writeString(elsewhere.resolve(PROCESSED), "pixels");

        assertEquals(FileTransfer.Result.NOT_ELIGIBLE, transfer((f, albums) -> true).transfer(file));
        assertTrue(Files.exists(file));
    }

    @Test
    public void testTooRecentlyModified() throws IOException {
        settings.setMinFileAgeSeconds(3600);
        Path file = Files.writeString(incoming.resolve(PROCESSED), "pixels");

        assertEquals(FileTransfer.Result.DEFERRED, transfer((f, albums) -> true).transfer(file));
        assertTrue(Files.exists(file));
    }

    @Test
    public void testJustProcessedFileIgnoresMinimumAge() throws IOException {
        settings.setMinFileAgeSeconds(3600);
        Path file = Files.writeString(incoming.resolve(PROCESSED), "pixels");
        List<Path> imported = new ArrayList<>();

        assertEquals(FileTransfer.Result.TRANSFERRED,
            transfer((f, albums) -> imported.add(f)).transferJustProcessed(file));
        assertEquals(List.of(destination.resolve(PROCESSED)), imported);
    }

    @Test
    public void testJustProcessedFileStillNeedsMarker() throws IOException {
        Path file = Files.writeString(incoming.resolve("IMG_0001.jpg"), "pixels");

        assertEquals(FileTransfer.Result.NOT_ELIGIBLE,
            transfer((f, albums) -> true).transferJustProcessed(file));
        assertTrue(Files.exists(file));
    }

    @Test
    public void testMissingFile() {
        assertEquals(FileTransfer.Result.FAILED, transfer((f, albums) -> true).transfer(incoming.resolve(PROCESSED)));
    }

    @Test
    public void testLibraryRefusal() throws IOException {
        Path file = Files.writeString(incoming.resolve(PROCESSED), "pixels");

        assertEquals(FileTransfer.Result.FAILED, transfer((f, albums) -> false).transfer(file));
        assertTrue(Files.exists(destination.resolve(PROCESSED)), "the move is not undone");
    }

    @Test
    public void testLibraryException() throws IOException {
        Path file = Files.writeString(incoming.resolve(PROCESSED), "pixels");

        assertEquals(FileTransfer.Result.FAILED, transfer((f, albums) -> {
            throw new IllegalStateException("library offline");
        }).transfer(file));
    }

    @Test
    public void testLibraryTimeout() throws IOException {
        settings.setLibraryTimeoutSeconds(1);
        Path file = Files.writeString(incoming.resolve(PROCESSED), "pixels");
        CountDownLatch never = new CountDownLatch(1);

        assertEquals(FileTransfer.Result.FAILED, transfer((f, albums) -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        }).transfer(file));
    }

    @Test
    public void testImportAfterTimeoutIsNotBlocked() throws IOException {
        settings.setLibraryTimeoutSeconds(1);
        Path first = Files.writeString(incoming.resolve(PROCESSED), "pixels");
        Path second = Files.writeString(incoming.resolve("2024_07_05_Picnic__LRE.jpg"), "pixels");
        CountDownLatch release = new CountDownLatch(1);
        AssetLibrary stuck = (f, albums) -> {
            boolean released = false;
            while (!released) {
                try {
                    released = release.await(10, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    // Keeps blocking, like a copy that ignores interruption.
                    released = false;
                }
            }
            return true;
        };
        try {
            assertEquals(FileTransfer.Result.FAILED, transfer(stuck).transfer(first));

            assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                assertEquals(FileTransfer.Result.TRANSFERRED, transfer((f, albums) -> true).transfer(second)));
        } finally {
            release.countDown();
        }
    }

    @Test
    public void testWaitForLock() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("free.jpg"), "pixels");
        assertTrue(FileTransfer.waitForLock(file, 0));
    }

    @Test
    public void testWaitForLockWhileHeld() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("held.jpg"), "pixels");
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE);
             FileLock lock = channel.lock()) {
            assertTrue(lock.isValid());
            assertFalse(FileTransfer.waitForLock(file, 0));
        }
        assertTrue(FileTransfer.waitForLock(file, 0));
    }
}
