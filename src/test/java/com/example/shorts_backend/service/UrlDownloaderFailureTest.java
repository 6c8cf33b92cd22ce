package com.example.shorts_backend.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.shorts_backend.engine.Interfaces.MediaFetcher;
import com.example.shorts_backend.exception.DownloadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UrlDownloaderFailureTest {

    private static final String URL = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
    private static final String INFO_OK = "{\"title\":\"Demo\",\"duration\":300,\"is_live\":false}";

    @TempDir
    private Path tempDir;

    @Test
    void privateVideoIsClassified() {
        UrlDownloader downloader = new TestDownloader(INFO_OK, "ERROR: [youtube] dQw4w9WgXcQ: Private video. Sign in if you've been granted access", 1, false, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.PRIVATE, ex.getKind());
        assertEquals("Video is private", ex.getMessage());
    }

    @Test
    void regionLockIsClassified() {
        UrlDownloader downloader = new TestDownloader(INFO_OK, "ERROR: The uploader has not made this video available in your country", 1, false, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.REGION_LOCKED, ex.getKind());
    }

    @Test
    void authWallWithSmartApostropheIsClassified() {
        UrlDownloader downloader = new TestDownloader(INFO_OK, "Sign in to confirm you’re not a bot.", 1, false, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.AUTH_REQUIRED, ex.getKind());
        assertTrue(ex.getMessage().contains("authentication/cookies"));
    }

    @Test
    void removedVideoIsUnavailable() {
        UrlDownloader downloader = new TestDownloader(INFO_OK, "ERROR: Video unavailable. This video has been removed by the uploader", 1, false, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.UNAVAILABLE, ex.getKind());
    }

    @Test
    void metadataFailureIsClassifiedBeforeDownload() {
        TestDownloader downloader = new TestDownloader("ERROR: Private video", "ok", 0, false, null);
        downloader.infoCode = 1;

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.PRIVATE, ex.getKind());
        assertEquals(1, downloader.commands.size());
    }

    @Test
    void tooLongVideoIsRejectedBeforeDownload() {
        TestDownloader downloader = new TestDownloader("{\"title\":\"Marathon\",\"duration\":20000}", "ok", 0, false, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.TOO_LONG, ex.getKind());
        assertTrue(ex.getMessage().startsWith("Video is too long (20000s)"));
        assertEquals(1, downloader.commands.size());
    }

    @Test
    void liveStreamIsRejected() {
        TestDownloader downloader = new TestDownloader("{\"title\":\"Live\",\"duration\":0,\"is_live\":true}", "ok", 0, false, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.LIVE_STREAM, ex.getKind());
        assertEquals("Cannot process live streams", ex.getMessage());
    }

    @Test
    void downloadTimeoutIsSurfacedAndPartialDeleted() throws IOException {
        Path target = target();
        Path partial = target.resolveSibling(target.getFileName().toString() + ".part");
        Files.createDirectories(partial.getParent());
        Files.createFile(partial);
        UrlDownloader downloader = new TestDownloader(INFO_OK, "processing...", -1, true, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target, null, null));

        assertEquals(DownloadException.Kind.TIMEOUT, ex.getKind());
        assertTrue(ex.getMessage().contains("timed out after 15 minutes"));
        assertTrue(Files.notExists(partial));
    }

    @Test
    void partialFilesAreDeletedOnFailure() throws IOException {
        Path target = target();
        Path partial = target.resolveSibling(target.getFileName().toString() + ".part");
        Files.createDirectories(partial.getParent());
        Files.createFile(partial);
        UrlDownloader downloader = new TestDownloader(INFO_OK, "error", 1, false, null);

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target, null, null));

        assertEquals(DownloadException.Kind.FAILED, ex.getKind());
        assertTrue(Files.notExists(partial));
    }

    @Test
    void progressLinesAreForwarded() {
        TestDownloader downloader = new TestDownloader(INFO_OK, "ok", 0, false, null);
        downloader.progressLines = List.of(
                "[youtube] dQw4w9WgXcQ: Downloading webpage",
                "[download]   12.5% of  48.20MiB at  2.10MiB/s ETA 00:20",
                "[download] 100% of  48.20MiB in 00:00:22");
        List<Double> seen = new ArrayList<>();

        MediaFetcher.FetchedMedia media = assertDoesNotThrow(() -> downloader.fetch(URL, target(), seen::add, null));

        assertEquals(List.of(12.5, 100.0), seen);
        assertEquals("Demo", media.title());
        assertEquals(300.0, media.durationSec());
        assertTrue(Files.exists(media.file()));
    }

    @Test
    void cookiesFileIsAddedWhenPresent() {
        Path cookies = tempDir.resolve("cookies.txt");
        assertDoesNotThrow(() -> Files.writeString(cookies, "dummy"));
        TestDownloader downloader = new TestDownloader(INFO_OK, "ok", 0, false, cookies);

        assertDoesNotThrow(() -> downloader.fetch(URL, target(), null, null));

        List<String> lastCmd = downloader.commands.get(downloader.commands.size() - 1);
        assertTrue(lastCmd.contains("--cookies"));
        int idx = lastCmd.indexOf("--cookies");
        assertEquals(cookies.toAbsolutePath().toString(), lastCmd.get(idx + 1));
        assertEquals(URL, lastCmd.get(lastCmd.size() - 1));
        int outputIdx = lastCmd.indexOf("-o");
        assertTrue(idx < outputIdx);
        assertTrue(downloader.commands.get(0).contains("--cookies"));
    }

    @Test
    void metadataTimeoutKillsProcess() {
        UrlDownloader downloader = new RealProcessDownloader();

        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch(URL, target(), null, null));

        assertEquals(DownloadException.Kind.TIMEOUT, ex.getKind());
        assertTrue(ex.getMessage().toLowerCase().contains("timed out"));
    }

    @Test
    void cancelStopsRunningProcess() {
        UrlDownloader downloader = new RealProcessDownloader("5", 1);
        long cancelAt = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);

        long start = System.nanoTime();
        DownloadException ex = assertThrows(DownloadException.class,
                () -> downloader.fetch(URL, target(), null, () -> System.nanoTime() - cancelAt >= 0));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(DownloadException.Kind.CANCELLED, ex.getKind());
        assertTrue(elapsedMs < 3000, "process was not stopped promptly: " + elapsedMs + "ms");
    }

    @Test
    void cancelAfterMetadataSkipsDownload() throws IOException {
        Path target = target();
        Path partial = target.resolveSibling(target.getFileName().toString() + ".part");
        Files.createDirectories(partial.getParent());
        Files.createFile(partial);
        TestDownloader downloader = new TestDownloader(INFO_OK, "ok", 0, false, null);
        downloader.cancelAfterInfo = true;

        DownloadException ex = assertThrows(DownloadException.class,
                () -> downloader.fetch(URL, target, null, () -> downloader.cancelRequested));

        assertEquals(DownloadException.Kind.CANCELLED, ex.getKind());
        assertEquals(1, downloader.commands.size());
        assertTrue(Files.notExists(partial));
        assertTrue(Files.notExists(target));
    }

    @Test
    void progressParsing() {
        assertEquals(42.0, UrlDownloader.parseProgress("[download]  42.0% of ~ 10.00MiB"));
        assertEquals(7.0, UrlDownloader.parseProgress("[download] 7% of 3MiB"));
        assertNull(UrlDownloader.parseProgress("[Merger] Merging formats into \"x.mp4\""));
        assertNull(UrlDownloader.parseProgress(null));
    }

    private Path target() {
        return tempDir.resolve("downloads/dQw4w9WgXcQ.mp4");
    }

    private static class TestDownloader extends UrlDownloader {
        private final String infoOutput;
        private final ProcessResult stubResult;
        final List<List<String>> commands = new ArrayList<>();
        int infoCode = 0;
        boolean cancelAfterInfo;
        volatile boolean cancelRequested;
        List<String> progressLines = List.of();

        TestDownloader(String infoOutput, String log, int code, boolean timeout, Path cookies) {
            super("yt-dlp", 10_800, 15, cookies != null ? cookies.toString() : null, new ObjectMapper());
            this.infoOutput = infoOutput;
            this.stubResult = new ProcessResult(code, log, timeout, false);
        }

        @Override
        protected ProcessResult runProcess(List<String> cmd, long timeoutMinutes, Consumer<String> lineListener,
                                           BooleanSupplier cancelled) {
            commands.add(List.copyOf(cmd));
            if (cmd.contains("--dump-single-json") && cancelAfterInfo) {
                cancelRequested = true;
            }
            if (cmd.contains("--dump-single-json")) {
                return new ProcessResult(infoCode, infoOutput, false, false);
            }
            progressLines.forEach(lineListener);
            try {
                if (stubResult.code() == 0 && !stubResult.timedOut()) {
                    Path target = Path.of(cmd.get(cmd.indexOf("-o") + 1));
                    Files.createDirectories(target.getParent());
                    Files.createFile(target);
                }
            } catch (IOException ignored) {
            }
            return stubResult;
        }
    }

    private static final class RealProcessDownloader extends UrlDownloader {
        private final String sleepSeconds;
        private final long timeoutMinutes;

        RealProcessDownloader() {
            this("2", 0);
        }

        RealProcessDownloader(String sleepSeconds, long timeoutMinutes) {
            super("yt-dlp", 10_800, 15, null, new ObjectMapper());
            this.sleepSeconds = sleepSeconds;
            this.timeoutMinutes = timeoutMinutes;
        }

        @Override
        protected ProcessResult runProcess(List<String> cmd, long ignoredTimeout, Consumer<String> lineListener,
                                           BooleanSupplier cancelled) throws IOException, InterruptedException {
            List<String> sleepCmd = List.of("sh", "-c", "sleep " + sleepSeconds);
            return super.runProcess(sleepCmd, timeoutMinutes, lineListener, cancelled);
        }
    }
}
