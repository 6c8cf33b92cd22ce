package com.example.shorts_backend.service;

import com.example.shorts_backend.engine.Interfaces.MediaFetcher;
import com.example.shorts_backend.exception.DownloadException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches YouTube sources with yt-dlp. Metadata is read first so live streams and overly long videos
 * are rejected before any bytes are downloaded.
 */
@Component
public class UrlDownloader implements MediaFetcher {
    private static final Logger log = LoggerFactory.getLogger(UrlDownloader.class);
    private static final long INFO_TIMEOUT_MINUTES = 2;
    private static final long CANCEL_POLL_MS = 200;
    private static final int LOG_SNIPPET_MAX = 4_000;
    private static final Pattern PROGRESS = Pattern.compile("\\[download]\\s+(\\d{1,3}(?:\\.\\d+)?)%");

    private final String ytdlp;
    private final String ytdlpCookiesFile;
    private final long maxDurationSec;
    private final long downloadTimeoutMinutes;
    private final ObjectMapper objectMapper;

    public UrlDownloader(@Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlp,
                         @Value("${downloader.max-duration-seconds:10800}") long maxDurationSec,
                         @Value("${downloader.timeout-minutes:15}") long downloadTimeoutMinutes,
                         @Value("${YTDLP_COOKIES_FILE:#{null}}") String ytdlpCookiesFile,
                         ObjectMapper objectMapper) {
        this.ytdlp = ytdlp;
        this.maxDurationSec = maxDurationSec;
        this.downloadTimeoutMinutes = downloadTimeoutMinutes;
        this.ytdlpCookiesFile = ytdlpCookiesFile;
        this.objectMapper = objectMapper;
    }

    @Override
    public FetchedMedia fetch(String url, Path target, ProgressListener listener, BooleanSupplier cancelled) {
        BooleanSupplier stop = cancelled != null ? cancelled : () -> false;
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            JsonNode info = readInfo(url, stop);
            double duration = info.path("duration").asDouble(0.0);
            String title = info.path("title").asText("Unknown");
            if (info.path("is_live").asBoolean(false)) {
                throw new DownloadException(DownloadException.Kind.LIVE_STREAM, "Cannot process live streams");
            }
            if (duration > maxDurationSec) {
                throw new DownloadException(DownloadException.Kind.TOO_LONG,
                        "Video is too long (" + (long) duration + "s). Maximum allowed is " + maxDurationSec + "s ("
                                + maxDurationSec / 60 + " minutes)");
            }
            if (stop.getAsBoolean()) {
                throw cancelledDownload(url, target);
            }
            downloadYoutubeMp4(url, target, listener, stop);
            log.info("yt-dlp download OK target={} url={} duration={}s", target, url, duration);
            return new FetchedMedia(target, title, duration);
        } catch (DownloadException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cleanupPartial(target);
            throw new DownloadException(DownloadException.Kind.FAILED, "Download interrupted", e);
        } catch (IOException e) {
            log.warn("yt-dlp could not run url={} err={}", url, e.toString());
            throw new DownloadException(DownloadException.Kind.FAILED, "Failed to download video", e);
        }
    }

    private JsonNode readInfo(String url, BooleanSupplier cancelled) throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>(List.of(ytdlp, "--dump-single-json", "--no-playlist", "--no-warnings"));
        maybeAddCookies(cmd);
        cmd.add(url);

        ProcessResult result = runProcess(cmd, INFO_TIMEOUT_MINUTES, line -> { }, cancelled);
        if (result.cancelled()) {
            throw cancelledDownload(url, null);
        }
        if (result.timedOut()) {
            log.warn("yt-dlp metadata timeout after {}m url={}", INFO_TIMEOUT_MINUTES, url);
            throw new DownloadException(DownloadException.Kind.TIMEOUT, "Timed out while reading video information");
        }
        if (result.code() != 0) {
            throw classify(url, result.code(), result.output());
        }
        String out = result.output();
        int start = out.indexOf('{');
        if (start < 0) {
            log.warn("yt-dlp returned no metadata url={} log={}", url, truncateLog(out));
            throw new DownloadException(DownloadException.Kind.FAILED, "Could not read video information");
        }
        return objectMapper.readTree(out.substring(start));
    }

    private void downloadYoutubeMp4(String url, Path mp4Target, ProgressListener listener, BooleanSupplier cancelled)
            throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--newline",
                "-S", "res:1080,codec:h264",
                "-f", "bv*[ext=mp4][height<=1080]+ba[ext=m4a]/b[ext=mp4]/b",
                "--merge-output-format", "mp4",
                "--no-playlist"
        ));

        maybeAddCookies(cmd);

        cmd.add("-o");
        cmd.add(mp4Target.toString());
        cmd.add(url);

        ProcessResult result = runProcess(cmd, downloadTimeoutMinutes, line -> {
            Double pct = parseProgress(line);
            if (pct != null && listener != null) {
                listener.onProgress(pct);
            }
        }, cancelled);

        if (result.cancelled()) {
            Files.deleteIfExists(mp4Target);
            throw cancelledDownload(url, mp4Target);
        }
        if (result.timedOut()) {
            String partialNote = cleanupPartial(mp4Target);
            log.warn("yt-dlp timeout after {}m url={}{}", downloadTimeoutMinutes, url, partialNote);
            throw new DownloadException(DownloadException.Kind.TIMEOUT,
                    "Download timed out after " + downloadTimeoutMinutes + " minutes");
        }

        if (result.code() != 0 || !Files.exists(mp4Target)) {
            cleanupPartial(mp4Target);
            throw classify(url, result.code(), result.output());
        }
    }

    static Double parseProgress(String line) {
        if (line == null) {
            return null;
        }
        Matcher m = PROGRESS.matcher(line);
        if (!m.find()) {
            return null;
        }
        return Math.min(100.0, Double.parseDouble(m.group(1)));
    }

    DownloadException classify(String url, int code, String output) {
        String normalized = output == null ? "" : output.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
        DownloadException.Kind kind;
        String message;
        if (normalized.contains("private video")) {
            kind = DownloadException.Kind.PRIVATE;
            message = "Video is private";
        } else if (normalized.contains("not available in your country") || normalized.contains("geo restriction")
                || normalized.contains("geo-restricted")) {
            kind = DownloadException.Kind.REGION_LOCKED;
            message = "Video is not available in this region";
        } else if (isAuthWall(normalized)) {
            kind = DownloadException.Kind.AUTH_REQUIRED;
            message = "YouTube download requires authentication/cookies";
        } else if (normalized.contains("video unavailable") || normalized.contains("has been removed")
                || normalized.contains("does not exist")) {
            kind = DownloadException.Kind.UNAVAILABLE;
            message = "Video is unavailable";
        } else {
            kind = DownloadException.Kind.FAILED;
            message = "Failed to download video";
        }
        log.warn("yt-dlp failed url={} exit={} kind={} log={}", url, code, kind, truncateLog(output));
        return new DownloadException(kind, message);
    }

    /**
     * Runs yt-dlp until it exits, the timeout passes or {@code cancelled} turns true. The last two
     * kill the process.
     */
    protected ProcessResult runProcess(List<String> cmd, long timeoutMinutes, Consumer<String> lineListener,
                                       BooleanSupplier cancelled) throws IOException, InterruptedException {
        log.debug("Exec: {}", String.join(" ", cmd));
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (var buffered = new java.io.BufferedReader(new java.io.InputStreamReader(p.getInputStream()))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    joiner.add(line);
                    lineListener.accept(line);
                }
            } catch (IOException e) {
                log.trace("yt-dlp output closed: {}", e.toString());
            }
        });
        reader.setDaemon(true);
        reader.start();

        long deadline = System.nanoTime() + TimeUnit.MINUTES.toNanos(timeoutMinutes);
        boolean finished = false;
        boolean stopped = false;
        try {
            while (!(finished = p.waitFor(CANCEL_POLL_MS, TimeUnit.MILLISECONDS))) {
                if (cancelled.getAsBoolean()) {
                    stopped = true;
                    break;
                }
                if (System.nanoTime() - deadline >= 0) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            throw e;
        }
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join();
        int code = finished ? p.exitValue() : -1;
        return new ProcessResult(code, joiner.toString(), !finished && !stopped, stopped);
    }

    private DownloadException cancelledDownload(String url, Path target) {
        String partialNote = target != null ? cleanupPartial(target) : "";
        log.info("yt-dlp stopped, job cancelled url={}{}", url, partialNote);
        return new DownloadException(DownloadException.Kind.CANCELLED, "Download cancelled");
    }

    private String truncateLog(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return output.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    private boolean isAuthWall(String normalized) {
        return normalized.contains("sign in to confirm you're not a bot")
                || normalized.contains("sign in to confirm your age")
                || normalized.contains("--cookies-from-browser")
                || normalized.contains("use --cookies");
    }

    private void maybeAddCookies(List<String> cmd) {
        if (ytdlpCookiesFile == null || ytdlpCookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(ytdlpCookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            log.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    private String cleanupPartial(Path mp4Target) {
        Path partial = mp4Target.resolveSibling(mp4Target.getFileName().toString() + ".part");
        if (Files.exists(partial)) {
            try {
                Files.deleteIfExists(partial);
            } catch (IOException e) {
                log.warn("Failed to delete yt-dlp partial file partial={}", partial, e);
            }
            return " partial=" + partial;
        }
        return "";
    }

    protected record ProcessResult(int code, String output, boolean timedOut, boolean cancelled) { }
}
