package com.example.shorts_backend.engine;

import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link MediaSampler} backed by the ffmpeg and ffprobe binaries. Decoded data is read from the
 * process' stdout pipe.
 */
public class FfmpegMediaSampler implements MediaSampler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaSampler.class);
    private static final int STDERR_MAX = 4_000;
    private static final long WATCHDOG_TICK_MS = 250;

    private final String ffmpegBin;
    private final String ffprobeBin;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public FfmpegMediaSampler(String ffmpegBin, String ffprobeBin, Duration timeout, ObjectMapper objectMapper) {
        this.ffmpegBin = ffmpegBin != null ? ffmpegBin : "ffmpeg";
        this.ffprobeBin = ffprobeBin != null ? ffprobeBin : "ffprobe";
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(30);
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    @Override
    public MediaInfo probe(Path mediaFile) throws Exception {
        requireFile(mediaFile);
        List<String> cmd = List.of(
                ffprobeBin, "-v", "error",
                "-print_format", "json",
                "-show_format", "-show_streams",
                mediaFile.toAbsolutePath().toString());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        runStreaming(cmd, in -> in.transferTo(out));
        return parseProbe(objectMapper.readTree(out.toByteArray()));
    }

    MediaInfo parseProbe(JsonNode root) {
        double duration = root.path("format").path("duration").asDouble(0.0);
        int width = 0;
        int height = 0;
        double fps = 0.0;
        boolean hasAudio = false;
        for (JsonNode stream : root.path("streams")) {
            String type = stream.path("codec_type").asText("");
            if ("video".equals(type) && width == 0) {
                width = stream.path("width").asInt(0);
                height = stream.path("height").asInt(0);
                // ffmpeg autorotates, so callers see the displayed size
                if (Math.abs(rotation(stream)) % 180 == 90) {
                    int coded = width;
                    width = height;
                    height = coded;
                }
                fps = parseRate(stream.path("avg_frame_rate").asText(null));
                if (duration <= 0) {
                    duration = stream.path("duration").asDouble(0.0);
                }
            } else if ("audio".equals(type)) {
                hasAudio = true;
            }
        }
        return new MediaInfo(duration, width, height, fps, hasAudio);
    }

    /**
     * Rotation in degrees from the display matrix side data, or the legacy {@code rotate} tag.
     */
    static int rotation(JsonNode videoStream) {
        for (JsonNode side : videoStream.path("side_data_list")) {
            if (side.has("rotation")) {
                return (int) Math.round(side.path("rotation").asDouble(0.0));
            }
        }
        return (int) Math.round(videoStream.path("tags").path("rotate").asDouble(0.0));
    }

    @Override
    public void streamGrayFrames(Path mediaFile, FrameSpec spec, Consumer<GrayFrame> consumer) throws Exception {
        requireFile(mediaFile);
        if (spec.intervalSec() <= 0 || spec.width() <= 0 || spec.height() <= 0) {
            throw new IllegalArgumentException("Invalid frame spec: " + spec);
        }
        String filter = String.format(Locale.ROOT, "fps=%.6f,scale=%d:%d,format=gray",
                1.0 / spec.intervalSec(), spec.width(), spec.height());
        List<String> cmd = List.of(
                ffmpegBin, "-v", "error", "-nostdin",
                "-i", mediaFile.toAbsolutePath().toString(),
                "-an",
                "-vf", filter,
                "-f", "rawvideo", "-pix_fmt", "gray",
                "pipe:1");
        int frameSize = spec.width() * spec.height();
        runStreaming(cmd, in -> {
            DataInputStream data = new DataInputStream(in);
            long index = 0;
            while (true) {
                byte[] pixels = new byte[frameSize];
                try {
                    data.readFully(pixels);
                } catch (EOFException eof) {
                    break;
                }
                consumer.accept(new GrayFrame(index * spec.intervalSec(), spec.width(), spec.height(), pixels));
                index++;
            }
            LOGGER.debug("Sampled frames={} interval={} size={}x{} file={}", index, spec.intervalSec(), spec.width(), spec.height(), mediaFile.getFileName());
        });
    }

    @Override
    public void streamPcm(Path mediaFile, int sampleRate, PcmConsumer consumer) throws Exception {
        requireFile(mediaFile);
        List<String> cmd = List.of(
                ffmpegBin, "-v", "error", "-nostdin",
                "-i", mediaFile.toAbsolutePath().toString(),
                "-vn", "-ac", "1", "-ar", String.valueOf(sampleRate),
                "-f", "s16le",
                "pipe:1");
        runStreaming(cmd, in -> {
            byte[] buf = new byte[16_384];
            float[] samples = new float[buf.length / 2 + 1];
            int carry = -1;
            int read;
            while ((read = in.read(buf)) != -1) {
                int count = 0;
                int i = 0;
                if (carry >= 0 && read > 0) {
                    samples[count++] = toSample(carry, buf[0]);
                    i = 1;
                    carry = -1;
                }
                for (; i + 1 < read; i += 2) {
                    samples[count++] = toSample(buf[i], buf[i + 1]);
                }
                if (i < read) {
                    carry = buf[i] & 0xFF;
                }
                if (count > 0) {
                    consumer.accept(samples, count);
                }
            }
        });
    }

    @Override
    public byte[] extractJpeg(Path mediaFile, double timeSec, int maxWidth) throws Exception {
        requireFile(mediaFile);
        List<String> cmd = List.of(
                ffmpegBin, "-v", "error", "-nostdin",
                "-ss", String.format(Locale.ROOT, "%.3f", Math.max(0.0, timeSec)),
                "-i", mediaFile.toAbsolutePath().toString(),
                "-frames:v", "1",
                "-vf", "scale='min(" + maxWidth + ",iw)':-2",
                "-f", "image2", "-c:v", "mjpeg", "-q:v", "3",
                "pipe:1");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        runStreaming(cmd, in -> in.transferTo(out));
        if (out.size() == 0) {
            throw new IllegalStateException("ffmpeg produced no frame at t=" + timeSec + " for " + mediaFile.getFileName());
        }
        return out.toByteArray();
    }

    private static float toSample(int lo, int hi) {
        short value = (short) ((lo & 0xFF) | (hi << 8));
        return value / 32768f;
    }

    private static double parseRate(String rate) {
        if (rate == null || rate.isBlank()) {
            return 0.0;
        }
        int slash = rate.indexOf('/');
        try {
            if (slash < 0) {
                return Double.parseDouble(rate);
            }
            double num = Double.parseDouble(rate.substring(0, slash));
            double den = Double.parseDouble(rate.substring(slash + 1));
            return den == 0 ? 0.0 : num / den;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static void requireFile(Path mediaFile) {
        if (mediaFile == null || !Files.exists(mediaFile)) {
            throw new IllegalArgumentException("Input file not found: " + mediaFile);
        }
    }

    @FunctionalInterface
    interface StdoutHandler {
        void handle(InputStream stdout) throws Exception;
    }

    /**
     * Runs the command and hands its stdout to the handler on the calling thread. A watchdog kills
     * the process when the timeout passes or the calling thread gets interrupted, which unblocks any
     * pending pipe read.
     */
    void runStreaming(List<String> cmd, StdoutHandler handler) throws Exception {
        LOGGER.debug("Exec: {}", String.join(" ", cmd));
        Process p = new ProcessBuilder(cmd).start();
        StringBuilder errBuf = new StringBuilder();
        Thread errReader = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(p.getErrorStream()))) {
                String line;
                while ((line = br.readLine()) != null) {
                    synchronized (errBuf) {
                        if (errBuf.length() < STDERR_MAX) {
                            errBuf.append(line).append('\n');
                        }
                    }
                }
            } catch (IOException e) {
                LOGGER.trace("ffmpeg stderr closed: {}", e.toString());
            }
        }, "ffmpeg-stderr");
        errReader.setDaemon(true);
        errReader.start();

        Thread caller = Thread.currentThread();
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean[] killed = new boolean[1];
        Thread watchdog = new Thread(() -> {
            try {
                while (!p.waitFor(WATCHDOG_TICK_MS, TimeUnit.MILLISECONDS)) {
                    if (caller.isInterrupted() || System.nanoTime() > deadline) {
                        killed[0] = true;
                        p.destroyForcibly();
                        return;
                    }
                }
            } catch (InterruptedException e) {
                p.destroyForcibly();
                Thread.currentThread().interrupt();
            }
        }, "ffmpeg-watchdog");
        watchdog.setDaemon(true);
        watchdog.start();

        try (InputStream stdout = p.getInputStream()) {
            handler.handle(stdout);
        } catch (IOException e) {
            if (!killed[0]) {
                throw e;
            }
        } finally {
            if (p.isAlive()) {
                p.destroyForcibly();
            }
        }
        p.waitFor(5, TimeUnit.SECONDS);
        errReader.join(1_000);
        watchdog.join(1_000);

        if (caller.isInterrupted()) {
            throw new InterruptedException("Interrupted while running " + cmd.get(0));
        }
        if (killed[0]) {
            throw new IllegalStateException(cmd.get(0) + " timed out after " + timeout);
        }
        int code = p.exitValue();
        if (code != 0) {
            String stderr;
            synchronized (errBuf) {
                stderr = errBuf.toString();
            }
            throw new IllegalStateException(cmd.get(0) + " failed with exit " + code + "\n---- stderr ----\n" + stderr);
        }
    }
}
