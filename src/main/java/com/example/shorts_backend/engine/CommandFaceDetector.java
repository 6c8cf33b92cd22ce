package com.example.shorts_backend.engine;

import com.example.shorts_backend.engine.Interfaces.FaceDetector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external face detection command over the whole video and reads its JSON report from
 * stdout.
 *
 * <p>Invocation: {@code <command> --input <video> --interval <seconds>}. Expected output:
 * <pre>
 * {"frames": [{"t": 0.0, "width": 1920, "height": 1080, "faces": [[x, y, w, h], ...]}, ...]}
 * </pre>
 */
public class CommandFaceDetector implements FaceDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandFaceDetector.class);
    private static final int LOG_SNIPPET_MAX = 2_000;

    private final String command;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public CommandFaceDetector(String command, Duration timeout, ObjectMapper objectMapper) {
        this.command = command;
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(20);
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    @Override
    public boolean isAvailable() {
        if (command == null || command.isBlank()) {
            return false;
        }
        try {
            ProcessResult result = runProcess(List.of(command, "--version"), Duration.ofSeconds(10));
            if (result.code() == 0) {
                return true;
            }
            LOGGER.warn("Face detector '{}' not usable exit={} log={}", command, result.code(), truncate(result.stderr()));
        } catch (IOException e) {
            LOGGER.warn("Face detector '{}' not found: {}", command, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public List<FrameFaces> detect(Path mediaFile, double intervalSec) throws Exception {
        if (mediaFile == null || !Files.exists(mediaFile)) {
            throw new IllegalArgumentException("Input file not found: " + mediaFile);
        }
        List<String> cmd = List.of(
                command,
                "--input", mediaFile.toAbsolutePath().toString(),
                "--interval", String.format(Locale.ROOT, "%.3f", intervalSec));
        ProcessResult result = runProcess(cmd, timeout);
        if (result.timedOut()) {
            throw new IllegalStateException("Face detector timed out after " + timeout);
        }
        if (result.code() != 0) {
            throw new IllegalStateException("Face detector failed exit=" + result.code() + " log=" + truncate(result.stderr()));
        }
        return parse(objectMapper.readTree(result.stdout()));
    }

    List<FrameFaces> parse(JsonNode root) {
        List<FrameFaces> frames = new ArrayList<>();
        for (JsonNode frame : root.path("frames")) {
            List<FaceBox> faces = new ArrayList<>();
            for (JsonNode box : frame.path("faces")) {
                if (box.isArray() && box.size() >= 4) {
                    faces.add(new FaceBox(box.get(0).asInt(), box.get(1).asInt(), box.get(2).asInt(), box.get(3).asInt()));
                } else if (box.isObject()) {
                    faces.add(new FaceBox(box.path("x").asInt(), box.path("y").asInt(), box.path("w").asInt(), box.path("h").asInt()));
                }
            }
            frames.add(new FrameFaces(frame.path("t").asDouble(), frame.path("width").asInt(), frame.path("height").asInt(), faces));
        }
        return frames;
    }

    protected ProcessResult runProcess(List<String> cmd, Duration limit) throws IOException, InterruptedException {
        LOGGER.debug("Exec: {}", String.join(" ", cmd));
        Process p = new ProcessBuilder(cmd).start();
        StringJoiner err = new StringJoiner(System.lineSeparator());
        Thread errReader = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(p.getErrorStream()))) {
                String line;
                while ((line = br.readLine()) != null) {
                    err.add(line);
                }
            } catch (IOException e) {
                LOGGER.trace("face detector stderr closed: {}", e.toString());
            }
        });
        errReader.setDaemon(true);
        errReader.start();

        StringBuilder out = new StringBuilder();
        Thread outReader = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(p.getInputStream()))) {
                String line;
                while ((line = br.readLine()) != null) {
                    out.append(line).append('\n');
                }
            } catch (IOException e) {
                LOGGER.trace("face detector stdout closed: {}", e.toString());
            }
        });
        outReader.setDaemon(true);
        outReader.start();

        boolean finished;
        try {
            finished = p.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            throw e;
        }
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        outReader.join();
        errReader.join();
        return new ProcessResult(finished ? p.exitValue() : -1, out.toString(), err.toString(), !finished);
    }

    private static String truncate(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        return output.length() <= LOG_SNIPPET_MAX ? output : output.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    protected record ProcessResult(int code, String stdout, String stderr, boolean timedOut) { }
}
