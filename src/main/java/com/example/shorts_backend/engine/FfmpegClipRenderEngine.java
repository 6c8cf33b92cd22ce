package com.example.shorts_backend.engine;

import com.example.shorts_backend.dto.RenderOptions;
import com.example.shorts_backend.dto.RenderResult;
import com.example.shorts_backend.engine.Interfaces.ClipRenderEngine;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.exception.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Cuts a segment out of the source and encodes it as a vertical clip. Landscape sources lose their
 * sides, tall sources lose top and bottom; the center is always kept.
 */
public class FfmpegClipRenderEngine implements ClipRenderEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegClipRenderEngine.class);
    private static final int STDERR_MAX = 4_000;

    private final String ffmpegBin;
    private final Duration timeout;

    public FfmpegClipRenderEngine(String ffmpegBin, Duration timeout) {
        this.ffmpegBin = ffmpegBin != null ? ffmpegBin : "ffmpeg";
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(5);
    }

    @Override
    public RenderResult render(Path inputFile, MediaSampler.MediaInfo source, double startSec, double endSec,
                               Path target, RenderOptions options) throws IOException, InterruptedException {
        if (inputFile == null || !Files.exists(inputFile)) {
            throw new IllegalArgumentException("Input file not found: " + inputFile);
        }
        if (startSec < 0 || endSec <= startSec) {
            throw new IllegalArgumentException("Invalid range: startSec=" + startSec + ", endSec=" + endSec);
        }
        RenderOptions opts = options != null ? options : RenderOptions.DEFAULT;
        int W = even(opts.width());
        int H = even(opts.height());

        Files.createDirectories(target.toAbsolutePath().getParent());
        Path tmpOut = target.resolveSibling(target.getFileName().toString() + ".part.mp4");

        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-nostdin");

        if (source != null && source.hasVideo()) {
            cmd.add("-ss"); cmd.add(seconds(startSec));
            cmd.add("-i");  cmd.add(inputFile.toAbsolutePath().toString());
            cmd.add("-t");  cmd.add(seconds(endSec - startSec));
            cmd.add("-vf"); cmd.add(cropFilter(source.width(), source.height(), W, H));
        } else {
            // audio only: black canvas with the source audio
            cmd.add("-f"); cmd.add("lavfi");
            cmd.add("-i"); cmd.add("color=color=black:size=" + W + "x" + H + ":rate=30");
            cmd.add("-ss"); cmd.add(seconds(startSec));
            cmd.add("-i");  cmd.add(inputFile.toAbsolutePath().toString());
            cmd.add("-t");  cmd.add(seconds(endSec - startSec));
            cmd.add("-map"); cmd.add("0:v:0");
            cmd.add("-map"); cmd.add("1:a:0?");
            cmd.add("-shortest");
        }

        cmd.add("-c:v"); cmd.add("libx264");
        cmd.add("-preset"); cmd.add(opts.preset());
        cmd.add("-crf"); cmd.add(String.valueOf(opts.crf()));
        cmd.add("-c:a"); cmd.add("aac");
        cmd.add("-b:a"); cmd.add(opts.audioBitrate());
        cmd.add("-movflags"); cmd.add("+faststart");
        cmd.add("-pix_fmt"); cmd.add("yuv420p");
        cmd.add(tmpOut.toAbsolutePath().toString());

        LOGGER.info("FFmpeg command: {}", String.join(" ", cmd));
        long t0 = System.nanoTime();
        ProcessResult result;
        try {
            result = runProcess(cmd, timeout);
        } catch (IOException | InterruptedException e) {
            Files.deleteIfExists(tmpOut);
            throw e;
        }

        if (result.timedOut()) {
            Files.deleteIfExists(tmpOut);
            throw new RenderException("ffmpeg timed out after " + timeout + " for " + target.getFileName());
        }
        if (result.code() != 0 || !Files.exists(tmpOut)) {
            Files.deleteIfExists(tmpOut);
            throw new RenderException("ffmpeg failed with exit " + result.code()
                    + " for " + target.getFileName() + "\n---- ffmpeg stderr ----\n" + result.stderr());
        }
        Files.move(tmpOut, target, StandardCopyOption.REPLACE_EXISTING);
        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        return new RenderResult(target, Files.size(target), tookMs);
    }

    /**
     * Center crop to the output aspect ratio followed by a scale to the output size.
     */
    static String cropFilter(int inW, int inH, int outW, int outH) {
        double outRatio = (double) outW / outH;
        double inRatio = (double) inW / inH;
        int cropW = inW;
        int cropH = inH;
        if (inRatio > outRatio) {
            cropW = even((int) (inH * outRatio));
        } else if (inRatio < outRatio) {
            cropH = even((int) (inW / outRatio));
        }
        int x = (inW - cropW) / 2;
        int y = (inH - cropH) / 2;
        return "crop=" + cropW + ":" + cropH + ":" + x + ":" + y + ",scale=" + outW + ":" + outH + ",setsar=1";
    }

    protected ProcessResult runProcess(List<String> cmd, Duration limit) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        StringBuilder errBuf = new StringBuilder();
        Thread tErr = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(p.getInputStream()))) {
                String line;
                while ((line = br.readLine()) != null) {
                    LOGGER.debug("[ffmpeg] {}", line);
                    if (errBuf.length() < STDERR_MAX) {
                        errBuf.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                LOGGER.trace("ffmpeg output closed: {}", e.toString());
            }
        });
        tErr.setDaemon(true);
        tErr.start();

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
        tErr.join(1_000);
        return new ProcessResult(finished ? p.exitValue() : -1, errBuf.toString(), !finished);
    }

    private static int even(int value) {
        return (value & 1) == 1 ? value - 1 : value;
    }

    private static String seconds(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    protected record ProcessResult(int code, String stderr, boolean timedOut) { }
}
