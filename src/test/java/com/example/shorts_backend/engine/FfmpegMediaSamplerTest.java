package com.example.shorts_backend.engine;

import com.example.shorts_backend.engine.Interfaces.MediaSampler.MediaInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FfmpegMediaSamplerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final FfmpegMediaSampler sampler = new FfmpegMediaSampler("ffmpeg", "ffprobe", Duration.ofMinutes(1), mapper);

    @Test
    void readsVideoAndAudioStreams() throws Exception {
        MediaInfo info = sampler.parseProbe(mapper.readTree("""
                {"streams": [
                   {"codec_type": "video", "width": 1920, "height": 1080, "avg_frame_rate": "30000/1001"},
                   {"codec_type": "audio", "sample_rate": "48000"}
                 ],
                 "format": {"duration": "312.480000"}}"""));

        assertThat(info.durationSec()).isEqualTo(312.48);
        assertThat(info.width()).isEqualTo(1920);
        assertThat(info.height()).isEqualTo(1080);
        assertThat(info.fps()).isCloseTo(29.97, within(0.01));
        assertThat(info.hasAudio()).isTrue();
        assertThat(info.hasVideo()).isTrue();
    }

    @Test
    void audioOnlyFileHasNoVideo() throws Exception {
        MediaInfo info = sampler.parseProbe(mapper.readTree("""
                {"streams": [{"codec_type": "audio"}], "format": {"duration": "60.0"}}"""));

        assertThat(info.hasVideo()).isFalse();
        assertThat(info.hasAudio()).isTrue();
        assertThat(info.durationSec()).isEqualTo(60.0);
    }

    @Test
    void streamDurationIsFallbackWhenFormatHasNone() throws Exception {
        MediaInfo info = sampler.parseProbe(mapper.readTree("""
                {"streams": [{"codec_type": "video", "width": 640, "height": 360, "avg_frame_rate": "25/1", "duration": "42.5"}],
                 "format": {}}"""));

        assertThat(info.durationSec()).isEqualTo(42.5);
        assertThat(info.fps()).isEqualTo(25.0);
        assertThat(info.hasAudio()).isFalse();
    }

    @Test
    void portraitPhoneVideoReportsDisplayedSize() throws Exception {
        MediaInfo info = sampler.parseProbe(mapper.readTree("""
                {"streams": [{"codec_type": "video", "width": 1920, "height": 1080, "avg_frame_rate": "30/1",
                   "side_data_list": [{"side_data_type": "Display Matrix", "rotation": -90}]}],
                 "format": {"duration": "20.0"}}"""));

        assertThat(info.width()).isEqualTo(1080);
        assertThat(info.height()).isEqualTo(1920);
        assertThat(FfmpegClipRenderEngine.cropFilter(info.width(), info.height(), 1080, 1920))
                .startsWith("crop=1080:1920:0:0,");
    }

    @Test
    void legacyRotateTagIsHonoured() throws Exception {
        MediaInfo rotated = sampler.parseProbe(mapper.readTree("""
                {"streams": [{"codec_type": "video", "width": 1280, "height": 720, "tags": {"rotate": "270"}}],
                 "format": {"duration": "5.0"}}"""));
        MediaInfo upsideDown = sampler.parseProbe(mapper.readTree("""
                {"streams": [{"codec_type": "video", "width": 1280, "height": 720, "tags": {"rotate": "180"}}],
                 "format": {"duration": "5.0"}}"""));

        assertThat(rotated.width()).isEqualTo(720);
        assertThat(rotated.height()).isEqualTo(1280);
        assertThat(upsideDown.width()).isEqualTo(1280);
        assertThat(upsideDown.height()).isEqualTo(720);
    }
}
