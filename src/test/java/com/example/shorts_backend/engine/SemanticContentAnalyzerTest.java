package com.example.shorts_backend.engine;

import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.FrameInsight;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.service.OllamaVisionClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SemanticContentAnalyzerTest {

    @Mock private MediaSampler sampler;
    @Mock private OllamaVisionClient client;

    @Test
    void samplesEveryIntervalOnShortMedia() {
        SemanticContentAnalyzer analyzer = new SemanticContentAnalyzer(sampler, client, 3.0, 50);

        List<Double> times = analyzer.sampleTimes(30);

        assertThat(times).hasSize(10);
        assertThat(times.get(0)).isEqualTo(0.0);
        assertThat(times.get(9)).isEqualTo(27.0);
    }

    @Test
    void widensIntervalToStayWithinFrameBudget() {
        SemanticContentAnalyzer analyzer = new SemanticContentAnalyzer(sampler, client, 3.0, 50);

        List<Double> times = analyzer.sampleTimes(3600);

        assertThat(times).hasSize(50);
        assertThat(times.get(1)).isEqualTo(72.0);
        assertThat(times.get(49)).isLessThan(3600.0);
        assertThat(analyzer.sampleTimes(0)).isEmpty();
    }

    @Test
    void scoresFramesWithModelRating() throws Exception {
        when(sampler.extractJpeg(any(), anyDouble(), anyInt())).thenReturn(new byte[]{(byte) 0xFF, (byte) 0xD8});
        when(client.describeFrame(any()))
                .thenReturn(new FrameInsight(70, "Host laughs", "reaction", true, false, "funny", "high"))
                .thenReturn(FrameInsight.NEUTRAL);
        SemanticContentAnalyzer analyzer = new SemanticContentAnalyzer(sampler, client, 3.0, 50);

        AnalyzerResult result = analyzer.analyze(new AnalysisRequest(UUID.randomUUID(), Path.of("v.mp4"),
                new MediaSampler.MediaInfo(6, 1280, 720, 30, true)));

        assertThat(result.samples()).hasSize(2);
        assertThat(result.samples().get(0).score().value()).isEqualTo(97.0);
        assertThat(result.samples().get(0).score().metadata())
                .containsEntry("viralPotential", "high")
                .containsEntry("description", "Host laughs")
                .containsEntry("contentType", "reaction");
        assertThat(result.samples().get(1).score().value()).isEqualTo(50.0);
        verify(client, times(2)).describeFrame(any());
    }

    @Test
    void availabilityFollowsClient() {
        when(client.isAvailable()).thenReturn(false);

        assertThat(new SemanticContentAnalyzer(sampler, client, 3.0, 50).isAvailable()).isFalse();
    }
}
