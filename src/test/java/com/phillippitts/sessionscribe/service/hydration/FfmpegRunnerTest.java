package com.phillippitts.sessionscribe.service.hydration;

import com.phillippitts.sessionscribe.exception.HydrationException;
import com.phillippitts.sessionscribe.testutil.FakeProcess;
import com.phillippitts.sessionscribe.testutil.FakeProcessFactory;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegRunnerTest {

    @Test
    void shouldBuildDecodeCommand() {
        // Arrange
        FakeProcessFactory factory = new FakeProcessFactory().scripted(cmd -> exited(0, ""));
        FfmpegRunner runner = new FfmpegRunner(factory, "/opt/ffmpeg", false);

        // Act
        runner.decodeToPcm(Path.of("in.ogg"), Path.of("out.pcm"));

        // Assert
        assertThat(factory.commands()).containsExactly(List.of("/opt/ffmpeg", "-hide_banner", "-loglevel",
                "warning", "-i", "in.ogg", "-f", "s16le", "-ar", "48000", "-ac", "2", "-y", "out.pcm"));
    }

    @Test
    void shouldRunUnderNiceWhenLowPriority() {
        // Arrange
        FakeProcessFactory factory = new FakeProcessFactory().scripted(cmd -> exited(0, ""));
        FfmpegRunner runner = new FfmpegRunner(factory, "ffmpeg", true);

        // Act
        runner.mix(List.of(Path.of("a.wav")), Path.of("mix.wav"));

        // Assert
        List<String> command = factory.commands().get(0);
        assertThat(command.subList(0, 4)).containsExactly("nice", "-n", "19", "ffmpeg");
        assertThat(command).containsSequence("-filter_complex", "loudnorm");
    }

    @Test
    void shouldFallBackWhenNiceCannotStart() {
        // Arrange
        FakeProcessFactory factory = new FakeProcessFactory().failNext(1).scripted(cmd -> exited(0, ""));
        FfmpegRunner runner = new FfmpegRunner(factory, "ffmpeg", true);

        // Act
        runner.decodeToPcm(Path.of("in.ogg"), Path.of("out.pcm"));

        // Assert
        assertThat(factory.commands()).hasSize(2);
        assertThat(factory.commands().get(1).get(0)).isEqualTo("ffmpeg");
    }

    @Test
    void shouldBuildMixFilterForSeveralInputs() {
        assertThat(FfmpegRunner.mixFilter(3)).isEqualTo("amix=inputs=3:duration=longest,loudnorm");
        assertThat(FfmpegRunner.mixFilter(1)).isEqualTo("loudnorm");
    }

    @Test
    void shouldReportStderrTailOnFailure() {
        // Arrange
        FakeProcessFactory factory = new FakeProcessFactory()
                .scripted(cmd -> exited(1, "first line\nin.ogg: Invalid data found when processing input\n"));
        FfmpegRunner runner = new FfmpegRunner(factory, "ffmpeg", false);

        // Act & Assert
        assertThatThrownBy(() -> runner.decodeToPcm(Path.of("in.ogg"), Path.of("out.pcm")))
                .isInstanceOf(HydrationException.class)
                .hasMessageContaining("exited with 1")
                .hasMessageContaining("Invalid data found");
    }

    @Test
    void shouldKillProcessThatExceedsTimeout() {
        // Arrange
        FakeProcess hung = new FakeProcess();
        FakeProcessFactory factory = new FakeProcessFactory().enqueue(hung);
        FfmpegRunner runner = new FfmpegRunner(factory, "ffmpeg", false, Duration.ofMillis(50));

        // Act & Assert
        assertThatThrownBy(() -> runner.decodeToPcm(Path.of("in.ogg"), Path.of("out.pcm")))
                .isInstanceOf(HydrationException.class)
                .hasMessageContaining("timed out");
        assertThat(hung.destroyForciblyCount()).isEqualTo(1);
    }

    @Test
    void shouldFailWhenFfmpegCannotStart() {
        // Arrange
        FfmpegRunner runner = new FfmpegRunner(new FakeProcessFactory().failNext(1), "ffmpeg", false);

        // Act & Assert
        assertThatThrownBy(() -> runner.mix(List.of(Path.of("a.wav")), Path.of("mix.wav")))
                .isInstanceOf(HydrationException.class)
                .hasMessageContaining("Failed to start ffmpeg");
    }

    @Test
    void shouldProbeAvailabilityWithVersionCommand() {
        // Arrange
        FakeProcessFactory ok = new FakeProcessFactory().scripted(cmd -> exited(0, ""));
        FakeProcessFactory missing = new FakeProcessFactory().failNext(1);

        // Act & Assert
        assertThat(new FfmpegRunner(ok, "ffmpeg", true).isAvailable()).isTrue();
        assertThat(ok.commands()).containsExactly(List.of("ffmpeg", "-version"));
        assertThat(new FfmpegRunner(missing, "ffmpeg", true).isAvailable()).isFalse();
    }

    private static FakeProcess exited(int code, String stderr) {
        FakeProcess process = new FakeProcess(stderr);
        process.exit(code);
        return process;
    }
}
