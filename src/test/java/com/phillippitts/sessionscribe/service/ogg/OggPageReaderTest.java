package com.phillippitts.sessionscribe.service.ogg;

import com.phillippitts.sessionscribe.exception.ContainerFormatException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OggPageReaderTest {

    @Test
    void shouldIgnoreTruncatedTrailingPage() throws IOException {
        // Arrange
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        OggOpusMuxer muxer = new OggOpusMuxer(sink, "v", 7);
        muxer.writeFrame(new byte[]{1, 2, 3, 4});
        muxer.writeFrame(new byte[]{5, 6, 7, 8});
        byte[] all = sink.toByteArray();
        byte[] truncated = Arrays.copyOf(all, all.length - 2);

        // Act
        List<byte[]> audio = OggPageReader.readAudioPackets(new ByteArrayInputStream(truncated));

        // Assert
        assertThat(audio).hasSize(1);
        assertThat(audio.get(0)).containsExactly(1, 2, 3, 4);
    }

    @Test
    void shouldReportOffsetOfGarbageData() throws IOException {
        // Arrange
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        new OggOpusMuxer(sink, "v", 7);
        int validLength = sink.size();
        sink.write(new byte[40]);

        // Act & Assert
        assertThatThrownBy(() -> OggPageReader.readPages(new ByteArrayInputStream(sink.toByteArray())))
                .isInstanceOf(ContainerFormatException.class)
                .satisfies(e -> assertThat(((ContainerFormatException) e).getOffset()).isEqualTo(validLength));
    }

    @Test
    void shouldReturnNoPacketsForEmptyInput() throws IOException {
        assertThat(OggPageReader.readAudioPackets(new ByteArrayInputStream(new byte[0]))).isEmpty();
    }
}
