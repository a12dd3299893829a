package com.phillippitts.sessionscribe.service.recorder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpusPacketInspectorTest {

    @Test
    void shouldReadTwentyMillisecondCeltPacket() {
        byte[] packet = {(byte) 0xFC, 0x00};

        assertThat(OpusPacketInspector.packetDurationMicros(packet)).isEqualTo(20_000);
        assertThat(OpusPacketInspector.isStandardDuration(packet)).isTrue();
    }

    @Test
    void shouldReadSilkAndHybridConfigurations() {
        // config 0: SILK NB 10 ms; config 3: SILK NB 60 ms; config 13: hybrid SWB 20 ms
        assertThat(OpusPacketInspector.frameDurationMicros((byte) (0 << 3))).isEqualTo(10_000);
        assertThat(OpusPacketInspector.frameDurationMicros((byte) (3 << 3))).isEqualTo(60_000);
        assertThat(OpusPacketInspector.frameDurationMicros((byte) (13 << 3))).isEqualTo(20_000);
        assertThat(OpusPacketInspector.frameDurationMicros((byte) (12 << 3))).isEqualTo(10_000);
    }

    @Test
    void shouldMultiplyByFrameCountCode() {
        // CELT 10 ms, code 1 (two equal frames) -> 20 ms
        byte[] twoFrames = {(byte) (0xF0 | 0x01)};
        // CELT 20 ms, code 3 with three frames -> 60 ms
        byte[] threeFrames = {(byte) (0xF8 | 0x03), 0x03};

        assertThat(OpusPacketInspector.packetDurationMicros(twoFrames)).isEqualTo(20_000);
        assertThat(OpusPacketInspector.isStandardDuration(twoFrames)).isTrue();
        assertThat(OpusPacketInspector.packetDurationMicros(threeFrames)).isEqualTo(60_000);
    }

    @Test
    void shouldReportZeroForUnreadablePackets() {
        assertThat(OpusPacketInspector.packetDurationMicros(new byte[0])).isZero();
        assertThat(OpusPacketInspector.frameCount(new byte[]{(byte) 0xFB})).isZero();
        assertThat(OpusPacketInspector.isStandardDuration(new byte[0])).isFalse();
    }
}
