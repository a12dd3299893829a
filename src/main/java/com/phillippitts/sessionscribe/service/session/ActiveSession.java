package com.phillippitts.sessionscribe.service.session;

import com.phillippitts.sessionscribe.service.burst.BurstTracker;
import com.phillippitts.sessionscribe.service.gate.SttOrchestrator;
import com.phillippitts.sessionscribe.service.recorder.TrackRecorder;
import com.phillippitts.sessionscribe.service.transcript.TranscriptWriter;
import com.phillippitts.sessionscribe.service.usage.UsageTracker;
import com.phillippitts.sessionscribe.service.voice.VoiceTransport;

/**
 * Per-session components owned by {@link SessionManager}. The STT members are {@code null} when
 * transcription is disabled or its engine could not be loaded.
 */
final class ActiveSession {

    final String sessionId;
    final String guildId;
    final VoiceTransport transport;
    final TrackRecorder recorder;
    final BurstTracker bursts;
    final SttOrchestrator orchestrator;
    final UsageTracker usage;
    final TranscriptWriter transcripts;

    ActiveSession(String sessionId,
                  String guildId,
                  VoiceTransport transport,
                  TrackRecorder recorder,
                  BurstTracker bursts,
                  SttOrchestrator orchestrator,
                  UsageTracker usage,
                  TranscriptWriter transcripts) {
        this.sessionId = sessionId;
        this.guildId = guildId;
        this.transport = transport;
        this.recorder = recorder;
        this.bursts = bursts;
        this.orchestrator = orchestrator;
        this.usage = usage;
        this.transcripts = transcripts;
    }

    boolean transcribing() {
        return orchestrator != null;
    }
}
