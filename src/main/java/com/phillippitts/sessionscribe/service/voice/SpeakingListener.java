package com.phillippitts.sessionscribe.service.voice;

/**
 * Receives voice-activity edges.
 */
public interface SpeakingListener {

    void onSpeakingStart(String speakerId);

    void onSpeakingEnd(String speakerId);
}
