package com.phillippitts.sessionscribe.domain;

/**
 * STT usage accumulated for one session and engine.
 */
public record UsageRecord(String sessionId, String engine, double speechSeconds, double estimatedCostUsd) {
}
