/**
 * Voice-activity gating of STT streams: per-speaker {@link com.phillippitts.sessionscribe.service.gate.VadGate}
 * and the per-session {@link com.phillippitts.sessionscribe.service.gate.SttOrchestrator}.
 */
package com.phillippitts.sessionscribe.service.gate;
