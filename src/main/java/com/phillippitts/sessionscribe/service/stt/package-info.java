/**
 * Streaming speech-to-text contracts and the reference-counted engine registry.
 *
 * <p>Engines are long-lived and shared; streams are short-lived and owned by a single
 * {@link com.phillippitts.sessionscribe.service.gate.VadGate}.
 */
package com.phillippitts.sessionscribe.service.stt;
