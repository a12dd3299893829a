/**
 * Streaming recognition on a local Vosk model.
 */
package com.phillippitts.sessionscribe.service.stt.vosk;
