/**
 * Offline reconstruction of time-aligned audio from speech-only tracks and their bursts.
 */
package com.phillippitts.sessionscribe.service.hydration;
