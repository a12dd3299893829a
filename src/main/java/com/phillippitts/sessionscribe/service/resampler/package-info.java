/**
 * Per-speaker ffmpeg subprocesses that turn the 48 kHz stereo Opus feed into 16 kHz mono PCM for
 * speech recognition.
 *
 * <p>{@link com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry} owns every process and
 * guards spawning with a {@link com.phillippitts.sessionscribe.service.resampler.SpawnCircuitBreaker},
 * so a broken binary or missing permission cannot cause a spawn storm. Processes are killed on speaker
 * leave, session stop, explicit respawn, or by their own idle watchdog.
 */
package com.phillippitts.sessionscribe.service.resampler;
