/**
 * Exception hierarchy for the recording pipeline.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.sessionscribe.exception.SessionScribeException}:
 * <ul>
 *   <li>{@link com.phillippitts.sessionscribe.exception.TranscriptionException} - an STT engine or
 *       stream could not be created</li>
 *   <li>{@link com.phillippitts.sessionscribe.exception.PersistenceException} - the recording store
 *       is unavailable; the triggering operation aborts</li>
 *   <li>{@link com.phillippitts.sessionscribe.exception.ContainerFormatException} - a container file
 *       is corrupt (not merely truncated)</li>
 *   <li>{@link com.phillippitts.sessionscribe.exception.HydrationException} - the offline tool cannot
 *       continue; carries the exit code</li>
 * </ul>
 *
 * <p>Transient conditions (pipe backpressure, an STT stream closed by the backend) and data-quality
 * anomalies (non-standard frame duration, burst offsets beyond decoded audio) are not modelled as
 * exceptions. They are handled in place and logged.
 */
package com.phillippitts.sessionscribe.exception;
