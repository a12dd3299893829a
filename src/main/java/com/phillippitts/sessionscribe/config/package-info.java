/**
 * Application-wide configuration beans.
 *
 * <ul>
 *   <li>{@link com.phillippitts.sessionscribe.config.ThreadPoolConfig} - session timer scheduler
 *       and event listener pool, both propagating the logging context</li>
 *   <li>{@link com.phillippitts.sessionscribe.config.RecordingConfig} - journal store, resampler
 *       registry and the shared STT engine cache</li>
 * </ul>
 *
 * <p>Externalized settings are bound from {@code application.properties} by the classes in {@code config.properties}.
 */
package com.phillippitts.sessionscribe.config;
