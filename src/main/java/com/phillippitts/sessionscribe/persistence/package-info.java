/**
 * Persistence boundary of the recorder.
 *
 * <p>{@link com.phillippitts.sessionscribe.persistence.RecordingStore} is the only way the pipeline
 * reads or writes durable state. The journal-backed implementation keeps one JSON object per line;
 * entries are never rewritten, and the current state is the replay of the whole file.
 */
package com.phillippitts.sessionscribe.persistence;
