/**
 * Immutable records describing what the recorder persists.
 *
 * <p>Sessions own tracks, tracks own bursts. Frame offsets in a {@link
 * com.phillippitts.sessionscribe.domain.Burst} refer to the owning {@link
 * com.phillippitts.sessionscribe.domain.Track}'s frame counter, one unit per 20 ms Opus packet.
 * These offsets and the track's first-packet time are what the offline hydration tool uses to
 * rebuild continuous audio.
 */
package com.phillippitts.sessionscribe.domain;
