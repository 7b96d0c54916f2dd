/**
 * Immutable domain model of a streaming session: chunks, audio artifacts, the playback state
 * machine and progress snapshots.
 */
package com.phillippitts.readaloud.domain;
