/**
 * Bounded, cancellable queues connecting the pipeline stages.
 *
 * <p>{@link com.phillippitts.readaloud.service.buffer.WorkQueue} carries chunks from the feeder to
 * the workers, {@link com.phillippitts.readaloud.service.buffer.ReorderBuffer} restores index order
 * and {@link com.phillippitts.readaloud.service.buffer.PlaybackBuffer} feeds the controller.
 * {@link com.phillippitts.readaloud.service.buffer.BufferOccupancy} tracks the combined
 * reorder + playback occupancy that throttles the workers.
 */
package com.phillippitts.readaloud.service.buffer;
