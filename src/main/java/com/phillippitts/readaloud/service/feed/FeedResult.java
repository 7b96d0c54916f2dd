package com.phillippitts.readaloud.service.feed;

/**
 * Outcome of a completed feed.
 *
 * @param chunksEmitted chunks handed to the sink
 * @param capped        whether the source was cut at the configured character cap
 */
public record FeedResult(int chunksEmitted, boolean capped) {}
