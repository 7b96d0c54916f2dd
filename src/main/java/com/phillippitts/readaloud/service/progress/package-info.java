/**
 * Progress reporting: per-session counters, rate-limited snapshot publication and the
 * notification sink contract ({@link com.phillippitts.readaloud.service.progress.ProgressListener}).
 */
package com.phillippitts.readaloud.service.progress;
