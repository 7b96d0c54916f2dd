/**
 * Exception hierarchy rooted at {@link com.phillippitts.readaloud.exception.ReadAloudException}.
 *
 * <p>Per-chunk failures ({@link com.phillippitts.readaloud.exception.SynthesisException}) are
 * isolated by the pipeline; source and device failures may end a session.
 */
package com.phillippitts.readaloud.exception;
