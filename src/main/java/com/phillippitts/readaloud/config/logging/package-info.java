/**
 * Logging support: request correlation ids carried in the Log4j2 ThreadContext.
 */
package com.phillippitts.readaloud.config.logging;
