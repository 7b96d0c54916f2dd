/**
 * Translation of domain exceptions into HTTP error responses.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>{@code SessionNotFoundException} - 404</li>
 *   <li>{@code InvalidStateTransitionException} - 409, e.g. resuming a stopped session</li>
 *   <li>{@code FetchException}, bean validation failures, malformed bodies - 400</li>
 *   <li>any other {@code ReadAloudException} - 503</li>
 *   <li>everything else - 500</li>
 * </ul>
 */
package com.phillippitts.readaloud.presentation.exception;
