/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP boundary of the application. Presentation depends on the
 * service layer, never the other way round.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers</li>
 *   <li>{@code presentation.dto} - request and response bodies</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; pipeline logic lives in
 * {@link com.phillippitts.readaloud.service.orchestration}.
 *
 * @see com.phillippitts.readaloud.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.readaloud.presentation;
