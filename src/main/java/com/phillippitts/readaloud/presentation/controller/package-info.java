/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.readaloud.presentation.controller.SessionController}
 *       - {@code /api/sessions}: start, list, inspect and command read-aloud sessions</li>
 *   <li>{@link com.phillippitts.readaloud.presentation.controller.PingController}
 *       - {@code GET /ping} for verifying server status and MDC logging</li>
 * </ul>
 *
 * <p>The server binds to the loopback interface by default; these endpoints control local
 * audio output and are not meant to be exposed.
 */
package com.phillippitts.readaloud.presentation.controller;
