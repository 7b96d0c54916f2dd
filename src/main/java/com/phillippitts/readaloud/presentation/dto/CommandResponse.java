package com.phillippitts.readaloud.presentation.dto;

import com.phillippitts.readaloud.domain.PlaybackState;

/**
 * Result of a session command.
 *
 * @param id       session id
 * @param command  command name
 * @param applied  {@code false} when the command had nothing to act on, such as a skip with no
 *                 artifact loaded
 * @param state    session state after the command
 */
public record CommandResponse(String id, String command, boolean applied, PlaybackState state) {}
