package com.phillippitts.readaloud.presentation.controller;

import com.phillippitts.readaloud.config.pipeline.PipelineSettings;
import com.phillippitts.readaloud.config.properties.FeederProperties;
import com.phillippitts.readaloud.domain.VoiceParams;
import com.phillippitts.readaloud.exception.FetchException;
import com.phillippitts.readaloud.presentation.dto.CommandResponse;
import com.phillippitts.readaloud.presentation.dto.SessionResponse;
import com.phillippitts.readaloud.presentation.dto.StartSessionRequest;
import com.phillippitts.readaloud.service.feed.ContentSource;
import com.phillippitts.readaloud.service.feed.ReaderContentSource;
import com.phillippitts.readaloud.service.feed.StringContentSource;
import com.phillippitts.readaloud.service.orchestration.PipelineOrchestrator;
import com.phillippitts.readaloud.service.orchestration.StreamingSession;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Local control surface for read-aloud sessions.
 *
 * <p>Thin adapter over {@link PipelineOrchestrator}: builds the content source and per-session
 * settings from the request, then hands off. Error mapping lives in the global exception handler.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final PipelineOrchestrator orchestrator;
    private final SynthesisEngine engine;
    private final PipelineSettings defaults;
    private final int readBufferChars;

    SessionController(PipelineOrchestrator orchestrator,
                      SynthesisEngine engine,
                      PipelineSettings defaults,
                      FeederProperties feederProperties) {
        this.orchestrator = Objects.requireNonNull(orchestrator);
        this.engine = Objects.requireNonNull(engine);
        this.defaults = Objects.requireNonNull(defaults);
        this.readBufferChars = feederProperties.readBufferChars();
    }

    @PostMapping
    ResponseEntity<SessionResponse> start(@Valid @RequestBody StartSessionRequest request) {
        ContentSource source = openSource(request);
        StreamingSession session = orchestrator.start(source, engine, settingsFor(request));
        LOG.info("Session {} started over REST for source {}", session.id(), session.sourceId());
        return ResponseEntity
                .created(URI.create("/api/sessions/" + session.id()))
                .body(SessionResponse.from(session));
    }

    @GetMapping
    List<SessionResponse> list() {
        return orchestrator.activeSessions().stream()
                .map(SessionResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    SessionResponse get(@PathVariable String id) {
        return SessionResponse.from(orchestrator.get(id));
    }

    @PostMapping("/{id}/pause")
    CommandResponse pause(@PathVariable String id) {
        StreamingSession session = orchestrator.get(id);
        session.pause();
        return new CommandResponse(id, "pause", true, session.state());
    }

    @PostMapping("/{id}/resume")
    CommandResponse resume(@PathVariable String id) {
        StreamingSession session = orchestrator.get(id);
        session.resume();
        return new CommandResponse(id, "resume", true, session.state());
    }

    @PostMapping("/{id}/skip")
    CommandResponse skip(@PathVariable String id) {
        StreamingSession session = orchestrator.get(id);
        boolean skipped = session.skip();
        return new CommandResponse(id, "skip", skipped, session.state());
    }

    @PostMapping("/{id}/stop")
    CommandResponse stop(@PathVariable String id) {
        StreamingSession session = orchestrator.get(id);
        session.stop();
        return new CommandResponse(id, "stop", true, session.state());
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> cancel(@PathVariable String id) {
        orchestrator.cancel(id);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }

    private ContentSource openSource(StartSessionRequest request) {
        if (request.hasText()) {
            return new StringContentSource(request.sourceId(), request.text());
        }
        try {
            return ReaderContentSource.ofFile(request.sourceId(), Path.of(request.path()), readBufferChars);
        } catch (IOException e) {
            throw new FetchException("Cannot open " + request.path(), request.sourceId(), e);
        }
    }

    private PipelineSettings settingsFor(StartSessionRequest request) {
        if (request.voice() == null && request.language() == null) {
            return defaults;
        }
        VoiceParams base = defaults.voice();
        String language = request.language() != null ? request.language() : base.language();
        String voice = request.voice() != null ? request.voice()
                : (request.language() != null ? null : base.voice());
        return defaults.toBuilder()
                .voice(new VoiceParams(voice, language))
                .build();
    }
}
