package com.webdoc.dispatch.api;

import com.webdoc.core.engine.SessionController;
import com.webdoc.core.model.CommandResult;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for the pipeline session lifecycle.
 */
@RestController
@RequestMapping("/api/v1/session")
public class SessionApiController {

    private static final Logger log = LoggerFactory.getLogger(SessionApiController.class);

    private final SessionController sessionController;
    private final SseStreamingService sseStreamingService;

    public SessionApiController(SessionController sessionController, SseStreamingService sseStreamingService) {
        this.sessionController = sessionController;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/session: Start a new session. The idea stage runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> start(@RequestBody PipelineConfig config) {
        CommandResult result = sessionController.start(config);
        if (result.accepted()) {
            log.info("Accepted session {} for pipeline '{}'", result.sessionId(), config.name());
        }
        return toResponse(result, HttpStatus.ACCEPTED);
    }

    /**
     * GET /api/v1/session: Current session snapshot, or {@code {"stage":"idle"}}.
     */
    @GetMapping
    public ResponseEntity<SessionSnapshot> status() {
        return ResponseEntity.ok(sessionController.snapshot());
    }

    /**
     * POST /api/v1/session/selection: Choose topics and start document generation.
     */
    @PostMapping("/selection")
    public ResponseEntity<Map<String, Object>> select(@RequestBody SelectionRequest request) {
        return toResponse(sessionController.selectAndGenerate(request.selected()), HttpStatus.ACCEPTED);
    }

    /**
     * POST /api/v1/session/cancel: Cancel the running session.
     */
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        return toResponse(sessionController.cancel(), HttpStatus.OK);
    }

    /**
     * GET /api/v1/session/events: SSE stream, first frame {@code snapshot}.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return sseStreamingService.createEmitter();
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException e) {
        String detail = e.getMostSpecificCause().getMessage();
        log.info("Rejected unreadable request body: {}", detail);
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body: " + detail));
    }

    private static ResponseEntity<Map<String, Object>> toResponse(CommandResult result, HttpStatus acceptedStatus) {
        if (!result.accepted()) {
            HttpStatus status = result.isConflict() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
            return ResponseEntity.status(status).body(Map.of("error", result.reason()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", result.sessionId());
        body.put("stage", result.stage().wireName());
        return ResponseEntity.status(acceptedStatus).body(body);
    }
}
