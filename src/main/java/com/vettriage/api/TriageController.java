package com.vettriage.api;

import com.vettriage.session.OpeningPrompt;
import com.vettriage.session.SessionController;
import com.vettriage.session.SessionSnapshot;
import com.vettriage.session.TurnResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface for triage conversations.
 *
 * POST /v1/triage/sessions/{sessionId}/answers   submit one answer
 * POST /v1/triage/sessions/{sessionId}/clear     reset the session
 * GET  /v1/triage/sessions/{sessionId}           inspect session state
 */
@RestController
@RequestMapping("/v1/triage/sessions")
public class TriageController {

    private final SessionController sessionController;

    public TriageController(SessionController sessionController) {
        this.sessionController = sessionController;
    }

    @PostMapping("/{sessionId}/answers")
    public ResponseEntity<TurnResult> submitAnswer(@PathVariable String sessionId,
                                                   @RequestBody AnswerRequest request) {
        TurnResult result = sessionController.submitAnswer(sessionId, request.userAnswer());
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    @PostMapping("/{sessionId}/clear")
    public OpeningPrompt clear(@PathVariable String sessionId) {
        return sessionController.clearSession(sessionId);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSnapshot> getSession(@PathVariable String sessionId) {
        return sessionController.snapshot(sessionId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    private HttpStatus statusOf(TurnResult result) {
        if (result instanceof TurnResult.Error error) {
            return error.errorCode() == TurnResult.ErrorCode.INVALID_INPUT
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.OK;
    }
}
