package app.lingvo.core.study.controller;

import app.lingvo.core.security.CurrentUserProvider;
import app.lingvo.core.study.controller.dto.AnswerRequest;
import app.lingvo.core.study.controller.dto.HintTextRequest;
import app.lingvo.core.study.controller.dto.SessionView;
import app.lingvo.core.study.service.StudySessionService;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/study")
public class StudySessionController {

    private final CurrentUserProvider currentUserProvider;
    private final StudySessionService sessionService;

    public StudySessionController(CurrentUserProvider currentUserProvider, StudySessionService sessionService) {
        this.currentUserProvider = currentUserProvider;
        this.sessionService = sessionService;
    }

    // POST /api/core/study/languages/{languageId}/sessions
    @PostMapping("/languages/{languageId}/sessions")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionView begin(@AuthenticationPrincipal Jwt jwt,
                             @PathVariable UUID languageId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.begin(userId, languageId);
    }

    // GET /api/core/study/sessions/{sessionId}
    @GetMapping("/sessions/{sessionId}")
    public SessionView current(@AuthenticationPrincipal Jwt jwt,
                               @PathVariable UUID sessionId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.current(userId, sessionId);
    }

    // POST /api/core/study/sessions/{sessionId}/reveal
    @PostMapping("/sessions/{sessionId}/reveal")
    public SessionView reveal(@AuthenticationPrincipal Jwt jwt,
                              @PathVariable UUID sessionId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.reveal(userId, sessionId);
    }

    // POST /api/core/study/sessions/{sessionId}/answer
    @PostMapping("/sessions/{sessionId}/answer")
    public SessionView answer(@AuthenticationPrincipal Jwt jwt,
                              @PathVariable UUID sessionId,
                              @RequestBody AnswerRequest req) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.answer(userId, sessionId, req.score());
    }

    // POST /api/core/study/sessions/{sessionId}/hints/{hintType}/use
    @PostMapping("/sessions/{sessionId}/hints/{hintType}/use")
    public SessionView useHint(@AuthenticationPrincipal Jwt jwt,
                               @PathVariable UUID sessionId,
                               @PathVariable String hintType) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.useHint(userId, sessionId, hintType);
    }

    @PostMapping("/sessions/{sessionId}/hints/{hintType}/create")
    public SessionView createHint(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable UUID sessionId,
                                  @PathVariable String hintType) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.beginHintCreation(userId, sessionId, hintType);
    }

    @PostMapping("/sessions/{sessionId}/hints/{hintType}/edit")
    public SessionView editHint(@AuthenticationPrincipal Jwt jwt,
                                @PathVariable UUID sessionId,
                                @PathVariable String hintType) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.beginHintEdit(userId, sessionId, hintType);
    }

    // PUT /api/core/study/sessions/{sessionId}/hint
    @PutMapping("/sessions/{sessionId}/hint")
    public SessionView submitHint(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable UUID sessionId,
                                  @RequestBody HintTextRequest req) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.submitHint(userId, sessionId, req.text());
    }

    @DeleteMapping("/sessions/{sessionId}/hint")
    public SessionView cancelHint(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable UUID sessionId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.cancelHint(userId, sessionId);
    }

    // POST /api/core/study/sessions/{sessionId}/skip
    @PostMapping("/sessions/{sessionId}/skip")
    public SessionView toggleSkip(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable UUID sessionId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.toggleSkip(userId, sessionId);
    }

    // POST /api/core/study/sessions/{sessionId}/next
    @PostMapping("/sessions/{sessionId}/next")
    public SessionView next(@AuthenticationPrincipal Jwt jwt,
                            @PathVariable UUID sessionId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return sessionService.next(userId, sessionId);
    }

    // DELETE /api/core/study/sessions/{sessionId}
    @DeleteMapping("/sessions/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void end(@AuthenticationPrincipal Jwt jwt,
                    @PathVariable UUID sessionId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        sessionService.end(userId, sessionId);
    }
}
