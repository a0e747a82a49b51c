package app.lingvo.core.study.controller;

import app.lingvo.core.security.CurrentUserProvider;
import app.lingvo.core.study.controller.dto.ProgressSummaryResponse;
import app.lingvo.core.study.service.ProgressSummaryService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/study/languages/{languageId}/progress")
public class ProgressController {

    private final CurrentUserProvider currentUserProvider;
    private final ProgressSummaryService summaryService;

    public ProgressController(CurrentUserProvider currentUserProvider, ProgressSummaryService summaryService) {
        this.currentUserProvider = currentUserProvider;
        this.summaryService = summaryService;
    }

    // GET /api/core/study/languages/{languageId}/progress
    @GetMapping
    public ProgressSummaryResponse summary(@AuthenticationPrincipal Jwt jwt,
                                           @PathVariable UUID languageId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return summaryService.summary(userId, languageId);
    }
}
