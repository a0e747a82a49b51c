package app.lingvo.core.study.controller;

import app.lingvo.core.security.CurrentUserProvider;
import app.lingvo.core.study.controller.dto.LanguageSettingsDto;
import app.lingvo.core.study.service.UserLanguageSettingsService;
import app.lingvo.core.study.service.UserLanguageSettingsService.SettingsPatch;
import app.lingvo.core.study.service.UserLanguageSettingsService.UserLanguageSettings;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/study/languages/{languageId}/settings")
public class LanguageSettingsController {

    private final CurrentUserProvider currentUserProvider;
    private final UserLanguageSettingsService settingsService;

    public LanguageSettingsController(CurrentUserProvider currentUserProvider,
                                      UserLanguageSettingsService settingsService) {
        this.currentUserProvider = currentUserProvider;
        this.settingsService = settingsService;
    }

    // GET /api/core/study/languages/{languageId}/settings
    @GetMapping
    public LanguageSettingsDto get(@AuthenticationPrincipal Jwt jwt,
                                   @PathVariable UUID languageId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return toDto(settingsService.get(userId, languageId));
    }

    // PATCH /api/core/study/languages/{languageId}/settings
    @PatchMapping
    public LanguageSettingsDto update(@AuthenticationPrincipal Jwt jwt,
                                      @PathVariable UUID languageId,
                                      @RequestBody LanguageSettingsDto req) {
        UUID userId = currentUserProvider.getUserId(jwt);
        SettingsPatch patch = new SettingsPatch(
                req.startWord(),
                req.skipMarked(),
                req.useCheckDate(),
                req.showHintMeaning(),
                req.showHintPhoneticSound(),
                req.showHintPhoneticAssociation(),
                req.showHintWriting()
        );
        return toDto(settingsService.update(userId, languageId, patch));
    }

    private static LanguageSettingsDto toDto(UserLanguageSettings s) {
        return new LanguageSettingsDto(
                s.startWord(),
                s.skipMarked(),
                s.useCheckDate(),
                s.showHintMeaning(),
                s.showHintPhoneticSound(),
                s.showHintPhoneticAssociation(),
                s.showHintWriting()
        );
    }
}
