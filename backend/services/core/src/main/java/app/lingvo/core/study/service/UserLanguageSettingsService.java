package app.lingvo.core.study.service;

import app.lingvo.core.study.api.WordCatalogPort;
import app.lingvo.core.study.domain.HintType;
import app.lingvo.core.study.entity.UserLanguageSettingsEntity;
import app.lingvo.core.study.exception.SettingsInvalidException;
import app.lingvo.core.study.exception.StoreFailures;
import app.lingvo.core.study.repository.UserLanguageSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;

@Service
public class UserLanguageSettingsService {

    private static final Logger log = LoggerFactory.getLogger(UserLanguageSettingsService.class);

    private final UserLanguageSettingsRepository repository;
    private final WordCatalogPort catalog;

    public UserLanguageSettingsService(UserLanguageSettingsRepository repository, WordCatalogPort catalog) {
        this.repository = repository;
        this.catalog = catalog;
    }

    /**
     * Stored settings, or the defaults when the user never changed anything. Never creates a row.
     */
    @Transactional(readOnly = true)
    public UserLanguageSettings get(UUID userId, UUID languageId) {
        catalog.requireLanguage(languageId);
        return StoreFailures.guard("settings lookup", () -> repository.findByUserIdAndLanguageId(userId, languageId))
                .map(UserLanguageSettingsService::toSettings)
                .orElse(UserLanguageSettings.DEFAULTS);
    }

    @Transactional
    public UserLanguageSettings update(UUID userId, UUID languageId, SettingsPatch patch) {
        catalog.requireLanguage(languageId);
        UserLanguageSettingsEntity entity = StoreFailures.guard("settings lookup",
                        () -> repository.findByUserIdAndLanguageId(userId, languageId))
                .orElseGet(() -> buildDefault(userId, languageId));

        if (patch != null) {
            patch.applyTo(entity);
        }
        UserLanguageSettings candidate = toSettings(entity);
        validate(languageId, candidate);

        UserLanguageSettingsEntity saved = StoreFailures.guard("settings save", () -> repository.save(entity));
        UserLanguageSettings result = toSettings(saved);
        log.info("Settings updated for user {} language {}: startWord={}, skipMarked={}, useCheckDate={}",
                userId, languageId, result.startWord(), result.skipMarked(), result.useCheckDate());
        return result;
    }

    /**
     * Rejects settings the selector cannot run with.
     */
    public void validate(UUID languageId, UserLanguageSettings settings) {
        if (settings.startWord() < 1) {
            throw new SettingsInvalidException("start_word must be >= 1, got " + settings.startWord());
        }
        OptionalInt max = catalog.maxWordNumber(languageId);
        if (max.isPresent() && settings.startWord() > max.getAsInt()) {
            throw new SettingsInvalidException(
                    "start_word " + settings.startWord() + " is beyond the last word number " + max.getAsInt());
        }
    }

    private static UserLanguageSettingsEntity buildDefault(UUID userId, UUID languageId) {
        UserLanguageSettings d = UserLanguageSettings.DEFAULTS;
        UserLanguageSettingsEntity entity = new UserLanguageSettingsEntity();
        entity.setUserId(userId);
        entity.setLanguageId(languageId);
        entity.setStartWord(d.startWord());
        entity.setSkipMarked(d.skipMarked());
        entity.setUseCheckDate(d.useCheckDate());
        entity.setShowHintMeaning(d.showHintMeaning());
        entity.setShowHintPhoneticSound(d.showHintPhoneticSound());
        entity.setShowHintPhoneticAssociation(d.showHintPhoneticAssociation());
        entity.setShowHintWriting(d.showHintWriting());
        return entity;
    }

    private static UserLanguageSettings toSettings(UserLanguageSettingsEntity e) {
        return new UserLanguageSettings(
                e.getStartWord(),
                e.isSkipMarked(),
                e.isUseCheckDate(),
                e.isShowHintMeaning(),
                e.isShowHintPhoneticSound(),
                e.isShowHintPhoneticAssociation(),
                e.isShowHintWriting()
        );
    }

    public record UserLanguageSettings(int startWord,
                                       boolean skipMarked,
                                       boolean useCheckDate,
                                       boolean showHintMeaning,
                                       boolean showHintPhoneticSound,
                                       boolean showHintPhoneticAssociation,
                                       boolean showHintWriting) {

        public static final UserLanguageSettings DEFAULTS =
                new UserLanguageSettings(1, false, true, true, true, true, true);

        public boolean isVisible(HintType type) {
            return switch (type) {
                case MEANING -> showHintMeaning;
                case PHONETIC_SOUND -> showHintPhoneticSound;
                case PHONETIC_ASSOCIATION -> showHintPhoneticAssociation;
                case WRITING -> showHintWriting;
            };
        }

        public Set<HintType> visibleHintTypes() {
            EnumSet<HintType> visible = EnumSet.noneOf(HintType.class);
            for (HintType type : HintType.values()) {
                if (isVisible(type)) {
                    visible.add(type);
                }
            }
            return visible;
        }
    }

    /**
     * Partial update; {@code null} fields are left unchanged.
     */
    public record SettingsPatch(Integer startWord,
                                Boolean skipMarked,
                                Boolean useCheckDate,
                                Boolean showHintMeaning,
                                Boolean showHintPhoneticSound,
                                Boolean showHintPhoneticAssociation,
                                Boolean showHintWriting) {

        void applyTo(UserLanguageSettingsEntity e) {
            if (startWord != null) e.setStartWord(startWord);
            if (skipMarked != null) e.setSkipMarked(skipMarked);
            if (useCheckDate != null) e.setUseCheckDate(useCheckDate);
            if (showHintMeaning != null) e.setShowHintMeaning(showHintMeaning);
            if (showHintPhoneticSound != null) e.setShowHintPhoneticSound(showHintPhoneticSound);
            if (showHintPhoneticAssociation != null) e.setShowHintPhoneticAssociation(showHintPhoneticAssociation);
            if (showHintWriting != null) e.setShowHintWriting(showHintWriting);
        }
    }
}
