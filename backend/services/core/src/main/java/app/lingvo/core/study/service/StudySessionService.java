package app.lingvo.core.study.service;

import app.lingvo.core.study.api.WordCatalogPort;
import app.lingvo.core.study.api.WordCatalogPort.CatalogWord;
import app.lingvo.core.study.controller.dto.SessionView;
import app.lingvo.core.study.controller.dto.StudyWordView;
import app.lingvo.core.study.domain.HintType;
import app.lingvo.core.study.domain.Score;
import app.lingvo.core.study.domain.StudyPhase;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.entity.StudySessionEntity;
import app.lingvo.core.study.exception.NotFoundException;
import app.lingvo.core.study.exception.StoreFailures;
import app.lingvo.core.study.repository.StudySessionRepository;
import app.lingvo.core.study.service.UserLanguageSettingsService.UserLanguageSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Entry point for callers: loads the session of the calling user, runs one state machine step and saves it.
 * Session rows are locked for the duration of a step, so repeated taps are applied one after another.
 */
@Service
public class StudySessionService {

    private static final Logger log = LoggerFactory.getLogger(StudySessionService.class);

    private final StudySessionRepository sessionRepository;
    private final SessionStateMachine stateMachine;
    private final ProgressStore progressStore;
    private final WordCatalogPort catalog;
    private final UserLanguageSettingsService settingsService;

    public StudySessionService(StudySessionRepository sessionRepository,
                               SessionStateMachine stateMachine,
                               ProgressStore progressStore,
                               WordCatalogPort catalog,
                               UserLanguageSettingsService settingsService) {
        this.sessionRepository = sessionRepository;
        this.stateMachine = stateMachine;
        this.progressStore = progressStore;
        this.catalog = catalog;
        this.settingsService = settingsService;
    }

    /**
     * Starts a new session; a previous session of the same user, in any language, is discarded.
     */
    @Transactional
    public SessionView begin(UUID userId, UUID languageId) {
        catalog.requireLanguage(languageId);
        StoreFailures.guard("session cleanup", () -> sessionRepository.deleteByUserId(userId));

        StudySessionEntity session = stateMachine.start(userId, languageId);
        StudySessionEntity saved = StoreFailures.guard("session save", () -> sessionRepository.save(session));
        log.info("Study session {} started for user {} in language {} at word {}",
                saved.getSessionId(), userId, languageId, saved.getCurrentWordNumber());
        return toView(saved);
    }

    @Transactional(readOnly = true)
    public SessionView current(UUID userId, UUID sessionId) {
        StudySessionEntity session = StoreFailures.guard("session lookup", () -> sessionRepository.findById(sessionId))
                .filter(s -> s.getUserId().equals(userId))
                .orElseThrow(() -> NotFoundException.session(sessionId));
        return toView(session);
    }

    @Transactional
    public SessionView reveal(UUID userId, UUID sessionId) {
        return step(userId, sessionId, stateMachine::reveal);
    }

    @Transactional
    public SessionView answer(UUID userId, UUID sessionId, Integer scoreCode) {
        if (scoreCode == null) {
            throw new IllegalArgumentException("Score is required");
        }
        Score score = Score.fromCode(scoreCode);
        return step(userId, sessionId, session -> stateMachine.answer(session, score));
    }

    @Transactional
    public SessionView useHint(UUID userId, UUID sessionId, String hintType) {
        HintType type = HintType.fromString(hintType);
        return step(userId, sessionId, session -> stateMachine.useHint(session, type));
    }

    @Transactional
    public SessionView beginHintCreation(UUID userId, UUID sessionId, String hintType) {
        HintType type = HintType.fromString(hintType);
        return step(userId, sessionId, session -> stateMachine.beginHintCreation(session, type));
    }

    @Transactional
    public SessionView beginHintEdit(UUID userId, UUID sessionId, String hintType) {
        HintType type = HintType.fromString(hintType);
        return step(userId, sessionId, session -> stateMachine.beginHintEdit(session, type));
    }

    @Transactional
    public SessionView submitHint(UUID userId, UUID sessionId, String text) {
        return step(userId, sessionId, session -> stateMachine.submitHint(session, text));
    }

    @Transactional
    public SessionView cancelHint(UUID userId, UUID sessionId) {
        return step(userId, sessionId, stateMachine::cancelHint);
    }

    @Transactional
    public SessionView toggleSkip(UUID userId, UUID sessionId) {
        return step(userId, sessionId, stateMachine::toggleSkip);
    }

    @Transactional
    public SessionView next(UUID userId, UUID sessionId) {
        return step(userId, sessionId, stateMachine::next);
    }

    @Transactional
    public void end(UUID userId, UUID sessionId) {
        StudySessionEntity session = loadForUpdate(userId, sessionId);
        StoreFailures.guard("session delete", () -> sessionRepository.delete(session));
        log.info("Study session {} ended by user {} after {} words", sessionId, userId, session.getWordsSeen());
    }

    private SessionView step(UUID userId, UUID sessionId, Consumer<StudySessionEntity> action) {
        StudySessionEntity session = loadForUpdate(userId, sessionId);
        action.accept(session);
        StudySessionEntity saved = StoreFailures.guard("session save", () -> sessionRepository.save(session));
        return toView(saved);
    }

    private StudySessionEntity loadForUpdate(UUID userId, UUID sessionId) {
        return StoreFailures.guard("session lookup", () -> sessionRepository.findByIdForUpdate(sessionId))
                .filter(s -> s.getUserId().equals(userId))
                .orElseThrow(() -> NotFoundException.session(sessionId));
    }

    private SessionView toView(StudySessionEntity session) {
        UserLanguageSettings settings = settingsService.get(session.getUserId(), session.getLanguageId());
        Set<HintType> used = session.getUsedHints();
        return new SessionView(
                session.getSessionId(),
                session.getLanguageId(),
                session.getPhase(),
                session.getPhase() == StudyPhase.COMPLETED,
                session.isWordShown(),
                used,
                settings.visibleHintTypes(),
                session.getPendingHintType(),
                session.getWordsSeen(),
                toWordView(session, used)
        );
    }

    private StudyWordView toWordView(StudySessionEntity session, Set<HintType> used) {
        UUID wordId = session.getCurrentWordId();
        if (wordId == null) {
            return null;
        }
        CatalogWord word = catalog.findWord(wordId).orElseThrow(() -> NotFoundException.word(wordId));
        Optional<ProgressRecordEntity> progress = progressStore.get(session.getUserId(), wordId);

        Map<HintType, String> hints = new EnumMap<>(HintType.class);
        progress.ifPresent(record -> used.forEach(type -> {
            String text = record.getHint(type);
            if (text != null) {
                hints.put(type, text);
            }
        }));

        boolean shown = session.isWordShown();
        return new StudyWordView(
                word.id(),
                word.wordNumber(),
                word.translation(),
                word.soundFilePath(),
                shown ? word.wordForeign() : null,
                shown ? word.transcription() : null,
                progress.map(r -> new StudyWordView.Progress(
                        r.getScore(), r.isSkipped(), r.getCheckInterval(), r.getNextCheckDate())).orElse(null),
                hints
        );
    }
}
