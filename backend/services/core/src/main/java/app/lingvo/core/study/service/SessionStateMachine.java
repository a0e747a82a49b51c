package app.lingvo.core.study.service;

import app.lingvo.core.study.domain.HintType;
import app.lingvo.core.study.domain.Score;
import app.lingvo.core.study.domain.StudyPhase;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.entity.StudySessionEntity;
import app.lingvo.core.study.exception.InvalidSessionStateException;
import app.lingvo.core.study.service.UserLanguageSettingsService.UserLanguageSettings;
import app.lingvo.core.study.service.WordSelector.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Drives one study session: show word, collect answer or hint use, advance.
 * <p>
 * Every phase change goes through {@link #transition}; a change that {@link StudyPhase}
 * does not allow fails with {@link InvalidSessionStateException} and leaves the session untouched.
 * The session is handed in by the caller, which owns loading and saving it.
 */
@Component
public class SessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    private final WordSelector selector;
    private final ScoreUpdater scoreUpdater;
    private final ProgressStore progressStore;
    private final UserLanguageSettingsService settingsService;
    private final Clock clock;

    public SessionStateMachine(WordSelector selector,
                               ScoreUpdater scoreUpdater,
                               ProgressStore progressStore,
                               UserLanguageSettingsService settingsService,
                               Clock clock) {
        this.selector = selector;
        this.scoreUpdater = scoreUpdater;
        this.progressStore = progressStore;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    public StudySessionEntity start(UUID userId, UUID languageId) {
        UserLanguageSettings settings = settingsService.get(userId, languageId);
        settingsService.validate(languageId, settings);

        StudySessionEntity session = new StudySessionEntity();
        session.setSessionId(UUID.randomUUID());
        session.setUserId(userId);
        session.setLanguageId(languageId);
        session.setPhase(StudyPhase.STUDYING);
        session.setUsedHints(EnumSet.noneOf(HintType.class));
        session.setWordsSeen(0);
        session.setCreatedAt(Instant.now(clock));

        moveToNextCandidate(session, settings, null);
        return session;
    }

    public void reveal(StudySessionEntity session) {
        requireBrowsing(session, "reveal the word");
        requireCurrentWord(session);
        transition(session, StudyPhase.VIEWING_WORD_DETAILS);
        session.setWordShown(true);
    }

    /**
     * Scores the current word and moves on. Any hint used on the word turns the answer into "don't know".
     */
    public ProgressRecordEntity answer(StudySessionEntity session, Score score) {
        if (session.getPhase() != StudyPhase.VIEWING_WORD_DETAILS) {
            throw new InvalidSessionStateException("Answer requires the word to be revealed first, phase is " + session.getPhase());
        }
        UUID wordId = requireCurrentWord(session);
        boolean hintUsed = !session.getUsedHints().isEmpty();

        ProgressRecordEntity saved = scoreUpdater.apply(
                session.getUserId(), wordId, session.getLanguageId(), score, hintUsed);
        advance(session);
        return saved;
    }

    /**
     * Marks the hint as used for the current word and returns its text, if the user wrote one.
     */
    public Optional<String> useHint(StudySessionEntity session, HintType type) {
        requireBrowsing(session, "use a hint");
        UUID wordId = requireCurrentWord(session);
        requireVisible(session, type);

        Set<HintType> used = session.getUsedHints();
        used.add(type);
        session.setUsedHints(used);

        return progressStore.get(session.getUserId(), wordId)
                .map(record -> record.getHint(type));
    }

    public void beginHintCreation(StudySessionEntity session, HintType type) {
        enterHintEntry(session, type, StudyPhase.CREATING_HINT);
    }

    public void beginHintEdit(StudySessionEntity session, HintType type) {
        UUID wordId = requireCurrentWord(session);
        boolean hasText = progressStore.get(session.getUserId(), wordId)
                .map(record -> record.getHint(type))
                .filter(text -> !text.isBlank())
                .isPresent();
        if (!hasText) {
            throw new InvalidSessionStateException("No " + type.code() + " hint to edit for the current word");
        }
        enterHintEntry(session, type, StudyPhase.EDITING_HINT);
    }

    /**
     * Stores the hint text being entered, counts the hint as used and returns to the phase the entry started from.
     */
    public ProgressRecordEntity submitHint(StudySessionEntity session, String text) {
        if (!session.getPhase().isHintEntry()) {
            throw new InvalidSessionStateException("No hint is being entered, phase is " + session.getPhase());
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Hint text must not be blank");
        }
        UUID wordId = requireCurrentWord(session);
        HintType type = session.getPendingHintType();

        ProgressRecordEntity saved = progressStore.upsert(
                session.getUserId(), wordId, session.getLanguageId(), ProgressUpdate.hint(type, text.strip()));

        Set<HintType> used = session.getUsedHints();
        used.add(type);
        session.setUsedHints(used);
        leaveHintEntry(session);
        return saved;
    }

    public void cancelHint(StudySessionEntity session) {
        if (!session.getPhase().isHintEntry()) {
            throw new InvalidSessionStateException("No hint is being entered, phase is " + session.getPhase());
        }
        leaveHintEntry(session);
    }

    /**
     * Flips the skip mark of the current word. The phase does not change.
     */
    public ProgressRecordEntity toggleSkip(StudySessionEntity session) {
        UUID wordId = requireCurrentWord(session);
        return scoreUpdater.toggleSkip(session.getUserId(), wordId, session.getLanguageId());
    }

    /**
     * Moves to the next word without scoring the current one.
     */
    public void next(StudySessionEntity session) {
        requireBrowsing(session, "move to the next word");
        requireCurrentWord(session);
        advance(session);
    }

    private void advance(StudySessionEntity session) {
        UserLanguageSettings settings = settingsService.get(session.getUserId(), session.getLanguageId());
        moveToNextCandidate(session, settings, session.getCurrentWordNumber());
    }

    private void moveToNextCandidate(StudySessionEntity session, UserLanguageSettings settings, Integer afterWordNumber) {
        Iterator<Candidate> candidates = selector.nextCandidates(
                session.getUserId(), session.getLanguageId(), settings, afterWordNumber);

        if (candidates.hasNext()) {
            Candidate next = candidates.next();
            transition(session, StudyPhase.STUDYING);
            session.setCurrentWordId(next.word().id());
            session.setCurrentWordNumber(next.word().wordNumber());
            session.setWordsSeen(session.getWordsSeen() + 1);
        } else {
            transition(session, StudyPhase.COMPLETED);
            session.setCurrentWordId(null);
            log.info("Study session {} completed for user {} after {} words",
                    session.getSessionId(), session.getUserId(), session.getWordsSeen());
        }
        session.setWordShown(false);
        session.setUsedHints(EnumSet.noneOf(HintType.class));
        session.setPendingHintType(null);
        session.setReturnPhase(null);
    }

    private void enterHintEntry(StudySessionEntity session, HintType type, StudyPhase entryPhase) {
        requireCurrentWord(session);
        requireVisible(session, type);
        StudyPhase from = session.getPhase();
        transition(session, entryPhase);
        session.setReturnPhase(from);
        session.setPendingHintType(type);
    }

    private void leaveHintEntry(StudySessionEntity session) {
        StudyPhase back = session.getReturnPhase() == null ? StudyPhase.STUDYING : session.getReturnPhase();
        transition(session, back);
        session.setReturnPhase(null);
        session.setPendingHintType(null);
    }

    private void requireVisible(StudySessionEntity session, HintType type) {
        UserLanguageSettings settings = settingsService.get(session.getUserId(), session.getLanguageId());
        if (!settings.isVisible(type)) {
            throw new InvalidSessionStateException("Hint " + type.code() + " is hidden in the user's settings");
        }
    }

    private static void requireBrowsing(StudySessionEntity session, String action) {
        StudyPhase phase = session.getPhase();
        if (phase != StudyPhase.STUDYING && phase != StudyPhase.VIEWING_WORD_DETAILS) {
            throw new InvalidSessionStateException("Cannot " + action + " in phase " + phase);
        }
    }

    private static UUID requireCurrentWord(StudySessionEntity session) {
        if (session.getCurrentWordId() == null) {
            throw new InvalidSessionStateException("Session " + session.getSessionId() + " has no current word");
        }
        return session.getCurrentWordId();
    }

    static void transition(StudySessionEntity session, StudyPhase target) {
        StudyPhase current = session.getPhase();
        if (current == null || !current.canTransitionTo(target)) {
            throw new InvalidSessionStateException("Transition " + current + " -> " + target + " is not allowed");
        }
        session.setPhase(target);
    }
}
