package app.lingvo.core.study.service;

import app.lingvo.core.study.algorithm.ReviewScheduler;
import app.lingvo.core.study.algorithm.ReviewScheduler.ReviewComputation;
import app.lingvo.core.study.algorithm.ReviewScheduler.ReviewInput;
import app.lingvo.core.study.domain.Score;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Applies a user's judgement of a word to its progress record.
 * Store failures propagate unchanged; nothing is retried.
 */
@Service
public class ScoreUpdater {

    private static final Logger log = LoggerFactory.getLogger(ScoreUpdater.class);

    private final ProgressStore progressStore;
    private final ReviewScheduler scheduler;
    private final Clock clock;

    public ScoreUpdater(ProgressStore progressStore, ReviewScheduler scheduler, Clock clock) {
        this.progressStore = progressStore;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Transactional
    public ProgressRecordEntity apply(UUID userId, UUID wordId, UUID languageId, Score score, boolean hintUsed) {
        if (score == null) {
            throw new IllegalArgumentException("Score is required");
        }
        LocalDate today = LocalDate.now(clock);
        return progressStore.upsert(userId, wordId, languageId, locked -> {
            ReviewInput previous = ReviewInput.from(locked);
            ReviewComputation next = scheduler.advance(previous, score, hintUsed, today);
            log.debug("Scored word {} for user {}: submitted={}, hintUsed={}, stored={}, interval={} -> {}, next={}",
                    wordId, userId, score, hintUsed, next.score(), previous.checkInterval(),
                    next.checkInterval(), next.nextCheckDate());
            return ProgressUpdate.scheduled(next);
        });
    }

    /**
     * Flips the skip flag. Score and schedule are left as stored.
     */
    @Transactional
    public ProgressRecordEntity toggleSkip(UUID userId, UUID wordId, UUID languageId) {
        ProgressRecordEntity saved = progressStore.toggleSkip(userId, wordId, languageId);
        log.debug("Word {} for user {} skipped={}", wordId, userId, saved.isSkipped());
        return saved;
    }
}
