package app.lingvo.core.study.service;

import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.exception.StoreFailures;
import app.lingvo.core.study.repository.ProgressRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One progress record per (user, word). Absent record means the word is new to the user.
 */
@Service
public class ProgressStore {

    private final ProgressRecordRepository repository;
    private final Clock clock;

    public ProgressStore(ProgressRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<ProgressRecordEntity> get(UUID userId, UUID wordId) {
        return StoreFailures.guard("progress lookup", () -> repository.findByUserIdAndWordId(userId, wordId));
    }

    /**
     * Creates the record with defaults when absent, then merges {@code update} and stamps {@code updatedAt}.
     * The insert ignores conflicts and the merge runs under a row lock, so concurrent callers
     * for the same key end up with last-write-wins instead of a duplicate key failure.
     */
    @Transactional
    public ProgressRecordEntity upsert(UUID userId, UUID wordId, UUID languageId, ProgressUpdate update) {
        return upsert(userId, wordId, languageId, locked -> update);
    }

    /**
     * Same as {@link #upsert(UUID, UUID, UUID, ProgressUpdate)}, with the update derived from the locked record.
     * A record created by this call carries the defaults of a word never studied.
     */
    @Transactional
    public ProgressRecordEntity upsert(UUID userId,
                                       UUID wordId,
                                       UUID languageId,
                                       Function<ProgressRecordEntity, ProgressUpdate> updateFor) {
        return StoreFailures.guard("progress upsert", () -> {
            ProgressRecordEntity record = lockOrCreate(userId, wordId, languageId);
            ProgressUpdate update = updateFor.apply(record);
            if (update != null) {
                update.applyTo(record);
            }
            record.setUpdatedAt(Instant.now(clock));
            return repository.save(record);
        });
    }

    @Transactional
    public ProgressRecordEntity toggleSkip(UUID userId, UUID wordId, UUID languageId) {
        return StoreFailures.guard("skip toggle", () -> {
            ProgressRecordEntity record = lockOrCreate(userId, wordId, languageId);
            record.setSkipped(!record.isSkipped());
            record.setUpdatedAt(Instant.now(clock));
            return repository.save(record);
        });
    }

    /**
     * Words with a record due on or before {@code asOf}. Words without any record are not included.
     */
    @Transactional(readOnly = true)
    public Set<UUID> dueWordIds(UUID userId, UUID languageId, LocalDate asOf) {
        return StoreFailures.guard("due lookup", () ->
                new LinkedHashSet<>(repository.findDueWordIds(userId, languageId, asOf)));
    }

    @Transactional(readOnly = true)
    public Map<UUID, ProgressRecordEntity> findForWords(UUID userId, Collection<UUID> wordIds) {
        if (wordIds == null || wordIds.isEmpty()) {
            return Map.of();
        }
        return StoreFailures.guard("progress batch lookup", () -> repository.findByUserIdAndWordIdIn(userId, wordIds))
                .stream()
                .collect(Collectors.toMap(ProgressRecordEntity::getWordId, Function.identity(), (a, b) -> b));
    }

    private ProgressRecordEntity lockOrCreate(UUID userId, UUID wordId, UUID languageId) {
        repository.insertDefaultsIfAbsent(userId, wordId, languageId, Instant.now(clock));
        return repository.findForUpdate(userId, wordId)
                .orElseThrow(() -> new IllegalStateException(
                        "Progress record missing after insert: user=" + userId + ", word=" + wordId));
    }
}
