package app.lingvo.core.study.repository;

import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.entity.ProgressRecordId;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProgressRecordRepository extends JpaRepository<ProgressRecordEntity, ProgressRecordId> {

    Optional<ProgressRecordEntity> findByUserIdAndWordId(UUID userId, UUID wordId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from ProgressRecordEntity p where p.userId = :userId and p.wordId = :wordId")
    Optional<ProgressRecordEntity> findForUpdate(@Param("userId") UUID userId,
                                                 @Param("wordId") UUID wordId);

    @Modifying
    @Query(value = """
            insert into app_core.user_word_progress (
                user_id,
                word_id,
                language_id,
                score,
                is_skipped,
                check_interval,
                next_check_date,
                created_at,
                updated_at,
                row_version
            ) values (
                :userId,
                :wordId,
                :languageId,
                0,
                false,
                0,
                null,
                :now,
                :now,
                0
            )
            on conflict (user_id, word_id) do nothing
            """, nativeQuery = true)
    int insertDefaultsIfAbsent(@Param("userId") UUID userId,
                               @Param("wordId") UUID wordId,
                               @Param("languageId") UUID languageId,
                               @Param("now") Instant now);

    List<ProgressRecordEntity> findByUserIdAndWordIdIn(UUID userId, Collection<UUID> wordIds);

    @Query("""
        select p.wordId
        from ProgressRecordEntity p
        where p.userId = :userId
          and p.languageId = :languageId
          and p.nextCheckDate <= :asOf
        """)
    List<UUID> findDueWordIds(@Param("userId") UUID userId,
                              @Param("languageId") UUID languageId,
                              @Param("asOf") LocalDate asOf);

    long countByUserIdAndLanguageId(UUID userId, UUID languageId);

    long countByUserIdAndLanguageIdAndScore(UUID userId, UUID languageId, int score);

    long countByUserIdAndLanguageIdAndSkippedTrue(UUID userId, UUID languageId);

    long countByUserIdAndLanguageIdAndNextCheckDateLessThanEqual(UUID userId, UUID languageId, LocalDate asOf);

    long countByUserIdAndLanguageIdAndSkippedFalseAndNextCheckDateLessThanEqual(UUID userId, UUID languageId, LocalDate asOf);

    Optional<ProgressRecordEntity> findFirstByUserIdAndLanguageIdOrderByUpdatedAtDesc(UUID userId, UUID languageId);
}
