package app.lingvo.core.study.repository;

import app.lingvo.core.catalog.entity.LanguageEntity;
import app.lingvo.core.catalog.entity.WordEntity;
import app.lingvo.core.catalog.repository.LanguageRepository;
import app.lingvo.core.catalog.repository.WordRepository;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ProgressRecordRepositoryDataJpaTest extends PostgresIntegrationTest {

    @Autowired
    ProgressRecordRepository progressRepository;

    @Autowired
    LanguageRepository languageRepository;

    @Autowired
    WordRepository wordRepository;

    final UUID userId = UUID.randomUUID();
    final UUID languageId = UUID.randomUUID();
    final List<WordEntity> words = new ArrayList<>();

    @BeforeEach
    void seedCatalog() {
        LanguageEntity language = new LanguageEntity();
        language.setLanguageId(languageId);
        language.setNameRu("Английский");
        language.setNameForeign("English");
        languageRepository.saveAndFlush(language);

        for (int n = 1; n <= 5; n++) {
            WordEntity w = new WordEntity();
            w.setWordId(UUID.randomUUID());
            w.setLanguageId(languageId);
            w.setWordForeign("word" + n);
            w.setTranslation("слово" + n);
            w.setWordNumber(n);
            words.add(wordRepository.saveAndFlush(w));
        }
    }

    @Test
    void insertDefaultsIfAbsent_createsOnceWithDefaults() {
        UUID wordId = words.get(0).getWordId();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        int first = progressRepository.insertDefaultsIfAbsent(userId, wordId, languageId, now);
        int second = progressRepository.insertDefaultsIfAbsent(userId, wordId, languageId, now.plusSeconds(5));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();

        ProgressRecordEntity record = progressRepository.findForUpdate(userId, wordId).orElseThrow();
        assertThat(record.getScore()).isZero();
        assertThat(record.isSkipped()).isFalse();
        assertThat(record.getCheckInterval()).isZero();
        assertThat(record.getNextCheckDate()).isNull();
        assertThat(record.getUpdatedAt()).isEqualTo(now);
    }

    @Test
    void findDueWordIds_includesTodayAndExcludesTomorrowAndUnscheduled() {
        LocalDate today = LocalDate.of(2024, 3, 10);
        save(words.get(0), 1, 1, today);
        save(words.get(1), 1, 2, today.plusDays(1));
        save(words.get(2), 0, 1, today.minusDays(4));
        save(words.get(3), 0, 0, null);

        List<UUID> due = progressRepository.findDueWordIds(userId, languageId, today);

        assertThat(due).containsExactlyInAnyOrder(words.get(0).getWordId(), words.get(2).getWordId());
    }

    @Test
    void summaryCounts_matchStoredRecords() {
        LocalDate today = LocalDate.of(2024, 3, 10);
        save(words.get(0), 1, 1, today).setSkipped(true);
        save(words.get(1), 1, 4, today.plusDays(3));
        save(words.get(2), 0, 1, today);
        progressRepository.flush();

        assertThat(progressRepository.countByUserIdAndLanguageId(userId, languageId)).isEqualTo(3);
        assertThat(progressRepository.countByUserIdAndLanguageIdAndScore(userId, languageId, 1)).isEqualTo(2);
        assertThat(progressRepository.countByUserIdAndLanguageIdAndSkippedTrue(userId, languageId)).isEqualTo(1);
        assertThat(progressRepository.countByUserIdAndLanguageIdAndNextCheckDateLessThanEqual(userId, languageId, today))
                .isEqualTo(2);
        assertThat(progressRepository.countByUserIdAndLanguageIdAndSkippedFalseAndNextCheckDateLessThanEqual(userId, languageId, today))
                .isEqualTo(1);
    }

    @Test
    void findPageFrom_returnsWordsInNumberOrder() {
        List<WordEntity> page = wordRepository.findPageFrom(languageId, 3, PageRequest.of(0, 2));

        assertThat(page).extracting(WordEntity::getWordNumber).containsExactly(3, 4);
        assertThat(wordRepository.findMaxWordNumber(languageId)).isEqualTo(5);
    }

    private ProgressRecordEntity save(WordEntity word, int score, int interval, LocalDate next) {
        Instant now = Instant.now();
        ProgressRecordEntity e = new ProgressRecordEntity();
        e.setUserId(userId);
        e.setWordId(word.getWordId());
        e.setLanguageId(languageId);
        e.setScore(score);
        e.setCheckInterval(interval);
        e.setNextCheckDate(next);
        e.setCreatedAt(now);
        e.setUpdatedAt(now);
        return progressRepository.save(e);
    }
}
