package app.lingvo.core.study.service;

import app.lingvo.core.config.StudyProps;
import app.lingvo.core.study.api.WordCatalogPort;
import app.lingvo.core.study.api.WordCatalogPort.CatalogWord;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.service.UserLanguageSettingsService.UserLanguageSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Produces the words a user should study next, ascending by word number.
 * <p>
 * The catalog is read one page at a time; progress for a page is fetched with a single query
 * and the next page is requested only once the consumer has drained the previous one.
 * The same settings and progress snapshot always yield the same sequence.
 */
@Service
public class WordSelector {

    private static final Logger log = LoggerFactory.getLogger(WordSelector.class);

    private final WordCatalogPort catalog;
    private final ProgressStore progressStore;
    private final Clock clock;
    private final int batchSize;

    public WordSelector(WordCatalogPort catalog, ProgressStore progressStore, Clock clock, StudyProps props) {
        this.catalog = catalog;
        this.progressStore = progressStore;
        this.clock = clock;
        this.batchSize = props.candidateBatchSize();
    }

    public Iterator<Candidate> nextCandidates(UUID userId, UUID languageId, UserLanguageSettings settings) {
        return nextCandidates(userId, languageId, settings, null);
    }

    /**
     * @param afterWordNumber word number of the word just left behind, or {@code null} to begin at {@code start_word}
     */
    public Iterator<Candidate> nextCandidates(UUID userId,
                                              UUID languageId,
                                              UserLanguageSettings settings,
                                              Integer afterWordNumber) {
        if (afterWordNumber != null && afterWordNumber == Integer.MAX_VALUE) {
            return Collections.emptyIterator();
        }
        int from = settings.startWord();
        if (afterWordNumber != null && afterWordNumber + 1 > from) {
            from = afterWordNumber + 1;
        }
        LocalDate today = LocalDate.now(clock);
        Iterator<CatalogWord> words = catalog.wordsFrom(languageId, from);
        return new CandidateIterator(userId, settings, today, words);
    }

    static boolean isEligible(ProgressRecordEntity record, UserLanguageSettings settings, LocalDate today) {
        if (record == null) {
            return true;
        }
        if (settings.skipMarked() && record.isSkipped()) {
            return false;
        }
        if (!settings.useCheckDate()) {
            return true;
        }
        LocalDate due = record.getNextCheckDate();
        return due == null || !due.isAfter(today);
    }

    public record Candidate(CatalogWord word, ProgressRecordEntity progress) {
    }

    private final class CandidateIterator implements Iterator<Candidate> {

        private final UUID userId;
        private final UserLanguageSettings settings;
        private final LocalDate today;
        private final Iterator<CatalogWord> words;
        private final Deque<Candidate> buffer = new ArrayDeque<>();

        CandidateIterator(UUID userId, UserLanguageSettings settings, LocalDate today, Iterator<CatalogWord> words) {
            this.userId = userId;
            this.settings = settings;
            this.today = today;
            this.words = words;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && words.hasNext()) {
                fill();
            }
            return !buffer.isEmpty();
        }

        @Override
        public Candidate next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.removeFirst();
        }

        private void fill() {
            List<CatalogWord> batch = new ArrayList<>(batchSize);
            while (batch.size() < batchSize && words.hasNext()) {
                batch.add(words.next());
            }
            Map<UUID, ProgressRecordEntity> progress = progressStore.findForWords(
                    userId, batch.stream().map(CatalogWord::id).toList());

            int before = buffer.size();
            for (CatalogWord word : batch) {
                ProgressRecordEntity record = progress.get(word.id());
                if (isEligible(record, settings, today)) {
                    buffer.addLast(new Candidate(word, record));
                }
            }
            if (log.isDebugEnabled()) {
                log.debug("Selector batch for user {}: words {}..{}, {} eligible of {}",
                        userId,
                        batch.get(0).wordNumber(),
                        batch.get(batch.size() - 1).wordNumber(),
                        buffer.size() - before,
                        batch.size());
            }
        }
    }
}
