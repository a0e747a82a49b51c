package app.lingvo.core.catalog.adapter;

import app.lingvo.core.catalog.entity.WordEntity;
import app.lingvo.core.catalog.repository.LanguageRepository;
import app.lingvo.core.catalog.repository.WordRepository;
import app.lingvo.core.config.StudyProps;
import app.lingvo.core.study.api.WordCatalogPort;
import app.lingvo.core.study.exception.NotFoundException;
import app.lingvo.core.study.exception.StoreFailures;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

@Component
public class WordCatalogAdapter implements WordCatalogPort {

    private final LanguageRepository languageRepository;
    private final WordRepository wordRepository;
    private final int pageSize;

    public WordCatalogAdapter(LanguageRepository languageRepository,
                              WordRepository wordRepository,
                              StudyProps props) {
        this.languageRepository = languageRepository;
        this.wordRepository = wordRepository;
        this.pageSize = props.candidateBatchSize();
    }

    @Override
    public void requireLanguage(UUID languageId) {
        boolean exists = StoreFailures.guard("language lookup", () -> languageRepository.existsById(languageId));
        if (!exists) {
            throw NotFoundException.language(languageId);
        }
    }

    @Override
    public Iterator<CatalogWord> wordsFrom(UUID languageId, int startNumber) {
        requireLanguage(languageId);
        return new WordPageIterator(startNumber, fromNumber -> loadPage(languageId, fromNumber));
    }

    @Override
    public Optional<CatalogWord> findWord(UUID wordId) {
        return StoreFailures.guard("word lookup", () -> wordRepository.findById(wordId))
                .map(WordCatalogAdapter::toCatalogWord);
    }

    @Override
    public long countWords(UUID languageId) {
        return StoreFailures.guard("word count", () -> wordRepository.countByLanguageId(languageId));
    }

    @Override
    public OptionalInt maxWordNumber(UUID languageId) {
        Integer max = StoreFailures.guard("word number range", () -> wordRepository.findMaxWordNumber(languageId));
        return max == null ? OptionalInt.empty() : OptionalInt.of(max);
    }

    private List<CatalogWord> loadPage(UUID languageId, int fromNumber) {
        return StoreFailures.guard("word page load", () -> wordRepository
                .findPageFrom(languageId, fromNumber, PageRequest.of(0, pageSize)))
                .stream()
                .map(WordCatalogAdapter::toCatalogWord)
                .toList();
    }

    static CatalogWord toCatalogWord(WordEntity w) {
        return new CatalogWord(
                w.getWordId(),
                w.getLanguageId(),
                w.getWordForeign(),
                w.getTranslation(),
                w.getTranscription(),
                w.getWordNumber(),
                w.getSoundFilePath()
        );
    }
}
