package app.lingvo.core.study.api;

import java.util.Iterator;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Read-only view of the words of a language, ordered by {@code wordNumber}.
 */
public interface WordCatalogPort {

    record CatalogWord(
            UUID id,
            UUID languageId,
            String wordForeign,
            String translation,
            String transcription,
            int wordNumber,
            String soundFilePath
    ) {}

    /**
     * Fails with {@code NotFoundException} when the language does not exist.
     */
    void requireLanguage(UUID languageId);

    /**
     * Lazy, restartable sequence of words with {@code wordNumber >= startNumber}, ascending.
     * Each call returns a fresh iterator; words are fetched page by page while iterating.
     */
    Iterator<CatalogWord> wordsFrom(UUID languageId, int startNumber);

    Optional<CatalogWord> findWord(UUID wordId);

    long countWords(UUID languageId);

    OptionalInt maxWordNumber(UUID languageId);
}
