package app.lingvo.core.catalog.entity;

import jakarta.persistence.*;

import java.util.UUID;

@Entity
@Table(
        name = "words",
        schema = "app_core",
        uniqueConstraints = @UniqueConstraint(name = "uq_words_language_number", columnNames = {"language_id", "word_number"})
)
public class WordEntity {

    @Id
    @Column(name = "word_id", nullable = false)
    private UUID wordId;

    @Column(name = "language_id", nullable = false)
    private UUID languageId;

    @Column(name = "word_foreign", nullable = false)
    private String wordForeign;

    @Column(name = "translation")
    private String translation;

    @Column(name = "transcription")
    private String transcription;

    @Column(name = "word_number", nullable = false)
    private int wordNumber;

    @Column(name = "sound_file_path")
    private String soundFilePath;

    public UUID getWordId() {
        return wordId;
    }

    public void setWordId(UUID wordId) {
        this.wordId = wordId;
    }

    public UUID getLanguageId() {
        return languageId;
    }

    public void setLanguageId(UUID languageId) {
        this.languageId = languageId;
    }

    public String getWordForeign() {
        return wordForeign;
    }

    public void setWordForeign(String wordForeign) {
        this.wordForeign = wordForeign;
    }

    public String getTranslation() {
        return translation;
    }

    public void setTranslation(String translation) {
        this.translation = translation;
    }

    public String getTranscription() {
        return transcription;
    }

    public void setTranscription(String transcription) {
        this.transcription = transcription;
    }

    public int getWordNumber() {
        return wordNumber;
    }

    public void setWordNumber(int wordNumber) {
        this.wordNumber = wordNumber;
    }

    public String getSoundFilePath() {
        return soundFilePath;
    }

    public void setSoundFilePath(String soundFilePath) {
        this.soundFilePath = soundFilePath;
    }
}
