package app.lingvo.core.study.entity;

import app.lingvo.core.study.domain.HintType;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Learning progress of one user on one word. Created lazily on the first interaction.
 */
@Entity
@Table(name = "user_word_progress", schema = "app_core")
@IdClass(ProgressRecordId.class)
public class ProgressRecordEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Id
    @Column(name = "word_id", nullable = false)
    private UUID wordId;

    @Column(name = "language_id", nullable = false)
    private UUID languageId;

    @Column(name = "score", nullable = false)
    private int score;

    @Column(name = "is_skipped", nullable = false)
    private boolean skipped;

    @Column(name = "check_interval", nullable = false)
    private int checkInterval;

    @Column(name = "next_check_date")
    private LocalDate nextCheckDate;

    @Column(name = "hint_meaning")
    private String hintMeaning;

    @Column(name = "hint_phoneticsound")
    private String hintPhoneticSound;

    @Column(name = "hint_phoneticassociation")
    private String hintPhoneticAssociation;

    @Column(name = "hint_writing")
    private String hintWriting;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

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

    public int getScore() {
        return score;
    }

    public void setScore(int score) {
        this.score = score;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public void setSkipped(boolean skipped) {
        this.skipped = skipped;
    }

    public int getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(int checkInterval) {
        this.checkInterval = checkInterval;
    }

    public LocalDate getNextCheckDate() {
        return nextCheckDate;
    }

    public void setNextCheckDate(LocalDate nextCheckDate) {
        this.nextCheckDate = nextCheckDate;
    }

    public String getHintMeaning() {
        return hintMeaning;
    }

    public void setHintMeaning(String hintMeaning) {
        this.hintMeaning = hintMeaning;
    }

    public String getHintPhoneticSound() {
        return hintPhoneticSound;
    }

    public void setHintPhoneticSound(String hintPhoneticSound) {
        this.hintPhoneticSound = hintPhoneticSound;
    }

    public String getHintPhoneticAssociation() {
        return hintPhoneticAssociation;
    }

    public void setHintPhoneticAssociation(String hintPhoneticAssociation) {
        this.hintPhoneticAssociation = hintPhoneticAssociation;
    }

    public String getHintWriting() {
        return hintWriting;
    }

    public void setHintWriting(String hintWriting) {
        this.hintWriting = hintWriting;
    }

    public String getHint(HintType type) {
        return switch (type) {
            case MEANING -> hintMeaning;
            case PHONETIC_SOUND -> hintPhoneticSound;
            case PHONETIC_ASSOCIATION -> hintPhoneticAssociation;
            case WRITING -> hintWriting;
        };
    }

    public void setHint(HintType type, String text) {
        switch (type) {
            case MEANING -> hintMeaning = text;
            case PHONETIC_SOUND -> hintPhoneticSound = text;
            case PHONETIC_ASSOCIATION -> hintPhoneticAssociation = text;
            case WRITING -> hintWriting = text;
        }
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getRowVersion() {
        return rowVersion;
    }
}
