package app.lingvo.core.study.entity;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

public class ProgressRecordId implements Serializable {
    private UUID userId;
    private UUID wordId;

    public ProgressRecordId() {}

    public ProgressRecordId(UUID userId, UUID wordId) {
        this.userId = userId;
        this.wordId = wordId;
    }

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

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ProgressRecordId that = (ProgressRecordId) o;
        return Objects.equals(userId, that.userId) && Objects.equals(wordId, that.wordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, wordId);
    }
}
