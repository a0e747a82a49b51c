package app.lingvo.core.catalog.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "languages", schema = "app_core")
public class LanguageEntity {

    @Id
    @Column(name = "language_id", nullable = false)
    private UUID languageId;

    @Column(name = "name_ru", nullable = false)
    private String nameRu;

    @Column(name = "name_foreign", nullable = false)
    private String nameForeign;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public UUID getLanguageId() {
        return languageId;
    }

    public void setLanguageId(UUID languageId) {
        this.languageId = languageId;
    }

    public String getNameRu() {
        return nameRu;
    }

    public void setNameRu(String nameRu) {
        this.nameRu = nameRu;
    }

    public String getNameForeign() {
        return nameForeign;
    }

    public void setNameForeign(String nameForeign) {
        this.nameForeign = nameForeign;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
