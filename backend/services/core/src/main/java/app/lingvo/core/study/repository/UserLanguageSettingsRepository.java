package app.lingvo.core.study.repository;

import app.lingvo.core.study.entity.UserLanguageSettingsEntity;
import app.lingvo.core.study.entity.UserLanguageSettingsId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserLanguageSettingsRepository extends JpaRepository<UserLanguageSettingsEntity, UserLanguageSettingsId> {

    Optional<UserLanguageSettingsEntity> findByUserIdAndLanguageId(UUID userId, UUID languageId);
}
