package app.lingvo.core.catalog.repository;

import app.lingvo.core.catalog.entity.WordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WordRepository extends JpaRepository<WordEntity, UUID> {

    @Query("""
        select w
        from WordEntity w
        where w.languageId = :languageId
          and w.wordNumber >= :fromNumber
        order by w.wordNumber asc
        """)
    List<WordEntity> findPageFrom(@Param("languageId") UUID languageId,
                                  @Param("fromNumber") int fromNumber,
                                  Pageable pageable);

    long countByLanguageId(UUID languageId);

    @Query("select max(w.wordNumber) from WordEntity w where w.languageId = :languageId")
    Integer findMaxWordNumber(@Param("languageId") UUID languageId);
}
