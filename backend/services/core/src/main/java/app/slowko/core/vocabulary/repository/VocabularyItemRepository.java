package app.slowko.core.vocabulary.repository;

import app.slowko.core.vocabulary.entity.VocabularyItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface VocabularyItemRepository extends JpaRepository<VocabularyItemEntity, Long> {

    List<VocabularyItemEntity> findByDifficultyLevelInOrderByIdAsc(Collection<String> difficultyLevels);

    @Query("""
            select v
            from VocabularyItemEntity v
            where v.difficultyLevel in :levels
              and v.id not in :excluded
            order by v.id asc
            """)
    List<VocabularyItemEntity> findEligibleExcluding(@Param("levels") Collection<String> difficultyLevels,
                                                     @Param("excluded") Collection<Long> excludedIds);

    long countByDifficultyLevelIn(Collection<String> difficultyLevels);
}
