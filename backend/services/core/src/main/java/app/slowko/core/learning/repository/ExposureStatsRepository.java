package app.slowko.core.learning.repository;

import app.slowko.core.learning.entity.ExposureStatsEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ExposureStatsRepository extends JpaRepository<ExposureStatsEntity, Long> {

    interface LearningCountsProjection {
        long getTotal();

        long getKnown();

        long getWithFeedback();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ExposureStatsEntity s where s.id = :id")
    Optional<ExposureStatsEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<ExposureStatsEntity> findByUserIdAndItemId(long userId, long itemId);

    List<ExposureStatsEntity> findByUserIdAndItemIdIn(long userId, Collection<Long> itemIds);

    @Query("""
            select count(s.id) as total,
                   coalesce(sum(case when s.knowCount >= 3 and s.dontKnowCount = 0 then 1 else 0 end), 0) as known,
                   coalesce(sum(case when s.knowCount > 0 or s.dontKnowCount > 0 then 1 else 0 end), 0) as withFeedback
            from ExposureStatsEntity s
            where s.userId = :userId
            """)
    LearningCountsProjection countByKnowledge(@Param("userId") long userId);

    @Modifying
    @Query("delete from ExposureStatsEntity s where s.userId = :userId and s.itemId = :itemId")
    int deleteByUserIdAndItemId(@Param("userId") long userId,
                                @Param("itemId") long itemId);
}
