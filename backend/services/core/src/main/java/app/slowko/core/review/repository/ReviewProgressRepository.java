package app.slowko.core.review.repository;

import app.slowko.core.review.entity.ReviewProgressEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReviewProgressRepository extends JpaRepository<ReviewProgressEntity, Long> {

    interface ReviewCountsProjection {
        long getTotal();

        long getDueNow();

        long getMastered();

        long getLearning();

        long getFresh();
    }

    interface DueUserProjection {
        long getUserId();

        long getDueCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from ReviewProgressEntity p where p.id = :id")
    Optional<ReviewProgressEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<ReviewProgressEntity> findByUserIdAndItemId(long userId, long itemId);

    List<ReviewProgressEntity> findByUserIdOrderByIdAsc(long userId);

    @Query("""
            select p
            from ReviewProgressEntity p
            where p.userId = :userId
              and p.nextReviewAt <= :now
            order by p.nextReviewAt asc, p.id asc
            """)
    List<ReviewProgressEntity> findDue(@Param("userId") long userId,
                                       @Param("now") Instant now,
                                       Pageable pageable);

    @Query("""
            select count(p.id) as total,
                   coalesce(sum(case when p.nextReviewAt <= :now then 1 else 0 end), 0) as dueNow,
                   coalesce(sum(case when p.stage >= 4 then 1 else 0 end), 0) as mastered,
                   coalesce(sum(case when p.stage > 0 and p.stage < 4 then 1 else 0 end), 0) as learning,
                   coalesce(sum(case when p.stage = 0 then 1 else 0 end), 0) as fresh
            from ReviewProgressEntity p
            where p.userId = :userId
            """)
    ReviewCountsProjection countByStage(@Param("userId") long userId,
                                        @Param("now") Instant now);

    @Query("""
            select p.userId as userId,
                   count(p.id) as dueCount
            from ReviewProgressEntity p
            where p.nextReviewAt <= :now
            group by p.userId
            order by p.userId asc
            """)
    List<DueUserProjection> findUsersWithDueReviews(@Param("now") Instant now);

    @Modifying
    @Query("delete from ReviewProgressEntity p where p.userId = :userId and p.itemId = :itemId")
    int deleteByUserIdAndItemId(@Param("userId") long userId,
                                @Param("itemId") long itemId);
}
