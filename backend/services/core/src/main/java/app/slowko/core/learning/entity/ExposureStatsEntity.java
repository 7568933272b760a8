package app.slowko.core.learning.entity;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "exposure_stats", schema = "slowko",
        uniqueConstraints = @UniqueConstraint(name = "uq_exposure_stats_user_item", columnNames = {"user_id", "item_id"}))
public class ExposureStatsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private long userId;

    @Column(name = "item_id", nullable = false)
    private long itemId;

    @Column(name = "know_count", nullable = false)
    private int knowCount;

    @Column(name = "dont_know_count", nullable = false)
    private int dontKnowCount;

    @Column(name = "last_shown_at")
    private Instant lastShownAt;

    @Column(name = "priority_score", nullable = false)
    private double priorityScore;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public long getUserId() {
        return userId;
    }

    public void setUserId(long userId) {
        this.userId = userId;
    }

    public long getItemId() {
        return itemId;
    }

    public void setItemId(long itemId) {
        this.itemId = itemId;
    }

    public int getKnowCount() {
        return knowCount;
    }

    public void setKnowCount(int knowCount) {
        this.knowCount = knowCount;
    }

    public int getDontKnowCount() {
        return dontKnowCount;
    }

    public void setDontKnowCount(int dontKnowCount) {
        this.dontKnowCount = dontKnowCount;
    }

    public Instant getLastShownAt() {
        return lastShownAt;
    }

    public void setLastShownAt(Instant lastShownAt) {
        this.lastShownAt = lastShownAt;
    }

    public double getPriorityScore() {
        return priorityScore;
    }

    public void setPriorityScore(double priorityScore) {
        this.priorityScore = priorityScore;
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
}
