package app.slowko.core.review.entity;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "review_progress", schema = "slowko",
        uniqueConstraints = @UniqueConstraint(name = "uq_review_progress_user_item", columnNames = {"user_id", "item_id"}))
public class ReviewProgressEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private long userId;

    @Column(name = "item_id", nullable = false)
    private long itemId;

    @Column(name = "stage", nullable = false)
    private int stage;

    @Column(name = "repetitions", nullable = false)
    private int repetitions;

    @Column(name = "easiness_factor", nullable = false)
    private double easinessFactor;

    @Column(name = "interval_days", nullable = false)
    private int intervalDays;

    @Column(name = "next_review_at", nullable = false)
    private Instant nextReviewAt;

    @Column(name = "last_quality", nullable = false)
    private int lastQuality;

    @Column(name = "last_reviewed_at")
    private Instant lastReviewedAt;

    @Column(name = "times_reviewed", nullable = false)
    private int timesReviewed;

    @Column(name = "times_correct", nullable = false)
    private int timesCorrect;

    @Column(name = "times_wrong", nullable = false)
    private int timesWrong;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

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

    public int getStage() {
        return stage;
    }

    public void setStage(int stage) {
        this.stage = stage;
    }

    public int getRepetitions() {
        return repetitions;
    }

    public void setRepetitions(int repetitions) {
        this.repetitions = repetitions;
    }

    public double getEasinessFactor() {
        return easinessFactor;
    }

    public void setEasinessFactor(double easinessFactor) {
        this.easinessFactor = easinessFactor;
    }

    public int getIntervalDays() {
        return intervalDays;
    }

    public void setIntervalDays(int intervalDays) {
        this.intervalDays = intervalDays;
    }

    public Instant getNextReviewAt() {
        return nextReviewAt;
    }

    public void setNextReviewAt(Instant nextReviewAt) {
        this.nextReviewAt = nextReviewAt;
    }

    public int getLastQuality() {
        return lastQuality;
    }

    public void setLastQuality(int lastQuality) {
        this.lastQuality = lastQuality;
    }

    public Instant getLastReviewedAt() {
        return lastReviewedAt;
    }

    public void setLastReviewedAt(Instant lastReviewedAt) {
        this.lastReviewedAt = lastReviewedAt;
    }

    public int getTimesReviewed() {
        return timesReviewed;
    }

    public void setTimesReviewed(int timesReviewed) {
        this.timesReviewed = timesReviewed;
    }

    public int getTimesCorrect() {
        return timesCorrect;
    }

    public void setTimesCorrect(int timesCorrect) {
        this.timesCorrect = timesCorrect;
    }

    public int getTimesWrong() {
        return timesWrong;
    }

    public void setTimesWrong(int timesWrong) {
        this.timesWrong = timesWrong;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
