package app.slowko.core.review.controller;

import app.slowko.core.review.controller.dto.AnswerReviewRequest;
import app.slowko.core.review.controller.dto.ReviewProgressResponse;
import app.slowko.core.review.domain.RecallQuality;
import app.slowko.core.review.domain.ReviewStats;
import app.slowko.core.review.service.ReviewService;
import app.slowko.core.review.service.ReviewStatsService;
import app.slowko.core.security.CurrentUserProvider;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/review")
public class ReviewController {

    private final CurrentUserProvider currentUserProvider;
    private final ReviewService reviewService;
    private final ReviewStatsService statsService;

    public ReviewController(CurrentUserProvider currentUserProvider,
                            ReviewService reviewService,
                            ReviewStatsService statsService) {
        this.currentUserProvider = currentUserProvider;
        this.reviewService = reviewService;
        this.statsService = statsService;
    }

    // GET /review/due?limit=10
    @GetMapping("/due")
    public List<ReviewProgressResponse> due(@AuthenticationPrincipal Jwt jwt,
                                            @RequestParam(required = false) Integer limit) {
        long userId = currentUserProvider.getUserId(jwt);
        if (limit != null && limit <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");
        }
        return reviewService.getDueItems(userId, limit).stream()
                .map(ReviewProgressResponse::from)
                .toList();
    }

    // POST /review/progress/{progressId}/answer
    @PostMapping("/progress/{progressId}/answer")
    public ResponseEntity<ReviewProgressResponse> answer(@AuthenticationPrincipal Jwt jwt,
                                                         @PathVariable long progressId,
                                                         @Valid @RequestBody AnswerReviewRequest req) {
        long userId = currentUserProvider.getUserId(jwt);
        int quality = (req.quality() != null)
                ? req.quality()
                : RecallQuality.forAnswer(req.correct()).code();

        // a stale progress id is not an error for the chat flow
        return reviewService.applyAnswer(userId, progressId, quality, req.correct())
                .map(p -> ResponseEntity.ok(ReviewProgressResponse.from(p)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // POST /review/items/{itemId}
    @PostMapping("/items/{itemId}")
    public ResponseEntity<ReviewProgressResponse> addItem(@AuthenticationPrincipal Jwt jwt,
                                                          @PathVariable long itemId) {
        long userId = currentUserProvider.getUserId(jwt);
        return reviewService.addItemToUser(userId, itemId)
                .map(p -> ResponseEntity.status(HttpStatus.CREATED).body(ReviewProgressResponse.from(p)))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT, "Item " + itemId + " is already scheduled"));
    }

    // DELETE /review/items/{itemId}
    @DeleteMapping("/items/{itemId}")
    public ResponseEntity<Void> removeItem(@AuthenticationPrincipal Jwt jwt,
                                           @PathVariable long itemId) {
        long userId = currentUserProvider.getUserId(jwt);
        if (!reviewService.removeItemFromUser(userId, itemId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Item " + itemId + " is not scheduled");
        }
        return ResponseEntity.noContent().build();
    }

    // GET /review/stats
    @GetMapping("/stats")
    public ReviewStats stats(@AuthenticationPrincipal Jwt jwt) {
        long userId = currentUserProvider.getUserId(jwt);
        return statsService.getReviewStats(userId);
    }
}
