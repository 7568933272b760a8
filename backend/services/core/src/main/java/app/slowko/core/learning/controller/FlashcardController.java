package app.slowko.core.learning.controller;

import app.slowko.core.learning.controller.dto.ExposureStatsResponse;
import app.slowko.core.learning.controller.dto.FeedbackRequest;
import app.slowko.core.learning.controller.dto.FlashcardResponse;
import app.slowko.core.learning.domain.LearningStats;
import app.slowko.core.learning.service.FlashcardService;
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
@RequestMapping("/learning")
public class FlashcardController {

    private final CurrentUserProvider currentUserProvider;
    private final FlashcardService flashcardService;

    public FlashcardController(CurrentUserProvider currentUserProvider, FlashcardService flashcardService) {
        this.currentUserProvider = currentUserProvider;
        this.flashcardService = flashcardService;
    }

    // GET /learning/next?exclude=3,7
    @GetMapping("/next")
    public ResponseEntity<FlashcardResponse> next(@AuthenticationPrincipal Jwt jwt,
                                                  @RequestParam(name = "exclude", required = false) List<Long> exclude) {
        long userId = currentUserProvider.getUserId(jwt);
        return flashcardService.selectNext(userId, exclude)
                .map(s -> ResponseEntity.ok(FlashcardResponse.from(s)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // POST /learning/stats/{statsId}/feedback
    @PostMapping("/stats/{statsId}/feedback")
    public ResponseEntity<ExposureStatsResponse> feedback(@AuthenticationPrincipal Jwt jwt,
                                                          @PathVariable long statsId,
                                                          @Valid @RequestBody FeedbackRequest req) {
        long userId = currentUserProvider.getUserId(jwt);
        return flashcardService.recordFeedback(userId, statsId, req.knowsWord())
                .map(s -> ResponseEntity.ok(ExposureStatsResponse.from(s)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // PUT /learning/items/{itemId}
    @PutMapping("/items/{itemId}")
    public ResponseEntity<ExposureStatsResponse> addItem(@AuthenticationPrincipal Jwt jwt,
                                                         @PathVariable long itemId) {
        long userId = currentUserProvider.getUserId(jwt);
        return flashcardService.addToLearning(userId, itemId)
                .map(s -> ResponseEntity.status(HttpStatus.CREATED).body(ExposureStatsResponse.from(s)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // DELETE /learning/items/{itemId}
    @DeleteMapping("/items/{itemId}")
    public ResponseEntity<Void> removeItem(@AuthenticationPrincipal Jwt jwt,
                                           @PathVariable long itemId) {
        long userId = currentUserProvider.getUserId(jwt);
        if (!flashcardService.removeFromLearning(userId, itemId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Item " + itemId + " is not being learned");
        }
        return ResponseEntity.noContent().build();
    }

    // GET /learning/stats
    @GetMapping("/stats")
    public LearningStats stats(@AuthenticationPrincipal Jwt jwt) {
        long userId = currentUserProvider.getUserId(jwt);
        return flashcardService.getLearningStats(userId);
    }
}
