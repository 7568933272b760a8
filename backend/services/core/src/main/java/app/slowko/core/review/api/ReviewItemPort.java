package app.slowko.core.review.api;

public interface ReviewItemPort {

    boolean exists(long itemId);
}
