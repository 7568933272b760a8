package app.slowko.core.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Resolves the learner behind a request. The chat gateway mints tokens carrying the numeric chat
 * user id in the {@code user_id} claim.
 */
@Component
public class CurrentUserProvider {

    private static final String USER_ID_CLAIM = "user_id";

    public long getUserId(Jwt jwt) {
        String claim = jwt.getClaimAsString(USER_ID_CLAIM);
        if (claim == null || claim.isBlank()) {
            throw new IllegalStateException("JWT does not contain '" + USER_ID_CLAIM + "' claim");
        }
        try {
            return Long.parseLong(claim.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("JWT claim '" + USER_ID_CLAIM + "' is not a numeric user id: " + claim, ex);
        }
    }
}
