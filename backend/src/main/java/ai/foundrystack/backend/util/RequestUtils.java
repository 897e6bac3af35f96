package ai.foundrystack.backend.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Helpers for identifying the caller of a request.
 */
public final class RequestUtils {

    private RequestUtils() {
    }

    /**
     * Rate limit identifier for the caller: the JWT subject when authenticated, otherwise the
     * first X-Forwarded-For address or the remote address.
     */
    public static String resolveClientId(Jwt jwt, HttpServletRequest request) {
        if (jwt != null && jwt.getSubject() != null) {
            return "user:" + jwt.getSubject();
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    public static String subjectOf(Jwt jwt) {
        return jwt != null ? jwt.getSubject() : null;
    }
}
