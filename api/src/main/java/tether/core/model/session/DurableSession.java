package tether.core.model.session;

import java.time.Instant;
import java.util.Optional;

/**
 * Session row held by the durable layer.
 *
 * <p>Unlike {@link SessionRecord}, the id is stable across token rotation and the row
 * outlives cache expiry until it is cleaned up.
 */
public record DurableSession(
        String id,
        SessionUser user,
        AuthProvider provider,
        String accessToken,
        String refreshToken,
        Instant accessExpiresAt,
        Instant refreshExpiresAt,
        SessionStatus status,
        Instant createdAt,
        Instant updatedAt,
        Instant revokedAt,
        String ipAddress,
        String userAgent,
        boolean rememberMe) {

    public DurableSession {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Durable session ID cannot be null or blank");
        }
        if (status == null) {
            status = SessionStatus.ACTIVE;
        }
    }

    /**
     * Active and within its refresh window.
     */
    public boolean isUsable(Instant now) {
        return status == SessionStatus.ACTIVE
                && (refreshExpiresAt == null || refreshExpiresAt.isAfter(now));
    }

    public boolean isAccessValid(Instant now) {
        return isUsable(now) && (accessExpiresAt == null || accessExpiresAt.isAfter(now));
    }

    public Optional<Instant> finishedAt() {
        return switch (status) {
            case ACTIVE -> Optional.empty();
            case REVOKED -> Optional.ofNullable(revokedAt != null ? revokedAt : updatedAt);
            case EXPIRED -> Optional.ofNullable(updatedAt);
        };
    }

    public DurableSession withTokens(TokenPair tokens, Instant accessExpiry, Instant refreshExpiry, Instant now) {
        return new DurableSession(
                id,
                user,
                provider,
                tokens.accessToken(),
                tokens.refreshToken(),
                accessExpiry,
                refreshExpiry,
                status,
                createdAt,
                now,
                revokedAt,
                ipAddress,
                userAgent,
                rememberMe);
    }

    public DurableSession revoked(Instant now) {
        return new DurableSession(
                id,
                user,
                provider,
                accessToken,
                refreshToken,
                accessExpiresAt,
                refreshExpiresAt,
                SessionStatus.REVOKED,
                createdAt,
                now,
                now,
                ipAddress,
                userAgent,
                rememberMe);
    }

    public DurableSession expired(Instant now) {
        return new DurableSession(
                id,
                user,
                provider,
                accessToken,
                refreshToken,
                accessExpiresAt,
                refreshExpiresAt,
                SessionStatus.EXPIRED,
                createdAt,
                now,
                revokedAt,
                ipAddress,
                userAgent,
                rememberMe);
    }
}
