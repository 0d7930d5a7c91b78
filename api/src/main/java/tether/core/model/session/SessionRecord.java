package tether.core.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One authenticated session as held in the cache.
 *
 * <p>The {@code id} is derived from the access token, so the same token always maps
 * to the same cache key. {@code version} grows by one on every rewrite and lets
 * writers detect that somebody else changed the record after they read it.
 *
 * @param id           session id derived from the access token
 * @param accessToken  access credential
 * @param refreshToken refresh credential (may be null)
 * @param provider     issuing provider
 * @param user         user snapshot taken at creation
 * @param createdAt    creation time
 * @param updatedAt    last activity time
 * @param status       lifecycle status
 * @param ttlSeconds   TTL applied to the cache entry
 * @param ipAddress    client address (may be null)
 * @param userAgent    client user agent (may be null)
 * @param attributes   free-form attributes, kept sorted by key
 * @param version      write counter
 */
public record SessionRecord(
        String id,
        String accessToken,
        String refreshToken,
        AuthProvider provider,
        SessionUser user,
        Instant createdAt,
        Instant updatedAt,
        SessionStatus status,
        long ttlSeconds,
        String ipAddress,
        String userAgent,
        Map<String, String> attributes,
        long version) {

    public SessionRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (provider == null) {
            throw new IllegalArgumentException("Provider cannot be null");
        }
        if (user == null) {
            throw new IllegalArgumentException("User cannot be null");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttlSeconds);
        }
        if (status == null) {
            status = SessionStatus.ACTIVE;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        attributes = attributes == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
    }

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public Duration ttl() {
        return Duration.ofSeconds(ttlSeconds);
    }

    /**
     * Time elapsed since the last activity.
     */
    public Duration idleFor(Instant now) {
        return Duration.between(updatedAt, now);
    }

    public SessionRecord withProvider(AuthProvider newProvider, Duration newTtl) {
        return new SessionRecord(
                id,
                accessToken,
                refreshToken,
                newProvider,
                user,
                createdAt,
                updatedAt,
                status,
                newTtl.toSeconds(),
                ipAddress,
                userAgent,
                attributes,
                version);
    }

    public SessionRecord withTtl(Duration newTtl) {
        return withProvider(provider, newTtl);
    }

    public SessionRecord withStatus(SessionStatus newStatus) {
        return new SessionRecord(
                id,
                accessToken,
                refreshToken,
                provider,
                user,
                createdAt,
                updatedAt,
                newStatus,
                ttlSeconds,
                ipAddress,
                userAgent,
                attributes,
                version);
    }

    public SessionRecord withVersion(long newVersion) {
        return new SessionRecord(
                id,
                accessToken,
                refreshToken,
                provider,
                user,
                createdAt,
                updatedAt,
                status,
                ttlSeconds,
                ipAddress,
                userAgent,
                attributes,
                newVersion);
    }

    /**
     * Resolve a named field for exact-match criteria.
     *
     * <p>Known field names address record and user fields; anything else is looked up
     * in {@link #attributes()}.
     *
     * @param field field name such as {@code provider}, {@code user_role} or an attribute key
     * @return the field value rendered as a string, or empty if unset
     */
    public Optional<String> fieldValue(String field) {
        return switch (field) {
            case "id" -> Optional.of(id);
            case "provider" -> Optional.of(provider.key());
            case "status" -> Optional.of(status.key());
            case "user_uuid" -> Optional.of(user.uuid());
            case "user_role", "role" -> Optional.ofNullable(user.role());
            case "user_email", "email" -> Optional.ofNullable(user.email());
            case "ip_address" -> Optional.ofNullable(ipAddress);
            case "user_agent" -> Optional.ofNullable(userAgent);
            case "ttl" -> Optional.of(Long.toString(ttlSeconds));
            default -> Optional.ofNullable(attributes.get(field));
        };
    }
}
