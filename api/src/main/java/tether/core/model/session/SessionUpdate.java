package tether.core.model.session;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shallow field merge applied by bulk updates.
 *
 * <p>Unset fields keep the value already on the record. Attributes are merged key by
 * key; an attribute mapped to {@code null} is removed.
 */
public final class SessionUpdate {

    private final String role;
    private final SessionStatus status;
    private final String ipAddress;
    private final String userAgent;
    private final Map<String, String> attributes;
    private final Set<String> removedAttributes;

    private SessionUpdate(Builder builder) {
        this.role = builder.role;
        this.status = builder.status;
        this.ipAddress = builder.ipAddress;
        this.userAgent = builder.userAgent;
        this.attributes = Map.copyOf(builder.attributes);
        this.removedAttributes = Set.copyOf(builder.removedAttributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build an update from loosely typed input.
     *
     * <p>{@code role}/{@code user_role}, {@code status}, {@code ip_address} and
     * {@code user_agent} map to their fields; every other key becomes an attribute.
     *
     * @param values update values
     * @return the update
     */
    public static SessionUpdate fromMap(Map<String, String> values) {
        final var builder = builder();
        values.forEach((key, value) -> {
            switch (key) {
                case "role", "user_role" -> builder.role(value);
                case "status" -> builder.status(SessionStatus.fromKey(value));
                case "ip_address" -> builder.ipAddress(value);
                case "user_agent" -> builder.userAgent(value);
                default -> builder.attribute(key, value);
            }
        });
        return builder.build();
    }

    public Optional<String> role() {
        return Optional.ofNullable(role);
    }

    public Optional<SessionStatus> status() {
        return Optional.ofNullable(status);
    }

    public boolean isEmpty() {
        return role == null
                && status == null
                && ipAddress == null
                && userAgent == null
                && attributes.isEmpty()
                && removedAttributes.isEmpty();
    }

    /**
     * Apply this update to a record.
     *
     * <p>The version and TTL are left untouched; the caller owns both.
     *
     * @param record the record to merge into
     * @return the merged record
     */
    public SessionRecord applyTo(SessionRecord record) {
        final var mergedAttributes = new HashMap<>(record.attributes());
        mergedAttributes.putAll(attributes);
        removedAttributes.forEach(mergedAttributes::remove);

        return new SessionRecord(
                record.id(),
                record.accessToken(),
                record.refreshToken(),
                record.provider(),
                role != null ? record.user().withRole(role) : record.user(),
                record.createdAt(),
                record.updatedAt(),
                status != null ? status : record.status(),
                record.ttlSeconds(),
                ipAddress != null ? ipAddress : record.ipAddress(),
                userAgent != null ? userAgent : record.userAgent(),
                mergedAttributes,
                record.version());
    }

    @Override
    public String toString() {
        final var fields = new HashMap<String, Object>();
        role().ifPresent(r -> fields.put("role", r));
        status().ifPresent(s -> fields.put("status", s.key()));
        if (ipAddress != null) {
            fields.put("ip_address", ipAddress);
        }
        if (userAgent != null) {
            fields.put("user_agent", userAgent);
        }
        fields.putAll(attributes);
        removedAttributes.forEach(key -> fields.put(key, null));
        return fields.toString();
    }

    public static final class Builder {

        private String role;
        private SessionStatus status;
        private String ipAddress;
        private String userAgent;
        private final Map<String, String> attributes = new HashMap<>();
        private final Set<String> removedAttributes = new HashSet<>();

        private Builder() {}

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder attribute(String key, String value) {
            if (value == null) {
                attributes.remove(key);
                removedAttributes.add(key);
            } else {
                removedAttributes.remove(key);
                attributes.put(key, value);
            }
            return this;
        }

        public SessionUpdate build() {
            return new SessionUpdate(this);
        }
    }
}
