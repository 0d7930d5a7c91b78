package tether.core.model.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Selection criteria for bulk session operations.
 *
 * <p>Each variant narrows the matched sessions; {@link AllOf} combines several
 * with AND semantics and matches everything when empty.
 */
public sealed interface SessionCriteria {

    record ByProvider(AuthProvider provider) implements SessionCriteria {
        public ByProvider {
            if (provider == null) {
                throw new IllegalArgumentException("Provider cannot be null");
            }
        }
    }

    record ByIdleOlderThan(Duration idle) implements SessionCriteria {
        public ByIdleOlderThan {
            if (idle == null || idle.isNegative()) {
                throw new IllegalArgumentException("Idle duration must be zero or positive");
            }
        }
    }

    record ByUserRole(String role) implements SessionCriteria {}

    record ByUser(String userUuid) implements SessionCriteria {}

    /**
     * Exact match on a named record field or attribute.
     */
    record FieldEquals(String field, String value) implements SessionCriteria {}

    record Custom(String description, Predicate<SessionRecord> predicate) implements SessionCriteria {}

    record AllOf(List<SessionCriteria> criteria) implements SessionCriteria {
        public AllOf {
            criteria = List.copyOf(criteria);
        }
    }

    static SessionCriteria provider(AuthProvider provider) {
        return new ByProvider(provider);
    }

    static SessionCriteria idleLongerThan(Duration idle) {
        return new ByIdleOlderThan(idle);
    }

    static SessionCriteria role(String role) {
        return new ByUserRole(role);
    }

    static SessionCriteria user(String userUuid) {
        return new ByUser(userUuid);
    }

    static SessionCriteria matching(String description, Predicate<SessionRecord> predicate) {
        return new Custom(description, predicate);
    }

    static SessionCriteria allOf(SessionCriteria... criteria) {
        return new AllOf(List.of(criteria));
    }

    /**
     * Parse loosely typed criteria.
     *
     * <p>Recognized keys are {@code provider}, {@code idle_time} (seconds, optionally
     * written {@code ">N"}), {@code user_role} and {@code user_uuid}. Any other key is an
     * exact match against {@link SessionRecord#fieldValue(String)}.
     *
     * @param values criteria map
     * @return the combined criteria
     * @throws IllegalArgumentException on an unknown provider or malformed idle time
     */
    static SessionCriteria fromMap(Map<String, String> values) {
        final var parsed = new ArrayList<SessionCriteria>();
        values.forEach((key, value) -> {
            switch (key) {
                case "provider" -> parsed.add(new ByProvider(AuthProvider.fromKey(value)));
                case "idle_time" -> parsed.add(new ByIdleOlderThan(parseIdleTime(value)));
                case "user_role" -> parsed.add(new ByUserRole(value));
                case "user_uuid" -> parsed.add(new ByUser(value));
                default -> parsed.add(new FieldEquals(key, value));
            }
        });
        if (parsed.size() == 1) {
            return parsed.get(0);
        }
        return new AllOf(parsed);
    }

    private static Duration parseIdleTime(String value) {
        if (value == null) {
            throw new IllegalArgumentException("idle_time must not be null");
        }
        var trimmed = value.trim();
        if (trimmed.startsWith(">")) {
            trimmed = trimmed.substring(1).trim();
        }
        try {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed idle_time: " + value, e);
        }
    }
}
