package tether.core.model.session;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a session.
 */
public enum SessionStatus {
    ACTIVE,
    REVOKED,
    EXPIRED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SessionStatus fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Session status must not be null");
        }
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
