package tether.core.model.transaction;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import tether.core.model.session.SessionRecord;

/**
 * Inverse of one forward mutation, replayed on rollback.
 *
 * <p>Each compensation carries the version the forward step left behind. Replay only
 * touches the session while it still has that version, so a change made by another
 * writer in between is reported instead of overwritten.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Compensation.RestoreSession.class, name = "restore_session"),
    @JsonSubTypes.Type(value = Compensation.DeleteSession.class, name = "delete_session")
})
public sealed interface Compensation {

    String sessionId();

    /**
     * Rewrite {@code original} and its index entries.
     *
     * @param original        record as it was before the forward step
     * @param expectedVersion version left by the forward step, or null when the forward step deleted it
     */
    record RestoreSession(SessionRecord original, Long expectedVersion) implements Compensation {
        @Override
        public String sessionId() {
            return original.id();
        }
    }

    /**
     * Remove a session created inside the transaction.
     */
    record DeleteSession(String sessionId, String accessToken, long expectedVersion) implements Compensation {}
}
