package tether.core.service.session;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import tether.core.model.session.SessionRecord;
import tether.core.model.transaction.Compensation;

/**
 * JSON encoding of the values the session store writes to the cache.
 *
 * <p>Output is deterministic: map entries are sorted and timestamps are ISO-8601, so
 * encoding an equal record twice yields the same string.
 */
@ApplicationScoped
public class SessionRecordCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, Long>> INDEX_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Compensation>> JOURNAL_TYPE = new TypeReference<>() {};

    public String encode(SessionRecord record) {
        return write(record, "session record");
    }

    /**
     * Decode a session record.
     *
     * @throws SessionCodecException if the value is not a valid record
     */
    public SessionRecord decode(String value) {
        return read(value, SessionRecord.class, "session record");
    }

    public String encodeIndex(Map<String, Long> members) {
        return write(members, "session index");
    }

    public Map<String, Long> decodeIndex(String value) {
        try {
            return OBJECT_MAPPER.readValue(value, INDEX_TYPE);
        } catch (JsonProcessingException e) {
            throw new SessionCodecException("Failed to decode session index", e);
        }
    }

    public String encodeJournal(List<Compensation> compensations) {
        try {
            return OBJECT_MAPPER.writerFor(JOURNAL_TYPE).writeValueAsString(compensations);
        } catch (JsonProcessingException e) {
            throw new SessionCodecException("Failed to encode transaction journal", e);
        }
    }

    public List<Compensation> decodeJournal(String value) {
        try {
            return OBJECT_MAPPER.readValue(value, JOURNAL_TYPE);
        } catch (JsonProcessingException e) {
            throw new SessionCodecException("Failed to decode transaction journal", e);
        }
    }

    private String write(Object value, String what) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SessionCodecException("Failed to encode " + what, e);
        }
    }

    private <T> T read(String value, Class<T> type, String what) {
        try {
            return OBJECT_MAPPER.readValue(value, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SessionCodecException("Failed to decode " + what, e);
        }
    }

    /**
     * Thrown when a cached value cannot be encoded or decoded.
     */
    public static class SessionCodecException extends RuntimeException {

        public SessionCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
