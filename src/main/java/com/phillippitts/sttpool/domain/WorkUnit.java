package com.phillippitts.sttpool.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable description of one dispatchable job.
 *
 * <p>Exactly one {@link Outcome} is ever produced per {@link #id()}. An id may carry a caller's
 * correlation hint (typically the HTTP request id) as a prefix: {@code <hint>/<uuid>}.
 *
 * @param id          correlation id, generated at submission time
 * @param payload     input reference for the work function
 * @param submittedAt submission timestamp, used for queue-wait accounting
 */
public record WorkUnit(String id, WorkPayload payload, Instant submittedAt) {

    static final char HINT_SEPARATOR = '/';
    static final int MAX_HINT_LENGTH = 36;

    public WorkUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(submittedAt, "submittedAt must not be null");
    }

    /**
     * Creates a unit with a fresh random id, stamped with the current time.
     */
    public static WorkUnit create(WorkPayload payload) {
        return create(payload, null);
    }

    /**
     * Creates a unit whose id is prefixed with {@code correlationHint}. The hint is reduced to
     * {@code [A-Za-z0-9._-]} and capped at 36 characters; a hint with nothing left is ignored.
     * The random part keeps ids unique when callers reuse a hint.
     */
    public static WorkUnit create(WorkPayload payload, String correlationHint) {
        String random = UUID.randomUUID().toString();
        String hint = sanitizeHint(correlationHint);
        String id = hint == null ? random : hint + HINT_SEPARATOR + random;
        return new WorkUnit(id, payload, Instant.now());
    }

    /** The caller's hint this id was built from, or null. */
    public String correlationHint() {
        int sep = id.lastIndexOf(HINT_SEPARATOR);
        return sep < 0 ? null : id.substring(0, sep);
    }

    /** First eight characters of the random part of the id, for log lines. */
    public String shortId() {
        String random = id.substring(id.lastIndexOf(HINT_SEPARATOR) + 1);
        return random.length() <= 8 ? random : random.substring(0, 8);
    }

    private static String sanitizeHint(String hint) {
        if (hint == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(Math.min(hint.length(), MAX_HINT_LENGTH));
        for (int i = 0; i < hint.length() && sb.length() < MAX_HINT_LENGTH; i++) {
            char c = hint.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-') {
                sb.append(c);
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
