package hintvote.coordinator.model;

import java.util.Objects;

/**
 * Owner metadata supplied when a session is created.
 *
 * @param tgid process that owns the session
 * @param uid  user id of that process
 * @param tag  kind of client
 */
public record SessionDescriptor(int tgid, int uid, SessionTag tag) {

    public SessionDescriptor {
        Objects.requireNonNull(tag, "tag is required");
    }

    /**
     * Human-readable id in the form {@code tgid-uid-sessionId}.
     */
    public String idString(long sessionId) {
        return tgid + "-" + uid + "-" + sessionId;
    }
}
