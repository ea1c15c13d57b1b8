package group.cloudtrailsource.producer;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * One CloudTrail record exactly as it appeared in its file, with the time parsed from its eventTime.
 *
 * @param payload read-only view of the record's original bytes
 * @param timestampNanos eventTime in nanoseconds since the epoch
 */
public record CloudTrailEvent(
        ByteBuffer payload,
        long timestampNanos
) {
    public byte[] bytes() {
        ByteBuffer view = payload.duplicate();
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }

    public String json() {
        return new String(bytes(), StandardCharsets.UTF_8);
    }
}
