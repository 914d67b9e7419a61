package io.fuzzdeck.api.reverse;

import java.time.Instant;

/**
 * A hit on the reverse/facade server: an inbound HTTP, RMI or DNS callback.
 */
public record ReverseNotification(
        String uuid,
        String type,
        String remoteAddr,
        byte[] raw,
        String token,
        Instant timestamp
) {

    public ReverseNotification {
        if (uuid == null) {
            throw new IllegalArgumentException("Notification uuid must not be null");
        }
        raw = raw == null ? new byte[0] : raw.clone();
    }

    @Override
    public byte[] raw() {
        return raw.clone();
    }
}
