package io.fuzzdeck.core.reverse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fuzzdeck.api.reverse.ReverseNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Newest-first, bounded list of reverse-server notifications.
 * <p>
 * Messages arrive as JSON objects and are parsed as they come in; the list is republished
 * on a fixed cadence, but only when it changed since the last publication.
 */
public class ReverseNotificationFeed {

    private static final Logger log = LoggerFactory.getLogger(ReverseNotificationFeed.class);

    public static final int DEFAULT_CAPACITY = 100;
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500);

    private final int capacity;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Deque<ReverseNotification> messages = new ArrayDeque<>();
    private final List<Consumer<List<ReverseNotification>>> listeners = new CopyOnWriteArrayList<>();

    private List<ReverseNotification> published;
    private ScheduledExecutorService scheduler;

    public ReverseNotificationFeed() {
        this(DEFAULT_CAPACITY);
    }

    public ReverseNotificationFeed(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void onChange(Consumer<List<ReverseNotification>> listener) {
        listeners.add(listener);
    }

    /**
     * Parse and keep one message. Malformed messages are skipped.
     *
     * @return true if the message was kept
     */
    public synchronized boolean onMessage(String json, Instant timestamp) {
        ReverseNotification notification;
        try {
            notification = parse(json, timestamp);
        } catch (IOException e) {
            log.debug("Skipping malformed reverse notification: {}", e.getMessage());
            return false;
        }
        if (notification == null) {
            return false;
        }
        messages.addFirst(notification);
        if (messages.size() > capacity) {
            messages.removeLast();
        }
        return true;
    }

    /**
     * Publish the list if its length or newest entry changed, or if nothing was published yet.
     *
     * @return true if observers were notified
     */
    public synchronized boolean flush() {
        if (published != null && !changedSincePublished()) {
            return false;
        }
        published = List.copyOf(messages);
        for (Consumer<List<ReverseNotification>> listener : listeners) {
            try {
                listener.accept(published);
            } catch (RuntimeException e) {
                log.error("Reverse notification observer failed", e);
            }
        }
        return true;
    }

    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fuzzdeck-reverse-feed");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                flush();
            } catch (Exception e) {
                log.error("Error publishing reverse notifications", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * @return the current list, newest first
     */
    public synchronized List<ReverseNotification> current() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    private boolean changedSincePublished() {
        if (published.size() != messages.size()) {
            return true;
        }
        if (messages.isEmpty()) {
            return false;
        }
        return !published.get(0).uuid().equals(messages.peekFirst().uuid());
    }

    private ReverseNotification parse(String json, Instant timestamp) throws IOException {
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonNode node = objectMapper.readTree(json);
        if (node == null || !node.isObject() || !node.hasNonNull("uuid")) {
            log.debug("Skipping reverse notification without uuid");
            return null;
        }
        JsonNode raw = node.get("raw");
        byte[] rawBytes = raw != null && raw.isTextual() ? raw.binaryValue() : null;
        return new ReverseNotification(
                node.get("uuid").asText(),
                node.path("type").asText(""),
                node.path("remote_addr").asText(""),
                rawBytes,
                node.path("token").asText(""),
                timestamp);
    }
}
