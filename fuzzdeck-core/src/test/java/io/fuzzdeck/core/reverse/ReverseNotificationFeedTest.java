package io.fuzzdeck.core.reverse;

import io.fuzzdeck.api.reverse.ReverseNotification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ReverseNotificationFeedTest {

    private final ReverseNotificationFeed feed = new ReverseNotificationFeed(3);
    private final List<List<ReverseNotification>> published = new CopyOnWriteArrayList<>();

    {
        feed.onChange(published::add);
    }

    @AfterEach
    void tearDown() {
        feed.stop();
    }

    private static String message(String uuid) {
        return "{\"uuid\":\"" + uuid + "\",\"type\":\"http\",\"remote_addr\":\"10.0.0.1:5555\",\"token\":\"t\"}";
    }

    // --- Ingest ---

    @Test
    void shouldKeepNewestFirst() {
        feed.onMessage(message("a"), Instant.now());
        feed.onMessage(message("b"), Instant.now());

        assertThat(feed.current()).extracting(ReverseNotification::uuid).containsExactly("b", "a");
    }

    @Test
    void shouldDropOldestBeyondCapacity() {
        for (String uuid : List.of("a", "b", "c", "d")) {
            feed.onMessage(message(uuid), Instant.now());
        }

        assertThat(feed.size()).isEqualTo(3);
        assertThat(feed.current()).extracting(ReverseNotification::uuid).containsExactly("d", "c", "b");
    }

    @Test
    void shouldParseFields() {
        String raw = Base64.getEncoder().encodeToString("GET /x HTTP/1.1".getBytes(StandardCharsets.UTF_8));
        Instant at = Instant.parse("2024-05-01T10:15:30Z");

        feed.onMessage("{\"uuid\":\"u1\",\"type\":\"dnslog\",\"remote_addr\":\"8.8.8.8:53\",\"raw\":\""
                + raw + "\",\"token\":\"abc\"}", at);

        ReverseNotification n = feed.current().get(0);
        assertThat(n.type()).isEqualTo("dnslog");
        assertThat(n.remoteAddr()).isEqualTo("8.8.8.8:53");
        assertThat(n.token()).isEqualTo("abc");
        assertThat(new String(n.raw(), StandardCharsets.UTF_8)).isEqualTo("GET /x HTTP/1.1");
        assertThat(n.timestamp()).isEqualTo(at);
    }

    @Test
    void shouldSkipMalformedMessages() {
        assertThat(feed.onMessage("{broken", Instant.now())).isFalse();
        assertThat(feed.onMessage("{\"type\":\"http\"}", Instant.now())).isFalse();
        assertThat(feed.onMessage("[1,2]", Instant.now())).isFalse();
        assertThat(feed.onMessage("", Instant.now())).isFalse();
        assertThat(feed.onMessage(null, Instant.now())).isFalse();

        assertThat(feed.size()).isZero();
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new ReverseNotificationFeed(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // --- Publication ---

    @Test
    void shouldPublishOnlyWhenChanged() {
        assertThat(feed.flush()).isTrue();
        assertThat(feed.flush()).isFalse();

        feed.onMessage(message("a"), Instant.now());
        assertThat(feed.flush()).isTrue();
        assertThat(feed.flush()).isFalse();

        assertThat(published).hasSize(2);
        assertThat(published.get(1)).extracting(ReverseNotification::uuid).containsExactly("a");
    }

    @Test
    void shouldPublishWhenNewestChangesAtCapacity() {
        for (String uuid : List.of("a", "b", "c")) {
            feed.onMessage(message(uuid), Instant.now());
        }
        feed.flush();

        feed.onMessage(message("d"), Instant.now());

        assertThat(feed.flush()).isTrue();
        assertThat(published.get(published.size() - 1).get(0).uuid()).isEqualTo("d");
    }

    @Test
    void shouldPublishOnCadence() {
        feed.start(Duration.ofMillis(50));

        feed.onMessage(message("a"), Instant.now());

        await().atMost(Duration.ofSeconds(2))
                .until(() -> !published.isEmpty() && published.get(published.size() - 1).size() == 1);
    }
}
