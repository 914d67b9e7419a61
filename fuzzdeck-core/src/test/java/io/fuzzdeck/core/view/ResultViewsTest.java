package io.fuzzdeck.core.view;

import io.fuzzdeck.api.result.PartitionedResults;
import io.fuzzdeck.api.result.ResultRecord;
import io.fuzzdeck.api.result.ResultSnapshot;
import io.fuzzdeck.api.session.SessionToken;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static io.fuzzdeck.core.ResultFixtures.failed;
import static io.fuzzdeck.core.ResultFixtures.ok;
import static org.assertj.core.api.Assertions.assertThat;

class ResultViewsTest {

    private static ResultSnapshot snapshotOf(ResultRecord... records) {
        return new ResultSnapshot(SessionToken.generate(), List.of(records), Instant.now());
    }

    // --- partition ---

    @Test
    void shouldPartitionByOutcomePreservingOrder() {
        ResultRecord first = ok("1");
        ResultRecord second = failed("2");
        ResultRecord third = ok("3");

        PartitionedResults parts = ResultViews.partition(snapshotOf(first, second, third));

        assertThat(parts.succeeded()).containsExactly(first, third);
        assertThat(parts.failed()).containsExactly(second);
        assertThat(parts.total()).isEqualTo(3);
    }

    @Test
    void shouldPartitionEmptySnapshot() {
        PartitionedResults parts = ResultViews.partition(ResultSnapshot.empty());

        assertThat(parts.succeeded()).isEmpty();
        assertThat(parts.failed()).isEmpty();
    }

    // --- search ---

    @Test
    void shouldReturnSnapshotUnfilteredForEmptySearch() {
        ResultSnapshot snapshot = snapshotOf(ok("1"), failed("2"));

        assertThat(ResultViews.search(snapshot, "")).isSameAs(snapshot);
        assertThat(ResultViews.search(snapshot, null)).isSameAs(snapshot);
    }

    @Test
    void shouldMatchSubstringCaseSensitively() {
        ResultRecord admin = ok("1", "HTTP/1.1 200 OK\r\n\r\nwelcome Admin");
        ResultRecord denied = ok("2", "HTTP/1.1 403 Forbidden\r\n\r\naccess denied");
        ResultSnapshot snapshot = snapshotOf(admin, denied);

        assertThat(ResultViews.search(snapshot, "Admin").records()).containsExactly(admin);
        assertThat(ResultViews.search(snapshot, "admin").records()).isEmpty();
        assertThat(ResultViews.search(snapshot, "HTTP/1.1").records()).containsExactly(admin, denied);
    }

    @Test
    void shouldNotMutateSnapshot() {
        ResultSnapshot snapshot = snapshotOf(ok("1", "abc"), ok("2", "xyz"));

        ResultViews.search(snapshot, "abc");
        ResultViews.partition(snapshot);

        assertThat(snapshot.size()).isEqualTo(2);
    }

    @Test
    void shouldDecodeUsingEncodingHint() {
        Charset gbk = Charset.forName("GBK");
        ResultRecord record = ResultRecord.builder("1")
                .succeeded(200)
                .response("登录成功".getBytes(gbk))
                .responseEncoding("GBK")
                .build();

        assertThat(ResultViews.decodeResponse(record)).contains("登录成功");
        assertThat(ResultViews.search(snapshotOf(record), "成功").records()).containsExactly(record);
    }

    @Test
    void shouldNotMatchUndecodableResponse() {
        ResultRecord broken = ResultRecord.builder("1")
                .succeeded(200)
                .response(new byte[]{'o', 'k', (byte) 0xC3, (byte) 0x28})
                .responseEncoding("UTF-8")
                .build();

        assertThat(ResultViews.decodeResponse(broken)).isEmpty();
        assertThat(ResultViews.search(snapshotOf(broken), "ok").records()).isEmpty();
        assertThat(broken.ok()).isTrue();
    }

    @Test
    void shouldFallBackToUtf8ForUnknownHint() {
        assertThat(ResultViews.charsetFor("no-such-charset")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(ResultViews.charsetFor("bad charset name!")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(ResultViews.charsetFor(" ")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(ResultViews.charsetFor("ISO-8859-1")).isEqualTo(StandardCharsets.ISO_8859_1);
    }

    @Test
    void shouldComposeSearchAndPartition() {
        ResultRecord hit = ok("1", "token=abc");
        ResultRecord miss = ok("2", "nothing");
        ResultRecord failedHit = ResultRecord.builder("3")
                .failed("connection reset")
                .response("token=abc".getBytes(StandardCharsets.UTF_8))
                .build();

        PartitionedResults view = ResultViews.partition(
                ResultViews.search(snapshotOf(hit, miss, failedHit), "token="));

        assertThat(view.succeeded()).containsExactly(hit);
        assertThat(view.failed()).containsExactly(failedHit);
    }
}
