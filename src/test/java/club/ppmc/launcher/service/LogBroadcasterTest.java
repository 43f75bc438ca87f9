package club.ppmc.launcher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import club.ppmc.launcher.model.LogLevel;
import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.LogStream;
import club.ppmc.launcher.model.ObserverSession;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class LogBroadcasterTest {

    @Test
    void subscribe_receivesReplayThenLive() {
        var broadcaster = new LogBroadcaster(3, 100);
        broadcaster.beginRun("run-1");
        for (long seq = 1; seq <= 5; seq++) {
            broadcaster.publish(record(seq));
        }

        ObserverSession session = broadcaster.subscribe("s1/sub-0", "s1", "user");
        broadcaster.publish(record(6));

        // 回放缓冲区只保留最近 3 条
        assertThat(session.drain(100)).extracting(LogRecord::sequence).containsExactly(3L, 4L, 5L, 6L);
    }

    @Test
    void beginRun_clearsReplayBuffer() {
        var broadcaster = new LogBroadcaster(10, 100);
        broadcaster.publish(record(1));

        broadcaster.beginRun("run-2");

        assertThat(broadcaster.replaySnapshot()).isEmpty();
    }

    @Test
    void publish_withSaturatedObserver_neverBlocks() {
        var broadcaster = new LogBroadcaster(200, 10);
        ObserverSession stalled = broadcaster.subscribe("slow/sub-0", "slow", "slow-user");
        ObserverSession healthy = broadcaster.subscribe("fast/sub-0", "fast", "fast-user");

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            for (long seq = 1; seq <= 100_000; seq++) {
                broadcaster.publish(record(seq));
                if (seq % 5 == 0) {
                    healthy.drain(100);
                }
            }
        });

        assertThat(stalled.getPendingCount()).isEqualTo(10);
        assertThat(stalled.getDroppedCount()).isEqualTo(99_990);
        assertThat(stalled.drain(100)).extracting(LogRecord::sequence).first().isEqualTo(99_991L);
        assertThat(healthy.getDroppedCount()).isZero();
    }

    @Test
    void unsubscribe_isIdempotent() {
        var broadcaster = new LogBroadcaster(10, 10);
        ObserverSession session = broadcaster.subscribe("s1/sub-0", "s1", "user");

        assertThat(broadcaster.unsubscribe("s1/sub-0")).isTrue();
        assertThat(broadcaster.unsubscribe("s1/sub-0")).isFalse();
        assertThat(broadcaster.unsubscribe("unknown")).isFalse();
        assertThat(session.isClosed()).isTrue();
        assertThat(broadcaster.sessions()).isEmpty();
    }

    @Test
    void unsubscribeConnection_removesAllSessionsOfThatConnection() {
        var broadcaster = new LogBroadcaster(10, 10);
        broadcaster.subscribe("s1/sub-0", "s1", "user-1");
        broadcaster.subscribe("s1/sub-1", "s1", "user-1");
        broadcaster.subscribe("s2/sub-0", "s2", "user-2");

        assertThat(broadcaster.unsubscribeConnection("s1")).isEqualTo(2);
        assertThat(broadcaster.sessions()).extracting(ObserverSession::getId).containsExactly("s2/sub-0");
    }

    @Test
    void subscribe_sameId_replacesPreviousSession() {
        var broadcaster = new LogBroadcaster(10, 10);
        ObserverSession first = broadcaster.subscribe("s1/sub-0", "s1", "user");

        ObserverSession second = broadcaster.subscribe("s1/sub-0", "s1", "user");

        assertThat(first.isClosed()).isTrue();
        assertThat(broadcaster.sessions()).containsExactly(second);
    }

    private static LogRecord record(long sequence) {
        return new LogRecord("run-1", sequence, Instant.now(), LogLevel.INFO, LogStream.STDOUT, "line " + sequence);
    }
}
