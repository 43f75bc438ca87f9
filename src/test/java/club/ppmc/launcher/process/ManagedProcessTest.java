package club.ppmc.launcher.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.launcher.exception.SpawnFailureException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManagedProcessTest {

    @TempDir
    Path workDir;

    @Test
    void spawn_runsCommandWithEnvironmentAndReportsExitCode() throws Exception {
        var process = new ManagedProcess(new DefaultProcessLauncher());

        process.spawn(List.of("sh", "-c", "echo \"$GREETING\"; exit 3"), Map.of("GREETING", "hello-env"), workDir);

        assertThat(process.onExit().get(10, TimeUnit.SECONDS)).isEqualTo(3);
        assertThat(new String(process.stdout().readAllBytes(), StandardCharsets.UTF_8).strip()).isEqualTo("hello-env");
        assertThat(process.exitCode()).hasValue(3);
        assertThat(process.isAlive()).isFalse();
        assertThat(process.startedAt()).isNotNull();
    }

    @Test
    void spawn_missingExecutable_throwsSpawnFailure() {
        var process = new ManagedProcess(new DefaultProcessLauncher());

        assertThatThrownBy(() -> process.spawn(List.of("/nonexistent/launcher-binary"), Map.of(), workDir))
                .isInstanceOf(SpawnFailureException.class)
                .satisfies(e -> assertThat(((SpawnFailureException) e).getType()).isEqualTo("SPAWN_FAILURE"));
        assertThat(process.isAlive()).isFalse();
    }

    @Test
    void spawn_environmentValueWithNul_throwsSpawnFailure() {
        var process = new ManagedProcess(new DefaultProcessLauncher());

        assertThatThrownBy(() -> process.spawn(List.of("sh", "-c", "exit 0"), Map.of("K", "a\u0000b"), workDir))
                .isInstanceOf(SpawnFailureException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void spawn_twice_isRejected() throws Exception {
        var process = new ManagedProcess(new DefaultProcessLauncher());
        process.spawn(List.of("sh", "-c", "exit 0"), Map.of(), workDir);

        assertThatThrownBy(() -> process.spawn(List.of("sh", "-c", "exit 0"), Map.of(), workDir))
                .isInstanceOf(IllegalStateException.class);
        process.awaitExit();
    }

    @Test
    void terminate_stopsProcessAndIsIdempotent() throws Exception {
        var process = new ManagedProcess(new DefaultProcessLauncher());
        process.spawn(List.of("sh", "-c", "sleep 30"), Map.of(), workDir);

        assertThat(process.terminate()).isTrue();
        assertThat(process.terminate()).isFalse();

        process.onExit().get(10, TimeUnit.SECONDS);
        assertThat(process.isAlive()).isFalse();
        assertThat(process.kill()).isFalse();
    }

    @Test
    void kill_endsProcessIgnoringTerm() throws Exception {
        var process = new ManagedProcess(new DefaultProcessLauncher());
        process.spawn(List.of("sh", "-c", "trap '' TERM; while true; do sleep 0.1; done"), Map.of(), workDir);
        Thread.sleep(200);

        process.terminate();
        assertThat(process.kill()).isTrue();

        process.onExit().get(10, TimeUnit.SECONDS);
        assertThat(process.exitCode()).isPresent();
    }

    @Test
    void accessors_beforeSpawn_areRejected() {
        var process = new ManagedProcess(new DefaultProcessLauncher());

        assertThat(process.isAlive()).isFalse();
        assertThat(process.exitCode()).isEmpty();
        assertThatThrownBy(process::pid).isInstanceOf(IllegalStateException.class);
    }
}
