package me.golemcore.gateway.adapter.outbound.sandbox;

import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.DispatchException;
import me.golemcore.gateway.domain.model.DispatchFailureKind;
import me.golemcore.gateway.domain.model.SandboxPrompt;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class DockerSandboxAdapterTest {

    private static final SandboxPrompt PROMPT = new SandboxPrompt("SYSTEM RULES", "User request:\nhello");

    @TempDir
    Path tempDir;

    private GatewayProperties properties;
    private DockerSandboxAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getSandbox().setTimeout(Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        if (adapter != null) {
            adapter.shutdown();
        }
    }

    private static Deadline deadline() {
        return Deadline.after(Clock.systemUTC(), Duration.ofSeconds(30));
    }

    private void installFakeDocker(String body) throws IOException {
        Path script = tempDir.resolve("docker");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        properties.getSandbox().setDockerBinary(script.toString());
        adapter = new DockerSandboxAdapter(properties);
    }

    private String mountDirScript() {
        return """
                if [ "$1" = "rm" ]; then exit 0; fi
                echo "$@" > %s
                prev=""
                for arg in "$@"; do
                  if [ "$prev" = "-v" ]; then mount="$arg"; fi
                  prev="$arg"
                done
                dir="${mount%%%%:*}"
                echo "$dir" > %s
                """.formatted(tempDir.resolve("args.txt"), tempDir.resolve("dir.txt"));
    }

    @Test
    void shouldReturnStdoutOfSandbox() throws IOException {
        installFakeDocker(mountDirScript() + """
                printf 'system=%s;' "$(cat "$dir/system.txt")"
                cat "$dir/user.txt"
                """);

        String answer = adapter.execute(PROMPT, deadline());

        assertEquals("system=SYSTEM RULES;User request:\nhello", answer);
    }

    @Test
    void shouldRunIsolatedContainerWithReadOnlyMount() throws IOException {
        installFakeDocker(mountDirScript() + "echo ok");

        adapter.execute(PROMPT, deadline());

        String args = Files.readString(tempDir.resolve("args.txt")).trim();
        assertTrue(args.startsWith("run --rm --name " + DockerSandboxAdapter.CONTAINER_PREFIX));
        assertTrue(args.contains("--network none"));
        assertTrue(args.contains("--read-only"));
        assertTrue(args.contains(":/app/input:ro"));
        assertTrue(args.endsWith("gateway-llm-sandbox:latest"));
    }

    @Test
    void shouldDeleteInputDirectoryAfterRun() throws IOException {
        installFakeDocker(mountDirScript() + "echo ok");

        adapter.execute(PROMPT, deadline());

        Path inputDir = Path.of(Files.readString(tempDir.resolve("dir.txt")).trim());
        assertTrue(inputDir.getFileName().toString().startsWith("gateway-llm-input-"));
        assertFalse(Files.exists(inputDir));
    }

    @Test
    void shouldFailOnNonZeroExitAndKeepStderrAsDiagnostics() throws IOException {
        installFakeDocker(mountDirScript() + """
                echo "model crashed" >&2
                exit 3
                """);

        DispatchException ex = assertThrows(DispatchException.class, () -> adapter.execute(PROMPT, deadline()));

        assertEquals(DispatchFailureKind.EXECUTION_FAILURE, ex.getKind());
        assertEquals("Sandbox exited with code 3", ex.getMessage());
        assertTrue(ex.getDiagnostics().contains("model crashed"));
        Path inputDir = Path.of(Files.readString(tempDir.resolve("dir.txt")).trim());
        assertFalse(Files.exists(inputDir));
    }

    @Test
    void shouldTimeOutAndForceRemoveContainer() throws IOException {
        Path rmLog = tempDir.resolve("rm.txt");
        installFakeDocker("""
                if [ "$1" = "rm" ]; then echo "$@" > %s; exit 0; fi
                exec sleep 30
                """.formatted(rmLog));
        properties.getSandbox().setTimeout(Duration.ofMillis(300));

        DispatchException ex = assertThrows(DispatchException.class, () -> adapter.execute(PROMPT, deadline()));

        assertEquals(DispatchFailureKind.TIMEOUT, ex.getKind());
        assertTrue(Files.readString(rmLog).startsWith("rm -f " + DockerSandboxAdapter.CONTAINER_PREFIX));
    }

    @Test
    void shouldTruncateOversizedOutput() throws IOException {
        installFakeDocker(mountDirScript() + "printf '%0200d' 0");
        properties.getSandbox().setMaxOutputLength(10);

        String answer = adapter.execute(PROMPT, deadline());

        assertTrue(answer.startsWith("0000000000\n[Output truncated...]"));
    }

    @Test
    void shouldFailWhenDockerBinaryMissing() {
        properties.getSandbox().setDockerBinary(tempDir.resolve("missing-docker").toString());
        adapter = new DockerSandboxAdapter(properties);

        DispatchException ex = assertThrows(DispatchException.class, () -> adapter.execute(PROMPT, deadline()));

        assertEquals(DispatchFailureKind.EXECUTION_FAILURE, ex.getKind());
    }

    @Test
    void shouldNotStartWhenDeadlineExpired() throws IOException {
        installFakeDocker("echo \"$@\" > " + tempDir.resolve("args.txt"));
        Deadline expired = Deadline.after(Clock.systemUTC(), Duration.ZERO);

        DispatchException ex = assertThrows(DispatchException.class, () -> adapter.execute(PROMPT, expired));

        assertEquals(DispatchFailureKind.TIMEOUT, ex.getKind());
        assertFalse(Files.exists(tempDir.resolve("args.txt")));
    }

    @Test
    void shouldBuildHardenedCommand() {
        adapter = new DockerSandboxAdapter(properties);

        List<String> command = adapter.buildCommand(Path.of("/tmp/input"), "gateway-sandbox-1");

        assertEquals(List.of("docker", "run", "--rm", "--name", "gateway-sandbox-1",
                "--network", "none", "--read-only", "--cap-drop", "ALL",
                "--security-opt", "no-new-privileges", "--pids-limit", "64", "--memory", "512m",
                "-v", "/tmp/input:/app/input:ro", "gateway-llm-sandbox:latest"), command);
    }
}
