package me.golemcore.gateway.adapter.outbound.sandbox;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.DispatchException;
import me.golemcore.gateway.domain.model.DispatchFailureKind;
import me.golemcore.gateway.domain.model.SandboxPrompt;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.IsolatedExecutionPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the prompt pair in a throwaway Docker container.
 *
 * <p>
 * For every call:
 * <ol>
 * <li>a private temp directory receives {@code system.txt} and
 * {@code user.txt}</li>
 * <li>{@code docker run --rm} starts a uniquely named container with networking
 * disabled, a read-only root filesystem, all capabilities dropped, pid and
 * memory limits, and the temp directory mounted read-only</li>
 * <li>stdout becomes the answer, stderr is kept as diagnostics</li>
 * <li>the temp directory is deleted, whatever happened</li>
 * </ol>
 *
 * <p>
 * The wait is bounded by the shorter of {@code gateway.sandbox.timeout} and the
 * remaining request deadline. On expiry the docker client is killed and the
 * container is force-removed, so nothing keeps running after the request is
 * gone. Nothing is retried.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code gateway.sandbox.docker-binary} - docker executable</li>
 * <li>{@code gateway.sandbox.image} - sandbox image</li>
 * <li>{@code gateway.sandbox.timeout} - execution budget</li>
 * <li>{@code gateway.sandbox.mount-path} - read-only mount point in the
 * container</li>
 * <li>{@code gateway.sandbox.memory-limit}, {@code gateway.sandbox.pids-limit}
 * - resource limits</li>
 * <li>{@code gateway.sandbox.max-output-length} - output truncation</li>
 * </ul>
 */
@Component
@Slf4j
public class DockerSandboxAdapter implements IsolatedExecutionPort {

    static final String SYSTEM_FILE = "system.txt";
    static final String USER_FILE = "user.txt";
    static final String CONTAINER_PREFIX = "gateway-sandbox-";

    private static final String TRUNCATION_MARKER = "\n[Output truncated...]";
    private static final long STREAM_DRAIN_TIMEOUT_MS = 2000;
    private static final long REMOVE_TIMEOUT_SECONDS = 10;

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "TZ", "TMPDIR", "HOME",
            "DOCKER_HOST", "DOCKER_CONFIG", "DOCKER_CONTEXT", "DOCKER_CERT_PATH", "DOCKER_TLS_VERIFY");

    private final GatewayProperties.SandboxProperties config;
    private final Set<String> allowedEnvVars;
    private final ExecutorService streamExecutor;

    public DockerSandboxAdapter(GatewayProperties properties) {
        this.config = properties.getSandbox();
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.streamExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "sandbox-stream");
            thread.setDaemon(true);
            return thread;
        });
        log.info("[Sandbox] Using image {} via {}", config.getImage(), config.getDockerBinary());
    }

    @PreDestroy
    public void shutdown() {
        streamExecutor.shutdownNow();
        try {
            if (!streamExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Sandbox] Stream executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String execute(SandboxPrompt prompt, Deadline deadline) {
        Duration budget = deadline.cap(config.getTimeout());
        if (budget.isZero()) {
            throw DispatchException.timeout("No time left for isolated execution");
        }

        Path inputDir = null;
        try {
            inputDir = prepareInput(prompt);
            return run(inputDir, budget);
        } finally {
            deleteInput(inputDir);
        }
    }

    private Path prepareInput(SandboxPrompt prompt) {
        try {
            Path dir;
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                dir = Files.createTempDirectory("gateway-llm-input-",
                        PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
            } else {
                dir = Files.createTempDirectory("gateway-llm-input-");
            }
            writePrivate(dir.resolve(SYSTEM_FILE), prompt.systemPrompt());
            writePrivate(dir.resolve(USER_FILE), prompt.userContent());
            return dir;
        } catch (IOException e) {
            throw new DispatchException(DispatchFailureKind.EXECUTION_FAILURE,
                    "Failed to prepare sandbox input", e.getMessage(), e);
        }
    }

    private void writePrivate(Path file, String content) throws IOException {
        Files.writeString(file, content != null ? content : "", StandardCharsets.UTF_8);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }

    private String run(Path inputDir, Duration budget) {
        String containerName = CONTAINER_PREFIX + UUID.randomUUID();
        List<String> command = buildCommand(inputDir, containerName);

        ProcessBuilder pb = new ProcessBuilder(command);
        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new DispatchException(DispatchFailureKind.EXECUTION_FAILURE,
                    "Failed to start sandbox", e.getMessage(), e);
        }
        log.debug("[Sandbox] Started container {} (budget={}ms)", containerName, budget.toMillis());

        Future<String> stdout = streamExecutor.submit(() -> readLimited(process.getInputStream()));
        Future<String> stderr = streamExecutor.submit(() -> readLimited(process.getErrorStream()));

        boolean completed;
        try {
            completed = process.waitFor(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tearDown(process, containerName, stdout, stderr);
            throw DispatchException.timeout("Interrupted while waiting for sandbox");
        }

        if (!completed) {
            tearDown(process, containerName, stdout, stderr);
            log.warn("[Sandbox] Container {} timed out after {}ms", containerName, budget.toMillis());
            throw DispatchException.timeout("Sandbox timed out after " + budget.toMillis() + "ms");
        }

        String errorOutput = collect(stderr, "");
        int exitCode = process.exitValue();
        long duration = System.currentTimeMillis() - startTime;
        log.info("[Sandbox] Container {} finished: exitCode={}, duration={}ms", containerName, exitCode, duration);

        if (exitCode != 0) {
            stdout.cancel(true);
            throw DispatchException.failure("Sandbox exited with code " + exitCode, errorOutput);
        }
        String output = collect(stdout, null);
        if (output == null) {
            throw DispatchException.failure("Failed to read sandbox output", errorOutput);
        }
        if (!errorOutput.isBlank()) {
            log.debug("[Sandbox] stderr ({} chars) captured for diagnostics", errorOutput.length());
        }
        return output;
    }

    List<String> buildCommand(Path inputDir, String containerName) {
        String volume = normalizeHostPath(inputDir.toAbsolutePath().toString()) + ":" + config.getMountPath() + ":ro";

        List<String> command = new ArrayList<>();
        command.add(config.getDockerBinary());
        command.add("run");
        command.add("--rm");
        command.addAll(List.of("--name", containerName));
        command.addAll(List.of("--network", "none"));
        command.add("--read-only");
        command.addAll(List.of("--cap-drop", "ALL"));
        command.addAll(List.of("--security-opt", "no-new-privileges"));
        if (config.getPidsLimit() > 0) {
            command.addAll(List.of("--pids-limit", String.valueOf(config.getPidsLimit())));
        }
        if (config.getMemoryLimit() != null && !config.getMemoryLimit().isBlank()) {
            command.addAll(List.of("--memory", config.getMemoryLimit()));
        }
        command.addAll(List.of("-v", volume));
        command.add(config.getImage());
        return command;
    }

    /**
     * Docker Desktop on Windows expects forward slashes in host paths.
     */
    static String normalizeHostPath(String path) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return path.replace('\\', '/');
        }
        return path;
    }

    private String readLimited(InputStream stream) throws IOException {
        int limit = config.getMaxOutputLength();
        StringBuilder output = new StringBuilder();
        boolean truncated = false;
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read = reader.read(buffer);
            while (read != -1) {
                int room = limit - output.length();
                if (room > 0) {
                    output.append(buffer, 0, Math.min(room, read));
                }
                if (read > room) {
                    truncated = true;
                }
                read = reader.read(buffer);
            }
        }
        if (truncated) {
            output.append(TRUNCATION_MARKER);
        }
        return output.toString();
    }

    private String collect(Future<String> future, String fallback) {
        try {
            return future.get(STREAM_DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fallback;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Sandbox] Failed to read process stream: {}", e.getMessage());
            future.cancel(true);
            return fallback;
        }
    }

    private void tearDown(Process process, String containerName, Future<String> stdout, Future<String> stderr) {
        process.destroyForcibly();
        stdout.cancel(true);
        stderr.cancel(true);
        removeContainer(containerName);
    }

    private void removeContainer(String containerName) {
        ProcessBuilder pb = new ProcessBuilder(config.getDockerBinary(), "rm", "-f", containerName);
        pb.environment().keySet().retainAll(allowedEnvVars);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        try {
            Process remover = pb.start();
            if (!remover.waitFor(REMOVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                remover.destroyForcibly();
                log.warn("[Sandbox] Timed out force-removing container {}", containerName);
            } else if (remover.exitValue() != 0) {
                log.warn("[Sandbox] Force-removing container {} exited with {}", containerName,
                        remover.exitValue());
            }
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to force-remove container {}: {}", containerName, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Sandbox] Interrupted while force-removing container {}", containerName);
        }
    }

    private void deleteInput(Path inputDir) {
        if (inputDir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(inputDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to delete sandbox input {}: {}", inputDir, e.getMessage());
        }
    }

    private static Set<String> buildAllowedEnvVars(String configValue) {
        if (configValue == null || configValue.isBlank()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        Set<String> custom = Arrays.stream(configValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        merged.addAll(custom);
        return Collections.unmodifiableSet(merged);
    }
}
