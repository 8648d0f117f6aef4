package me.golemcore.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link RiskProperties} - risk-scoring collaborator</li>
 * <li>{@link SafetyProperties} - output-safety collaborator</li>
 * <li>{@link ScanProperties} - external content taint scanning</li>
 * <li>{@link SandboxProperties} - isolated execution environment</li>
 * <li>{@link SecurityProperties} - inbound request limits</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    /** End-to-end budget of a single mediation. */
    private Duration requestTimeout = Duration.ofSeconds(30);

    private RiskProperties risk = new RiskProperties();
    private SafetyProperties safety = new SafetyProperties();
    private ScanProperties scan = new ScanProperties();
    private SandboxProperties sandbox = new SandboxProperties();
    private SecurityProperties security = new SecurityProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class RiskProperties {
        private String url = "http://localhost:8001";
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class SafetyProperties {
        private String url = "http://localhost:8002";
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class ScanProperties {
        private int parallelism = 8;
    }

    // ==================== SANDBOX ====================

    @Data
    public static class SandboxProperties {
        private String dockerBinary = "docker";
        private String image = "gateway-llm-sandbox:latest";
        private Duration timeout = Duration.ofSeconds(15);
        private String mountPath = "/app/input";
        private String memoryLimit = "512m";
        private int pidsLimit = 64;
        private int maxOutputLength = 100_000;
        private String allowedEnvVars = "";
    }

    @Data
    public static class SecurityProperties {
        private int maxMessageLength = 20_000;
        private int maxExternalItems = 32;
        private int maxExternalContentLength = 100_000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 2000;
        private long readTimeout = 10000;
        private long writeTimeout = 10000;
        private int maxIdleConnections = 10;
        private long keepAliveDuration = 300000;
    }
}
