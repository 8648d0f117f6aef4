package me.golemcore.gateway;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the prompt-isolation mediation gateway.
 *
 * <p>
 * The gateway sits in front of an isolated LLM execution environment and two
 * policy services. Every chat request is risk-scored, its external content is
 * taint-scanned, the prompt is split into a fixed policy channel and a masked
 * data channel, the model runs in a throwaway network-less container, and the
 * draft answer passes an output-safety review before it is returned.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ChatController
 * Domain Layer       → MediationOrchestrator, TaintScanner, PathPolicy,
 *                      PromptIsolationBuilder, SensitiveDataMasker
 * Infrastructure     → Risk / Output-safety (Feign + OkHttp), Docker sandbox
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code gateway.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }

}
