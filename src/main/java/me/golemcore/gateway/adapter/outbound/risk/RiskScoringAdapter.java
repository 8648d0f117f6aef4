package me.golemcore.gateway.adapter.outbound.risk;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Request;
import feign.RequestLine;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CollaboratorException;
import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.RiskAssessment;
import me.golemcore.gateway.domain.model.RiskLevel;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.http.FeignClientFactory;
import me.golemcore.gateway.port.outbound.RiskAssessmentPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Risk-scoring adapter - calls the risk service over HTTP through Feign.
 *
 * <p>
 * Endpoint: {@code POST /v1/risk-score} with {@code {prompt, metadata}},
 * answering {@code {sanitized_prompt, risk_level, flags, self_check_required}}.
 *
 * <p>
 * Each call is bounded by the shorter of {@code gateway.risk.timeout} and the
 * remaining request deadline. Transport errors, timeouts, non-2xx statuses and
 * undecodable bodies all surface as {@link CollaboratorException}; nothing is
 * retried. An unknown {@code risk_level} is read as HIGH.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code gateway.risk.url} - risk service base URL</li>
 * <li>{@code gateway.risk.timeout} - per-call budget</li>
 * </ul>
 *
 * @see RiskAssessmentPort
 */
@Component
@Slf4j
public class RiskScoringAdapter implements RiskAssessmentPort {

    private final FeignClientFactory feignClientFactory;
    private final RiskScoringApi api;
    private final Duration timeout;

    public RiskScoringAdapter(GatewayProperties properties, FeignClientFactory feignClientFactory) {
        this.feignClientFactory = feignClientFactory;
        this.api = feignClientFactory.create(RiskScoringApi.class, properties.getRisk().getUrl());
        this.timeout = properties.getRisk().getTimeout();
    }

    @Override
    public RiskAssessment assess(String text, Map<String, String> metadata, Deadline deadline) {
        if (deadline.isExpired()) {
            throw new CollaboratorException("Deadline expired before risk scoring");
        }

        RiskScoreResponse response;
        try {
            response = api.score(new RiskScoreRequest(text != null ? text : "", metadata),
                    feignClientFactory.optionsFor(deadline.cap(timeout)));
        } catch (FeignException e) {
            log.warn("[Risk] Call failed: status={}, error={}", e.status(), e.getClass().getSimpleName());
            throw new CollaboratorException("Risk service call failed (status " + e.status() + ")", e);
        } catch (RuntimeException e) {
            log.warn("[Risk] Call error: {}", e.getMessage());
            throw new CollaboratorException("Risk service call failed", e);
        }

        if (response == null) {
            throw new CollaboratorException("Risk service returned an empty body");
        }
        return toAssessment(response);
    }

    private RiskAssessment toAssessment(RiskScoreResponse response) {
        List<String> flags = response.flags() != null ? response.flags() : List.of();
        return RiskAssessment.builder()
                .sanitizedPrompt(response.sanitizedPrompt())
                .riskLevel(RiskLevel.fromWire(response.riskLevel()))
                .flags(flags.stream().filter(Objects::nonNull).toList())
                .selfCheckRequired(Boolean.TRUE.equals(response.selfCheckRequired()))
                .build();
    }

    // Feign API interface
    interface RiskScoringApi {
        @RequestLine("POST /v1/risk-score")
        @Headers("Content-Type: application/json")
        RiskScoreResponse score(RiskScoreRequest request, Request.Options options);
    }

    record RiskScoreRequest(String prompt, Map<String, String> metadata) {
    }

    record RiskScoreResponse(
            @JsonProperty("sanitized_prompt") String sanitizedPrompt,
            @JsonProperty("risk_level") String riskLevel,
            @JsonProperty("flags") List<String> flags,
            @JsonProperty("self_check_required") Boolean selfCheckRequired) {
    }
}
