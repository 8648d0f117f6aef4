package me.golemcore.gateway.adapter.outbound.safety;

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
import me.golemcore.gateway.domain.model.HandlingPath;
import me.golemcore.gateway.domain.model.RiskLevel;
import me.golemcore.gateway.domain.model.SafetyReview;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.http.FeignClientFactory;
import me.golemcore.gateway.port.outbound.OutputSafetyPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Output-safety adapter - sends the draft answer to the output-safety service
 * for the final review.
 *
 * <p>
 * Endpoint: {@code POST /v1/output-safety} with
 * {@code {user_prompt, draft_answer, risk_level, flags, mode}}, answering
 * {@code {final_answer, was_modified, reason_flags}}. A response without
 * {@code final_answer} is treated as a failure so that an unreviewed draft is
 * never returned.
 *
 * @see OutputSafetyPort
 */
@Component
@Slf4j
public class OutputSafetyAdapter implements OutputSafetyPort {

    private final FeignClientFactory feignClientFactory;
    private final OutputSafetyApi api;
    private final Duration timeout;

    public OutputSafetyAdapter(GatewayProperties properties, FeignClientFactory feignClientFactory) {
        this.feignClientFactory = feignClientFactory;
        this.api = feignClientFactory.create(OutputSafetyApi.class, properties.getSafety().getUrl());
        this.timeout = properties.getSafety().getTimeout();
    }

    @Override
    public SafetyReview review(String userPrompt, String draftAnswer, RiskLevel riskLevel,
            Collection<String> flags, HandlingPath mode, Deadline deadline) {
        if (deadline.isExpired()) {
            throw new CollaboratorException("Deadline expired before output review");
        }

        OutputSafetyRequest request = new OutputSafetyRequest(
                userPrompt,
                draftAnswer,
                riskLevel != null ? riskLevel.name() : RiskLevel.HIGH.name(),
                flags != null ? List.copyOf(flags) : List.of(),
                mode.getWireValue());

        OutputSafetyResponse response;
        try {
            response = api.review(request, feignClientFactory.optionsFor(deadline.cap(timeout)));
        } catch (FeignException e) {
            log.warn("[Safety] Call failed: status={}, error={}", e.status(), e.getClass().getSimpleName());
            throw new CollaboratorException("Output safety service call failed (status " + e.status() + ")", e);
        } catch (RuntimeException e) {
            log.warn("[Safety] Call error: {}", e.getMessage());
            throw new CollaboratorException("Output safety service call failed", e);
        }

        if (response == null || response.finalAnswer() == null) {
            throw new CollaboratorException("Output safety service returned no final answer");
        }

        List<String> reasonFlags = response.reasonFlags() != null ? response.reasonFlags() : List.of();
        log.debug("[Safety] Reviewed: mode={}, modified={}, reasons={}", mode.getWireValue(),
                response.wasModified(), reasonFlags);
        return SafetyReview.builder()
                .finalAnswer(response.finalAnswer())
                .wasModified(Boolean.TRUE.equals(response.wasModified()))
                .reasonFlags(reasonFlags.stream().filter(Objects::nonNull).toList())
                .build();
    }

    // Feign API interface
    interface OutputSafetyApi {
        @RequestLine("POST /v1/output-safety")
        @Headers("Content-Type: application/json")
        OutputSafetyResponse review(OutputSafetyRequest request, Request.Options options);
    }

    record OutputSafetyRequest(
            @JsonProperty("user_prompt") String userPrompt,
            @JsonProperty("draft_answer") String draftAnswer,
            @JsonProperty("risk_level") String riskLevel,
            @JsonProperty("flags") List<String> flags,
            @JsonProperty("mode") String mode) {
    }

    record OutputSafetyResponse(
            @JsonProperty("final_answer") String finalAnswer,
            @JsonProperty("was_modified") Boolean wasModified,
            @JsonProperty("reason_flags") List<String> reasonFlags) {
    }
}
