package me.golemcore.gateway.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ChatRequestDto;
import me.golemcore.gateway.adapter.inbound.web.dto.ChatResponseDto;
import me.golemcore.gateway.domain.model.ChatRequest;
import me.golemcore.gateway.domain.model.ExternalDatum;
import me.golemcore.gateway.domain.model.MalformedRequestException;
import me.golemcore.gateway.domain.model.MediationResult;
import me.golemcore.gateway.domain.service.MediationOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Public chat endpoint.
 *
 * <p>
 * {@code POST /v1/chat} accepts {@code {user_id, session_id, message,
 * external_data?}} and answers {@code {answer, risk_level, path}}. Malformed
 * input yields 400; any downstream failure yields a generic 500 (see
 * {@link me.golemcore.gateway.adapter.inbound.web.GlobalExceptionHandler}).
 * Other methods on the path are rejected with 405 by WebFlux.
 *
 * <p>
 * Mediation is blocking, so it runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final MediationOrchestrator orchestrator;

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatResponseDto>> chat(@RequestBody(required = false) ChatRequestDto request) {
        return Mono.fromCallable(() -> {
            ChatRequest chatRequest = toDomain(request);
            MediationResult result = orchestrator.mediate(chatRequest);
            log.info("[API] Chat completed: riskLevel={}, path={}", result.getRiskLevel(),
                    result.getPath().getWireValue());
            return ResponseEntity.ok(ChatResponseDto.from(result));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private ChatRequest toDomain(ChatRequestDto request) {
        if (request == null) {
            throw new MalformedRequestException("request body is required");
        }

        List<ExternalDatum> externalData = new ArrayList<>();
        if (request.getExternalData() != null) {
            for (ChatRequestDto.ExternalDatumDto dto : request.getExternalData()) {
                if (dto == null) {
                    throw new MalformedRequestException("'external_data' must not contain null items");
                }
                externalData.add(ExternalDatum.builder()
                        .id(dto.getId())
                        .source(dto.getSource())
                        .type(dto.getType())
                        .content(dto.getContent())
                        .build());
            }
        }

        return ChatRequest.builder()
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .message(request.getMessage())
                .externalData(externalData)
                .build();
    }
}
