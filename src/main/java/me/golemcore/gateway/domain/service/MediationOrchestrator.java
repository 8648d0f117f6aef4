package me.golemcore.gateway.domain.service;

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
import me.golemcore.gateway.domain.model.AbortReason;
import me.golemcore.gateway.domain.model.ChatRequest;
import me.golemcore.gateway.domain.model.CollaboratorException;
import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.DeadlineExceededException;
import me.golemcore.gateway.domain.model.DispatchException;
import me.golemcore.gateway.domain.model.DispatchFailureKind;
import me.golemcore.gateway.domain.model.ExternalDatum;
import me.golemcore.gateway.domain.model.HandlingPath;
import me.golemcore.gateway.domain.model.MalformedRequestException;
import me.golemcore.gateway.domain.model.MediationAbortedException;
import me.golemcore.gateway.domain.model.MediationResult;
import me.golemcore.gateway.domain.model.MediationStage;
import me.golemcore.gateway.domain.model.RiskAssessment;
import me.golemcore.gateway.domain.model.SafetyReview;
import me.golemcore.gateway.domain.model.SandboxPrompt;
import me.golemcore.gateway.domain.model.TaintScanSummary;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.http.OkHttpConfig;
import me.golemcore.gateway.port.outbound.IsolatedExecutionPort;
import me.golemcore.gateway.port.outbound.OutputSafetyPort;
import me.golemcore.gateway.port.outbound.RiskAssessmentPort;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one chat request through the mediation pipeline.
 *
 * <pre>
 * RECEIVED → RISK_SCORED → PATH_DECIDED → EXTERNAL_SCANNED
 *          → PROMPT_BUILT → EXECUTED → REVIEWED → RESPONDED
 * </pre>
 *
 * <p>
 * Stages run strictly in order, once, without retries. A single
 * {@link Deadline} is created on entry and passed to every blocking call; it is
 * checked again between stages. Any collaborator failure, execution failure or
 * deadline expiry ends the run with {@link MediationAbortedException} and no
 * answer. The only locally recovered failure is a per-datum scan error, which
 * {@link TaintScanner} turns into a dangerous taint.
 *
 * <p>
 * Holds no per-request state; concurrent requests are independent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediationOrchestrator {

    static final String MDC_REQUEST_ID = OkHttpConfig.MDC_REQUEST_ID;
    static final String FLAG_EXTERNAL_FLAGGED = "external_data_flagged";
    static final String FLAG_EXTERNAL_SCAN_DEGRADED = "external_scan_degraded";

    private static final int MAX_DIAGNOSTICS_LOG_LENGTH = 2000;

    private final RiskAssessmentPort riskAssessmentPort;
    private final TaintScanner taintScanner;
    private final PathPolicy pathPolicy;
    private final PromptIsolationBuilder promptIsolationBuilder;
    private final SensitiveDataMasker masker;
    private final IsolatedExecutionPort isolatedExecutionPort;
    private final OutputSafetyPort outputSafetyPort;
    private final GatewayProperties properties;
    private final Clock clock;

    public MediationResult mediate(ChatRequest request) {
        validate(request);

        String requestId = UUID.randomUUID().toString();
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            return run(request);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private MediationResult run(ChatRequest request) {
        Deadline deadline = Deadline.after(clock, properties.getRequestTimeout());
        MediationStage stage = MediationStage.RECEIVED;
        log.info("[Mediation] Received: userId={}, sessionId={}, messageLength={}, externalItems={}",
                request.getUserId(), request.getSessionId(), request.getMessage().length(),
                request.getExternalData().size());

        // 1. Risk scoring of the primary message
        RiskAssessment risk;
        try {
            risk = riskAssessmentPort.assess(request.getMessage(),
                    primaryMetadata(request), deadline);
        } catch (CollaboratorException e) {
            throw abort(AbortReason.RISK_SCORING_FAILED, stage, "Risk scoring failed", e);
        }
        stage = advance(stage, MediationStage.RISK_SCORED, deadline);
        log.info("[Mediation] Risk scored: level={}, flags={}, selfCheckRequired={}",
                risk.getRiskLevel(), risk.getFlags(), risk.isSelfCheckRequired());

        // 2. Path decision
        HandlingPath path = pathPolicy.decide(risk);
        stage = advance(stage, MediationStage.PATH_DECIDED, deadline);
        log.info("[Mediation] Path decided: {}", path.getWireValue());

        // 3. Taint scan of external content
        TaintScanSummary scanSummary;
        try {
            scanSummary = taintScanner.scan(request.getExternalData(), request.getUserId(),
                    request.getSessionId(), deadline);
        } catch (DeadlineExceededException e) {
            throw abort(AbortReason.DEADLINE_EXCEEDED, stage, e.getMessage(), e);
        }
        stage = advance(stage, MediationStage.EXTERNAL_SCANNED, deadline);

        // 4. Prompt isolation
        SandboxPrompt prompt = promptIsolationBuilder.build(request.getMessage(), risk,
                request.getExternalData(), request.getUserId(), request.getSessionId());
        stage = advance(stage, MediationStage.PROMPT_BUILT, deadline);
        log.debug("[Mediation] Prompt built: systemLength={}, userContentLength={}",
                prompt.systemPrompt().length(), prompt.userContent().length());

        // 5. Isolated execution
        String draftAnswer;
        try {
            draftAnswer = isolatedExecutionPort.execute(prompt, deadline);
        } catch (DispatchException e) {
            log.warn("[Mediation] Execution diagnostics (path={}): {}", path.getWireValue(),
                    truncate(e.getDiagnostics()));
            AbortReason reason = e.getKind() == DispatchFailureKind.TIMEOUT
                    ? AbortReason.EXECUTION_TIMEOUT
                    : AbortReason.EXECUTION_FAILED;
            throw abort(reason, stage, e.getMessage(), e);
        }
        stage = advance(stage, MediationStage.EXECUTED, deadline);

        // 6. Output safety review
        SafetyReview review;
        try {
            review = outputSafetyPort.review(masker.mask(request.getMessage()), draftAnswer,
                    risk.getRiskLevel(), reviewFlags(risk, scanSummary), path, deadline);
        } catch (CollaboratorException e) {
            throw abort(AbortReason.OUTPUT_REVIEW_FAILED, stage, "Output safety review failed", e);
        }
        stage = advance(stage, MediationStage.REVIEWED, deadline);
        if (review.isWasModified()) {
            log.info("[Mediation] Draft answer modified by output review: reasons={}", review.getReasonFlags());
        }

        advance(stage, MediationStage.RESPONDED, deadline);
        return MediationResult.builder()
                .answer(review.getFinalAnswer())
                .riskLevel(risk.getRiskLevel())
                .path(path)
                .wasModified(review.isWasModified())
                .reasonFlags(review.getReasonFlags())
                .build();
    }

    private void validate(ChatRequest request) {
        if (request == null) {
            throw new MalformedRequestException("request body is required");
        }
        GatewayProperties.SecurityProperties limits = properties.getSecurity();
        String message = request.getMessage();
        if (message == null || message.isBlank()) {
            throw new MalformedRequestException("'message' is required");
        }
        if (message.length() > limits.getMaxMessageLength()) {
            throw new MalformedRequestException(
                    "'message' exceeds " + limits.getMaxMessageLength() + " characters");
        }
        List<ExternalDatum> externalData = request.getExternalData();
        if (externalData.size() > limits.getMaxExternalItems()) {
            throw new MalformedRequestException(
                    "'external_data' exceeds " + limits.getMaxExternalItems() + " items");
        }
        Set<ExternalDatum> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ExternalDatum datum : externalData) {
            if (datum == null) {
                throw new MalformedRequestException("'external_data' must not contain null items");
            }
            if (!seen.add(datum)) {
                throw new MalformedRequestException("'external_data' must not repeat the same item");
            }
            if (datum.getContent().length() > limits.getMaxExternalContentLength()) {
                throw new MalformedRequestException("'external_data' item content exceeds "
                        + limits.getMaxExternalContentLength() + " characters");
            }
            if (datum.isScanned()) {
                throw new MalformedRequestException("'external_data' items must not be reused across requests");
            }
        }
    }

    private Map<String, String> primaryMetadata(ChatRequest request) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(TaintScanner.META_USER_ID, request.getUserId() != null ? request.getUserId() : "");
        metadata.put(TaintScanner.META_SESSION_ID, request.getSessionId() != null ? request.getSessionId() : "");
        return metadata;
    }

    private List<String> reviewFlags(RiskAssessment risk, TaintScanSummary scanSummary) {
        Set<String> flags = new LinkedHashSet<>(risk.getFlags());
        if (scanSummary.anyFlagged()) {
            flags.add(FLAG_EXTERNAL_FLAGGED);
        }
        if (scanSummary.anyScanFailed()) {
            flags.add(FLAG_EXTERNAL_SCAN_DEGRADED);
        }
        return new ArrayList<>(flags);
    }

    private MediationStage advance(MediationStage current, MediationStage next, Deadline deadline) {
        if (deadline.isExpired()) {
            throw abort(AbortReason.DEADLINE_EXCEEDED, current,
                    "Deadline expired before reaching " + next, null);
        }
        log.debug("[Mediation] {} -> {} (remaining={}ms)", current, next, deadline.remaining().toMillis());
        return next;
    }

    private MediationAbortedException abort(AbortReason reason, MediationStage stage, String message,
            Throwable cause) {
        log.error("[Mediation] Aborted at {}: reason={}, message={}", stage, reason, message);
        return new MediationAbortedException(reason, stage, message, cause);
    }

    private String truncate(String text) {
        if (text == null) {
            return "<null>";
        }
        if (text.length() <= MAX_DIAGNOSTICS_LOG_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_DIAGNOSTICS_LOG_LENGTH) + "...";
    }
}
