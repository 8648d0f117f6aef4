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
import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.DeadlineExceededException;
import me.golemcore.gateway.domain.model.ExternalDatum;
import me.golemcore.gateway.domain.model.RiskAssessment;
import me.golemcore.gateway.domain.model.RiskLevel;
import me.golemcore.gateway.domain.model.TaintScanSummary;
import me.golemcore.gateway.domain.model.TaintStatus;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.RiskAssessmentPort;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Classifies every piece of external content as trusted or dangerous using the
 * risk-scoring collaborator.
 *
 * <p>
 * Policy per datum:
 * <ul>
 * <li>collaborator fails, times out or is unreachable - {@link TaintStatus#SCAN_FAILED}</li>
 * <li>collaborator reports HIGH - {@link TaintStatus#FLAGGED}</li>
 * <li>otherwise - {@link TaintStatus#TRUSTED}</li>
 * </ul>
 * A failure on one datum never affects the others nor the request.
 *
 * <p>
 * Each call starts at most {@code min(items, gateway.scan.parallelism)}
 * workers on the unbounded {@code externalScanExecutor}; the workers drain this
 * request's items and nothing else, so one request never queues behind another.
 * If the end-to-end deadline expires before every datum is resolved, the
 * workers are interrupted and {@link DeadlineExceededException} is thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaintScanner {

    static final String META_USER_ID = "user_id";
    static final String META_SESSION_ID = "session_id";
    static final String META_CONTENT_KIND = "content_kind";
    static final String META_EXTERNAL_ID = "external_id";

    private final RiskAssessmentPort riskAssessmentPort;
    private final ExecutorService externalScanExecutor;
    private final GatewayProperties properties;

    public TaintScanSummary scan(List<ExternalDatum> externalData, String userId, String sessionId,
            Deadline deadline) {
        if (externalData == null || externalData.isEmpty()) {
            return TaintScanSummary.empty();
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        int workers = Math.min(externalData.size(), Math.max(1, properties.getScan().getParallelism()));
        AtomicInteger next = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(externalScanExecutor.submit(
                    () -> withMdc(mdc, () -> drain(externalData, next, userId, sessionId, deadline))));
        }

        try {
            for (Future<?> future : futures) {
                future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new DeadlineExceededException("Deadline expired while scanning external data");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new DeadlineExceededException("Interrupted while scanning external data");
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("External data scan failed", cause);
        }

        TaintScanSummary summary = summarize(externalData);
        log.info("[Taint] Scanned {} external item(s): trusted={}, flagged={}, scanFailed={}",
                summary.total(), summary.trusted(), summary.flagged(), summary.scanFailed());
        return summary;
    }

    private void drain(List<ExternalDatum> externalData, AtomicInteger next, String userId, String sessionId,
            Deadline deadline) {
        int index;
        while ((index = next.getAndIncrement()) < externalData.size()) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            scanOne(externalData.get(index), userId, sessionId, deadline);
        }
    }

    private void scanOne(ExternalDatum datum, String userId, String sessionId, Deadline deadline) {
        TaintStatus status;
        try {
            RiskAssessment assessment = riskAssessmentPort.assess(datum.getContent(),
                    buildMetadata(datum, userId, sessionId), deadline);
            if (assessment.getRiskLevel() == RiskLevel.HIGH) {
                log.warn("[Taint] External datum flagged as HIGH risk: id={}, source={}",
                        datum.getId(), datum.getSource());
                status = TaintStatus.FLAGGED;
            } else {
                status = TaintStatus.TRUSTED;
            }
        } catch (RuntimeException e) {
            log.warn("[Taint] Scan failed, marking external datum dangerous: id={}, error={}",
                    datum.getId(), e.getMessage());
            status = TaintStatus.SCAN_FAILED;
        }
        datum.markScanned(status);
    }

    private void withMdc(Map<String, String> mdc, Runnable task) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            task.run();
        } finally {
            MDC.clear();
        }
    }

    private Map<String, String> buildMetadata(ExternalDatum datum, String userId, String sessionId) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(META_USER_ID, userId != null ? userId : "");
        metadata.put(META_SESSION_ID, sessionId != null ? sessionId : "");
        metadata.put(META_CONTENT_KIND, "external");
        if (datum.getId() != null) {
            metadata.put(META_EXTERNAL_ID, datum.getId());
        }
        return metadata;
    }

    private TaintScanSummary summarize(List<ExternalDatum> externalData) {
        int trusted = 0;
        int flagged = 0;
        int scanFailed = 0;
        for (ExternalDatum datum : externalData) {
            switch (datum.getTaintStatus()) {
            case TRUSTED -> trusted++;
            case FLAGGED -> flagged++;
            default -> scanFailed++;
            }
        }
        return new TaintScanSummary(trusted, flagged, scanFailed);
    }

    private void cancelAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
