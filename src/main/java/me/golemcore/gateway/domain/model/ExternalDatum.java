package me.golemcore.gateway.domain.model;

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

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Untrusted content bundled with a chat request: a retrieved document, a web
 * page, tool output and so on.
 *
 * <p>
 * All fields are fixed at construction except the taint status, which is
 * assigned exactly once by {@link me.golemcore.gateway.domain.service.TaintScanner}.
 */
@Getter
@ToString
public class ExternalDatum {

    private final String id;
    private final String source;
    private final String type;
    @ToString.Exclude
    private final String content;

    private volatile TaintStatus taintStatus = TaintStatus.UNSCANNED;

    @Builder
    public ExternalDatum(String id, String source, String type, String content) {
        this.id = id;
        this.source = source;
        this.type = type;
        this.content = content != null ? content : "";
    }

    /**
     * Records the scan outcome.
     *
     * @throws IllegalStateException
     *             if the datum was already scanned
     */
    public synchronized void markScanned(TaintStatus status) {
        Objects.requireNonNull(status, "status");
        if (status == TaintStatus.UNSCANNED) {
            throw new IllegalArgumentException("Scan outcome cannot be UNSCANNED");
        }
        if (taintStatus != TaintStatus.UNSCANNED) {
            throw new IllegalStateException("External datum already scanned: " + id);
        }
        this.taintStatus = status;
    }

    public boolean isScanned() {
        return taintStatus != TaintStatus.UNSCANNED;
    }

    public boolean isDangerous() {
        return taintStatus.isDangerous();
    }
}
