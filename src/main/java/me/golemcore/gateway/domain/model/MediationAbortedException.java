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

import lombok.Getter;

/**
 * Raised when a mediation cannot complete. No partial answer exists once this
 * is thrown.
 */
@Getter
public class MediationAbortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AbortReason reason;
    private final MediationStage stage;

    public MediationAbortedException(AbortReason reason, MediationStage stage, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.stage = stage;
    }

    public MediationAbortedException(AbortReason reason, MediationStage stage, String message) {
        this(reason, stage, message, null);
    }
}
