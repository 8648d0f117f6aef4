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
 * Failure of the isolated execution step. {@link #getDiagnostics()} holds the
 * environment's error stream and must stay out of caller-visible responses.
 */
@Getter
public class DispatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DispatchFailureKind kind;
    private final String diagnostics;

    public DispatchException(DispatchFailureKind kind, String message, String diagnostics, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.diagnostics = diagnostics != null ? diagnostics : "";
    }

    public DispatchException(DispatchFailureKind kind, String message, String diagnostics) {
        this(kind, message, diagnostics, null);
    }

    public static DispatchException timeout(String message) {
        return new DispatchException(DispatchFailureKind.TIMEOUT, message, "");
    }

    public static DispatchException failure(String message, String diagnostics) {
        return new DispatchException(DispatchFailureKind.EXECUTION_FAILURE, message, diagnostics);
    }
}
