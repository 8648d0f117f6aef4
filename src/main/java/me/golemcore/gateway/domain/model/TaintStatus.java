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

/**
 * Taint classification of a single piece of external content.
 *
 * <p>
 * Only {@link #TRUSTED} content is treated as safe. {@link #UNSCANNED} is the
 * initial state and counts as dangerous, so content that somehow skipped the
 * scan is never trusted.
 */
public enum TaintStatus {

    /** Not yet scanned. */
    UNSCANNED,

    /** Scanned, risk below HIGH. */
    TRUSTED,

    /** Scanned, risk service reported HIGH. */
    FLAGGED,

    /** Risk service unavailable, failed or timed out for this item. */
    SCAN_FAILED;

    public boolean isDangerous() {
        return this != TRUSTED;
    }
}
