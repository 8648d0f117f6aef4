package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.CollaboratorException;
import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.RiskAssessment;

import java.util.Map;

/**
 * Port for the risk-scoring collaborator. Used for the primary user message and
 * independently for every piece of external content.
 */
public interface RiskAssessmentPort {

    /**
     * Score a piece of text.
     *
     * @param text
     *            text to score
     * @param metadata
     *            request metadata (user and session ids, content kind)
     * @param deadline
     *            end-to-end deadline; the call never outlives it
     * @return the assessment
     * @throws CollaboratorException
     *             on transport failure, timeout or non-success status
     */
    RiskAssessment assess(String text, Map<String, String> metadata, Deadline deadline);
}
