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
import me.golemcore.gateway.domain.model.HandlingPath;
import me.golemcore.gateway.domain.model.RiskLevel;
import me.golemcore.gateway.domain.model.SafetyReview;

import java.util.Collection;

/**
 * Port for the output-safety collaborator that reviews the draft answer before
 * it is returned.
 */
public interface OutputSafetyPort {

    /**
     * Review a draft answer.
     *
     * @throws CollaboratorException
     *             on transport failure, timeout or non-success status
     */
    SafetyReview review(String userPrompt, String draftAnswer, RiskLevel riskLevel,
            Collection<String> flags, HandlingPath mode, Deadline deadline);
}
