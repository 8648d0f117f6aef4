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

import me.golemcore.gateway.domain.model.HandlingPath;
import me.golemcore.gateway.domain.model.RiskAssessment;
import me.golemcore.gateway.domain.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Maps a risk assessment to a handling path. Escalates to
 * {@link HandlingPath#SLOW} when the risk is HIGH or the risk service asked for
 * a self check; everything else takes {@link HandlingPath#FAST}. A missing
 * risk level is handled as HIGH.
 */
@Component
public class PathPolicy {

    public HandlingPath decide(RiskAssessment assessment) {
        Objects.requireNonNull(assessment, "assessment");
        RiskLevel level = assessment.getRiskLevel();
        if (level == null || level == RiskLevel.HIGH || assessment.isSelfCheckRequired()) {
            return HandlingPath.SLOW;
        }
        return HandlingPath.FAST;
    }
}
