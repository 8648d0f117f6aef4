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

import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.DispatchException;
import me.golemcore.gateway.domain.model.SandboxPrompt;

/**
 * Capability to run a prompt pair inside an isolated, single-use execution
 * environment. The concrete mechanism (container, microVM, restricted
 * subprocess) lives in an adapter.
 *
 * <p>
 * Implementations must:
 * <ul>
 * <li>create a fresh environment per call and tear it down afterwards, whatever
 * the outcome</li>
 * <li>disable network access and mount the inputs read-only</li>
 * <li>never run past {@code deadline} nor their own sub-budget</li>
 * </ul>
 */
public interface IsolatedExecutionPort {

    /**
     * Run the prompt pair and return the model's primary output.
     *
     * @throws DispatchException
     *             classified as timeout or execution failure
     */
    String execute(SandboxPrompt prompt, Deadline deadline);
}
