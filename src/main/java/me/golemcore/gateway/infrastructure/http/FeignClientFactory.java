package me.golemcore.gateway.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds the declarative collaborator clients.
 *
 * <p>
 * Every client shares the pooled {@link okhttp3.OkHttpClient}, encodes and
 * decodes with the application {@link ObjectMapper}, and never retries: a
 * failed collaborator call surfaces at once to the mediation pipeline, which
 * decides what the failure means.
 *
 * <pre>{@code
 * RiskScoringApi api = factory.create(RiskScoringApi.class, "http://risk:8001");
 * api.score(body, factory.optionsFor(deadline.cap(timeout)));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client for the given API interface.
     */
    public <T> T create(Class<T> apiType, String baseUrl) {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }

    /**
     * Per-call options bounding both connect and read time by {@code budget}.
     */
    public Request.Options optionsFor(Duration budget) {
        long millis = Math.max(1L, budget.toMillis());
        return new Request.Options(millis, TimeUnit.MILLISECONDS, millis, TimeUnit.MILLISECONDS, false);
    }
}
