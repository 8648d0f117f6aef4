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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client for the risk-scoring and output-safety collaborators.
 *
 * <p>
 * Pool and default timeouts come from {@code gateway.http.*}; Feign narrows the
 * timeouts per call to the remaining request budget. Failed connections are
 * never retried. Every outbound call carries the current mediation id as
 * {@value #REQUEST_ID_HEADER} when one is bound in the MDC.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";

    private final GatewayProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        GatewayProperties.HttpProperties http = properties.getHttp();
        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                TimeUnit.MILLISECONDS);

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(pool)
                .retryOnConnectionFailure(false)
                .addInterceptor(requestIdInterceptor())
                .build();
    }

    static Interceptor requestIdInterceptor() {
        return chain -> {
            String requestId = MDC.get(MDC_REQUEST_ID);
            Request request = chain.request();
            if (requestId == null || request.header(REQUEST_ID_HEADER) != null) {
                return chain.proceed(request);
            }
            return chain.proceed(request.newBuilder().header(REQUEST_ID_HEADER, requestId).build());
        };
    }
}
