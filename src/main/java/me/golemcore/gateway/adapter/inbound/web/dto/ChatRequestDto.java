package me.golemcore.gateway.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for {@code POST /v1/chat}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequestDto {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("session_id")
    private String sessionId;

    /** User message. Required. */
    private String message;

    /** Untrusted external content (documents, web pages, tool output). Optional. */
    @JsonProperty("external_data")
    @Builder.Default
    private List<ExternalDatumDto> externalData = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExternalDatumDto {
        private String id;

        /** Provenance, e.g. {@code kb:payments}, {@code web:https://...}, {@code tool:db-query}. */
        private String source;

        /** Content kind, e.g. {@code document}, {@code web_page}, {@code tool_output}. */
        private String type;

        private String content;
    }
}
