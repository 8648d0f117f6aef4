package me.golemcore.gateway.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.MediationResult;

/**
 * Response body for {@code POST /v1/chat}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponseDto {

    private String answer;

    @JsonProperty("risk_level")
    private String riskLevel;

    /** {@code fast} or {@code slow}. */
    private String path;

    public static ChatResponseDto from(MediationResult result) {
        return ChatResponseDto.builder()
                .answer(result.getAnswer())
                .riskLevel(result.getRiskLevel().name())
                .path(result.getPath().getWireValue())
                .build();
    }
}
