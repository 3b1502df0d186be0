package com.pulsewatch.agent.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record AnalyzeRequestDto(
        @Size(max = 200) List<@NotBlank String> metrics,
        Boolean forward
) {

    public boolean forwardFlag() {
        return forward != null && forward;
    }
}
