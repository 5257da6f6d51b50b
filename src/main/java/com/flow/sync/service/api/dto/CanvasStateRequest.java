package com.flow.sync.service.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanvasStateRequest {

    @NotNull(message = "offsetX is required")
    private Double offsetX;

    @NotNull(message = "offsetY is required")
    private Double offsetY;

    @NotNull(message = "zoom is required")
    @Positive(message = "zoom must be positive")
    private Double zoom;
}
