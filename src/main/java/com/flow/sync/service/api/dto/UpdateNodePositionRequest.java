package com.flow.sync.service.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateNodePositionRequest {

    @NotNull(message = "x is required")
    private Double x;

    @NotNull(message = "y is required")
    private Double y;
}
