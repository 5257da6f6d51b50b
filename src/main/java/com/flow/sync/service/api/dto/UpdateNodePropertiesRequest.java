package com.flow.sync.service.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Property merge. Keys mapped to null are removed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateNodePropertiesRequest {

    @NotNull(message = "properties is required")
    private Map<String, Object> properties;
}
