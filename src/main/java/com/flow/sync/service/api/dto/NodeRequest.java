package com.flow.sync.service.api.dto;

import com.flow.sync.service.model.PortDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request to add a node to a graph.
 *
 * Supply {@code id} to make the request safe to retry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeRequest {

    private String id;

    private String templateId;

    private String type;

    @NotBlank(message = "title is required")
    private String title;

    @NotNull(message = "position is required")
    @Valid
    private PositionDto position;

    private Map<String, Object> properties;

    @Valid
    private List<PortDto> ports;

    private Map<String, Object> metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionDto {

        @NotNull(message = "position.x is required")
        private Double x;

        @NotNull(message = "position.y is required")
        private Double y;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PortDto {

        @NotBlank(message = "port id is required")
        private String id;

        private String label;

        @NotNull(message = "port direction is required")
        private PortDirection direction;
    }
}
