package com.flow.sync.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to connect an output port to an input port.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectNodesRequest {

    private String id;

    @NotNull(message = "source is required")
    @Valid
    private EndpointDto source;

    @NotNull(message = "target is required")
    @Valid
    private EndpointDto target;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EndpointDto {

        @NotBlank(message = "nodeId is required")
        private String nodeId;

        @NotBlank(message = "portId is required")
        private String portId;
    }
}
