package com.flow.sync.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to add several nodes as one atomic unit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddNodesBatchRequest {

    @NotEmpty(message = "nodes must not be empty")
    @Valid
    private List<NodeRequest> nodes;
}
