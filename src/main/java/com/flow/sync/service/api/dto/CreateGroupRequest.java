package com.flow.sync.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to create a node group. Supply {@code id} to make it safe to retry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateGroupRequest {

    private String id;

    @NotBlank(message = "title is required")
    private String title;

    private String description;

    private String color;

    private Boolean collapsed;

    private List<String> nodeIds;
}
