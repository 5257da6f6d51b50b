package com.flow.sync.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial group update. Omitted fields are left untouched; {@code nodeIds}
 * replaces the membership set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateGroupRequest {

    private String title;

    private String description;

    private String color;

    private Boolean collapsed;

    private List<String> nodeIds;
}
