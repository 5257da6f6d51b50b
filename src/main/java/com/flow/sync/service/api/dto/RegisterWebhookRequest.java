package com.flow.sync.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request to register a webhook target. Reusing an {@code id} replaces the target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterWebhookRequest {

    private String id;

    @NotBlank(message = "url is required")
    @Pattern(regexp = "https?://.+", message = "url must be an http or https url")
    private String url;

    private List<String> events;

    private Map<String, String> headers;
}
