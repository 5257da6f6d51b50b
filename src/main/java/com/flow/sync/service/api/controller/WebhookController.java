package com.flow.sync.service.api.controller;

import com.flow.sync.service.api.dto.ApiResponse;
import com.flow.sync.service.api.dto.RegisterWebhookRequest;
import com.flow.sync.service.webhook.WebhookTarget;
import com.flow.sync.service.webhook.WebhookTargetRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/webhooks")
@Tag(name = "Webhooks", description = "Register receivers of committed change events")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookTargetRegistry targetRegistry;

    @PostMapping
    @Operation(summary = "Register webhook", description = "Subscribes a url to change events, all events by default")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Webhook registered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid url")
    })
    public ResponseEntity<ApiResponse<WebhookTarget>> register(@Valid @RequestBody RegisterWebhookRequest request) {
        var target = targetRegistry.register(request.getId(), request.getUrl(), request.getEvents(), request.getHeaders());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(target));
    }

    @GetMapping
    @Operation(summary = "List webhooks", description = "Returns registered targets in registration order")
    public ResponseEntity<ApiResponse<List<WebhookTarget>>> list() {
        return ResponseEntity.ok(ApiResponse.success(targetRegistry.list()));
    }

    @DeleteMapping("/{webhookId}")
    @Operation(summary = "Unregister webhook")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Webhook removed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Webhook not found")
    })
    public ResponseEntity<Void> unregister(@Parameter(description = "Webhook ID") @PathVariable String webhookId) {
        targetRegistry.unregister(webhookId);
        return ResponseEntity.noContent().build();
    }
}
