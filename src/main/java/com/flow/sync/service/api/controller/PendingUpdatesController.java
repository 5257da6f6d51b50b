package com.flow.sync.service.api.controller;

import com.flow.sync.service.api.dto.ApiResponse;
import com.flow.sync.service.service.PendingUpdates;
import com.flow.sync.service.service.WorkflowSyncService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Catch-up polling for clients that missed live updates.
 */
@Slf4j
@RestController
@RequestMapping("/workflows/{workflowId}/updates")
@Tag(name = "Pending Updates", description = "Catch-up polling of committed changes")
@RequiredArgsConstructor
public class PendingUpdatesController {

    private final WorkflowSyncService syncService;

    @GetMapping
    @Operation(summary = "Get pending updates",
               description = "Returns retained changes after the cursor in commit order")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Updates returned"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "410",
                    description = "Cursor fell behind retention; reload full state")
    })
    public ResponseEntity<ApiResponse<PendingUpdates>> getPendingUpdates(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Last sequence the caller has applied")
            @RequestParam(required = false) Long since) {
        var updates = syncService.getPendingUpdates(workflowId, since);
        return ResponseEntity.ok(ApiResponse.success(updates));
    }

    @DeleteMapping
    @Operation(summary = "Clear pending updates", description = "Discards the workflow's retained changes")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Updates cleared")
    })
    public ResponseEntity<Void> clearPendingUpdates(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId) {
        int cleared = syncService.clearPendingUpdates(workflowId);

        log.info("Cleared {} pending updates for workflow {}", cleared, workflowId);
        return ResponseEntity.noContent().build();
    }
}
