package com.flow.sync.service.api.controller;

import com.flow.sync.service.api.dto.ApiResponse;
import com.flow.sync.service.api.dto.CanvasStateRequest;
import com.flow.sync.service.api.dto.CreateGraphRequest;
import com.flow.sync.service.api.dto.MutationResponse;
import com.flow.sync.service.api.mapper.WorkflowRequestMapper;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.GraphSnapshot;
import com.flow.sync.service.model.GraphState;
import com.flow.sync.service.model.WorkflowSnapshot;
import com.flow.sync.service.service.WorkflowSyncService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for whole-workflow reads and graph-level mutations.
 * Handles snapshots, subgraph creation and removal, canvas state and deletion.
 */
@Slf4j
@RestController
@RequestMapping("/workflows/{workflowId}")
@Tag(name = "Workflow State", description = "Snapshots, graphs and canvas state")
@RequiredArgsConstructor
public class WorkflowStateController {

    private final WorkflowSyncService syncService;
    private final WorkflowRequestMapper mapper;

    // ==================== Reads ====================

    @GetMapping
    @Operation(summary = "Get workflow", description = "Returns every graph of the workflow with its latest sequence")
    public ResponseEntity<ApiResponse<WorkflowSnapshot>> getWorkflow(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId) {
        return ResponseEntity.ok(ApiResponse.success(syncService.getWorkflowState(workflowId)));
    }

    @GetMapping("/state")
    @Operation(summary = "Get graph state",
               description = "Returns one graph with the sequence it reflects; use it to resync after a stale cursor")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Graph found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Graph not found")
    })
    public ResponseEntity<ApiResponse<GraphState>> getGraphState(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId) {
        return ResponseEntity.ok(ApiResponse.success(syncService.getGraphState(workflowId, graphId)));
    }

    // ==================== Graphs ====================

    @PostMapping("/graphs")
    @Operation(summary = "Create graph", description = "Creates an empty subgraph")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Graph created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Duplicate graph ID")
    })
    public ResponseEntity<ApiResponse<MutationResponse<GraphSnapshot>>> createGraph(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Valid @RequestBody CreateGraphRequest request) {
        var result = syncService.createGraph(workflowId, request.getGraphId(), request.getName());

        log.info("Created graph {} in workflow {}", request.getGraphId(), workflowId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(MutationResponse.from(result)));
    }

    @DeleteMapping("/graphs/{graphId}")
    @Operation(summary = "Remove graph", description = "Removes a subgraph; the main graph cannot be removed")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Graph removed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Main graph"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Graph not found")
    })
    public ResponseEntity<ApiResponse<MutationResponse<GraphSnapshot>>> removeGraph(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @PathVariable String graphId) {
        var result = syncService.removeGraph(workflowId, graphId);
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }

    @PutMapping("/graphs/{graphId}/canvas")
    @Operation(summary = "Update canvas state", description = "Sets the graph's pan offset and zoom")
    public ResponseEntity<ApiResponse<MutationResponse<CanvasState>>> updateCanvas(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @PathVariable String graphId,
            @Valid @RequestBody CanvasStateRequest request) {
        var result = syncService.updateCanvasState(workflowId, graphId, mapper.toCanvas(request));
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }

    // ==================== Lifecycle ====================

    @DeleteMapping
    @Operation(summary = "Delete workflow", description = "Drops the workflow's document, checkpoint and pending updates")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Workflow deleted")
    })
    public ResponseEntity<Void> deleteWorkflow(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId) {
        boolean removed = syncService.deleteWorkflow(workflowId);

        log.info("Deleted workflow {} (existed={})", workflowId, removed);
        return ResponseEntity.noContent().build();
    }
}
