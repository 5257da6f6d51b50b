package com.flow.sync.service.api.controller;

import com.flow.sync.service.api.dto.AddNodesBatchRequest;
import com.flow.sync.service.api.dto.ApiResponse;
import com.flow.sync.service.api.dto.MutationResponse;
import com.flow.sync.service.api.dto.NodeRequest;
import com.flow.sync.service.api.dto.UpdateNodePositionRequest;
import com.flow.sync.service.api.dto.UpdateNodePropertiesRequest;
import com.flow.sync.service.api.mapper.WorkflowRequestMapper;
import com.flow.sync.service.model.WorkflowNode;
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

import java.util.List;

/**
 * Controller for node mutations.
 * Every endpoint takes an optional {@code graphId}, defaulting to the main graph.
 */
@Slf4j
@RestController
@RequestMapping("/workflows/{workflowId}/nodes")
@Tag(name = "Nodes", description = "Add, move, update and remove workflow nodes")
@RequiredArgsConstructor
public class WorkflowNodeController {

    private final WorkflowSyncService syncService;
    private final WorkflowRequestMapper mapper;

    // ==================== Endpoints ====================

    @PostMapping
    @Operation(summary = "Add node", description = "Adds a node; the ID is generated unless supplied")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Node added"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid node"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Duplicate node ID")
    })
    public ResponseEntity<ApiResponse<MutationResponse<WorkflowNode>>> addNode(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId,
            @Valid @RequestBody NodeRequest request) {
        log.debug("Adding node to {}/{}", workflowId, graphId);

        var result = syncService.addNode(workflowId, graphId, mapper.toNodeSpec(request));

        log.info("Added node {} to workflow {}", result.entity().id(), workflowId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(MutationResponse.from(result)));
    }

    @PostMapping("/batch")
    @Operation(summary = "Add nodes in batch", description = "Adds several nodes atomically: all or none")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Nodes added"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid node in batch"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Duplicate node ID")
    })
    public ResponseEntity<ApiResponse<MutationResponse<List<WorkflowNode>>>> addNodesBatch(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId,
            @Valid @RequestBody AddNodesBatchRequest request) {
        log.debug("Adding {} nodes to {}/{}", request.getNodes().size(), workflowId, graphId);

        var result = syncService.addNodesBatch(workflowId, graphId, mapper.toNodeSpecs(request.getNodes()));

        log.info("Added {} nodes to workflow {}", result.entity().size(), workflowId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(MutationResponse.from(result)));
    }

    @GetMapping
    @Operation(summary = "List nodes", description = "Returns the nodes of one graph in insertion order")
    public ResponseEntity<ApiResponse<List<WorkflowNode>>> listNodes(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId) {
        var state = syncService.getGraphState(workflowId, graphId);
        return ResponseEntity.ok(ApiResponse.success(state.graph().nodes()));
    }

    @DeleteMapping("/{nodeId}")
    @Operation(summary = "Remove node",
               description = "Removes a node with its connections and drops it from every group")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Node removed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Node not found")
    })
    public ResponseEntity<ApiResponse<MutationResponse<WorkflowNode>>> removeNode(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Node ID") @PathVariable String nodeId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId) {
        var result = syncService.removeNode(workflowId, graphId, nodeId);

        log.info("Removed node {} from workflow {}", nodeId, workflowId);
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }

    @PatchMapping("/{nodeId}/properties")
    @Operation(summary = "Update node properties",
               description = "Merges the given keys into the node's properties; null values remove keys")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Properties merged"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Node not found")
    })
    public ResponseEntity<ApiResponse<MutationResponse<WorkflowNode>>> updateNodeProperties(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Node ID") @PathVariable String nodeId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId,
            @Valid @RequestBody UpdateNodePropertiesRequest request) {
        var result = syncService.updateNodeProperties(workflowId, graphId, nodeId, request.getProperties());
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }

    @PutMapping("/{nodeId}/position")
    @Operation(summary = "Move node", description = "Sets the node's canvas position")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Node moved"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Node not found")
    })
    public ResponseEntity<ApiResponse<MutationResponse<WorkflowNode>>> updateNodePosition(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Node ID") @PathVariable String nodeId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId,
            @Valid @RequestBody UpdateNodePositionRequest request) {
        var result = syncService.updateNodePosition(workflowId, graphId, nodeId, mapper.toPosition(request));
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }
}
