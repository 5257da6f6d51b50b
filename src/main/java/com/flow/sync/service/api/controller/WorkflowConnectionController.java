package com.flow.sync.service.api.controller;

import com.flow.sync.service.api.dto.ApiResponse;
import com.flow.sync.service.api.dto.ConnectNodesRequest;
import com.flow.sync.service.api.dto.MutationResponse;
import com.flow.sync.service.api.mapper.WorkflowRequestMapper;
import com.flow.sync.service.model.Connection;
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
 * Controller for connections between node ports.
 */
@Slf4j
@RestController
@RequestMapping("/workflows/{workflowId}/connections")
@Tag(name = "Connections", description = "Connect and disconnect node ports")
@RequiredArgsConstructor
public class WorkflowConnectionController {

    private final WorkflowSyncService syncService;
    private final WorkflowRequestMapper mapper;

    @PostMapping
    @Operation(summary = "Connect nodes", description = "Connects an output port to a free input port")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Connection created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Port direction mismatch"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Port not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Input port already connected"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422", description = "Endpoint node missing")
    })
    public ResponseEntity<ApiResponse<MutationResponse<Connection>>> connectNodes(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId,
            @Valid @RequestBody ConnectNodesRequest request) {
        var result = syncService.connectNodes(workflowId, graphId, request.getId(),
                mapper.toEndpoint(request.getSource()), mapper.toEndpoint(request.getTarget()));

        log.info("Connected {} -> {} in workflow {}",
                request.getSource().getNodeId(), request.getTarget().getNodeId(), workflowId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(MutationResponse.from(result)));
    }

    @DeleteMapping("/{connectionId}")
    @Operation(summary = "Remove connection")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Connection removed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Connection not found")
    })
    public ResponseEntity<ApiResponse<MutationResponse<Connection>>> removeConnection(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Connection ID") @PathVariable String connectionId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId) {
        var result = syncService.removeConnection(workflowId, graphId, connectionId);
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }
}
