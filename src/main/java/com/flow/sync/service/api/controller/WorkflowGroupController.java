package com.flow.sync.service.api.controller;

import com.flow.sync.service.api.dto.ApiResponse;
import com.flow.sync.service.api.dto.CreateGroupRequest;
import com.flow.sync.service.api.dto.MutationResponse;
import com.flow.sync.service.api.dto.UpdateGroupRequest;
import com.flow.sync.service.api.mapper.WorkflowRequestMapper;
import com.flow.sync.service.model.NodeGroup;
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

@Slf4j
@RestController
@RequestMapping("/workflows/{workflowId}/groups")
@Tag(name = "Groups", description = "Create, update and remove node groups")
@RequiredArgsConstructor
public class WorkflowGroupController {

    private final WorkflowSyncService syncService;
    private final WorkflowRequestMapper mapper;

    @PostMapping
    @Operation(summary = "Create group", description = "Creates a group over existing nodes")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Group created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422", description = "Member node missing")
    })
    public ResponseEntity<ApiResponse<MutationResponse<NodeGroup>>> createGroup(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId,
            @Valid @RequestBody CreateGroupRequest request) {
        var result = syncService.createNodeGroup(workflowId, graphId, mapper.toGroupSpec(request));

        log.info("Created group {} in workflow {}", result.entity().id(), workflowId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(MutationResponse.from(result)));
    }

    @PatchMapping("/{groupId}")
    @Operation(summary = "Update group", description = "Applies a partial update; nodeIds replaces membership")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Group updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Group not found")
    })
    public ResponseEntity<ApiResponse<MutationResponse<NodeGroup>>> updateGroup(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Group ID") @PathVariable String groupId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId,
            @RequestBody(required = false) UpdateGroupRequest request) {
        var result = syncService.updateGroupProperties(workflowId, graphId, groupId, mapper.toGroupPatch(request));
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }

    @DeleteMapping("/{groupId}")
    @Operation(summary = "Remove group", description = "Removes the group; member nodes are kept")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Group removed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Group not found")
    })
    public ResponseEntity<ApiResponse<MutationResponse<NodeGroup>>> removeGroup(
            @Parameter(description = "Workflow ID") @PathVariable String workflowId,
            @Parameter(description = "Group ID") @PathVariable String groupId,
            @Parameter(description = "Graph ID") @RequestParam(required = false) String graphId) {
        var result = syncService.removeGroup(workflowId, graphId, groupId);
        return ResponseEntity.ok(ApiResponse.success(MutationResponse.from(result)));
    }
}
