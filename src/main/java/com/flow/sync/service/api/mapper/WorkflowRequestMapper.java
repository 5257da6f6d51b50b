package com.flow.sync.service.api.mapper;

import com.flow.sync.service.api.dto.CanvasStateRequest;
import com.flow.sync.service.api.dto.ConnectNodesRequest;
import com.flow.sync.service.api.dto.CreateGroupRequest;
import com.flow.sync.service.api.dto.NodeRequest;
import com.flow.sync.service.api.dto.UpdateGroupRequest;
import com.flow.sync.service.api.dto.UpdateNodePositionRequest;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.Endpoint;
import com.flow.sync.service.model.Port;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.mutation.GroupPatch;
import com.flow.sync.service.mutation.GroupSpec;
import com.flow.sync.service.mutation.NodeSpec;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps REST request DTOs to the engine's mutation inputs.
 */
@Component
public class WorkflowRequestMapper {

    public NodeSpec toNodeSpec(NodeRequest request) {
        if (request == null) {
            return null;
        }
        return new NodeSpec(
                request.getId(),
                request.getTemplateId(),
                request.getType(),
                request.getTitle(),
                toPosition(request.getPosition()),
                request.getProperties(),
                toPorts(request.getPorts()),
                request.getMetadata()
        );
    }

    public List<NodeSpec> toNodeSpecs(List<NodeRequest> requests) {
        return requests == null ? null : requests.stream().map(this::toNodeSpec).toList();
    }

    public Position toPosition(UpdateNodePositionRequest request) {
        return new Position(request.getX(), request.getY());
    }

    public Endpoint toEndpoint(ConnectNodesRequest.EndpointDto endpoint) {
        return endpoint == null ? null : new Endpoint(endpoint.getNodeId(), endpoint.getPortId());
    }

    public GroupSpec toGroupSpec(CreateGroupRequest request) {
        return new GroupSpec(
                request.getId(),
                request.getTitle(),
                request.getDescription(),
                request.getColor(),
                request.getCollapsed(),
                request.getNodeIds()
        );
    }

    public GroupPatch toGroupPatch(UpdateGroupRequest request) {
        if (request == null) {
            return new GroupPatch(null, null, null, null, null);
        }
        return new GroupPatch(
                request.getTitle(),
                request.getDescription(),
                request.getColor(),
                request.getCollapsed(),
                request.getNodeIds()
        );
    }

    public CanvasState toCanvas(CanvasStateRequest request) {
        return new CanvasState(request.getOffsetX(), request.getOffsetY(), request.getZoom());
    }

    // ==================== Helpers ====================

    private Position toPosition(NodeRequest.PositionDto position) {
        return position == null ? null : new Position(position.getX(), position.getY());
    }

    private List<Port> toPorts(List<NodeRequest.PortDto> ports) {
        if (ports == null) {
            return List.of();
        }
        return ports.stream()
                .map(port -> new Port(port.getId(), port.getLabel(), port.getDirection()))
                .toList();
    }
}
