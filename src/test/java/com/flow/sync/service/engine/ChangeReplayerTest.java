package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.change.PendingChange;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.Endpoint;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.mutation.GraphMutation;
import com.flow.sync.service.mutation.GroupPatch;
import com.flow.sync.service.mutation.GroupSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.flow.sync.service.engine.MutationApplierTest.node;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * A replica fed only with change records must end up equal to the source document.
 */
class ChangeReplayerTest {

    private static final String WORKFLOW_ID = "wf-replay";
    private static final String MAIN = WorkflowDocument.MAIN_GRAPH_ID;

    private final MutationApplier applier = new MutationApplier();
    private final ChangeReplayer replayer = new ChangeReplayer();
    private final List<ChangeRecord> records = new ArrayList<>();

    private WorkflowDocument source;

    @BeforeEach
    void setUp() {
        source = WorkflowDocument.create(WORKFLOW_ID);
    }

    @Test
    void replica_convergesWithSource() {
        commit(new GraphMutation.AddNodesBatch(MAIN, List.of(node("a"), node("b"), node("c"))));
        commit(new GraphMutation.ConnectNodes(MAIN, "c1", new Endpoint("a", "out"), new Endpoint("b", "in")));
        commit(new GraphMutation.ConnectNodes(MAIN, "c2", new Endpoint("b", "out"), new Endpoint("c", "in")));
        commit(new GraphMutation.UpdateNodeProperties(MAIN, "a", Map.of("url", "https://example.org")));
        commit(new GraphMutation.UpdateNodePosition(MAIN, "c", new Position(300, 120)));
        commit(new GraphMutation.CreateGroup(MAIN, new GroupSpec("g1", "Fetch", null, null, null, List.of("a", "b"))));
        commit(new GraphMutation.UpdateGroup(MAIN, "g1", new GroupPatch("Fetch stage", null, null, true, null)));
        commit(new GraphMutation.RemoveNode(MAIN, "b"));
        commit(new GraphMutation.CreateGraph("sub", "Sub flow"));
        commit(new GraphMutation.AddNode("sub", node("s1")));
        commit(new GraphMutation.UpdateCanvas("sub", new CanvasState(5, 5, 2)));

        var replica = WorkflowDocument.create(WORKFLOW_ID);
        long last = replayer.replay(replica, records, 0);

        assertThat(last).isEqualTo(records.size());
        assertThat(replica.snapshot(last)).isEqualTo(source.snapshot(last));
    }

    @Test
    void replay_skipsRecordsAtOrBelowCursor() {
        commit(new GraphMutation.AddNode(MAIN, node("a")));
        commit(new GraphMutation.AddNode(MAIN, node("b")));

        var replica = WorkflowDocument.create(WORKFLOW_ID);
        replayer.apply(replica, records.get(0));
        long last = replayer.replay(replica, records, 1);

        assertThat(last).isEqualTo(2);
        assertThat(replica.snapshot(last)).isEqualTo(source.snapshot(last));
    }

    @Test
    void removedGraph_isDroppedFromReplica() {
        commit(new GraphMutation.CreateGraph("sub", null));
        commit(new GraphMutation.RemoveGraph("sub"));

        var replica = WorkflowDocument.create(WORKFLOW_ID);
        replayer.replay(replica, records, 0);

        assertThat(replica.hasGraph("sub")).isFalse();
    }

    private void commit(GraphMutation<?> mutation) {
        var applied = applier.apply(source, mutation);
        for (PendingChange change : applied.changes()) {
            records.add(change.commit(WORKFLOW_ID, records.size() + 1, Instant.EPOCH));
        }
    }
}
