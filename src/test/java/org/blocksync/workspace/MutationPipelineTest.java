package org.blocksync.workspace;

import org.blocksync.graph.EventOrigin;
import org.blocksync.graph.Graph;
import org.blocksync.graph.GraphEvent;
import org.blocksync.graph.Node;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockKindRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MutationPipelineTest {

    private final BlockKindRegistry registry = BlockKindRegistry.defaults();

    @Mock
    private IGraphReaction reaction;

    @Mock
    private Consumer<Graph> settleListener;

    private Graph graph;
    private MutationPipeline pipeline;

    @BeforeEach
    void setUp() {
        graph = new Graph();
        pipeline = new MutationPipeline(graph);
    }

    @Test
    @DisplayName("Reactions see user events but not the events of fixes")
    void reactionsOnlySeeUserEvents() {
        pipeline.addReaction(reaction);

        pipeline.edit(g -> g.create(registry.lookup("forever")));
        pipeline.defer("add a pause", g -> g.create(registry.lookup("pause")));
        int applied = pipeline.settle();

        ArgumentCaptor<GraphEvent> events = ArgumentCaptor.forClass(GraphEvent.class);
        verify(reaction).onEvent(events.capture(), same(graph), same(pipeline));
        verify(reaction).afterSettle(graph);
        verifyNoMoreInteractions(reaction);
        assertThat(applied).isEqualTo(1);
        assertThat(events.getValue().type()).isEqualTo(GraphEvent.Type.CREATED);
        assertThat(events.getValue().origin()).isEqualTo(EventOrigin.USER);
        assertThat(graph.size()).isEqualTo(2);
    }

    @Test
    void fixesRunInQueueOrder() {
        List<String> order = new ArrayList<>();
        pipeline.defer("first", g -> order.add("first"));
        pipeline.defer("second", g -> order.add("second"));
        pipeline.defer("third", g -> order.add("third"));

        assertThat(pipeline.pendingCount()).isEqualTo(3);
        pipeline.settle();

        assertThat(order).containsExactly("first", "second", "third");
        assertThat(pipeline.hasPending()).isFalse();
    }

    @Test
    @DisplayName("A fix that breaks the structure is dropped along with the nodes it created")
    void violatingFixIsDropped() {
        Node show = graph.create(registry.lookup("show_number"));
        pipeline.defer("attach text to a number slot", g -> {
            Node text = g.create(registry.lookup("text"));
            g.attach(text.id(), SlotRef.of(show.id(), "NUM"));
        });
        pipeline.defer("still runs", g -> g.create(registry.lookup("pause")));

        int applied = pipeline.settle();

        assertThat(applied).isEqualTo(1);
        assertThat(graph.nodes()).extracting(n -> n.kind().tag()).containsExactly("show_number", "pause");
    }

    @Test
    void settleListenersRunAfterFixes() {
        pipeline.addSettleListener(settleListener);
        pipeline.defer("create", g -> g.create(registry.lookup("pause")));

        pipeline.settle();
        pipeline.settle();

        verify(settleListener, times(2)).accept(graph);
    }

    @Test
    void fixesQueuedWhileSettlingRunInTheSamePhase() {
        pipeline.defer("outer", g -> pipeline.defer("inner", inner -> inner.create(registry.lookup("pause"))));

        assertThat(pipeline.settle()).isEqualTo(2);
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void settleIsNotReentrant() {
        pipeline.defer("recursive", g -> pipeline.settle());

        assertThatThrownBy(pipeline::settle)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("reentrant");
    }

    @Test
    @DisplayName("Reactions that mutate the graph directly are rejected")
    void reactionsCannotMutateDuringDispatch() {
        pipeline.addReaction((event, g, scheduler) -> g.create(registry.lookup("pause")));

        assertThatThrownBy(() -> pipeline.edit(g -> g.create(registry.lookup("forever"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void removedReactionIsNoLongerNotified() {
        pipeline.addReaction(reaction);
        pipeline.removeReaction(reaction);

        pipeline.edit(g -> g.create(registry.lookup("pause")));
        pipeline.settle();

        verify(reaction, times(0)).onEvent(any(), any(), any());
    }
}
