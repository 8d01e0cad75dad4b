package org.blocksync.workspace;

import org.blocksync.graph.Node;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.features.loops.LoopBlocks;
import org.blocksync.registry.features.variables.VariableBlocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoopVariableMaintainerTest {

    private Workspace workspace;
    private Node loop;
    private Node reference;

    @BeforeEach
    void setUp() {
        workspace = Workspace.create();
        AtomicReference<Node> created = new AtomicReference<>();
        workspace.edit(g -> {
            Node forRange = g.create(workspace.registry().lookup(LoopBlocks.FOR_RANGE));
            Node variable = g.create(workspace.registry().lookup(VariableBlocks.GET));
            g.setField(variable.id(), VariableBlocks.VAR, "i");
            g.attach(variable.id(), SlotRef.of(forRange.id(), LoopBlocks.VAR));
            created.set(variable);
            loop = forRange;
        });
        workspace.settle();
        reference = created.get();
    }

    private Node slotContent() {
        return workspace.graph().child(loop.id(), LoopBlocks.VAR).orElseThrow();
    }

    @Test
    void tracksReferencesInBindingSlots() {
        assertThat(workspace.loopVariables().tracked())
                .containsEntry(reference.id(), new LoopVariableMaintainer.Binding(loop.id(), LoopBlocks.VAR, "i"));
    }

    @Test
    @DisplayName("Dragging the loop variable out puts a fresh reference back")
    void restoresDetachedReference() {
        workspace.edit(g -> g.detach(reference.id()));
        assertThat(workspace.graph().child(loop.id(), LoopBlocks.VAR)).isEmpty();

        workspace.settle();

        Node restored = slotContent();
        assertThat(restored.id()).isNotEqualTo(reference.id());
        assertThat(restored.field(VariableBlocks.VAR)).isEqualTo("i");
        assertThat(workspace.graph().node(reference.id()).isRoot()).isTrue();
        assertThat(workspace.loopVariables().tracked()).containsOnlyKeys(restored.id());
    }

    @Test
    void restoresDeletedReference() {
        workspace.edit(g -> g.dispose(reference.id()));
        workspace.settle();

        assertThat(slotContent().field(VariableBlocks.VAR)).isEqualTo("i");
    }

    @Test
    @DisplayName("A slot the user refilled before settling is left as it is")
    void refilledSlotIsNotTouched() {
        AtomicReference<Node> replacement = new AtomicReference<>();
        workspace.edit(g -> {
            g.detach(reference.id());
            Node other = g.create(workspace.registry().lookup(VariableBlocks.GET));
            g.setField(other.id(), VariableBlocks.VAR, "j");
            g.attach(other.id(), SlotRef.of(loop.id(), LoopBlocks.VAR));
            replacement.set(other);
        });
        workspace.settle();

        assertThat(slotContent().id()).isEqualTo(replacement.get().id());
        assertThat(slotContent().field(VariableBlocks.VAR)).isEqualTo("j");
    }

    @Test
    void deletedLoopIsNotRestored() {
        workspace.edit(g -> g.dispose(loop.id()));
        workspace.settle();

        assertThat(workspace.graph().isEmpty()).isTrue();
        assertThat(workspace.loopVariables().tracked()).isEmpty();
    }
}
