package org.blocksync.workspace;

import org.blocksync.graph.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class HandlerUniquenessEnforcerTest {

    private Workspace workspace;

    @BeforeEach
    void setUp() {
        workspace = Workspace.create();
    }

    private List<Node> createHandlers(String... tags) {
        List<Node> created = new ArrayList<>();
        workspace.edit(g -> {
            for (String tag : tags) {
                created.add(g.create(workspace.registry().lookup(tag)));
            }
        });
        return created;
    }

    private boolean disabled(Node node) {
        return workspace.graph().node(node.id()).isDisabled();
    }

    @Test
    @DisplayName("A second handler with the same procedure name is disabled")
    void disablesLaterDuplicate() {
        List<Node> handlers = createHandlers("forever", "forever");

        workspace.settle();

        assertThat(disabled(handlers.get(0))).isFalse();
        assertThat(disabled(handlers.get(1))).isTrue();
        assertThat(workspace.handlers().disabledDuplicates()).containsExactly(handlers.get(1).id());
        assertThat(workspace.source()).containsOnlyOnce("def on_forever():");
    }

    @Test
    void handlersWithDifferentNamesStayEnabled() {
        List<Node> handlers = createHandlers("on_button_pressed", "on_button_pressed", "forever");
        workspace.edit(g -> g.setField(handlers.get(1).id(), "BUTTON", "B"));

        workspace.settle();

        assertThat(handlers).noneMatch(this::disabled);
    }

    @Test
    @DisplayName("Deleting the first handler re-enables the duplicate")
    void reEnablesWhenOriginalIsDeleted() {
        List<Node> handlers = createHandlers("on_start", "on_start");
        workspace.settle();

        workspace.edit(g -> g.dispose(handlers.get(0).id()));
        workspace.settle();

        assertThat(disabled(handlers.get(1))).isFalse();
        assertThat(workspace.handlers().disabledDuplicates()).isEmpty();
    }

    @Test
    @DisplayName("Changing a field so that names differ re-enables the duplicate")
    void reEnablesWhenNameChanges() {
        List<Node> handlers = createHandlers("on_gesture", "on_gesture");
        workspace.settle();
        assertThat(disabled(handlers.get(1))).isTrue();

        workspace.edit(g -> g.setField(handlers.get(1).id(), "GESTURE", "LOGO_UP"));
        workspace.settle();

        assertThat(disabled(handlers.get(1))).isFalse();
    }

    @Test
    @DisplayName("A handler the user disabled does not claim its name")
    void userDisabledHandlerIsLeftAlone() {
        List<Node> handlers = createHandlers("forever", "forever");
        workspace.edit(g -> g.setDisabled(handlers.get(0).id(), true));

        workspace.settle();

        assertThat(disabled(handlers.get(0))).isTrue();
        assertThat(disabled(handlers.get(1))).isFalse();
        assertThat(workspace.handlers().disabledDuplicates()).isEmpty();
    }
}
