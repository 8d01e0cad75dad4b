package org.blocksync.compiler.backend;

import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.IRenderContext;
import org.blocksync.registry.Order;
import org.blocksync.registry.Slot;
import org.blocksync.registry.SlotKind;
import org.blocksync.registry.features.variables.VariableBlocks;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rendering state for one top-level stack: the graph, the options and whether the stack hangs
 * off an event handler.
 */
final class RenderContext implements IRenderContext {

    private final Graph graph;
    private final CompilerOptions options;
    private final boolean underEventHandler;

    RenderContext(Graph graph, CompilerOptions options, boolean underEventHandler) {
        this.graph = graph;
        this.options = options;
        this.underEventHandler = underEventHandler;
    }

    @Override
    public String valueToCode(Node node, String slotName, Order required) {
        Slot slot = node.kind().slot(slotName, node.mutation())
                .orElseThrow(() -> new IllegalArgumentException(node + " has no slot " + slotName));
        Optional<Node> child = node.child(slotName).map(graph::node).filter(this::renders);
        Fragment fragment = child.isPresent()
                ? child.get().kind().render(child.get(), this)
                : Fragment.atomic(slot.defaultValue() == null ? "None" : slot.defaultValue());
        if (fragment.isEmpty()) {
            return "None";
        }
        return fragment.order().needsParenthesesWithin(required) ? "(" + fragment.code() + ")" : fragment.code();
    }

    @Override
    public String statementToCode(Node node, String slotName) {
        String body = node.child(slotName).map(head -> renderChain(graph.node(head))).orElse("");
        if (body.isEmpty()) {
            body = "pass\n";
        }
        return indentLines(body);
    }

    @Override
    public String indent() {
        return options.indent();
    }

    @Override
    public Graph graph() {
        return graph;
    }

    @Override
    public List<String> assignedVariables(Node node) {
        Set<String> names = new LinkedHashSet<>();
        for (Node n : renderedBelow(node)) {
            if (VariableBlocks.ASSIGNING.contains(n.kind().tag())) {
                names.add(n.field(VariableBlocks.VAR));
            }
        }
        return new ArrayList<>(names);
    }

    @Override
    public boolean awaits(Node node) {
        return renderedBelow(node).stream().anyMatch(n -> n.kind().isAwaited());
    }

    /** Renders a statement chain, leaving out disabled statements and, if gated, detached ones. */
    String renderChain(Node head) {
        StringBuilder sb = new StringBuilder();
        for (Node statement : graph.chain(head.id())) {
            if (renders(statement)) {
                sb.append(statement.kind().render(statement, this).code());
            }
        }
        return sb.toString();
    }

    private boolean renders(Node node) {
        if (node.isDisabled()) {
            return false;
        }
        return !(node.kind().isGated() && !underEventHandler && options.gateDetachedStatements());
    }

    /**
     * Collects the nodes below {@code node} that produce text, in pre-order. A node that is left
     * out takes its slots with it; its chain successors are still collected.
     */
    private List<Node> renderedBelow(Node node) {
        List<Node> result = new ArrayList<>();
        collectSlots(node, result);
        return result;
    }

    private void collectSlots(Node node, List<Node> into) {
        for (Slot slot : node.kind().slots(node.mutation())) {
            if (slot.kind() != SlotKind.FIELD) {
                node.child(slot.name()).map(graph::node).ifPresent(c -> collectRendered(c, into));
            }
        }
    }

    private void collectRendered(Node node, List<Node> into) {
        if (renders(node)) {
            into.add(node);
            collectSlots(node, into);
        }
        node.next().map(graph::node).ifPresent(n -> collectRendered(n, into));
    }

    private String indentLines(String code) {
        StringBuilder sb = new StringBuilder(code.length() + 16);
        String prefix = options.indent();
        int start = 0;
        while (start < code.length()) {
            int end = code.indexOf('\n', start);
            if (end < 0) {
                end = code.length() - 1;
            }
            sb.append(prefix).append(code, start, end + 1);
            start = end + 1;
        }
        return sb.toString();
    }
}
