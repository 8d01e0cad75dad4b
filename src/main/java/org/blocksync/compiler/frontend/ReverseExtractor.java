package org.blocksync.compiler.frontend;

import org.blocksync.compiler.diagnostics.DiagnosticsEngine;
import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.BlockShape;
import org.blocksync.registry.ClauseMatch;
import org.blocksync.registry.ClauseSpec;
import org.blocksync.registry.ParameterSet;
import org.blocksync.registry.PatternMatch;
import org.blocksync.registry.Slot;
import org.blocksync.registry.SlotKind;
import org.blocksync.registry.features.opaque.OpaqueBlocks;
import org.blocksync.registry.pattern.Captures;
import org.blocksync.registry.pattern.SourceBlock;
import org.blocksync.registry.pattern.TextScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rebuilds a block graph from program text using the registry's patterns.
 * <p>
 * Each logical line is matched against the statement kinds in recognition order; at top level
 * event handler kinds are tried first. A match claims the lines indented below it as its body
 * and the sibling lines its clauses recognize. Value captures are matched recursively against
 * the value kinds, bodies recursively against the statement kinds. Consecutive top-level
 * statements form one stack until a blank line or an event handler starts a new one.
 * <p>
 * Extraction always builds a fresh graph, so a failed extraction leaves no partial state behind.
 */
public final class ReverseExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReverseExtractor.class);

    private final BlockKindRegistry registry;
    private final ExtractionPolicy policy;
    private final SourceReader reader = new SourceReader();

    public ReverseExtractor(BlockKindRegistry registry) {
        this(registry, ExtractionPolicy.PRESERVE);
    }

    public ReverseExtractor(BlockKindRegistry registry, ExtractionPolicy policy) {
        this.registry = registry;
        this.policy = policy;
    }

    public ExtractionPolicy policy() {
        return policy;
    }

    public ExtractionResult extract(String source) {
        return extract(source, "<source>");
    }

    /**
     * Extracts a graph from program text.
     * @param source     The program text.
     * @param sourceName A name for the text used in diagnostics, e.g. the file name.
     * @return The graph and everything that was not recognized.
     * @throws UnrecognizedFragmentException under {@link ExtractionPolicy#FAIL}, for the first
     *                                       fragment that is not recognized.
     */
    public ExtractionResult extract(String source, String sourceName) {
        Extraction extraction = new Extraction(sourceName);
        extraction.topLevel(reader.read(source));
        log.debug("Extracted {} node(s) from {}, {} unrecognized fragment(s)",
                extraction.graph.size(), sourceName, extraction.unrecognized.size());
        return new ExtractionResult(extraction.graph, extraction.unrecognized,
                extraction.diagnostics.getDiagnostics());
    }

    private record Recognized(PatternMatch match, int consumed) {
    }

    /** State of one extraction run. */
    private final class Extraction {

        private final Graph graph = new Graph();
        private final List<UnrecognizedFragment> unrecognized = new ArrayList<>();
        private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        private final String sourceName;

        Extraction(String sourceName) {
            this.sourceName = sourceName;
        }

        void topLevel(List<SourceBlock> blocks) {
            Node tail = null;
            int i = 0;
            while (i < blocks.size()) {
                SourceBlock block = blocks.get(i);
                if (isPass(block)) {
                    i++;
                    continue;
                }
                List<BlockKind> candidates = new ArrayList<>(registry.recognitionOrder(BlockShape.EVENT_HANDLER));
                candidates.addAll(registry.recognitionOrder(BlockShape.STATEMENT));
                StatementOutcome outcome = statement(blocks, i, candidates);
                i += outcome.consumed();
                Node node = outcome.node();
                if (node == null) {
                    continue;
                }
                if (node.kind().isEventHandler()) {
                    tail = null;
                    continue;
                }
                if (tail != null && !block.precededByBlank()) {
                    graph.attach(node.id(), SlotRef.next(tail.id()));
                }
                tail = node;
            }
        }

        Node body(List<SourceBlock> blocks) {
            List<BlockKind> candidates = registry.recognitionOrder(BlockShape.STATEMENT);
            Node head = null;
            Node tail = null;
            int i = 0;
            while (i < blocks.size()) {
                if (isPass(blocks.get(i))) {
                    i++;
                    continue;
                }
                StatementOutcome outcome = statement(blocks, i, candidates);
                i += outcome.consumed();
                if (outcome.node() == null) {
                    continue;
                }
                if (head == null) {
                    head = outcome.node();
                } else {
                    graph.attach(outcome.node().id(), SlotRef.next(tail.id()));
                }
                tail = outcome.node();
            }
            return head;
        }

        private StatementOutcome statement(List<SourceBlock> siblings, int index, List<BlockKind> candidates) {
            SourceBlock block = siblings.get(index);
            for (BlockKind kind : candidates) {
                Optional<Recognized> recognized = recognize(kind, siblings, index);
                if (recognized.isEmpty()) {
                    continue;
                }
                Optional<ParameterSet> parameters = kind.extract(recognized.get().match());
                if (parameters.isEmpty()) {
                    continue;
                }
                log.trace("Line {} recognized as {}: {}", block.line(), kind.tag(), parameters.get());
                Node node = build(kind, parameters.get(), block.line());
                return new StatementOutcome(node, recognized.get().consumed());
            }
            String text = block.toSourceText();
            Node preserved = unrecognized(block.line(), text, "no statement pattern matches", () -> {
                Node opaque = graph.create(registry.lookup(OpaqueBlocks.STATEMENT));
                graph.setField(opaque.id(), OpaqueBlocks.SOURCE, text);
                return opaque;
            });
            return new StatementOutcome(preserved, 1);
        }

        private Optional<Recognized> recognize(BlockKind kind, List<SourceBlock> siblings, int index) {
            SourceBlock block = siblings.get(index);
            Optional<Captures> header = kind.pattern().flatMap(p -> p.match(block.text()));
            if (header.isEmpty()) {
                return Optional.empty();
            }
            if (block.hasChildren() && !hasStatementSlot(kind)) {
                return Optional.empty();
            }
            List<ClauseMatch> clauses = new ArrayList<>();
            int next = index + 1;
            for (ClauseSpec spec : kind.clauses()) {
                boolean matched = false;
                while (next < siblings.size()) {
                    SourceBlock candidate = siblings.get(next);
                    if (!spec.hasBody() && candidate.hasChildren()) {
                        break;
                    }
                    Optional<Captures> captures = spec.matcher().match(candidate.text());
                    if (captures.isEmpty()) {
                        break;
                    }
                    clauses.add(new ClauseMatch(spec.name(), captures.get(), candidate.children(), candidate.line()));
                    next++;
                    matched = true;
                    if (!spec.repeatable()) {
                        break;
                    }
                }
                if (spec.required() && !matched) {
                    return Optional.empty();
                }
            }
            PatternMatch match = new PatternMatch(header.get(), block.children(), clauses, block.line());
            return Optional.of(new Recognized(match, next - index));
        }

        private Node build(BlockKind kind, ParameterSet parameters, int line) {
            Node node = kind.construct(parameters, graph);
            for (Map.Entry<String, String> value : parameters.values().entrySet()) {
                Slot slot = node.kind().slot(value.getKey(), node.mutation())
                        .orElseThrow(() -> new IllegalStateException(kind.tag() + " extracted unknown slot "
                                + value.getKey()));
                Node child = expression(value.getValue(), slot, line);
                if (child != null) {
                    graph.attach(child.id(), SlotRef.of(node.id(), slot.name()));
                }
            }
            for (Map.Entry<String, List<SourceBlock>> body : parameters.bodies().entrySet()) {
                Node head = body(body.getValue());
                if (head != null) {
                    graph.attach(head.id(), SlotRef.of(node.id(), body.getKey()));
                }
            }
            return node;
        }

        private Node expression(String source, Slot slot, int line) {
            String text = TextScanner.stripEnclosingParens(source);
            String reason = "no expression pattern matches";
            if (text.isEmpty() || !TextScanner.isBalanced(text)) {
                reason = "malformed expression";
            } else {
                for (BlockKind kind : registry.recognitionOrder(BlockShape.VALUE)) {
                    Optional<Captures> captures = kind.pattern().flatMap(p -> p.match(text));
                    if (captures.isEmpty()) {
                        continue;
                    }
                    Optional<ParameterSet> parameters = kind.extract(PatternMatch.of(captures.get()));
                    if (parameters.isEmpty()) {
                        continue;
                    }
                    if (!slot.accepts(kind.outputCheck())) {
                        reason = kind.tag() + " produces " + kind.outputCheck() + " but " + slot.name()
                                + " requires " + slot.check();
                        continue;
                    }
                    return build(kind, parameters.get(), line);
                }
            }
            return unrecognized(line, text, reason, () -> {
                Node opaque = graph.create(registry.lookup(OpaqueBlocks.EXPRESSION));
                graph.setField(opaque.id(), OpaqueBlocks.SOURCE, text);
                return opaque;
            });
        }

        private Node unrecognized(int line, String text, String reason, Supplier<Node> preserve) {
            UnrecognizedFragment fragment = new UnrecognizedFragment(line, text, reason);
            unrecognized.add(fragment);
            diagnostics.reportWarning(reason + ": " + firstLine(text), sourceName, line);
            log.debug("Unrecognized fragment at {}:{}: {}", sourceName, line, reason);
            return switch (policy) {
                case FAIL -> throw new UnrecognizedFragmentException(fragment);
                case SKIP -> null;
                case PRESERVE -> preserve.get();
            };
        }

        private boolean hasStatementSlot(BlockKind kind) {
            return kind.isMutable() || kind.slots().stream().anyMatch(s -> s.kind() == SlotKind.STATEMENT);
        }

        private boolean isPass(SourceBlock block) {
            return "pass".equals(block.text()) && !block.hasChildren();
        }

        private String firstLine(String text) {
            int newline = text.indexOf('\n');
            return newline < 0 ? text : text.substring(0, newline) + " ...";
        }
    }

    private record StatementOutcome(Node node, int consumed) {
    }
}
