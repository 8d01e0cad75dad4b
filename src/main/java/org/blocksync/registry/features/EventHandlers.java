package org.blocksync.registry.features;

import org.blocksync.graph.Mutation;
import org.blocksync.graph.Node;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.ClauseMatch;
import org.blocksync.registry.ClauseSpec;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.IRenderContext;
import org.blocksync.registry.ParameterSet;
import org.blocksync.registry.PatternMatch;
import org.blocksync.registry.Slot;
import org.blocksync.registry.SlotKind;
import org.blocksync.registry.pattern.Captures;
import org.blocksync.registry.pattern.IFragmentMatcher;
import org.blocksync.registry.pattern.RegexMatcher;
import org.blocksync.registry.pattern.SourceBlock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Shared shape of event handler kinds. A handler compiles to
 * <pre>
 * [async ]def NAME():
 *     global a, b          (only if the body assigns variables)
 *     BODY
 *     EPILOGUE             (optional, e.g. the pause of an interval loop)
 * REGISTRATION(NAME)
 * </pre>
 * where {@code NAME} is derived from the handler's fields and {@code async} is added when the
 * body awaits something. Extraction accepts a definition only
 * if the definition name, the name passed to the registration and the name derived from the
 * registration's parameters all agree.
 */
public final class EventHandlers {

    /** The statement slot holding the handler body. */
    public static final String BODY = "DO";

    private static final String REGISTRATION = "registration";
    private static final IFragmentMatcher DEFINITION = new RegexMatcher("(?:async )?def (?<PROC>[A-Za-z_]\\w*)\\(\\):");
    private static final Pattern GLOBAL_LINE =
            Pattern.compile("global\\s+[A-Za-z_]\\w*(?:\\s*,\\s*[A-Za-z_]\\w*)*");

    private EventHandlers() {
    }

    /**
     * Renders the line registering a handler procedure.
     */
    @FunctionalInterface
    public interface IRegistration {
        String render(Node node, String procedureName, IRenderContext context);
    }

    /**
     * A line the handler always appends to its body, and the pattern recognizing it. Captures of
     * the pattern fill value slots of the same name.
     */
    public record Epilogue(IRegistration line, IFragmentMatcher pattern) {
    }

    /**
     * Completes a handler kind whose fields (and value slots used by an epilogue) are already
     * declared on {@code base}.
     *
     * @param base                The builder with the handler's parameter slots.
     * @param naming              Derives the procedure name from field values.
     * @param registration        Renders the registration line.
     * @param registrationPattern Recognizes the registration line; must capture {@code HANDLER}.
     * @param epilogue            An optional trailing body line, may be {@code null}.
     * @return The finished kind.
     */
    public static BlockKind build(BlockKind.Builder base, Function<Map<String, String>, String> naming,
                                  IRegistration registration, IFragmentMatcher registrationPattern,
                                  Epilogue epilogue) {
        return base.statementInput(BODY)
                .procedureName(naming)
                .render((node, ctx) -> render(node, ctx, registration, epilogue))
                .pattern(DEFINITION)
                .clause(new ClauseSpec(REGISTRATION, registrationPattern, false, true, false))
                .extractor((kind, match) -> extract(kind, match, epilogue))
                .build();
    }

    private static Fragment render(Node node, IRenderContext ctx, IRegistration registration, Epilogue epilogue) {
        String name = node.kind().procedureName(node).orElseThrow();
        StringBuilder sb = new StringBuilder(ctx.awaits(node) ? "async def " : "def ").append(name).append("():\n");
        List<String> globals = ctx.assignedVariables(node);
        if (!globals.isEmpty()) {
            sb.append(ctx.indent()).append("global ").append(String.join(", ", globals)).append('\n');
        }
        if (epilogue == null || node.child(BODY).isPresent()) {
            sb.append(ctx.statementToCode(node, BODY));
        }
        if (epilogue != null) {
            sb.append(ctx.indent()).append(epilogue.line().render(node, name, ctx)).append('\n');
        }
        sb.append(registration.render(node, name, ctx)).append('\n');
        return Fragment.statement(sb.toString());
    }

    private static Optional<ParameterSet> extract(BlockKind kind, PatternMatch match, Epilogue epilogue) {
        List<ClauseMatch> registrations = match.clauses(REGISTRATION);
        if (registrations.isEmpty()) {
            return Optional.empty();
        }
        Captures registrationCaptures = registrations.get(0).captures();
        ParameterSet.Builder params = ParameterSet.builder();
        Map<String, String> fields = new LinkedHashMap<>();
        for (Slot slot : kind.slots()) {
            if (slot.kind() != SlotKind.FIELD) {
                continue;
            }
            fields.put(slot.name(), slot.defaultValue());
            Optional<String> captured = registrationCaptures.find(slot.name());
            if (captured.isPresent()) {
                fields.put(slot.name(), captured.get());
                params.field(slot.name(), captured.get());
            }
        }
        String expected = kind.procedureName(fields).orElseThrow();
        if (!expected.equals(match.header().get("PROC")) || !expected.equals(registrationCaptures.get("HANDLER"))) {
            return Optional.empty();
        }

        List<SourceBlock> body = new ArrayList<>(match.body());
        if (!body.isEmpty() && GLOBAL_LINE.matcher(body.get(0).text()).matches()) {
            body.remove(0);
        }
        if (epilogue != null) {
            if (body.isEmpty()) {
                return Optional.empty();
            }
            SourceBlock last = body.get(body.size() - 1);
            Optional<Captures> tail = last.hasChildren() ? Optional.empty() : epilogue.pattern().match(last.text());
            if (tail.isEmpty()) {
                return Optional.empty();
            }
            tail.get().asMap().forEach((slot, expression) -> {
                if (kind.slot(slot, Mutation.NONE).filter(s -> s.kind() == SlotKind.VALUE).isPresent()) {
                    params.value(slot, expression);
                }
            });
            body.remove(body.size() - 1);
        }
        params.body(BODY, body);
        return Optional.of(params.build());
    }
}
