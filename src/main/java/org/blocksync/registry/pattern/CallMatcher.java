package org.blocksync.registry.pattern;

import java.util.List;
import java.util.Optional;

/**
 * Matches a call {@code callee(arg, arg, ...)} whose arguments are split at top-level commas,
 * so nested calls and string literals containing commas stay intact. Each argument is matched
 * by its own sub-pattern.
 */
public final class CallMatcher implements IFragmentMatcher {

    private final String callee;
    private final List<RegexMatcher> arguments;

    /**
     * @param callee       The dotted callee, e.g. {@code basic.show_number}.
     * @param argumentRegex One regular expression per argument, with named groups.
     */
    public CallMatcher(String callee, String... argumentRegex) {
        this.callee = callee;
        this.arguments = java.util.Arrays.stream(argumentRegex).map(RegexMatcher::new).toList();
    }

    @Override
    public Optional<Captures> match(String fragment) {
        String prefix = callee + "(";
        if (!fragment.startsWith(prefix) || !fragment.endsWith(")")) {
            return Optional.empty();
        }
        int open = callee.length();
        if (TextScanner.matchingClose(fragment, open) != fragment.length() - 1) {
            return Optional.empty();
        }
        List<String> parts = TextScanner.splitTopLevel(fragment.substring(open + 1, fragment.length() - 1), ',');
        if (parts.size() != arguments.size()) {
            return Optional.empty();
        }
        Captures captures = Captures.empty();
        for (int i = 0; i < parts.size(); i++) {
            Optional<Captures> arg = arguments.get(i).match(parts.get(i));
            if (arg.isEmpty()) {
                return Optional.empty();
            }
            captures = captures.merge(arg.get());
        }
        return Optional.of(captures);
    }

    @Override
    public String toString() {
        return "call(" + callee + "/" + arguments.size() + ")";
    }
}
