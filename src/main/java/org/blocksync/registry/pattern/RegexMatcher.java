package org.blocksync.registry.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a whole fragment against a regular expression and captures its named groups.
 */
public final class RegexMatcher implements IFragmentMatcher {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final Pattern pattern;
    private final List<String> groupNames;

    public RegexMatcher(String regex) {
        this(Pattern.compile(regex));
    }

    public RegexMatcher(Pattern pattern) {
        this.pattern = pattern;
        this.groupNames = new ArrayList<>();
        Matcher names = GROUP_NAME.matcher(pattern.pattern());
        while (names.find()) {
            groupNames.add(names.group(1));
        }
    }

    @Override
    public Optional<Captures> match(String fragment) {
        Matcher m = pattern.matcher(fragment);
        if (!m.matches()) {
            return Optional.empty();
        }
        Map<String, String> groups = new LinkedHashMap<>();
        for (String name : groupNames) {
            String value = m.group(name);
            if (value != null) {
                groups.put(name, value);
            }
        }
        return Optional.of(Captures.of(groups));
    }

    @Override
    public String toString() {
        return "regex(" + pattern.pattern() + ")";
    }
}
