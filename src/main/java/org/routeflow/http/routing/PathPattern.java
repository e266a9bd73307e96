package org.routeflow.http.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Anchored matcher compiled from a route path such as {@code /users/{id}/orders/{orderId}}.
 * Each placeholder becomes a positional group matching one or more non-slash characters; the placeholder names are
 * kept alongside in the order they appear.
 */
public final class PathPattern {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)}");
    private static final String SEGMENT = "([^/]+)";
    // A brace that does not open a {n}, {n,} or {n,m} quantifier is plain text, as in PCRE.
    private static final Pattern LITERAL_BRACE = Pattern.compile("\\{(?!\\d+(?:,\\d*)?})");

    private final Pattern pattern;
    private final List<String> paramNames;

    private PathPattern(Pattern pattern, List<String> paramNames) {
        this.pattern = pattern;
        this.paramNames = paramNames;
    }

    public static PathPattern compile(String path) {
        return compile(path, true);
    }

    /**
     * @param quoteLiterals when false, the text between placeholders is used as raw regex
     */
    public static PathPattern compile(String path, boolean quoteLiterals) {
        List<String> paramNames = new ArrayList<>();
        StringBuilder regexBuilder = new StringBuilder("^");
        Matcher m = PLACEHOLDER.matcher(path);
        int start = 0;
        while (m.find()) {
            String name = m.group(1);
            if (paramNames.contains(name)) {
                throw new IllegalArgumentException("Duplicate placeholder {" + name + "} in route " + path);
            }
            regexBuilder.append(literal(path.substring(start, m.start()), quoteLiterals));
            regexBuilder.append(SEGMENT);
            paramNames.add(name);
            start = m.end();
        }
        regexBuilder.append(literal(path.substring(start), quoteLiterals));
        regexBuilder.append('$');
        return new PathPattern(Pattern.compile(regexBuilder.toString()), Collections.unmodifiableList(paramNames));
    }

    private static String literal(String text, boolean quote) {
        if (text.isEmpty()) {
            return text;
        }
        if (!quote) {
            return LITERAL_BRACE.matcher(text).replaceAll("\\\\{");
        }
        return Pattern.quote(text);
    }

    public Optional<Map<String, String>> match(String path) {
        Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < paramNames.size(); i++) {
            params.put(paramNames.get(i), matcher.group(i + 1));
        }
        return Optional.of(params);
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathPattern other)) {
            return false;
        }
        return pattern.pattern().equals(other.pattern.pattern()) && paramNames.equals(other.paramNames);
    }

    @Override
    public int hashCode() {
        return pattern.pattern().hashCode() * 31 + paramNames.hashCode();
    }

    @Override
    public String toString() {
        return pattern.pattern();
    }

}
