package io.datawrangle.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Expands the column selectors accepted wherever a recipe names columns ({@code columns},
 * {@code not_columns}, {@code input}, {@code column}) against the columns of a dataset:
 *
 * <ul>
 *   <li>{@code name} matches that column and fails when it does not exist;
 *   <li>{@code name?} matches the column when it exists and nothing otherwise;
 *   <li>{@code pre*fix} matches every column where each {@code *} stands for any text; {@code \*}
 *       is a literal star;
 *   <li>{@code regex:<pattern>} matches every column the whole of which matches the Java regular
 *       expression.
 * </ul>
 *
 * Results follow selector order, then column order within one pattern, and never repeat a column.
 */
public final class ColumnSelector {

    private static final String REGEX_PREFIX = "regex:";

    private ColumnSelector() {}

    /**
     * @throws IllegalArgumentException if a plain name does not exist or a regex does not compile
     */
    public static List<String> expand(List<String> columns, List<String> selectors) {
        Set<String> result = new LinkedHashSet<>();
        for (String selector : selectors) {
            Pattern pattern = pattern(selector);
            if (pattern != null) {
                for (String column : columns) {
                    if (pattern.matcher(column).matches()) {
                        result.add(column);
                    }
                }
                continue;
            }
            String name = selector.replace("\\*", "*");
            if (columns.contains(name)) {
                result.add(name);
            } else if (name.endsWith("?")) {
                String optional = name.substring(0, name.length() - 1);
                if (columns.contains(optional)) {
                    result.add(optional);
                }
            } else {
                throw new IllegalArgumentException("Column '" + name + "' does not exist; columns are " + columns);
            }
        }
        return List.copyOf(result);
    }

    /** Whether {@code selector} can match any number of columns rather than exactly one. */
    public static boolean isPattern(String selector) {
        return isRegex(selector) || hasWildcard(selector) || selector.endsWith("?");
    }

    private static boolean isRegex(String selector) {
        return selector.toLowerCase(Locale.ROOT).startsWith(REGEX_PREFIX);
    }

    private static boolean hasWildcard(String selector) {
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (c == '\\' && i + 1 < selector.length() && selector.charAt(i + 1) == '*') {
                i++;
            } else if (c == '*') {
                return true;
            }
        }
        return false;
    }

    private static Pattern pattern(String selector) {
        if (isRegex(selector)) {
            String regex = selector.substring(REGEX_PREFIX.length()).strip();
            try {
                return Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        "Invalid regex in column selector '" + selector + "': " + e.getDescription(), e);
            }
        }
        if (!hasWildcard(selector)) {
            return null;
        }
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (c == '\\' && i + 1 < selector.length() && selector.charAt(i + 1) == '*') {
                literal.append('*');
                i++;
            } else if (c == '*') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(".*");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}
