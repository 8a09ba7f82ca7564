package com.guidestore.tasks;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and rewrites {@code Key: value} marker lines in a task body.
 * Accepted forms, in priority order:
 * <pre>
 * * Key: value
 * - Key: value
 * **Key:** value
 * </pre>
 */
public final class TaskFields {

    private static final Pattern LIST_FIELD = Pattern.compile(
        "^[ \\t]*[-*][ \\t]+(?:\\*\\*)?([A-Za-z][A-Za-z0-9 _-]{0,40}?)(?::\\*\\*|\\*\\*:|:)[ \\t]*(.*?)[ \\t]*$",
        Pattern.MULTILINE);
    private static final Pattern BOLD_FIELD = Pattern.compile(
        "^[ \\t]*\\*\\*([A-Za-z][A-Za-z0-9 _-]{0,40}?):\\*\\*[ \\t]*(.*?)[ \\t]*$",
        Pattern.MULTILINE);

    private TaskFields() {
    }

    private static Pattern[] patternsFor(String key) {
        String k = Pattern.quote(key);
        int flags = Pattern.MULTILINE | Pattern.CASE_INSENSITIVE;
        return new Pattern[] {
            Pattern.compile("^[ \\t]*\\*[ \\t]+" + k + ":[ \\t]*(.*?)[ \\t]*$", flags),
            Pattern.compile("^[ \\t]*-[ \\t]+" + k + ":[ \\t]*(.*?)[ \\t]*$", flags),
            Pattern.compile("^[ \\t]*(?:[-*][ \\t]+)?\\*\\*" + k + ":\\*\\*[ \\t]*(.*?)[ \\t]*$", flags)
        };
    }

    public static Optional<String> extract(String body, String key) {
        if (body == null || body.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern p : patternsFor(key)) {
            Matcher m = p.matcher(body);
            if (m.find()) {
                return Optional.of(m.group(1).trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Body with the value of the first {@code key} line replaced, or empty
     * when the body has no such line.
     */
    public static Optional<String> replace(String body, String key, String value) {
        if (body == null || body.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern p : patternsFor(key)) {
            Matcher m = p.matcher(body);
            if (m.find()) {
                return Optional.of(body.substring(0, m.start(1)) + value + body.substring(m.end(1)));
            }
        }
        return Optional.empty();
    }

    /** All marker fields in document order; the first occurrence of a key wins. */
    public static Map<String, String> extractAll(String body) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (body == null || body.isEmpty()) {
            return fields;
        }
        for (String line : body.split("\n")) {
            Matcher m = LIST_FIELD.matcher(line);
            if (!m.matches()) {
                m = BOLD_FIELD.matcher(line);
                if (!m.matches()) {
                    continue;
                }
            }
            fields.putIfAbsent(m.group(1).trim(), m.group(2).trim());
        }
        return fields;
    }
}
