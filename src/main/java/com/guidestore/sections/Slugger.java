package com.guidestore.sections;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * GitHub-style heading slugs. An instance remembers the slugs it has issued
 * and suffixes repeats with {@code -1}, {@code -2}, ... in call order.
 */
public class Slugger {

    // Everything except letters, marks, digits, connector punctuation, '-' and ' '.
    private static final Pattern STRIP = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\p{Pc}\\- ]");

    private final Map<String, Integer> occurrences = new HashMap<>();

    public static String slugify(String title) {
        if (title == null) {
            return "";
        }
        String lowered = title.trim().toLowerCase(Locale.ROOT);
        return STRIP.matcher(lowered).replaceAll("").replace(' ', '-');
    }

    public String slug(String title) {
        String base = slugify(title);
        if (base.isEmpty()) {
            base = "section";
        }
        String candidate = base;
        while (occurrences.containsKey(candidate)) {
            int n = occurrences.merge(base, 1, Integer::sum);
            candidate = base + "-" + n;
        }
        occurrences.put(candidate, 0);
        return candidate;
    }

    public void reset() {
        occurrences.clear();
    }
}
