package com.guidestore.sections;

import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ErrorCode;
import com.guidestore.errors.SectionNotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Heading hierarchy of one markdown document. Immutable: every edit returns
 * the rewritten document text in a {@link SectionEdit} and leaves this tree
 * untouched. Text outside the edited span is carried over unchanged.
 */
public final class SectionTree {

    private static final Pattern ATX = Pattern.compile("^ {0,3}(#{1,6})(?:[ \\t]+(.*?))?[ \\t]*$");
    private static final Pattern CLOSING_HASHES = Pattern.compile("(?:^|[ \\t]+)#+$");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,})");
    private static final Pattern HEADING_LINE = Pattern.compile("^ {0,3}#{1,6}[ \\t]+\\S.*", Pattern.DOTALL);
    private static final Pattern LINK = Pattern.compile("!?\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern INLINE_MARKS = Pattern.compile("\\*{1,3}|~~|`+");

    private static final int MAX_DEPTH = 6;

    private final String content;
    private final List<Heading> headings;

    private SectionTree(String content, List<Heading> headings) {
        this.content = content;
        this.headings = Collections.unmodifiableList(headings);
    }

    public static SectionTree parse(String content) {
        String text = content == null ? "" : content;
        List<int[]> spans = new ArrayList<>();
        List<String> titles = new ArrayList<>();
        scan(text, spans, titles);

        List<Heading> result = new ArrayList<>(spans.size());
        Slugger slugger = new Slugger();
        Deque<Integer> stack = new ArrayDeque<>();
        for (int i = 0; i < spans.size(); i++) {
            int[] span = spans.get(i);
            int depth = span[0];
            while (!stack.isEmpty() && spans.get(stack.peek())[0] >= depth) {
                stack.pop();
            }
            int parent = stack.isEmpty() ? -1 : stack.peek();
            stack.push(i);

            int end = text.length();
            for (int j = i + 1; j < spans.size(); j++) {
                if (spans.get(j)[0] <= depth) {
                    end = spans.get(j)[1];
                    break;
                }
            }
            int ownBodyEnd = i + 1 < spans.size() ? spans.get(i + 1)[1] : text.length();

            String slug = slugger.slug(titles.get(i));
            String path = slug;
            if (depth > 1 && parent >= 0) {
                Heading parentHeading = result.get(parent);
                if (parentHeading.getDepth() > 1) {
                    path = parentHeading.getPath() + "/" + slug;
                }
            }
            result.add(new Heading(i, slug, path, titles.get(i), depth, parent,
                span[1], span[2], span[3], ownBodyEnd, end));
        }
        return new SectionTree(text, result);
    }

    // span = {depth, startOffset, lineEnd, bodyOffset}
    private static void scan(String text, List<int[]> spans, List<String> titles) {
        int pos = 0;
        int len = text.length();
        char fenceChar = 0;
        int fenceLen = 0;
        while (pos < len) {
            int nl = text.indexOf('\n', pos);
            int next = nl < 0 ? len : nl + 1;
            int lineEnd = nl < 0 ? len : nl;
            if (lineEnd > pos && text.charAt(lineEnd - 1) == '\r') {
                lineEnd--;
            }
            String line = text.substring(pos, lineEnd);
            Matcher fence = FENCE.matcher(line);
            if (fenceChar != 0) {
                if (fence.find() && isClosingFence(line, fenceChar, fenceLen)) {
                    fenceChar = 0;
                }
            } else if (fence.find()) {
                fenceChar = fence.group(1).charAt(0);
                fenceLen = fence.group(1).length();
            } else {
                Matcher m = ATX.matcher(line);
                if (m.matches()) {
                    String title = cleanTitle(m.group(2));
                    if (!title.isEmpty()) {
                        spans.add(new int[] {m.group(1).length(), pos, lineEnd, next});
                        titles.add(title);
                    }
                }
            }
            pos = next;
        }
    }

    private static boolean isClosingFence(String line, char fenceChar, int fenceLen) {
        String trimmed = line.trim();
        if (trimmed.length() < fenceLen) {
            return false;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (trimmed.charAt(i) != fenceChar) {
                return false;
            }
        }
        return true;
    }

    static String cleanTitle(String raw) {
        if (raw == null) {
            return "";
        }
        String s = CLOSING_HASHES.matcher(raw.trim()).replaceAll("");
        s = LINK.matcher(s).replaceAll("$1");
        s = INLINE_MARKS.matcher(s).replaceAll("");
        return s.trim();
    }

    // -----------------------------------------------------------------
    // Lookup
    // -----------------------------------------------------------------

    public String getContent() {
        return content;
    }

    public List<Heading> getHeadings() {
        return headings;
    }

    /** Title of the first depth-1 heading, if any. */
    public Optional<String> getTitle() {
        return headings.stream().filter(h -> h.getDepth() == 1).map(Heading::getTitle).findFirst();
    }

    public List<String> getSlugs() {
        return headings.stream().map(Heading::getSlug).collect(Collectors.toList());
    }

    /**
     * Finds a heading by flat slug, then by exact hierarchical path, then by
     * path suffix ({@code auth/jwt} matches {@code api/auth/jwt}).
     */
    public Optional<Heading> find(String ref) {
        if (ref == null) {
            return Optional.empty();
        }
        String key = normalizeRef(ref);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        for (Heading h : headings) {
            if (h.getSlug().equals(key)) {
                return Optional.of(h);
            }
        }
        for (Heading h : headings) {
            if (h.getPath().equals(key)) {
                return Optional.of(h);
            }
        }
        String suffix = "/" + key;
        for (Heading h : headings) {
            if (h.getPath().endsWith(suffix)) {
                return Optional.of(h);
            }
        }
        return Optional.empty();
    }

    public Heading require(String ref) {
        return find(ref).orElseThrow(() -> new SectionNotFoundException(String.valueOf(ref), getSlugs()));
    }

    public Optional<Heading> parent(Heading heading) {
        int p = heading.getParentIndex();
        return p < 0 ? Optional.empty() : Optional.of(headings.get(p));
    }

    public List<Heading> children(Heading heading) {
        List<Heading> result = new ArrayList<>();
        for (int i = heading.getIndex() + 1; i < headings.size(); i++) {
            Heading h = headings.get(i);
            if (h.getStartOffset() >= heading.getEndOffset()) {
                break;
            }
            if (h.getParentIndex() == heading.getIndex()) {
                result.add(h);
            }
        }
        return result;
    }

    /** Heading line plus the whole span, trailing whitespace removed. */
    public String readSection(String ref) {
        Heading h = require(ref);
        return content.substring(h.getStartOffset(), h.getEndOffset()).stripTrailing();
    }

    /** Body including descendants, without the heading line. */
    public String readBody(String ref) {
        Heading h = require(ref);
        return normalizeBody(content.substring(h.getBodyOffset(), h.getEndOffset()));
    }

    /** Body up to the first child heading. */
    public String readOwnBody(String ref) {
        Heading h = require(ref);
        return normalizeBody(content.substring(h.getBodyOffset(), h.getOwnBodyEnd()));
    }

    // -----------------------------------------------------------------
    // Edits
    // -----------------------------------------------------------------

    public SectionEdit apply(SectionOperation operation, String ref, String title, String body, Integer depth) {
        switch (operation) {
            case REPLACE:
                return replace(ref, body);
            case APPEND:
                return append(ref, body);
            case PREPEND:
                return prepend(ref, body);
            case INSERT_BEFORE:
            case INSERT_AFTER:
            case APPEND_CHILD:
                return insert(operation, ref, title, body, depth);
            case REMOVE:
                return remove(ref);
            default:
                throw new IllegalArgumentException("Unsupported operation: " + operation);
        }
    }

    /**
     * Content starting with a heading line replaces the whole span; anything
     * else replaces the body (descendants included) under the kept heading.
     */
    public SectionEdit replace(String ref, String newContent) {
        Heading target = require(ref);
        String body = normalizeBody(newContent);
        if (HEADING_LINE.matcher(body).matches()) {
            int firstLineEnd = body.indexOf('\n');
            Matcher first = ATX.matcher(firstLineEnd < 0 ? body : body.substring(0, firstLineEnd));
            if (!first.matches() || cleanTitle(first.group(2)).isEmpty()) {
                throw AddressingException.invalidParameter("content", "heading line has no text once markup is removed");
            }
            StringBuilder sb = new StringBuilder(content.substring(0, target.getStartOffset()));
            sb.append(body).append('\n');
            if (target.getEndOffset() < content.length()) {
                sb.append('\n');
            }
            sb.append(content, target.getEndOffset(), content.length());
            return edited(SectionOperation.REPLACE, sb.toString(), target.getStartOffset(), true);
        }
        String updated = spliceBody(content, target.getBodyOffset(), target.getEndOffset(), body);
        return edited(SectionOperation.REPLACE, updated, target.getStartOffset(), false);
    }

    public SectionEdit append(String ref, String text) {
        Heading target = require(ref);
        String existing = normalizeBody(content.substring(target.getBodyOffset(), target.getOwnBodyEnd()));
        String addition = normalizeBody(text);
        String body = existing.isEmpty() ? addition : existing + "\n\n" + addition;
        String updated = spliceBody(content, target.getBodyOffset(), target.getOwnBodyEnd(), body);
        return edited(SectionOperation.APPEND, updated, target.getStartOffset(), false);
    }

    public SectionEdit prepend(String ref, String text) {
        Heading target = require(ref);
        String existing = normalizeBody(content.substring(target.getBodyOffset(), target.getOwnBodyEnd()));
        String addition = normalizeBody(text);
        String body = existing.isEmpty() ? addition : addition + "\n\n" + existing;
        String updated = spliceBody(content, target.getBodyOffset(), target.getOwnBodyEnd(), body);
        return edited(SectionOperation.PREPEND, updated, target.getStartOffset(), false);
    }

    /** Replaces the body up to the first child heading; children are kept. */
    public SectionEdit rewriteOwnBody(String ref, String body) {
        Heading target = require(ref);
        String updated = spliceBody(content, target.getBodyOffset(), target.getOwnBodyEnd(), normalizeBody(body));
        return edited(SectionOperation.REPLACE, updated, target.getStartOffset(), false);
    }

    public SectionEdit insert(SectionOperation operation, String ref, String title, String body, Integer depth) {
        if (!operation.createsSection()) {
            throw new IllegalArgumentException(operation + " does not create a section");
        }
        String cleanTitle = requireTitle(title);
        Heading target = require(ref);
        int d;
        if (depth != null) {
            d = depth;
        } else if (operation == SectionOperation.APPEND_CHILD) {
            d = Math.min(MAX_DEPTH, target.getDepth() + 1);
        } else {
            d = target.getDepth();
        }
        if (d < 1 || d > MAX_DEPTH) {
            throw AddressingException.invalidParameter("depth", "must be between 1 and " + MAX_DEPTH + ", got " + d);
        }
        int at = operation == SectionOperation.INSERT_BEFORE ? target.getStartOffset() : target.getEndOffset();
        String normalizedBody = normalizeBody(body);

        StringBuilder sb = new StringBuilder(content.substring(0, at));
        if (sb.length() > 0) {
            if (sb.charAt(sb.length() - 1) != '\n') {
                sb.append('\n');
            }
            if (sb.length() < 2 || sb.charAt(sb.length() - 2) != '\n') {
                sb.append('\n');
            }
        }
        int headingStart = sb.length();
        sb.append("#".repeat(d)).append(' ').append(cleanTitle).append('\n');
        if (!normalizedBody.isEmpty()) {
            sb.append('\n').append(normalizedBody).append('\n');
        }
        if (at < content.length()) {
            sb.append('\n');
        }
        sb.append(content, at, content.length());
        return edited(operation, sb.toString(), headingStart, true);
    }

    /** Deletes the heading and its whole span; the removed text is returned. */
    public SectionEdit remove(String ref) {
        Heading target = require(ref);
        String removed = content.substring(target.getStartOffset(), target.getEndOffset());
        String updated = content.substring(0, target.getStartOffset()) + content.substring(target.getEndOffset());
        return new SectionEdit(SectionOperation.REMOVE, updated, target.getSlug(), target.getPath(),
            target.getDepth(), removed.stripTrailing());
    }

    /**
     * Rewrites only the heading-line title. Slugs derived from the old title
     * are not carried over; callers re-resolve after a rename.
     */
    public SectionEdit rename(String ref, String newTitle) {
        String cleanTitle = requireTitle(newTitle);
        Heading target = require(ref);
        String updated = content.substring(0, target.getStartOffset())
            + "#".repeat(target.getDepth()) + " " + cleanTitle
            + content.substring(target.getLineEnd());
        return edited(SectionOperation.REPLACE, updated, target.getStartOffset(), true);
    }

    private SectionEdit edited(SectionOperation operation, String updated, int headingStart, boolean checkSiblings) {
        SectionTree after = parse(updated);
        Heading heading = after.headingAt(headingStart);
        if (checkSiblings) {
            after.ensureUniqueAmongSiblings(heading);
        }
        return new SectionEdit(operation, updated, heading.getSlug(), heading.getPath(), heading.getDepth(), null);
    }

    private Heading headingAt(int offset) {
        for (Heading h : headings) {
            if (h.getStartOffset() == offset) {
                return h;
            }
        }
        throw new IllegalStateException("No heading starts at offset " + offset);
    }

    private void ensureUniqueAmongSiblings(Heading heading) {
        String base = Slugger.slugify(heading.getTitle());
        for (Heading other : headings) {
            if (other.getIndex() != heading.getIndex()
                    && other.getParentIndex() == heading.getParentIndex()
                    && other.getDepth() == heading.getDepth()
                    && Slugger.slugify(other.getTitle()).equals(base)) {
                throw new AddressingException(ErrorCode.DUPLICATE_HEADING,
                    "A sibling heading already uses the slug '" + base + "'",
                    Map.of("slug", base, "title", heading.getTitle()));
            }
        }
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw AddressingException.missingParameter("title");
        }
        if (title.indexOf('\n') >= 0 || title.indexOf('\r') >= 0) {
            throw AddressingException.invalidParameter("title", "must be a single line");
        }
        if (cleanTitle(title).isEmpty()) {
            throw AddressingException.invalidParameter("title", "has no text once markup is removed");
        }
        return title.trim();
    }

    private static String spliceBody(String text, int from, int to, String body) {
        StringBuilder sb = new StringBuilder(text.substring(0, from));
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        boolean followed = to < text.length();
        if (!body.isEmpty()) {
            sb.append('\n').append(body).append('\n');
        }
        if (followed) {
            sb.append('\n');
        }
        sb.append(text, to, text.length());
        return sb.toString();
    }

    /** Drops leading blank lines and trailing whitespace. */
    public static String normalizeBody(String text) {
        if (text == null) {
            return "";
        }
        String s = text.stripTrailing();
        int i = 0;
        while (i < s.length()) {
            int nl = s.indexOf('\n', i);
            if (nl < 0 || !s.substring(i, nl).isBlank()) {
                break;
            }
            i = nl + 1;
        }
        return s.substring(i);
    }

    private static String normalizeRef(String ref) {
        String s = ref.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("#")) {
            s = s.substring(1);
        }
        while (s.startsWith("/")) s = s.substring(1);
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }
}
