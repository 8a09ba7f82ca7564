package com.guidestore.addressing;

import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ErrorCode;

import java.util.Locale;
import java.util.Map;

/**
 * Turns user-supplied paths such as {@code api/auth.md#jwt/tokens} into
 * canonical {@link Address} values. Pure string work, no I/O.
 */
public class AddressResolver {

    public static final String EXTENSION = ".md";

    public Address resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw AddressingException.invalidPath(String.valueOf(rawPath), "path is empty");
        }
        String raw = rawPath.trim();
        String fragment = null;
        int hash = raw.indexOf('#');
        if (hash >= 0) {
            fragment = normalizeSlug(raw.substring(hash + 1));
            if (fragment.isEmpty()) {
                throw AddressingException.invalidPath(rawPath, "empty section fragment");
            }
            raw = raw.substring(0, hash);
        }
        String path = canonicalize(raw, rawPath);
        if (!path.endsWith(EXTENSION) || path.length() <= EXTENSION.length() + 1
                || path.endsWith("/" + EXTENSION)) {
            throw AddressingException.invalidPath(rawPath, "document paths must end with " + EXTENSION);
        }
        Address address = new Address(path, fragment);
        if (fragment != null && address.getNamespace().isSequentialOnly()) {
            throw new AddressingException(ErrorCode.NAMESPACE_VIOLATION,
                "Tasks under " + address.getNamespace().getPrefix()
                    + " are taken in order; section fragments are not allowed",
                Map.of("path", path, "slug", fragment));
        }
        return address;
    }

    /** Canonical folder path (no extension required, no fragment allowed). */
    public String resolveFolder(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw AddressingException.invalidPath(String.valueOf(rawPath), "path is empty");
        }
        if (rawPath.indexOf('#') >= 0) {
            throw AddressingException.invalidPath(rawPath, "folders cannot carry a section fragment");
        }
        String path = canonicalize(rawPath.trim(), rawPath);
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if ("/".equals(path)) {
            throw AddressingException.invalidPath(rawPath, "the workspace root cannot be addressed");
        }
        return path;
    }

    /**
     * Resolves a section reference relative to a document. Accepts
     * {@code slug}, {@code #slug} and {@code /doc.md#slug}. A bare slug names
     * a section of {@code document} for structural edits, so the namespace's
     * fragment rule does not apply to it.
     */
    public Address resolveSection(String ref, Address document) {
        if (ref == null || ref.isBlank()) {
            throw AddressingException.missingParameter("section");
        }
        String trimmed = ref.trim();
        if (trimmed.contains(EXTENSION + "#")) {
            Address full = resolve(trimmed);
            if (!full.getDocumentPath().equals(document.getDocumentPath())) {
                throw AddressingException.invalidParameter("section",
                    "reference points at " + full.getDocumentPath() + ", not " + document.getDocumentPath());
            }
            return full;
        }
        String slug = normalizeSlug(trimmed.startsWith("#") ? trimmed.substring(1) : trimmed);
        if (slug.isEmpty()) {
            throw AddressingException.invalidPath(ref, "empty section reference");
        }
        return new Address(document.getDocumentPath(), slug);
    }

    /** Ad hoc task addressing needs an explicit fragment. */
    public Address requireFragment(Address address) {
        if (!address.hasSection()) {
            throw new AddressingException(ErrorCode.MISSING_PARAMETER,
                "A task slug is required, e.g. " + address.getDocumentPath() + "#task-slug",
                Map.of("path", address.getDocumentPath(), "parameter", "slug"));
        }
        return address;
    }

    /**
     * Path as shown to callers: the {@code /coordinator/} prefix collapses to
     * {@code /}, everything else (archived paths included) is unchanged.
     */
    public static String toUserPath(String path) {
        if (path == null || Namespace.of(path) != Namespace.COORDINATOR) {
            return path;
        }
        return "/" + Namespace.COORDINATOR.relativePath(path);
    }

    public static String normalizeSlug(String slug) {
        String s = slug.trim().toLowerCase(Locale.ROOT);
        while (s.startsWith("/")) s = s.substring(1);
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }

    private String canonicalize(String raw, String original) {
        String normalized = raw.replace('\\', '/').replaceAll("/{2,}", "/");
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        for (String segment : normalized.substring(1).split("/", -1)) {
            if (".".equals(segment) || "..".equals(segment)) {
                throw AddressingException.invalidPath(original, "relative segments are not allowed");
            }
            if (segment.isBlank() && normalized.length() > 1 && !normalized.endsWith("/")) {
                throw AddressingException.invalidPath(original, "empty path segment");
            }
        }
        return normalized;
    }
}
