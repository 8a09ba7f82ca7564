package com.guidestore.storage;

import com.guidestore.errors.AddressingException;

import java.util.Objects;

/**
 * Version token of a file as observed at one point in time. Two tokens are
 * equal only if modification time, size and content hash all match.
 */
public final class FileVersion {

    private final long modifiedNanos;
    private final long size;
    private final String hash;

    public FileVersion(long modifiedNanos, long size, String hash) {
        this.modifiedNanos = modifiedNanos;
        this.size = size;
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    public long getModifiedNanos() {
        return modifiedNanos;
    }

    public long getSize() {
        return size;
    }

    public String getHash() {
        return hash;
    }

    /** Opaque string form handed to clients, e.g. {@code 1718000000000000000-512-3f2a9c0e1b7d4a66}. */
    public String asToken() {
        return modifiedNanos + "-" + size + "-" + hash;
    }

    public static FileVersion parse(String token) {
        if (token == null || token.isBlank()) {
            throw AddressingException.missingParameter("version");
        }
        String[] parts = token.trim().split("-", 3);
        if (parts.length != 3 || parts[2].isEmpty()) {
            throw AddressingException.invalidParameter("version", "malformed version token");
        }
        try {
            return new FileVersion(Long.parseLong(parts[0]), Long.parseLong(parts[1]), parts[2]);
        } catch (NumberFormatException e) {
            throw AddressingException.invalidParameter("version", "malformed version token");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileVersion)) return false;
        FileVersion other = (FileVersion) o;
        return modifiedNanos == other.modifiedNanos && size == other.size && hash.equals(other.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modifiedNanos, size, hash);
    }

    @Override
    public String toString() {
        return asToken();
    }
}
