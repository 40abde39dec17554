package com.logchef.logchefql.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A field reference: either a bare column name or a base column with a nested path
 * ({@code log_attributes.http.status} or {@code attrs."key with spaces"}).
 * Path segments are stored unquoted.
 */
public final class FieldPath {

    private final String base;
    private final List<String> path;

    public FieldPath(String base, List<String> path) {
        this.base = Objects.requireNonNull(base, "base");
        this.path = path == null ? List.of() : List.copyOf(path);
    }

    public static FieldPath simple(String name) {
        return new FieldPath(name, List.of());
    }

    /**
     * Parse the raw text of a key token. Dots separate segments outside quotes;
     * quoted segments keep dots and spaces verbatim.
     */
    public static FieldPath parse(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        boolean segmentQuoted = false;
        char quoteChar = 0;

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (inQuote) {
                if (c == '\\' && i + 1 < raw.length()) {
                    current.append(raw.charAt(++i));
                } else if (c == quoteChar) {
                    inQuote = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                inQuote = true;
                segmentQuoted = true;
                quoteChar = c;
            } else if (c == '.') {
                if (current.length() > 0 || segmentQuoted) {
                    parts.add(current.toString());
                }
                current.setLength(0);
                segmentQuoted = false;
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0 || segmentQuoted) {
            parts.add(current.toString());
        }

        if (parts.isEmpty()) {
            return simple(raw);
        }
        return new FieldPath(parts.get(0), parts.subList(1, parts.size()));
    }

    public String getBase() {
        return base;
    }

    public List<String> getPath() {
        return Collections.unmodifiableList(path);
    }

    public boolean isNested() {
        return !path.isEmpty();
    }

    /**
     * Dotted rendering, {@code base.seg1.seg2}
     */
    public String toDottedString() {
        if (path.isEmpty()) {
            return base;
        }
        return base + "." + String.join(".", path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath)) return false;
        FieldPath that = (FieldPath) o;
        return base.equals(that.base) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, path);
    }

    @Override
    public String toString() {
        return toDottedString();
    }
}
