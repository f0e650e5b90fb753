/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.sqlfs.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-user permission triple recorded on a filesystem node.
 *
 * <pre>
 *     perm = '  r    w    x  '
 *            Read  Write  Effect sub-files
 * </pre>
 *
 * <p>The third flag ("propagate") controls whether write access on a directory
 * extends to the entries beneath it. A user without an entry on a node is treated
 * as holding {@link #NONE}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Permission {

    public static final Permission NONE = new Permission(false, false, false);
    public static final Permission READ_ONLY = new Permission(true, false, false);
    public static final Permission READ_WRITE = new Permission(true, true, false);
    public static final Permission FULL = new Permission(true, true, true);

    private final boolean read;
    private final boolean write;
    private final boolean propagate;

    public Permission(boolean read, boolean write, boolean propagate) {
        this.read = read;
        this.write = write;
        this.propagate = propagate;
    }

    public boolean canRead() { return read; }
    public boolean canWrite() { return write; }
    public boolean propagates() { return propagate; }

    public boolean isNone() {
        return !read && !write && !propagate;
    }

    public Permission withRead(boolean value) {
        return new Permission(value, write, propagate);
    }

    public Permission withWrite(boolean value) {
        return new Permission(read, value, propagate);
    }

    public Permission withPropagate(boolean value) {
        return new Permission(read, write, value);
    }

    /**
     * Parse the three-character form, e.g. {@code "rwx"}, {@code "r--"} or {@code "-w-"}.
     *
     * @throws IllegalArgumentException if the text is not exactly three valid flag characters
     */
    public static Permission parse(String text) {
        if (text == null || text.length() != 3) {
            throw new IllegalArgumentException("Permission must have exactly three characters: " + text);
        }
        return new Permission(
                flag(text.charAt(0), 'r', text),
                flag(text.charAt(1), 'w', text),
                flag(text.charAt(2), 'x', text));
    }

    /**
     * Parse a grant list such as {@code "alice=rwx,bob=r--"}. Blank input yields an empty map.
     */
    public static Map<String, Permission> parseGrants(String text) {
        Map<String, Permission> grants = new HashMap<>();
        if (text == null || text.isBlank()) {
            return grants;
        }
        for (String entry : text.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("Malformed permission grant: " + trimmed);
            }
            grants.put(trimmed.substring(0, eq).trim(), parse(trimmed.substring(eq + 1).trim()));
        }
        return Collections.unmodifiableMap(grants);
    }

    private static boolean flag(char c, char expected, String text) {
        if (c == expected) {
            return true;
        }
        if (c == '-') {
            return false;
        }
        throw new IllegalArgumentException("Invalid permission flag '" + c + "' in: " + text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Permission that = (Permission) o;
        return read == that.read && write == that.write && propagate == that.propagate;
    }

    @Override
    public int hashCode() {
        return Objects.hash(read, write, propagate);
    }

    @Override
    public String toString() {
        return (read ? "r" : "-") + (write ? "w" : "-") + (propagate ? "x" : "-");
    }
}
