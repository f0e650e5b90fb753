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

package dev.mars.sqlfs.filesystem;

import dev.mars.sqlfs.core.exceptions.InvalidOperationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Slash-delimited, root-relative path handling.
 *
 * <p>Empty segments are ignored, so {@code "/a//b/"} and {@code "a/b"} address the
 * same node. {@code "."} and {@code ".."} are rejected rather than interpreted.</p>
 */
public final class FilesystemPath {

    public static final String SEPARATOR = "/";
    public static final String ROOT = "/";
    public static final int MAX_NAME_LENGTH = 255;

    private FilesystemPath() {
        // Utility class
    }

    /**
     * Split a path into its name segments.
     *
     * @throws InvalidOperationException for a null path or a {@code .}/{@code ..} segment
     */
    public static List<String> segments(String path) throws InvalidOperationException {
        if (path == null) {
            throw new InvalidOperationException("null", "Path cannot be null");
        }
        List<String> segments = new ArrayList<>();
        for (String segment : path.split(SEPARATOR)) {
            if (segment.isEmpty()) {
                continue;
            }
            if (segment.equals(".") || segment.equals("..")) {
                throw new InvalidOperationException(path, "Relative segments are not supported");
            }
            segments.add(segment);
        }
        return segments;
    }

    /**
     * Last segment of the path, or the empty string for the root. The path
     * does not need to exist.
     */
    public static String fileName(String path) {
        if (path == null) {
            return "";
        }
        String[] parts = path.split(SEPARATOR);
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isEmpty()) {
                return parts[i];
            }
        }
        return "";
    }

    public static String join(String parent, String name) {
        String base = normalize(parent);
        return base.equals(ROOT) ? ROOT + name : base + SEPARATOR + name;
    }

    /**
     * Canonical form with a single leading slash and no trailing slash.
     * Segments are not validated.
     */
    public static String normalize(String path) {
        if (path == null) {
            return ROOT;
        }
        StringBuilder sb = new StringBuilder();
        for (String segment : path.split(SEPARATOR)) {
            if (!segment.isEmpty()) {
                sb.append(SEPARATOR).append(segment);
            }
        }
        return sb.length() == 0 ? ROOT : sb.toString();
    }

    /**
     * Check a single entry name.
     *
     * @param context path used in the error message
     * @throws InvalidOperationException if the name is blank, too long, contains a
     *                                   separator, or is {@code .} or {@code ..}
     */
    public static void validateName(String context, String name) throws InvalidOperationException {
        if (name == null || name.isBlank()) {
            throw new InvalidOperationException(context, "Name cannot be null or blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidOperationException(context, "Name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        if (name.contains(SEPARATOR)) {
            throw new InvalidOperationException(context, "Name cannot contain '" + SEPARATOR + "': " + name);
        }
        if (name.equals(".") || name.equals("..")) {
            throw new InvalidOperationException(context, "Reserved name: " + name);
        }
    }
}
