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

import dev.mars.sqlfs.core.exceptions.ContentNotFoundException;
import dev.mars.sqlfs.core.exceptions.InvalidOperationException;
import dev.mars.sqlfs.core.exceptions.NameConflictException;
import dev.mars.sqlfs.core.exceptions.NodeNotFoundException;
import dev.mars.sqlfs.core.exceptions.PermissionDeniedException;
import dev.mars.sqlfs.core.exceptions.SqlfsException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Algebraic data type for the outcome of a {@link SerializedFilesystem} operation.
 *
 * <p>Callers switch on the permitted subtypes, or on {@link #kind()}, instead of
 * catching exceptions or testing booleans.</p>
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link Ok}: the operation succeeded; carries its value</li>
 *   <li>{@link PermissionDenied}: a permission check failed, nothing was changed</li>
 *   <li>{@link NotFound}: a path or content object does not exist</li>
 *   <li>{@link Conflict}: a name collision or a cycle</li>
 *   <li>{@link Invalid}: a malformed request, e.g. a bad name or removing the root</li>
 *   <li>{@link Failed}: a storage backend failed</li>
 * </ul>
 *
 * @param <T> the type of value produced on success
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface FilesystemResult<T>
        permits FilesystemResult.Ok,
                FilesystemResult.PermissionDenied,
                FilesystemResult.NotFound,
                FilesystemResult.Conflict,
                FilesystemResult.Invalid,
                FilesystemResult.Failed {

    enum Kind {
        OK,
        PERMISSION_DENIED,
        NOT_FOUND,
        CONFLICT,
        INVALID,
        FAILED
    }

    Kind kind();

    /**
     * One-line description suitable for logs and error responses.
     */
    String describe();

    record Ok<T>(T value) implements FilesystemResult<T> {
        @Override
        public Kind kind() {
            return Kind.OK;
        }

        @Override
        public String describe() {
            return "OK";
        }
    }

    /**
     * @param path        the node the check was made on
     * @param handle      the user that was denied
     * @param requirement the failed check, e.g. {@code "read"} or {@code "write (subtree)"}
     */
    record PermissionDenied<T>(String path, String handle, String requirement) implements FilesystemResult<T> {
        public PermissionDenied {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(requirement, "requirement");
        }

        @Override
        public Kind kind() {
            return Kind.PERMISSION_DENIED;
        }

        @Override
        public String describe() {
            return "Permission denied: " + handle + " lacks " + requirement + " on " + path;
        }
    }

    /**
     * @param target the missing path or content id
     */
    record NotFound<T>(String target) implements FilesystemResult<T> {
        public NotFound {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public Kind kind() {
            return Kind.NOT_FOUND;
        }

        @Override
        public String describe() {
            return "Not found: " + target;
        }
    }

    record Conflict<T>(String path, String reason) implements FilesystemResult<T> {
        @Override
        public Kind kind() {
            return Kind.CONFLICT;
        }

        @Override
        public String describe() {
            return "Conflict at " + path + ": " + reason;
        }
    }

    record Invalid<T>(String path, String reason) implements FilesystemResult<T> {
        @Override
        public Kind kind() {
            return Kind.INVALID;
        }

        @Override
        public String describe() {
            return "Invalid operation on " + path + ": " + reason;
        }
    }

    record Failed<T>(String reason, Throwable cause) implements FilesystemResult<T> {
        @Override
        public Kind kind() {
            return Kind.FAILED;
        }

        @Override
        public String describe() {
            return "Failed: " + reason;
        }
    }

    default boolean isOk() {
        return kind() == Kind.OK;
    }

    default T orElse(T other) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        return other;
    }

    default Optional<T> toOptional() {
        if (this instanceof Ok<T> ok) {
            return Optional.ofNullable(ok.value());
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalStateException if this is not {@link Ok}
     */
    default T getOrThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new IllegalStateException(describe());
    }

    /**
     * Transforms the value of an {@link Ok}; other outcomes are carried over unchanged.
     */
    @SuppressWarnings("unchecked")
    default <U> FilesystemResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        // Non-Ok variants carry no value, so the type parameter is phantom.
        return (FilesystemResult<U>) (FilesystemResult<?>) this;
    }

    static <T> FilesystemResult<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * Maps an engine exception onto the matching outcome.
     */
    static <T> FilesystemResult<T> fromException(SqlfsException e) {
        if (e instanceof PermissionDeniedException denied) {
            return new PermissionDenied<>(denied.getPath(), denied.getHandle(), denied.getRequirement());
        }
        if (e instanceof NodeNotFoundException notFound) {
            return new NotFound<>(notFound.getPath());
        }
        if (e instanceof ContentNotFoundException missing) {
            return new NotFound<>(String.valueOf(missing.getContentId()));
        }
        if (e instanceof NameConflictException conflict) {
            return new Conflict<>(conflict.getPath(), conflict.getReason());
        }
        if (e instanceof InvalidOperationException invalid) {
            return new Invalid<>(invalid.getPath(), invalid.getReason());
        }
        return new Failed<>(e.getMessage(), e);
    }
}
