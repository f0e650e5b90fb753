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

import java.util.Objects;

/**
 * Identity of a caller acting on the filesystem.
 *
 * <p>Filesystem entry points accept a {@code null} user to mean the system caller,
 * which bypasses all permission checks.</p>
 */
public interface FilesystemUser {

    /**
     * @return the stable string identity of this user
     */
    String getHandle();

    static FilesystemUser of(String handle) {
        return new SimpleUser(handle);
    }

    /**
     * Minimal user carrying only a handle.
     */
    final class SimpleUser implements FilesystemUser {
        private final String handle;

        private SimpleUser(String handle) {
            if (handle == null || handle.isBlank()) {
                throw new IllegalArgumentException("User handle cannot be null or empty");
            }
            this.handle = handle;
        }

        @Override
        public String getHandle() {
            return handle;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return handle.equals(((SimpleUser) o).handle);
        }

        @Override
        public int hashCode() {
            return Objects.hash(handle);
        }

        @Override
        public String toString() {
            return "User{" + handle + '}';
        }
    }
}
