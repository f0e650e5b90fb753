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

package dev.mars.sqlfs.core.exceptions;

/**
 * Thrown when a user lacks a grant required by an operation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PermissionDeniedException extends FilesystemException {

    private final String handle;
    private final String requirement;

    public PermissionDeniedException(String path, String handle, String requirement) {
        super(path, "Permission denied for '" + handle + "' (requires " + requirement + ")");
        this.handle = handle;
        this.requirement = requirement;
    }

    public String getHandle() {
        return handle;
    }

    public String getRequirement() {
        return requirement;
    }
}
