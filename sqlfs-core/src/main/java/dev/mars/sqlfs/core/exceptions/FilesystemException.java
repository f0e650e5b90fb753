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
 * Exception thrown when a filesystem tree operation cannot be applied.
 * Carries the path (or node description) the operation was addressed to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FilesystemException extends SqlfsException {

    private final String path;

    public FilesystemException(String path, String message) {
        super(message);
        this.path = path;
    }

    public FilesystemException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    /**
     * The message without the path prefix.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return String.format("%s: %s", path, super.getMessage());
    }
}
