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
 * Exception thrown by content store backends.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ContentStoreException extends SqlfsException {

    private final String contentId;

    public ContentStoreException(String contentId, String message) {
        super(message);
        this.contentId = contentId;
    }

    public ContentStoreException(String contentId, String message, Throwable cause) {
        super(message, cause);
        this.contentId = contentId;
    }

    public String getContentId() {
        return contentId;
    }

    @Override
    public String getMessage() {
        return String.format("Content %s: %s", contentId, super.getMessage());
    }
}
