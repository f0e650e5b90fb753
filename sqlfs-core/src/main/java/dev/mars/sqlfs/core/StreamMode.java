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

/**
 * Direction of a content stream.
 */
public enum StreamMode {
    READ("read"),
    WRITE("write");

    private final String value;

    StreamMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static StreamMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stream mode cannot be null");
        }
        for (StreamMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown stream mode: " + value);
    }
}
