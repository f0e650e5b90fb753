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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mars.sqlfs.core.Node;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of a directory listing, as seen by a particular user.
 *
 * <p>Serializes with the hyphenated keys used by existing listing consumers;
 * {@code upload-time} is fractional seconds since the epoch.</p>
 */
@JsonPropertyOrder({"file-name", "file-size", "is-dir", "owner", "upload-time", "writable"})
public final class DirectoryEntry {

    private final String name;
    private final long size;
    private final boolean directory;
    private final String owner;
    private final Instant uploadTime;
    private final boolean writable;

    public DirectoryEntry(String name, long size, boolean directory, String owner,
                          Instant uploadTime, boolean writable) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.size = size;
        this.directory = directory;
        this.owner = owner;
        this.uploadTime = Objects.requireNonNull(uploadTime, "uploadTime cannot be null");
        this.writable = writable;
    }

    @JsonCreator
    static DirectoryEntry fromJson(@JsonProperty("file-name") String name,
                                   @JsonProperty("file-size") long size,
                                   @JsonProperty("is-dir") boolean directory,
                                   @JsonProperty("owner") String owner,
                                   @JsonProperty("upload-time") double uploadTimeSeconds,
                                   @JsonProperty("writable") boolean writable) {
        return new DirectoryEntry(name, size, directory, owner, fromEpochSeconds(uploadTimeSeconds), writable);
    }

    public static DirectoryEntry of(Node node, boolean writable) {
        return new DirectoryEntry(node.getName(), node.getSize(), node.isDirectory(), node.getOwner(),
                node.getUploadTime(), writable);
    }

    @JsonProperty("file-name")
    public String getName() { return name; }

    @JsonProperty("file-size")
    public long getSize() { return size; }

    @JsonProperty("is-dir")
    public boolean isDirectory() { return directory; }

    @JsonProperty("owner")
    public String getOwner() { return owner; }

    @JsonIgnore
    public Instant getUploadTime() { return uploadTime; }

    @JsonProperty("upload-time")
    public double getUploadTimeSeconds() {
        return uploadTime.getEpochSecond() + uploadTime.getNano() / 1_000_000_000.0;
    }

    @JsonProperty("writable")
    public boolean isWritable() { return writable; }

    private static Instant fromEpochSeconds(double seconds) {
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1_000_000_000L);
        return Instant.ofEpochSecond(whole, nanos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DirectoryEntry that = (DirectoryEntry) o;
        return size == that.size
                && directory == that.directory
                && writable == that.writable
                && name.equals(that.name)
                && Objects.equals(owner, that.owner)
                && uploadTime.equals(that.uploadTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, size, directory, owner, uploadTime, writable);
    }

    @Override
    public String toString() {
        return "DirectoryEntry{" +
                "name='" + name + '\'' +
                ", size=" + size +
                ", directory=" + directory +
                ", owner='" + owner + '\'' +
                ", uploadTime=" + uploadTime +
                ", writable=" + writable +
                '}';
    }
}
