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

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.*;

/**
 * A directory or file entry in the filesystem tree.
 *
 * <p>Nodes are immutable; every mutation produces a new instance through
 * {@link #toBuilder()} which the record store then saves under the same id.
 * Files always carry a content reference into the content store, directories never do.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Node {

    private final long id;

    @NotNull
    private final String name;

    private final Long parentId;

    private final boolean directory;

    @NotBlank
    private final String owner;

    private final String contentRef;

    private final long size;

    @NotNull
    private final Instant uploadTime;

    private final Map<String, Permission> permissions;

    private Node(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.parentId = builder.parentId;
        this.directory = builder.directory;
        this.owner = builder.owner;
        this.contentRef = builder.contentRef;
        this.size = builder.size;
        this.uploadTime = builder.uploadTime;
        this.permissions = Collections.unmodifiableMap(new HashMap<>(builder.permissions));
    }

    // Getters
    public long getId() { return id; }
    public String getName() { return name; }
    public Long getParentId() { return parentId; }
    public boolean isDirectory() { return directory; }
    public String getOwner() { return owner; }
    public String getContentRef() { return contentRef; }
    public long getSize() { return size; }
    public Instant getUploadTime() { return uploadTime; }
    public Map<String, Permission> getPermissions() { return permissions; }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isFile() {
        return !directory;
    }

    /**
     * Permission held by the given user on this node, {@link Permission#NONE} when absent.
     */
    public Permission permissionFor(String handle) {
        Permission permission = permissions.get(handle);
        return permission != null ? permission : Permission.NONE;
    }

    public Node withName(String newName) {
        return toBuilder().name(newName).build();
    }

    public Node withParent(long newParentId) {
        return toBuilder().parentId(newParentId).build();
    }

    public Node withOwner(String newOwner) {
        return toBuilder().owner(newOwner).build();
    }

    public Node withPermissions(Map<String, Permission> newPermissions) {
        return toBuilder().permissions(newPermissions).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .parentId(parentId)
                .directory(directory)
                .owner(owner)
                .contentRef(contentRef)
                .size(size)
                .uploadTime(uploadTime)
                .permissions(permissions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String name;
        private Long parentId;
        private boolean directory;
        private String owner;
        private String contentRef;
        private long size;
        private Instant uploadTime = Instant.now();
        private Map<String, Permission> permissions = new HashMap<>();

        public Builder id(long id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder parentId(Long parentId) { this.parentId = parentId; return this; }
        public Builder directory(boolean directory) { this.directory = directory; return this; }
        public Builder owner(String owner) { this.owner = owner; return this; }
        public Builder contentRef(String contentRef) { this.contentRef = contentRef; return this; }
        public Builder size(long size) { this.size = size; return this; }
        public Builder uploadTime(Instant uploadTime) { this.uploadTime = uploadTime; return this; }
        public Builder permissions(Map<String, Permission> permissions) { this.permissions = new HashMap<>(permissions); return this; }
        public Builder grant(String handle, Permission permission) { this.permissions.put(handle, permission); return this; }

        public Node build() {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(owner, "owner cannot be null");
            Objects.requireNonNull(uploadTime, "uploadTime cannot be null");

            if (directory && contentRef != null) {
                throw new IllegalStateException("Directory '" + name + "' cannot reference content");
            }
            if (!directory && contentRef == null) {
                throw new IllegalStateException("File '" + name + "' must reference content");
            }
            if (size < 0) {
                throw new IllegalStateException("Size cannot be negative: " + size);
            }

            return new Node(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return id == node.id
                && directory == node.directory
                && size == node.size
                && name.equals(node.name)
                && Objects.equals(parentId, node.parentId)
                && owner.equals(node.owner)
                && Objects.equals(contentRef, node.contentRef)
                && uploadTime.equals(node.uploadTime)
                && permissions.equals(node.permissions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, parentId);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", parentId=" + parentId +
                ", directory=" + directory +
                ", owner='" + owner + '\'' +
                ", size=" + size +
                '}';
    }
}
