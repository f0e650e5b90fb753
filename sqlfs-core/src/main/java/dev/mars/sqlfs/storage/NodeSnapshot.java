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

package dev.mars.sqlfs.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.sqlfs.core.Node;
import dev.mars.sqlfs.core.Permission;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * JSON form of a node record. Permissions are stored in their {@code rwx} text form.
 */
public class NodeSnapshot {

    private final long id;
    private final String name;
    private final Long parentId;
    private final boolean directory;
    private final String owner;
    private final String contentRef;
    private final long size;
    private final Instant uploadTime;
    private final Map<String, String> permissions;

    @JsonCreator
    public NodeSnapshot(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("parentId") Long parentId,
            @JsonProperty("directory") boolean directory,
            @JsonProperty("owner") String owner,
            @JsonProperty("contentRef") String contentRef,
            @JsonProperty("size") long size,
            @JsonProperty("uploadTime") Instant uploadTime,
            @JsonProperty("permissions") Map<String, String> permissions) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
        this.directory = directory;
        this.owner = owner;
        this.contentRef = contentRef;
        this.size = size;
        this.uploadTime = uploadTime;
        this.permissions = permissions != null ? permissions : Map.of();
    }

    public static NodeSnapshot fromNode(Node node) {
        Map<String, String> perms = new HashMap<>();
        node.getPermissions().forEach((handle, permission) -> perms.put(handle, permission.toString()));
        return new NodeSnapshot(
                node.getId(),
                node.getName(),
                node.getParentId(),
                node.isDirectory(),
                node.getOwner(),
                node.getContentRef(),
                node.getSize(),
                node.getUploadTime(),
                perms);
    }

    public Node toNode() {
        Node.Builder builder = Node.builder()
                .id(id)
                .name(name)
                .parentId(parentId)
                .directory(directory)
                .owner(owner)
                .contentRef(contentRef)
                .size(size)
                .uploadTime(uploadTime != null ? uploadTime : Instant.EPOCH);
        permissions.forEach((handle, text) -> builder.grant(handle, Permission.parse(text)));
        return builder.build();
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
    public Map<String, String> getPermissions() { return permissions; }
}
