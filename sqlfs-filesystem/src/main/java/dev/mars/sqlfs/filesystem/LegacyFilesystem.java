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

import dev.mars.sqlfs.core.FilesystemUser;
import dev.mars.sqlfs.core.Node;
import dev.mars.sqlfs.core.Permission;
import dev.mars.sqlfs.core.StreamMode;
import dev.mars.sqlfs.storage.FileStream;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Boolean-returning view of {@link SerializedFilesystem} for callers written
 * against the older API. Every failure, denial included, collapses to
 * {@code false}, {@code null}, an empty list or {@link FileStream#EMPTY}.
 */
public class LegacyFilesystem {

    private static final Logger logger = Logger.getLogger(LegacyFilesystem.class.getName());

    private final SerializedFilesystem delegate;

    public LegacyFilesystem(SerializedFilesystem delegate) {
        this.delegate = delegate;
    }

    /**
     * @param mode {@code "read"} or {@code "write"}; anything else yields {@link FileStream#EMPTY}
     */
    public FileStream createFileHandle(String mode, long estimatedLength, String objectId, byte[] data) {
        StreamMode streamMode;
        try {
            streamMode = StreamMode.fromString(mode);
        } catch (IllegalArgumentException e) {
            logger.fine("Rejected file handle request: " + e.getMessage());
            return FileStream.EMPTY;
        }
        return delegate.createFileHandle(streamMode, estimatedLength, objectId, data)
                .orElse(FileStream.EMPTY);
    }

    /**
     * @return the new node, or null when the file could not be created
     */
    public Node createFile(String parentPath, String name, FileStream stream, FilesystemUser user) {
        return delegate.createFile(parentPath, name, stream, user).orElse(null);
    }

    public Node createDirectory(String parentPath, String name, FilesystemUser user) {
        return delegate.createDirectory(parentPath, name, user).orElse(null);
    }

    public boolean copy(String sourcePath, String targetParentPath, FilesystemUser user) {
        return delegate.copy(sourcePath, targetParentPath, user).isOk();
    }

    public boolean move(String sourcePath, String targetParentPath, FilesystemUser user) {
        return delegate.move(sourcePath, targetParentPath, user).isOk();
    }

    public boolean remove(String path, FilesystemUser user) {
        return delegate.remove(path, user).isOk();
    }

    public boolean rename(String path, String newName, FilesystemUser user) {
        return delegate.rename(path, newName, user).isOk();
    }

    public boolean changeOwnership(String path, String newOwner, FilesystemUser user) {
        return delegate.changeOwnership(path, newOwner, user).isOk();
    }

    public boolean changePermissions(String path, Map<String, Permission> changes, boolean recursive,
                                     FilesystemUser user) {
        return delegate.changePermissions(path, changes, recursive, user).isOk();
    }

    public int expungeUserOwnership(String handle) {
        return delegate.expungeUserOwnership(handle).orElse(0);
    }

    public List<DirectoryEntry> listDirectory(String path, FilesystemUser user) {
        return delegate.listDirectory(path, user).orElse(List.of());
    }

    /**
     * @return a read stream, or {@link FileStream#EMPTY} when the file is missing or unreadable
     */
    public FileStream getContent(String path, FilesystemUser user) {
        return delegate.openContent(path, user).orElse(FileStream.EMPTY);
    }

    public boolean readable(String path, FilesystemUser user) {
        return delegate.readable(path, user);
    }

    public boolean writable(String path, FilesystemUser user) {
        return delegate.writable(path, user);
    }

    public boolean writableSelf(String path, FilesystemUser user) {
        return delegate.writableSelf(path, user);
    }

    public static String getFileName(String path) {
        return SerializedFilesystem.getFileName(path);
    }
}
