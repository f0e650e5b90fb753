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
import dev.mars.sqlfs.core.exceptions.InvalidOperationException;
import dev.mars.sqlfs.core.exceptions.NodeNotFoundException;
import dev.mars.sqlfs.core.exceptions.PermissionDeniedException;
import dev.mars.sqlfs.core.exceptions.SqlfsException;
import dev.mars.sqlfs.filesystem.observability.FilesystemMetrics;
import dev.mars.sqlfs.storage.ContentStore;
import dev.mars.sqlfs.storage.FileStream;
import dev.mars.sqlfs.storage.NodeStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe entry point to a filesystem.
 *
 * <p>Every tree operation runs under the context's read/write lock: mutations take
 * the write lock, while listings, content reads and permission checks share the
 * read lock. Paths are resolved and permissions checked inside the same critical section as the
 * mutation, so no other caller can change the outcome of a check before it is acted
 * on. Record store changes are synced before the write lock is released; a mutation
 * that fails at any step, the sync included, is rolled back as a whole.</p>
 *
 * <p>Stream allocation ({@code createFileHandle}) and writes to a staged stream do
 * not touch the tree and take no lock.</p>
 *
 * <p>A {@code null} user is the system user and bypasses all permission checks.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SerializedFilesystem {

    private static final Logger logger = Logger.getLogger(SerializedFilesystem.class.getName());

    static final String REQUIRES_READ = "read";
    static final String REQUIRES_WRITE = "write";
    static final String REQUIRES_WRITE_SELF = "write (self)";
    static final String REQUIRES_WRITE_SUBTREE = "write (subtree)";
    static final String REQUIRES_READ_WRITE = "read+write";
    static final String REQUIRES_READ_WRITE_SUBTREE = "read+write (subtree)";

    @FunctionalInterface
    private interface Action<T> {
        T run() throws SqlfsException;
    }

    private final FilesystemTree tree;
    private final PermissionEngine permissions;
    private final NodeStore nodeStore;
    private final ContentStore contentStore;
    private final ReadWriteLock lock;
    private final FilesystemMetrics metrics;
    private final long defaultEstimatedLength;

    SerializedFilesystem(FilesystemTree tree,
                         PermissionEngine permissions,
                         NodeStore nodeStore,
                         ContentStore contentStore,
                         ReadWriteLock lock,
                         FilesystemMetrics metrics,
                         long defaultEstimatedLength) {
        this.tree = tree;
        this.permissions = permissions;
        this.nodeStore = nodeStore;
        this.contentStore = contentStore;
        this.lock = lock;
        this.metrics = metrics;
        this.defaultEstimatedLength = defaultEstimatedLength;
    }

    // Content handles

    /**
     * Allocates a staged stream in the content store. Takes no filesystem lock.
     *
     * @param mode            read or write
     * @param estimatedLength bytes to reserve for a write stream
     * @param objectId        object to read, or to start a write stream from; may be null
     * @param initialBytes    initial bytes of a fresh write stream; may be null
     */
    public FilesystemResult<FileStream> createFileHandle(StreamMode mode, long estimatedLength,
                                                         String objectId, byte[] initialBytes) {
        if (mode == null) {
            return new FilesystemResult.Invalid<>("stream", "Mode cannot be null");
        }
        try {
            FileStream stream = contentStore.open(mode, estimatedLength, objectId, initialBytes);
            return succeed("create_file_handle", stream);
        } catch (SqlfsException e) {
            return fail("create_file_handle", e);
        }
    }

    /**
     * Empty write stream with the configured default reservation.
     */
    public FilesystemResult<FileStream> createFileHandle() {
        return createFileHandle(StreamMode.WRITE, defaultEstimatedLength, null, null);
    }

    public FilesystemResult<FileStream> createFileHandle(long estimatedLength) {
        return createFileHandle(StreamMode.WRITE, estimatedLength, null, null);
    }

    public FilesystemResult<FileStream> createFileHandle(StreamMode mode, String objectId) {
        return createFileHandle(mode, defaultEstimatedLength, objectId, null);
    }

    // Mutations

    public FilesystemResult<Node> createFile(String parentPath, String name, FileStream stream, FilesystemUser user) {
        return mutate("create_file", () -> {
            Node parent = tree.resolve(parentPath);
            require(permissions.writable(parent, user), parent, user, REQUIRES_WRITE);
            Node file = tree.createFile(parent, name, ownerOf(user), stream, permissions.creatorGrants(user));
            if (metrics != null) {
                metrics.recordBytesCommitted(file.getSize());
            }
            return file;
        });
    }

    public FilesystemResult<Node> createDirectory(String parentPath, String name, FilesystemUser user) {
        return mutate("create_directory", () -> {
            Node parent = tree.resolve(parentPath);
            require(permissions.writable(parent, user), parent, user, REQUIRES_WRITE);
            return tree.createDirectory(parent, name, ownerOf(user), permissions.creatorGrants(user));
        });
    }

    /**
     * Deep-copies {@code sourcePath} into {@code targetParentPath}. The copy is owned
     * by the calling user.
     */
    public FilesystemResult<Node> copy(String sourcePath, String targetParentPath, FilesystemUser user) {
        return mutate("copy", () -> {
            Node source = tree.resolve(sourcePath);
            Node target = tree.resolve(targetParentPath);
            require(permissions.readable(source, user), source, user, REQUIRES_READ);
            require(permissions.writable(target, user), target, user, REQUIRES_WRITE);
            return tree.copy(source, target, user != null ? user.getHandle() : null);
        });
    }

    /**
     * Moves {@code sourcePath} under {@code targetParentPath} and gives the calling
     * user ownership of the moved subtree.
     */
    public FilesystemResult<Node> move(String sourcePath, String targetParentPath, FilesystemUser user) {
        return mutate("move", () -> {
            Node source = tree.resolve(sourcePath);
            Node target = tree.resolve(targetParentPath);
            require(permissions.readable(source, user), source, user, REQUIRES_READ);
            require(permissions.writableAll(source, user), source, user, REQUIRES_WRITE_SUBTREE);
            require(permissions.writableSelf(source, user), source, user, REQUIRES_WRITE_SELF);
            require(permissions.writable(target, user), target, user, REQUIRES_WRITE);
            Node moved = tree.move(source, target);
            permissions.copyReown(moved, user);
            return tree.refresh(moved);
        });
    }

    /**
     * @return number of removed nodes
     */
    public FilesystemResult<Integer> remove(String path, FilesystemUser user) {
        return mutate("remove", () -> {
            Node node = tree.resolve(path);
            require(permissions.readable(node, user), node, user, REQUIRES_READ);
            require(permissions.writableSelf(node, user), node, user, REQUIRES_WRITE_SELF);
            require(permissions.writableAll(node, user), node, user, REQUIRES_WRITE_SUBTREE);
            return tree.remove(node);
        });
    }

    public FilesystemResult<Node> rename(String path, String newName, FilesystemUser user) {
        return mutate("rename", () -> {
            Node node = tree.resolve(path);
            require(permissions.readWritable(node, user), node, user, REQUIRES_READ_WRITE);
            require(permissions.writableSelf(node, user), node, user, REQUIRES_WRITE_SELF);
            return tree.rename(node, newName);
        });
    }

    /**
     * @return number of nodes whose owner was set
     */
    public FilesystemResult<Integer> changeOwnership(String path, String newOwner, FilesystemUser user) {
        return mutate("change_ownership", () -> {
            Node node = tree.resolve(path);
            require(permissions.readWritableAll(node, user), node, user, REQUIRES_READ_WRITE_SUBTREE);
            require(permissions.writableSelf(node, user), node, user, REQUIRES_WRITE_SELF);
            return tree.changeOwnership(node, newOwner);
        });
    }

    /**
     * Merges permission entries into the node, and into its descendants when
     * {@code recursive}. {@link Permission#NONE} removes an entry.
     *
     * @return number of nodes changed
     */
    public FilesystemResult<Integer> changePermissions(String path, Map<String, Permission> changes,
                                                       boolean recursive, FilesystemUser user) {
        return mutate("change_permissions", () -> {
            Node node = tree.resolve(path);
            require(permissions.readWritableAll(node, user), node, user, REQUIRES_READ_WRITE_SUBTREE);
            require(permissions.writableSelf(node, user), node, user, REQUIRES_WRITE_SELF);
            return tree.changePermissions(node, changes, recursive);
        });
    }

    /**
     * Reassigns everything owned by {@code handle}, e.g. when the user is deleted.
     * System operation: no permission checks.
     *
     * @return number of nodes reassigned
     */
    public FilesystemResult<Integer> expungeUserOwnership(String handle) {
        return mutate("expunge_user_ownership", () -> tree.expungeUserOwnership(handle));
    }

    /**
     * Replaces the content of an existing file.
     */
    public FilesystemResult<Node> writeContent(String path, FileStream stream, FilesystemUser user) {
        return mutate("write_content", () -> {
            Node node = tree.resolve(path);
            require(permissions.readWritable(node, user), node, user, REQUIRES_READ_WRITE);
            require(permissions.writableSelf(node, user), node, user, REQUIRES_WRITE_SELF);
            Node updated = tree.replaceContent(node, stream);
            if (metrics != null) {
                metrics.recordBytesCommitted(updated.getSize());
            }
            return updated;
        });
    }

    // Reads

    /**
     * Children of a directory visible to the user. Unreadable entries are omitted.
     */
    public FilesystemResult<List<DirectoryEntry>> listDirectory(String path, FilesystemUser user) {
        return read("list_directory", () -> {
            Node directory = tree.resolve(path);
            if (!directory.isDirectory()) {
                throw new InvalidOperationException(tree.pathOf(directory), "Not a directory");
            }
            List<DirectoryEntry> entries = new ArrayList<>();
            for (Node child : tree.children(directory)) {
                if (permissions.readable(child, user)) {
                    entries.add(DirectoryEntry.of(child, permissions.writableSelf(child, user)));
                }
            }
            return entries;
        });
    }

    public FilesystemResult<byte[]> getContent(String path, FilesystemUser user) {
        return read("get_content", () -> {
            Node node = tree.resolve(path);
            require(permissions.readable(node, user), node, user, REQUIRES_READ);
            return tree.getContent(node);
        });
    }

    /**
     * Read stream over a file's current content.
     */
    public FilesystemResult<FileStream> openContent(String path, FilesystemUser user) {
        return read("open_content", () -> {
            Node node = tree.resolve(path);
            require(permissions.readable(node, user), node, user, REQUIRES_READ);
            return tree.openContent(node);
        });
    }

    public FilesystemResult<Node> stat(String path, FilesystemUser user) {
        return read("stat", () -> {
            Node node = tree.resolve(path);
            require(permissions.readable(node, user), node, user, REQUIRES_READ);
            return node;
        });
    }

    // Permission checks

    public boolean readable(String path, FilesystemUser user) {
        return checkPath(path, node -> permissions.readable(node, user));
    }

    public boolean writable(String path, FilesystemUser user) {
        return checkPath(path, node -> permissions.writable(node, user));
    }

    public boolean writableSelf(String path, FilesystemUser user) {
        return checkPath(path, node -> permissions.writableSelf(node, user));
    }

    /**
     * Last segment of {@code path}. The path does not need to exist.
     */
    public static String getFileName(String path) {
        return FilesystemPath.fileName(path);
    }

    private boolean checkPath(String path, Predicate<Node> check) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return check.test(tree.resolve(path));
        } catch (NodeNotFoundException | InvalidOperationException e) {
            logger.finest("Permission check on unresolvable path " + path + ": " + e.getMessage());
            return false;
        } finally {
            readLock.unlock();
        }
    }

    private <T> FilesystemResult<T> mutate(String operation, Action<T> action) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            tree.beginChange();
            T value;
            try {
                value = action.run();
                nodeStore.sync();
            } catch (SqlfsException | RuntimeException e) {
                tree.abandonChange(e);
                throw e;
            }
            tree.completeChange();
            return succeed(operation, value);
        } catch (SqlfsException e) {
            return fail(operation, e);
        } finally {
            writeLock.unlock();
        }
    }

    private <T> FilesystemResult<T> read(String operation, Action<T> action) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return succeed(operation, action.run());
        } catch (SqlfsException e) {
            return fail(operation, e);
        } finally {
            readLock.unlock();
        }
    }

    private <T> FilesystemResult<T> succeed(String operation, T value) {
        if (metrics != null) {
            metrics.recordOperation(operation, FilesystemResult.Kind.OK.name());
        }
        return FilesystemResult.ok(value);
    }

    private <T> FilesystemResult<T> fail(String operation, SqlfsException e) {
        FilesystemResult<T> result = FilesystemResult.fromException(e);
        if (result.kind() == FilesystemResult.Kind.FAILED) {
            logger.log(Level.WARNING, operation + " failed: " + e.getMessage(), e);
        } else {
            logger.fine(operation + " rejected: " + result.describe());
        }
        if (metrics != null) {
            metrics.recordOperation(operation, result.kind().name());
            if (result.kind() == FilesystemResult.Kind.PERMISSION_DENIED) {
                metrics.recordPermissionDenied(operation);
            }
        }
        return result;
    }

    private void require(boolean granted, Node node, FilesystemUser user, String requirement)
            throws PermissionDeniedException {
        if (!granted) {
            throw new PermissionDeniedException(tree.pathOf(node), user != null ? user.getHandle() : null, requirement);
        }
    }

    private String ownerOf(FilesystemUser user) {
        return user != null ? user.getHandle() : tree.getSystemOwner();
    }
}
