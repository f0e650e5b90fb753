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

import dev.mars.sqlfs.core.Node;
import dev.mars.sqlfs.core.Permission;
import dev.mars.sqlfs.core.StreamMode;
import dev.mars.sqlfs.core.exceptions.ContentStoreException;
import dev.mars.sqlfs.core.exceptions.InvalidOperationException;
import dev.mars.sqlfs.core.exceptions.NameConflictException;
import dev.mars.sqlfs.core.exceptions.NodeNotFoundException;
import dev.mars.sqlfs.core.exceptions.RecordStoreException;
import dev.mars.sqlfs.core.exceptions.SqlfsException;
import dev.mars.sqlfs.storage.ContentStore;
import dev.mars.sqlfs.storage.FileStream;
import dev.mars.sqlfs.storage.NodeStore;

import java.time.Instant;
import java.util.*;
import java.util.logging.Logger;

/**
 * Tree-shaped namespace over a {@link NodeStore} and a {@link ContentStore}.
 *
 * <p>This class performs no permission checks and no locking; callers are expected
 * to hold the filesystem lock and to have authorized the operation. Every mutation
 * validates its arguments before touching either store, so a rejected operation
 * leaves the tree unchanged. Multi-record mutations roll back the records they
 * already wrote when a store fails part way.</p>
 *
 * <p>Between {@link #beginChange()} and {@link #completeChange()} content releases
 * are deferred, so {@link #abandonChange(Exception)} can return the records to
 * their last synced state without leaving them pointing at released objects.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FilesystemTree {

    private static final Logger logger = Logger.getLogger(FilesystemTree.class.getName());

    static final String COPY_SUFFIX = "-copy";

    private final NodeStore nodeStore;
    private final ContentStore contentStore;
    private final String systemOwner;

    // Open change, or null when mutations apply immediately
    private Change change;

    public FilesystemTree(NodeStore nodeStore, ContentStore contentStore, String systemOwner) {
        this.nodeStore = Objects.requireNonNull(nodeStore, "nodeStore cannot be null");
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore cannot be null");
        if (systemOwner == null || systemOwner.isBlank()) {
            throw new IllegalArgumentException("systemOwner cannot be null or blank");
        }
        this.systemOwner = systemOwner;
    }

    public String getSystemOwner() {
        return systemOwner;
    }

    /**
     * Opens a change. Until it completes, released content stays in the content
     * store and committed content is remembered for {@link #abandonChange(Exception)}.
     */
    public void beginChange() {
        if (change != null) {
            throw new IllegalStateException("A change is already open");
        }
        change = new Change();
    }

    /**
     * Closes the open change after its records were synced, releasing the content
     * its mutations dropped.
     */
    public void completeChange() {
        Change completed = closeChange();
        for (Map.Entry<String, String> released : completed.released.entrySet()) {
            releaseNow(released.getKey(), released.getValue());
        }
    }

    /**
     * Closes the open change without keeping it: the record store goes back to its
     * last synced state and content committed during the change is released.
     * Cleanup failures are attached to {@code cause}.
     */
    public void abandonChange(Exception cause) {
        Change abandoned = closeChange();
        try {
            nodeStore.rollback();
        } catch (RecordStoreException e) {
            cause.addSuppressed(e);
        }
        for (String contentId : abandoned.created) {
            releaseQuietly(contentId, cause);
        }
        logger.fine("Abandoned change (" + abandoned.created.size() + " content objects dropped): "
                + cause.getMessage());
    }

    public boolean hasOpenChange() {
        return change != null;
    }

    /**
     * Returns the root directory, creating it owned by the system owner when the
     * record store is empty. Root permissions only apply on creation.
     */
    public Node initializeRoot(Map<String, Permission> rootPermissions) throws RecordStoreException {
        Optional<Node> existing = nodeStore.findRoot();
        if (existing.isPresent()) {
            return existing.get();
        }
        Node root = Node.builder()
                .id(nodeStore.nextId())
                .name("")
                .parentId(null)
                .directory(true)
                .owner(systemOwner)
                .uploadTime(Instant.now())
                .permissions(rootPermissions != null ? rootPermissions : Map.of())
                .build();
        nodeStore.save(root);
        logger.info("Initialized root directory (id " + root.getId() + ", owner " + systemOwner + ")");
        return root;
    }

    public Node root() {
        return nodeStore.findRoot()
                .orElseThrow(() -> new IllegalStateException("Filesystem root has not been initialized"));
    }

    /**
     * Walks the path segments from the root.
     *
     * @throws NodeNotFoundException     if any segment does not exist or descends through a file
     * @throws InvalidOperationException if the path is malformed
     */
    public Node resolve(String path) throws NodeNotFoundException, InvalidOperationException {
        Node current = root();
        for (String segment : FilesystemPath.segments(path)) {
            if (!current.isDirectory()) {
                throw new NodeNotFoundException(path, "Not a directory: " + pathOf(current));
            }
            current = nodeStore.findChild(current.getId(), segment)
                    .orElseThrow(() -> new NodeNotFoundException(path));
        }
        return current;
    }

    /**
     * Re-reads a node by id. Used to refresh a value after a mutation.
     */
    public Node refresh(Node node) throws NodeNotFoundException {
        return nodeStore.findById(node.getId())
                .orElseThrow(() -> new NodeNotFoundException("#" + node.getId()));
    }

    public Optional<Node> parentOf(Node node) {
        if (node.isRoot()) {
            return Optional.empty();
        }
        return nodeStore.findById(node.getParentId());
    }

    /**
     * Ancestors of the node, nearest first, ending with the root.
     */
    public List<Node> ancestors(Node node) {
        List<Node> ancestors = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        seen.add(node.getId());
        Optional<Node> parent = parentOf(node);
        while (parent.isPresent()) {
            Node current = parent.get();
            if (!seen.add(current.getId())) {
                throw new IllegalStateException("Cycle detected above node " + node.getId());
            }
            ancestors.add(current);
            parent = parentOf(current);
        }
        return ancestors;
    }

    public List<Node> children(Node directory) {
        if (!directory.isDirectory()) {
            return List.of();
        }
        return nodeStore.findChildren(directory.getId());
    }

    /**
     * The node followed by all its descendants in pre-order.
     */
    public List<Node> subtree(Node node) {
        List<Node> result = new ArrayList<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            result.add(current);
            List<Node> children = children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return result;
    }

    public String pathOf(Node node) {
        if (node.isRoot()) {
            return FilesystemPath.ROOT;
        }
        List<Node> ancestors = ancestors(node);
        StringBuilder sb = new StringBuilder();
        for (int i = ancestors.size() - 2; i >= 0; i--) {
            sb.append(FilesystemPath.SEPARATOR).append(ancestors.get(i).getName());
        }
        return sb.append(FilesystemPath.SEPARATOR).append(node.getName()).toString();
    }

    /**
     * True when {@code candidate} is {@code ancestor} itself or lies below it.
     */
    public boolean isWithin(Node candidate, Node ancestor) {
        if (candidate.getId() == ancestor.getId()) {
            return true;
        }
        for (Node node : ancestors(candidate)) {
            if (node.getId() == ancestor.getId()) {
                return true;
            }
        }
        return false;
    }

    public Node createFile(Node parent, String name, String owner, FileStream stream,
                           Map<String, Permission> grants) throws SqlfsException {
        String path = FilesystemPath.join(pathOf(parent), name);
        validateNewChild(parent, name, path);
        requireWriteStream(path, stream);

        String contentId = track(contentStore.commit(stream));
        Node file = Node.builder()
                .id(nodeStore.nextId())
                .name(name)
                .parentId(parent.getId())
                .directory(false)
                .owner(requireOwner(path, owner))
                .contentRef(contentId)
                .size(stream.length())
                .uploadTime(Instant.now())
                .permissions(inherit(parent, grants))
                .build();
        try {
            nodeStore.save(file);
        } catch (RecordStoreException e) {
            releaseQuietly(contentId, e);
            throw e;
        }
        logger.info("Created file " + path + " (" + file.getSize() + " bytes, owner " + file.getOwner() + ")");
        return file;
    }

    public Node createDirectory(Node parent, String name, String owner,
                                Map<String, Permission> grants) throws SqlfsException {
        String path = FilesystemPath.join(pathOf(parent), name);
        validateNewChild(parent, name, path);

        Node directory = Node.builder()
                .id(nodeStore.nextId())
                .name(name)
                .parentId(parent.getId())
                .directory(true)
                .owner(requireOwner(path, owner))
                .uploadTime(Instant.now())
                .permissions(inherit(parent, grants))
                .build();
        nodeStore.save(directory);
        logger.info("Created directory " + path + " (owner " + directory.getOwner() + ")");
        return directory;
    }

    /**
     * Deep copy of {@code source} into {@code targetParent}. Every file gets its own
     * duplicated content object. When the name is taken the copy is renamed with a
     * {@code -copy} suffix.
     *
     * @param newOwner owner for every copied node, or null to keep the original owners
     * @return the copied top-level node
     */
    public Node copy(Node source, Node targetParent, String newOwner) throws SqlfsException {
        String sourcePath = pathOf(source);
        String targetPath = pathOf(targetParent);
        requireDirectory(targetPath, targetParent);
        if (isWithin(targetParent, source)) {
            throw new NameConflictException(targetPath, "Cannot copy " + sourcePath + " into its own subtree");
        }
        String copyName = availableName(targetParent, source.getName());

        List<Node> originals = subtree(source);
        Map<Long, Long> idMap = new HashMap<>();
        List<Long> createdIds = new ArrayList<>();
        List<String> createdContent = new ArrayList<>();
        Instant now = Instant.now();
        Node copiedRoot = null;
        try {
            for (Node original : originals) {
                boolean top = original.getId() == source.getId();
                String contentRef = original.isFile() ? track(contentStore.duplicate(original.getContentRef())) : null;
                if (contentRef != null) {
                    createdContent.add(contentRef);
                }
                Node copy = original.toBuilder()
                        .id(nodeStore.nextId())
                        .name(top ? copyName : original.getName())
                        .parentId(top ? targetParent.getId() : idMap.get(original.getParentId()))
                        .owner(newOwner != null ? newOwner : original.getOwner())
                        .contentRef(contentRef)
                        .uploadTime(now)
                        .build();
                nodeStore.save(copy);
                createdIds.add(copy.getId());
                idMap.put(original.getId(), copy.getId());
                if (top) {
                    copiedRoot = copy;
                }
            }
        } catch (SqlfsException e) {
            undoCopy(createdIds, createdContent, e);
            throw e;
        }
        logger.info("Copied " + sourcePath + " to " + FilesystemPath.join(targetPath, copyName)
                + " (" + originals.size() + " nodes)");
        return copiedRoot;
    }

    /**
     * Relinks {@code source} under {@code targetParent}. Moving into the current
     * parent returns the node unchanged.
     */
    public Node move(Node source, Node targetParent) throws SqlfsException {
        String sourcePath = pathOf(source);
        String targetPath = pathOf(targetParent);
        if (source.isRoot()) {
            throw new InvalidOperationException(sourcePath, "Cannot move the root directory");
        }
        requireDirectory(targetPath, targetParent);
        if (Objects.equals(source.getParentId(), targetParent.getId())) {
            return source;
        }
        if (isWithin(targetParent, source)) {
            throw new NameConflictException(targetPath, "Cannot move " + sourcePath + " into its own subtree");
        }
        if (nodeStore.findChild(targetParent.getId(), source.getName()).isPresent()) {
            throw new NameConflictException(FilesystemPath.join(targetPath, source.getName()), "File exists");
        }
        Node moved = source.withParent(targetParent.getId());
        nodeStore.save(moved);
        logger.info("Moved " + sourcePath + " to " + FilesystemPath.join(targetPath, moved.getName()));
        return moved;
    }

    /**
     * Deletes the node and its whole subtree, releasing all referenced content.
     *
     * @return number of nodes removed
     */
    public int remove(Node node) throws SqlfsException {
        String path = pathOf(node);
        if (node.isRoot()) {
            throw new InvalidOperationException(path, "Cannot remove the root directory");
        }
        List<Node> doomed = subtree(node);
        int deleted = 0;
        try {
            for (int i = doomed.size() - 1; i >= 0; i--) {
                nodeStore.delete(doomed.get(i).getId());
                deleted++;
            }
        } catch (RecordStoreException e) {
            // Deleted bottom-up, so restoring top-down re-attaches parents first
            for (int i = doomed.size() - deleted; i < doomed.size(); i++) {
                try {
                    nodeStore.save(doomed.get(i));
                } catch (RecordStoreException restore) {
                    e.addSuppressed(restore);
                }
            }
            throw e;
        }
        for (Node current : doomed) {
            if (current.isFile()) {
                release(current.getContentRef(), path);
            }
        }
        logger.info("Removed " + path + " (" + doomed.size() + " nodes)");
        return doomed.size();
    }

    public Node rename(Node node, String newName) throws SqlfsException {
        String path = pathOf(node);
        if (node.isRoot()) {
            throw new InvalidOperationException(path, "Cannot rename the root directory");
        }
        FilesystemPath.validateName(path, newName);
        if (node.getName().equals(newName)) {
            return node;
        }
        Optional<Node> clash = nodeStore.findChild(node.getParentId(), newName);
        if (clash.isPresent()) {
            throw new NameConflictException(pathOf(clash.get()), "File exists");
        }
        Node renamed = node.withName(newName);
        nodeStore.save(renamed);
        logger.info("Renamed " + path + " to " + newName);
        return renamed;
    }

    /**
     * Sets the owner of the node and of every descendant.
     *
     * @return number of nodes visited
     */
    public int changeOwnership(Node node, String newOwner) throws SqlfsException {
        String path = pathOf(node);
        requireOwner(path, newOwner);
        List<Node> targets = subtree(node);
        List<Node> updated = new ArrayList<>(targets.size());
        for (Node target : targets) {
            updated.add(target.withOwner(newOwner));
        }
        saveAll(targets, updated);
        logger.info("Changed owner of " + path + " to " + newOwner + " (" + targets.size() + " nodes)");
        return targets.size();
    }

    /**
     * Merges {@code changes} into the permission map of the node, and of its
     * descendants when {@code recursive}. A {@link Permission#NONE} value removes
     * the user's entry.
     *
     * @return number of nodes visited
     */
    public int changePermissions(Node node, Map<String, Permission> changes, boolean recursive)
            throws SqlfsException {
        String path = pathOf(node);
        if (changes == null) {
            throw new InvalidOperationException(path, "Permission changes cannot be null");
        }
        for (Map.Entry<String, Permission> change : changes.entrySet()) {
            if (change.getKey() == null || change.getKey().isBlank()) {
                throw new InvalidOperationException(path, "User handle cannot be null or blank");
            }
            if (change.getValue() == null) {
                throw new InvalidOperationException(path, "Permission for " + change.getKey() + " cannot be null");
            }
        }
        List<Node> targets = recursive ? subtree(node) : List.of(node);
        List<Node> updated = new ArrayList<>(targets.size());
        for (Node target : targets) {
            Map<String, Permission> merged = new HashMap<>(target.getPermissions());
            changes.forEach((handle, permission) -> {
                if (permission.isNone()) {
                    merged.remove(handle);
                } else {
                    merged.put(handle, permission);
                }
            });
            updated.add(target.withPermissions(merged));
        }
        saveAll(targets, updated);
        logger.info("Changed permissions of " + path + (recursive ? " recursively" : "")
                + " (" + targets.size() + " nodes): " + changes);
        return targets.size();
    }

    /**
     * Hands every node owned by {@code handle} to the current owner of its parent,
     * processing shallow nodes first so a chain of owned nodes collapses onto the
     * nearest foreign ancestor. A root owned by the handle goes to the system owner.
     *
     * @return number of nodes whose owner changed
     */
    public int expungeUserOwnership(String handle) throws SqlfsException {
        if (handle == null || handle.isBlank()) {
            throw new InvalidOperationException(FilesystemPath.ROOT, "User handle cannot be null or blank");
        }
        List<Node> owned = new ArrayList<>(nodeStore.findByOwner(handle));
        Map<Long, Integer> depths = new HashMap<>();
        for (Node node : owned) {
            depths.put(node.getId(), ancestors(node).size());
        }
        owned.sort(Comparator.comparingInt((Node n) -> depths.get(n.getId())).thenComparingLong(Node::getId));

        List<Node> originals = new ArrayList<>();
        List<Node> updated = new ArrayList<>();
        Map<Long, String> reassigned = new HashMap<>();
        for (Node node : owned) {
            String newOwner;
            if (node.isRoot()) {
                newOwner = systemOwner;
            } else {
                newOwner = reassigned.get(node.getParentId());
                if (newOwner == null) {
                    newOwner = parentOf(node).map(Node::getOwner).orElse(systemOwner);
                }
            }
            if (newOwner.equals(handle)) {
                continue;
            }
            reassigned.put(node.getId(), newOwner);
            originals.add(node);
            updated.add(node.withOwner(newOwner));
        }
        saveAll(originals, updated);
        if (!updated.isEmpty()) {
            logger.info("Expunged ownership of " + handle + " (" + updated.size() + " nodes)");
        }
        return updated.size();
    }

    public byte[] getContent(Node node) throws SqlfsException {
        String path = pathOf(node);
        if (node.isDirectory()) {
            throw new InvalidOperationException(path, "Is a directory");
        }
        return contentStore.read(node.getContentRef());
    }

    /**
     * Opens a read stream over the node's current content.
     */
    public FileStream openContent(Node node) throws SqlfsException {
        String path = pathOf(node);
        if (node.isDirectory()) {
            throw new InvalidOperationException(path, "Is a directory");
        }
        return contentStore.open(StreamMode.READ, node.getSize(), node.getContentRef(), null);
    }

    /**
     * Commits {@code stream} as the node's new content and releases the previous
     * object.
     */
    public Node replaceContent(Node node, FileStream stream) throws SqlfsException {
        String path = pathOf(node);
        if (node.isDirectory()) {
            throw new InvalidOperationException(path, "Is a directory");
        }
        requireWriteStream(path, stream);

        String previous = node.getContentRef();
        String contentId = track(contentStore.commit(stream));
        Node updated = node.toBuilder()
                .contentRef(contentId)
                .size(stream.length())
                .uploadTime(Instant.now())
                .build();
        try {
            nodeStore.save(updated);
        } catch (RecordStoreException e) {
            releaseQuietly(contentId, e);
            throw e;
        }
        release(previous, path);
        logger.info("Replaced content of " + path + " (" + updated.getSize() + " bytes)");
        return updated;
    }

    private void validateNewChild(Node parent, String name, String path) throws SqlfsException {
        requireDirectory(pathOf(parent), parent);
        FilesystemPath.validateName(path, name);
        if (nodeStore.findChild(parent.getId(), name).isPresent()) {
            throw new NameConflictException(path, "File exists");
        }
    }

    private void requireDirectory(String path, Node node) throws InvalidOperationException {
        if (!node.isDirectory()) {
            throw new InvalidOperationException(path, "Not a directory");
        }
    }

    private String requireOwner(String path, String owner) throws InvalidOperationException {
        if (owner == null || owner.isBlank()) {
            throw new InvalidOperationException(path, "Owner cannot be null or blank");
        }
        return owner;
    }

    private void requireWriteStream(String path, FileStream stream) throws InvalidOperationException {
        if (stream == null || stream.isEmptySentinel() || stream.getMode() != StreamMode.WRITE) {
            throw new InvalidOperationException(path, "Content must be supplied through a write stream");
        }
        if (!stream.isOpen()) {
            throw new InvalidOperationException(path, "Stream is " + stream.getState());
        }
    }

    private Map<String, Permission> inherit(Node parent, Map<String, Permission> grants) {
        Map<String, Permission> permissions = new HashMap<>(parent.getPermissions());
        if (grants != null) {
            grants.forEach((handle, permission) -> {
                if (permission.isNone()) {
                    permissions.remove(handle);
                } else {
                    permissions.put(handle, permission);
                }
            });
        }
        return permissions;
    }

    /**
     * First free name among {@code name}, {@code name-copy}, {@code name-copy-2}, ...
     * The suffix goes before a file extension.
     */
    private String availableName(Node parent, String name) throws InvalidOperationException {
        if (nodeStore.findChild(parent.getId(), name).isEmpty()) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        for (int attempt = 1; ; attempt++) {
            String candidate = base + COPY_SUFFIX + (attempt == 1 ? "" : "-" + attempt) + extension;
            if (nodeStore.findChild(parent.getId(), candidate).isEmpty()) {
                FilesystemPath.validateName(pathOf(parent), candidate);
                return candidate;
            }
        }
    }

    /**
     * Saves {@code updated} record by record, restoring {@code originals} if a save fails.
     */
    private void saveAll(List<Node> originals, List<Node> updated) throws RecordStoreException {
        int saved = 0;
        try {
            for (Node node : updated) {
                nodeStore.save(node);
                saved++;
            }
        } catch (RecordStoreException e) {
            for (int i = saved - 1; i >= 0; i--) {
                try {
                    nodeStore.save(originals.get(i));
                } catch (RecordStoreException restore) {
                    e.addSuppressed(restore);
                }
            }
            throw e;
        }
    }

    private Change closeChange() {
        if (change == null) {
            throw new IllegalStateException("No change is open");
        }
        Change closed = change;
        change = null;
        return closed;
    }

    private String track(String contentId) {
        if (change != null) {
            change.created.add(contentId);
        }
        return contentId;
    }

    private void release(String contentId, String path) {
        if (change != null) {
            change.released.put(contentId, path);
        } else {
            releaseNow(contentId, path);
        }
    }

    private void releaseNow(String contentId, String path) {
        try {
            contentStore.release(contentId);
        } catch (ContentStoreException e) {
            // The record no longer points at the object; it is orphaned but the tree is consistent
            logger.warning("Failed to release content " + contentId + " of " + path + ": " + e.getMessage());
        }
    }

    private void undoCopy(List<Long> createdIds, List<String> createdContent, SqlfsException cause) {
        for (int i = createdIds.size() - 1; i >= 0; i--) {
            try {
                nodeStore.delete(createdIds.get(i));
            } catch (RecordStoreException e) {
                cause.addSuppressed(e);
            }
        }
        for (String contentId : createdContent) {
            releaseQuietly(contentId, cause);
        }
        logger.warning("Rolled back " + createdIds.size() + " copied nodes: " + cause.getMessage());
    }

    private void releaseQuietly(String contentId, Exception cause) {
        try {
            contentStore.release(contentId);
        } catch (ContentStoreException e) {
            cause.addSuppressed(e);
        }
    }

    private static final class Change {
        private final List<String> created = new ArrayList<>();
        private final Map<String, String> released = new LinkedHashMap<>();
    }
}
