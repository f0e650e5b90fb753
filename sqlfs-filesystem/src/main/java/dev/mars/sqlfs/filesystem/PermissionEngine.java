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
import dev.mars.sqlfs.core.exceptions.SqlfsException;

import java.util.Map;
import java.util.Optional;

/**
 * Evaluates per-user grants against the tree.
 *
 * <p>A {@code null} user is the system user and passes every check. Users without
 * an entry on a node hold {@link Permission#NONE} there.</p>
 *
 * <ul>
 *   <li><b>readable</b>: read on the node and on every ancestor</li>
 *   <li><b>writableSelf</b>: write on the node and propagate on its parent</li>
 *   <li><b>writable</b>: write and propagate on the node, so children may be added or removed</li>
 *   <li><b>writableAll</b>: writableSelf on the node and every descendant</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PermissionEngine {

    private final FilesystemTree tree;
    private final Permission creatorGrant;

    public PermissionEngine(FilesystemTree tree, Permission creatorGrant) {
        this.tree = tree;
        this.creatorGrant = creatorGrant != null ? creatorGrant : Permission.FULL;
    }

    public boolean readable(Node node, FilesystemUser user) {
        if (user == null) {
            return true;
        }
        String handle = user.getHandle();
        if (!node.permissionFor(handle).canRead()) {
            return false;
        }
        for (Node ancestor : tree.ancestors(node)) {
            if (!ancestor.permissionFor(handle).canRead()) {
                return false;
            }
        }
        return true;
    }

    public boolean writableSelf(Node node, FilesystemUser user) {
        if (user == null) {
            return true;
        }
        String handle = user.getHandle();
        if (!node.permissionFor(handle).canWrite()) {
            return false;
        }
        Optional<Node> parent = tree.parentOf(node);
        return parent.isPresent() && parent.get().permissionFor(handle).propagates();
    }

    public boolean writable(Node node, FilesystemUser user) {
        if (user == null) {
            return true;
        }
        Permission permission = node.permissionFor(user.getHandle());
        return permission.canWrite() && permission.propagates();
    }

    public boolean writableAll(Node node, FilesystemUser user) {
        if (user == null) {
            return true;
        }
        for (Node member : tree.subtree(node)) {
            if (!writableSelf(member, user)) {
                return false;
            }
        }
        return true;
    }

    public boolean readWritable(Node node, FilesystemUser user) {
        return readable(node, user) && writableSelf(node, user);
    }

    /**
     * Readable and self-writable for the node and every descendant. Descendants
     * are readable once the node is and they grant read themselves.
     */
    public boolean readWritableAll(Node node, FilesystemUser user) {
        if (user == null) {
            return true;
        }
        if (!readable(node, user)) {
            return false;
        }
        String handle = user.getHandle();
        for (Node member : tree.subtree(node)) {
            if (!member.permissionFor(handle).canRead() || !writableSelf(member, user)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Gives the user ownership of the node's whole subtree. No-op for the system user.
     *
     * @return number of nodes visited
     */
    public int copyReown(Node node, FilesystemUser user) throws SqlfsException {
        if (user == null) {
            return 0;
        }
        return tree.changeOwnership(node, user.getHandle());
    }

    /**
     * The entry added for the creator of a new node. Empty for the system user.
     */
    public Map<String, Permission> creatorGrants(FilesystemUser user) {
        if (user == null) {
            return Map.of();
        }
        return Map.of(user.getHandle(), creatorGrant);
    }

    public Permission getCreatorGrant() {
        return creatorGrant;
    }
}
