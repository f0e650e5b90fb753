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
import dev.mars.sqlfs.storage.InMemoryContentStore;
import dev.mars.sqlfs.storage.InMemoryNodeStore;
import dev.mars.sqlfs.storage.NodeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FilesystemTree}. Permission checks are out of the picture
 * here; every call acts with full authority.
 */
class FilesystemTreeTest {

    /**
     * Record store whose next save or delete fails after a number of successful
     * ones. Each failure fires once.
     */
    static class FailingNodeStore extends InMemoryNodeStore {
        private int savesBeforeFailure = -1;
        private int deletesBeforeFailure = -1;

        void failAfter(int saves) {
            this.savesBeforeFailure = saves;
        }

        void failDeleteAfter(int deletes) {
            this.deletesBeforeFailure = deletes;
        }

        @Override
        public void delete(long id) throws RecordStoreException {
            if (deletesBeforeFailure == 0) {
                deletesBeforeFailure = -1;
                throw new RecordStoreException("Simulated delete failure");
            }
            if (deletesBeforeFailure > 0) {
                deletesBeforeFailure--;
            }
            super.delete(id);
        }

        @Override
        public void save(Node node) throws RecordStoreException {
            if (savesBeforeFailure == 0) {
                savesBeforeFailure = -1;
                throw new RecordStoreException("Simulated save failure");
            }
            if (savesBeforeFailure > 0) {
                savesBeforeFailure--;
            }
            super.save(node);
        }
    }

    private FailingNodeStore nodeStore;
    private InMemoryContentStore contentStore;
    private FilesystemTree tree;
    private Node root;

    @BeforeEach
    void setUp() throws RecordStoreException {
        nodeStore = new FailingNodeStore();
        contentStore = new InMemoryContentStore(1024 * 1024);
        tree = new FilesystemTree(nodeStore, contentStore, "public");
        root = tree.initializeRoot(Map.of("alice", Permission.FULL));
    }

    private FileStream stream(String text) throws ContentStoreException {
        FileStream stream = contentStore.open(StreamMode.WRITE, 1024, null, null);
        stream.write(text.getBytes(StandardCharsets.UTF_8));
        return stream;
    }

    private Node mkdir(Node parent, String name) throws SqlfsException {
        return tree.createDirectory(parent, name, "alice", Map.of());
    }

    private Node touch(Node parent, String name, String text) throws SqlfsException {
        return tree.createFile(parent, name, "alice", stream(text), Map.of());
    }

    private String text(Node file) throws SqlfsException {
        return new String(tree.getContent(file), StandardCharsets.UTF_8);
    }

    /**
     * Checks that the records form one tree under the root: unique ids, unique
     * sibling names, every node reaching the root, no unreachable records, and one
     * unshared content object per file.
     */
    static void assertWellFormed(FilesystemTree tree, NodeStore nodeStore, ContentStore contentStore) {
        Node treeRoot = tree.root();
        List<Node> all = tree.subtree(treeRoot);
        Set<Long> ids = new HashSet<>();
        Set<String> contentRefs = new HashSet<>();
        for (Node node : all) {
            assertTrue(ids.add(node.getId()), () -> "Duplicate id " + node.getId());

            List<Node> children = tree.children(node);
            Set<String> names = new HashSet<>();
            for (Node child : children) {
                assertTrue(names.add(child.getName()), () -> "Duplicate name " + child.getName() + " in " + tree.pathOf(node));
                assertEquals(node.getId(), child.getParentId());
            }

            if (node.getId() != treeRoot.getId()) {
                List<Node> ancestors = tree.ancestors(node);
                assertFalse(ancestors.isEmpty());
                assertEquals(treeRoot.getId(), ancestors.get(ancestors.size() - 1).getId());
            }

            if (node.isFile()) {
                assertTrue(contentStore.contains(node.getContentRef()), () -> "Dangling content in " + tree.pathOf(node));
                assertTrue(contentRefs.add(node.getContentRef()), () -> "Shared content in " + tree.pathOf(node));
            } else {
                assertNull(node.getContentRef());
            }
        }
        assertEquals(nodeStore.count(), all.size(), "Records unreachable from the root");
        assertEquals(contentRefs.size(), contentStore.objectCount(), "Content objects not referenced by a file");
    }

    @Nested
    @DisplayName("Root and resolution")
    class Resolution {

        @Test
        void testRootIsCreatedOnce() throws Exception {
            assertTrue(root.isRoot());
            assertEquals("public", root.getOwner());
            assertEquals(Permission.FULL, root.permissionFor("alice"));

            Node again = tree.initializeRoot(Map.of("bob", Permission.FULL));
            assertEquals(root, again);
            assertEquals(Permission.NONE, again.permissionFor("bob"));
        }

        @Test
        void testResolveWalksSegments() throws Exception {
            Node docs = mkdir(root, "docs");
            Node file = touch(docs, "a.txt", "A");

            assertEquals(root, tree.resolve("/"));
            assertEquals(docs, tree.resolve("/docs/"));
            assertEquals(file, tree.resolve("docs//a.txt"));
            assertEquals("/docs/a.txt", tree.pathOf(file));
            assertEquals("/", tree.pathOf(root));
        }

        @Test
        void testResolveFailures() throws Exception {
            Node docs = mkdir(root, "docs");
            touch(docs, "a.txt", "A");

            assertThrows(NodeNotFoundException.class, () -> tree.resolve("/nope"));
            assertThrows(NodeNotFoundException.class, () -> tree.resolve("/docs/a.txt/deeper"));
            assertThrows(InvalidOperationException.class, () -> tree.resolve("/docs/../docs"));
        }

        @Test
        void testSubtreeIsPreOrder() throws Exception {
            Node a = mkdir(root, "a");
            Node b = mkdir(a, "b");
            touch(b, "f", "x");
            mkdir(a, "c");

            assertThat(tree.subtree(a)).extracting(Node::getName).containsExactly("a", "b", "f", "c");
            assertThat(tree.ancestors(b)).extracting(Node::getName).containsExactly("a", "");
            assertTrue(tree.isWithin(b, a));
            assertTrue(tree.isWithin(a, a));
            assertFalse(tree.isWithin(a, b));
        }
    }

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        void testNewNodesInheritParentPermissionsPlusGrants() throws Exception {
            Node docs = tree.createDirectory(root, "docs", "bob", Map.of("bob", Permission.FULL));

            assertEquals("bob", docs.getOwner());
            assertEquals(Permission.FULL, docs.permissionFor("alice"));
            assertEquals(Permission.FULL, docs.permissionFor("bob"));
        }

        @Test
        void testCreateFileCommitsStream() throws Exception {
            FileStream stream = stream("hello");
            Node file = tree.createFile(root, "hello.txt", "alice", stream, Map.of());

            assertEquals(FileStream.State.COMMITTED, stream.getState());
            assertEquals(stream.getCommittedId(), file.getContentRef());
            assertEquals(5, file.getSize());
            assertEquals("hello", text(file));
        }

        @Test
        void testCreateRejectsBadInput() throws Exception {
            Node file = touch(root, "f", "x");
            mkdir(root, "taken");

            assertThrows(NameConflictException.class, () -> mkdir(root, "taken"));
            assertThrows(InvalidOperationException.class, () -> mkdir(file, "child"));
            assertThrows(InvalidOperationException.class, () -> mkdir(root, "a/b"));
            assertThrows(InvalidOperationException.class,
                    () -> tree.createFile(root, "empty", "alice", FileStream.EMPTY, Map.of()));
            assertThrows(InvalidOperationException.class,
                    () -> tree.createFile(root, "ro", "alice",
                            contentStore.open(StreamMode.READ, 0, file.getContentRef(), null), Map.of()));
            assertEquals(1, contentStore.objectCount());
        }

        @Test
        void testConflictLeavesStreamUncommitted() throws Exception {
            touch(root, "f", "x");
            FileStream stream = stream("y");

            assertThrows(NameConflictException.class, () -> tree.createFile(root, "f", "alice", stream, Map.of()));
            assertTrue(stream.isOpen());
            assertEquals(1, contentStore.objectCount());
        }

        @Test
        void testFailedRecordSaveReleasesContent() throws Exception {
            nodeStore.failAfter(0);

            assertThrows(RecordStoreException.class, () -> touch(root, "f", "x"));
            assertEquals(0, contentStore.objectCount());
            assertEquals(1, nodeStore.count());
        }
    }

    @Nested
    @DisplayName("Copy")
    class Copy {

        @Test
        void testCopyDuplicatesContent() throws Exception {
            Node src = mkdir(root, "src");
            Node file = touch(src, "a.txt", "payload");
            Node dst = mkdir(root, "dst");

            Node copy = tree.copy(src, dst, "bob");

            Node copiedFile = tree.resolve("/dst/src/a.txt");
            assertEquals("src", copy.getName());
            assertEquals("bob", copy.getOwner());
            assertEquals("bob", copiedFile.getOwner());
            assertNotEquals(file.getContentRef(), copiedFile.getContentRef());
            assertEquals(2, contentStore.objectCount());

            tree.remove(src);
            assertEquals("payload", text(copiedFile));
        }

        @Test
        void testCopyKeepsOwnersWhenNoneGiven() throws Exception {
            Node file = touch(root, "a.txt", "x");
            Node dst = mkdir(root, "dst");

            assertEquals("alice", tree.copy(file, dst, null).getOwner());
        }

        @Test
        void testCopyIntoSameParentGetsSuffix() throws Exception {
            Node file = touch(root, "report.txt", "x");
            Node dir = mkdir(root, "data");

            assertEquals("report-copy.txt", tree.copy(file, root, null).getName());
            assertEquals("report-copy-2.txt", tree.copy(file, root, null).getName());
            assertEquals("data-copy", tree.copy(dir, root, null).getName());
        }

        @Test
        void testCopyIntoOwnSubtreeIsRejected() throws Exception {
            Node a = mkdir(root, "a");
            Node b = mkdir(a, "b");

            assertThrows(NameConflictException.class, () -> tree.copy(a, b, null));
            assertThrows(NameConflictException.class, () -> tree.copy(a, a, null));
            assertEquals(3, nodeStore.count());
        }

        @Test
        void testCopyIntoFileIsInvalid() throws Exception {
            Node a = mkdir(root, "a");
            Node file = touch(root, "f", "x");

            assertThrows(InvalidOperationException.class, () -> tree.copy(a, file, null));
        }

        @Test
        void testFailedCopyRollsBack() throws Exception {
            Node src = mkdir(root, "src");
            touch(src, "one", "1");
            touch(src, "two", "2");
            Node dst = mkdir(root, "dst");
            int nodes = nodeStore.count();
            int objects = contentStore.objectCount();

            contentStore.setFailOnPersist(true);
            assertThrows(ContentStoreException.class, () -> tree.copy(src, dst, null));
            contentStore.setFailOnPersist(false);

            assertEquals(nodes, nodeStore.count());
            assertEquals(objects, contentStore.objectCount());
            assertTrue(tree.children(dst).isEmpty());
        }
    }

    @Nested
    @DisplayName("Move, rename and remove")
    class Relink {

        @Test
        void testMove() throws Exception {
            Node a = mkdir(root, "a");
            Node b = mkdir(root, "b");
            touch(a, "f", "x");

            Node moved = tree.move(a, b);

            assertEquals(b.getId(), moved.getParentId());
            assertEquals("x", text(tree.resolve("/b/a/f")));
            assertThrows(NodeNotFoundException.class, () -> tree.resolve("/a"));
        }

        @Test
        void testMoveIntoCurrentParentIsNoOp() throws Exception {
            Node a = mkdir(root, "a");
            assertEquals(a, tree.move(a, root));
        }

        @Test
        void testMoveRejections() throws Exception {
            Node a = mkdir(root, "a");
            Node b = mkdir(a, "b");
            Node other = mkdir(root, "other");
            mkdir(other, "b");
            Node file = touch(root, "f", "x");

            assertThrows(NameConflictException.class, () -> tree.move(a, b));
            assertThrows(NameConflictException.class, () -> tree.move(a, a));
            assertThrows(NameConflictException.class, () -> tree.move(b, other));
            assertThrows(InvalidOperationException.class, () -> tree.move(a, file));
            assertThrows(InvalidOperationException.class, () -> tree.move(root, a));
            assertEquals(a.getId(), tree.resolve("/a/b").getParentId());
        }

        @Test
        void testRename() throws Exception {
            Node a = mkdir(root, "a");
            mkdir(root, "b");

            assertEquals("c", tree.rename(a, "c").getName());
            assertEquals("c", tree.rename(tree.resolve("/c"), "c").getName());
            assertThrows(NameConflictException.class, () -> tree.rename(tree.resolve("/c"), "b"));
            assertThrows(InvalidOperationException.class, () -> tree.rename(tree.resolve("/c"), "x/y"));
            assertThrows(InvalidOperationException.class, () -> tree.rename(root, "top"));
        }

        @Test
        void testRemoveDeletesSubtreeAndContent() throws Exception {
            Node a = mkdir(root, "a");
            Node b = mkdir(a, "b");
            touch(b, "f1", "1");
            touch(a, "f2", "2");

            assertEquals(4, tree.remove(a));
            assertEquals(1, nodeStore.count());
            assertEquals(0, contentStore.objectCount());
            assertThrows(InvalidOperationException.class, () -> tree.remove(root));
        }

        @Test
        void testFailedRemoveRestoresDeletedRecords() throws Exception {
            Node a = mkdir(root, "a");
            Node b = mkdir(a, "b");
            touch(b, "f1", "1");
            touch(a, "f2", "2");
            nodeStore.failDeleteAfter(2);

            assertThrows(RecordStoreException.class, () -> tree.remove(a));

            assertEquals(5, nodeStore.count());
            assertEquals("1", text(tree.resolve("/a/b/f1")));
            assertEquals("2", text(tree.resolve("/a/f2")));
            assertWellFormed(tree, nodeStore, contentStore);
        }
    }

    @Nested
    @DisplayName("Ownership and permissions")
    class Attributes {

        @Test
        void testChangeOwnershipIsRecursive() throws Exception {
            Node a = mkdir(root, "a");
            touch(a, "f", "x");

            assertEquals(2, tree.changeOwnership(a, "bob"));
            assertEquals("bob", tree.resolve("/a/f").getOwner());
            assertThrows(InvalidOperationException.class, () -> tree.changeOwnership(a, " "));
        }

        @Test
        void testChangePermissionsMergesAndRemoves() throws Exception {
            Node a = mkdir(root, "a");
            touch(a, "f", "x");

            tree.changePermissions(a, Map.of("bob", Permission.READ_ONLY), false);
            assertEquals(Permission.READ_ONLY, tree.resolve("/a").permissionFor("bob"));
            assertEquals(Permission.NONE, tree.resolve("/a/f").permissionFor("bob"));

            assertEquals(2, tree.changePermissions(tree.resolve("/a"),
                    Map.of("bob", Permission.FULL, "alice", Permission.NONE), true));
            Node file = tree.resolve("/a/f");
            assertEquals(Permission.FULL, file.permissionFor("bob"));
            assertFalse(file.getPermissions().containsKey("alice"));
        }

        @Test
        void testFailedPermissionChangeRestoresOriginals() throws Exception {
            Node a = mkdir(root, "a");
            touch(a, "f", "x");
            touch(a, "g", "y");

            nodeStore.failAfter(2);
            assertThrows(RecordStoreException.class,
                    () -> tree.changePermissions(a, Map.of("bob", Permission.FULL), true));

            for (Node node : tree.subtree(tree.resolve("/a"))) {
                assertEquals(Permission.NONE, node.permissionFor("bob"), node.getName());
            }
        }

        @Test
        void testExpungeCascadesTopDown() throws Exception {
            Node x = mkdir(root, "x");
            Node y = mkdir(x, "y");
            mkdir(y, "z");
            tree.changeOwnership(x, "bob");
            tree.changeOwnership(tree.resolve("/x/y"), "alice");

            assertEquals(2, tree.expungeUserOwnership("alice"));
            assertEquals("bob", tree.resolve("/x/y").getOwner());
            assertEquals("bob", tree.resolve("/x/y/z").getOwner());

            assertEquals(0, tree.expungeUserOwnership("alice"));
        }

        @Test
        void testExpungeHandsRootToSystemOwner() throws Exception {
            mkdir(root, "a");
            tree.changeOwnership(root, "alice");

            assertEquals(2, tree.expungeUserOwnership("alice"));
            assertEquals("public", tree.root().getOwner());
            assertEquals("public", tree.resolve("/a").getOwner());
            assertTrue(nodeStore.findByOwner("alice").isEmpty());
        }
    }

    @Nested
    @DisplayName("Content")
    class Content {

        @Test
        void testReplaceContentReleasesPreviousObject() throws Exception {
            Node file = touch(root, "f", "v1");

            Node updated = tree.replaceContent(file, stream("version 2"));

            assertEquals("version 2", text(updated));
            assertEquals(9, updated.getSize());
            assertFalse(contentStore.contains(file.getContentRef()));
            assertEquals(1, contentStore.objectCount());
        }

        @Test
        void testDirectoriesHaveNoContent() throws Exception {
            Node dir = mkdir(root, "d");

            assertThrows(InvalidOperationException.class, () -> tree.getContent(dir));
            assertThrows(InvalidOperationException.class, () -> tree.openContent(dir));
            assertThrows(InvalidOperationException.class, () -> tree.replaceContent(dir, stream("x")));
        }

        @Test
        void testOpenContentReturnsReadStream() throws Exception {
            Node file = touch(root, "f", "data");

            FileStream stream = tree.openContent(file);

            assertEquals(StreamMode.READ, stream.getMode());
            assertEquals("data", new String(stream.toByteArray(), StandardCharsets.UTF_8));
        }
    }

    @Nested
    @DisplayName("Changes")
    class Changes {

        @Test
        void testAbandonedChangeRestoresRecordsAndDropsNewContent() throws Exception {
            Node kept = touch(root, "kept", "old");
            nodeStore.sync();

            tree.beginChange();
            Node added = touch(root, "added", "new");
            tree.replaceContent(kept, stream("replaced"));
            tree.rename(tree.resolve("/kept"), "renamed");
            tree.abandonChange(new RecordStoreException("Simulated sync failure"));

            assertFalse(tree.hasOpenChange());
            assertThrows(NodeNotFoundException.class, () -> tree.resolve("/added"));
            assertThrows(NodeNotFoundException.class, () -> tree.resolve("/renamed"));
            assertEquals("old", text(tree.resolve("/kept")));
            assertFalse(contentStore.contains(added.getContentRef()));
            assertWellFormed(tree, nodeStore, contentStore);
        }

        @Test
        void testCompletedChangeReleasesDroppedContent() throws Exception {
            Node file = touch(root, "f", "v1");
            nodeStore.sync();

            tree.beginChange();
            tree.replaceContent(file, stream("v2"));
            assertTrue(contentStore.contains(file.getContentRef()));
            nodeStore.sync();
            tree.completeChange();

            assertFalse(contentStore.contains(file.getContentRef()));
            assertEquals("v2", text(tree.resolve("/f")));
            assertWellFormed(tree, nodeStore, contentStore);
        }

        @Test
        void testAbandonedRemoveKeepsContent() throws Exception {
            Node dir = mkdir(root, "d");
            Node file = touch(dir, "f", "data");
            nodeStore.sync();

            tree.beginChange();
            tree.remove(dir);
            tree.abandonChange(new RecordStoreException("Simulated sync failure"));

            assertEquals("data", text(tree.resolve("/d/f")));
            assertTrue(contentStore.contains(file.getContentRef()));
            assertWellFormed(tree, nodeStore, contentStore);
        }

        @Test
        void testChangesDoNotNest() {
            tree.beginChange();

            assertThrows(IllegalStateException.class, () -> tree.beginChange());
            tree.completeChange();
            assertThrows(IllegalStateException.class, () -> tree.completeChange());
        }
    }

    @Nested
    @DisplayName("Well-formedness")
    class WellFormedness {

        private final String[] names = {"a", "b", "c", "notes.txt"};

        private Node pick(Random random, boolean directoriesOnly) {
            List<Node> candidates = tree.subtree(tree.root());
            if (directoriesOnly) {
                candidates.removeIf(Node::isFile);
            }
            return candidates.get(random.nextInt(candidates.size()));
        }

        @RepeatedTest(5)
        void testRandomMutationsKeepOneTree(RepetitionInfo repetition) throws Exception {
            Random random = new Random(repetition.getCurrentRepetition());

            for (int step = 0; step < 200; step++) {
                String name = names[random.nextInt(names.length)];
                int op = nodeStore.count() > 150 ? 5 : random.nextInt(6);
                try {
                    switch (op) {
                        case 0 -> mkdir(pick(random, true), name);
                        case 1 -> touch(pick(random, true), name, "step " + step);
                        case 2 -> tree.copy(pick(random, false), pick(random, true), null);
                        case 3 -> tree.move(pick(random, false), pick(random, true));
                        case 4 -> tree.rename(pick(random, false), name);
                        default -> tree.remove(pick(random, false));
                    }
                } catch (SqlfsException e) {
                    assertThat(e).isNotInstanceOf(RecordStoreException.class);
                }
                assertWellFormed(tree, nodeStore, contentStore);
            }
        }
    }
}
