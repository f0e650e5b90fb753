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

import dev.mars.sqlfs.core.exceptions.ContentNotFoundException;
import dev.mars.sqlfs.core.exceptions.ContentStoreException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Content store keeping one blob file per object under a directory.
 *
 * <p>Objects are written to a temporary file and atomically moved into place,
 * so a crash never leaves a partially written object under its final name.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class FileContentStore extends AbstractContentStore {

    private static final Logger logger = Logger.getLogger(FileContentStore.class.getName());

    private static final String SUFFIX = ".blob";
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9-]+");

    private final Path directory;

    public FileContentStore(Path directory, long maxContentSize) {
        super(maxContentSize);
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create content directory " + directory, e);
        }
        logger.info("Content store opened at " + directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    protected boolean exists(String contentId) {
        return VALID_ID.matcher(contentId).matches() && Files.isRegularFile(pathOf(contentId));
    }

    @Override
    protected byte[] load(String contentId) throws ContentStoreException {
        if (!VALID_ID.matcher(contentId).matches()) {
            throw new ContentNotFoundException(contentId);
        }
        try {
            return Files.readAllBytes(pathOf(contentId));
        } catch (NoSuchFileException e) {
            throw new ContentNotFoundException(contentId);
        } catch (IOException e) {
            throw new ContentStoreException(contentId, "Failed to read content", e);
        }
    }

    @Override
    protected void persist(String contentId, byte[] payload) throws ContentStoreException {
        Path target = pathOf(contentId);
        Path temp = directory.resolve(contentId + SUFFIX + ".tmp");
        try {
            Files.write(temp, payload);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ContentStoreException(contentId, "Failed to write content", e);
        }
    }

    @Override
    protected void erase(String contentId) throws ContentStoreException {
        try {
            Files.deleteIfExists(pathOf(contentId));
        } catch (IOException e) {
            throw new ContentStoreException(contentId, "Failed to delete content", e);
        }
    }

    @Override
    public long size(String contentId) throws ContentStoreException {
        if (contentId == null || !exists(contentId)) {
            throw new ContentNotFoundException(String.valueOf(contentId));
        }
        try {
            return Files.size(pathOf(contentId));
        } catch (IOException e) {
            throw new ContentStoreException(contentId, "Failed to stat content", e);
        }
    }

    @Override
    public int objectCount() {
        try (Stream<Path> files = Files.list(directory)) {
            return (int) files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).count();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list content directory " + directory, e);
        }
    }

    @Override
    public void close() {
        logger.info("Content store closed at " + directory);
    }

    private Path pathOf(String contentId) {
        return directory.resolve(contentId + SUFFIX);
    }
}
