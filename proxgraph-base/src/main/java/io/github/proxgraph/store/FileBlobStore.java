/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.proxgraph.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A BlobStore that keeps one file per blob under a root directory.  Key segments map to subdirectories.
 * <p>
 * Writes go to a temporary file in the target directory which is then moved over the destination, so a reader
 * never sees a partially written blob.
 */
public class FileBlobStore implements BlobStore {
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    public FileBlobStore(Path root) throws IOException {
        this.root = Files.createDirectories(root);
    }

    public Path getRoot() {
        return root;
    }

    private Path pathFor(String key) {
        BlobStore.checkKey(key);
        return root.resolve(key);
    }

    @Override
    public void write(String key, byte[] bytes) throws IOException {
        Path target = pathFor(key);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TEMP_SUFFIX);
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public byte[] read(String key) throws IOException {
        try {
            return Files.readAllBytes(pathFor(key));
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @Override
    public boolean delete(String key) throws IOException {
        return Files.deleteIfExists(pathFor(key));
    }

    @Override
    public List<String> listKeys(String prefix) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                        .map(p -> root.relativize(p).toString().replace(p.getFileSystem().getSeparator(), "/"))
                        .filter(key -> !key.endsWith(TEMP_SUFFIX) && key.startsWith(prefix))
                        .sorted()
                        .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            // a file vanished while walking
            throw e.getCause();
        }
    }

    @Override
    public String toString() {
        return "FileBlobStore(" + root + ")";
    }
}
