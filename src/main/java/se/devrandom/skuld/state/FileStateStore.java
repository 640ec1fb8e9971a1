/*
 * Skuld - Incremental Billing Data Extraction
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.skuld.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps the snapshot in a local JSON file, written to a sibling temp file and moved into place.
 */
public class FileStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private final Path path;

    public FileStateStore(Path path) {
        this.path = path.toAbsolutePath();
    }

    @Override
    public SyncState load() {
        if (!Files.exists(path)) {
            log.info("No state file at {}, starting from configured start date", path);
            return new SyncState();
        }
        try {
            SyncState state = StateSerializer.fromBytes(Files.readAllBytes(path));
            log.info("Loaded state from {}", path);
            return state;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read state file " + path, e);
        }
    }

    @Override
    public void save(SyncState state) {
        Path directory = path.getParent();
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            Files.write(temp, StateSerializer.toBytes(state));
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replace", directory);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state file " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }
}
