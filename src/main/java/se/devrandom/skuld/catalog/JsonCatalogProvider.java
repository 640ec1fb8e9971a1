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
package se.devrandom.skuld.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.skuld.config.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the catalog from a JSON file.
 */
public class JsonCatalogProvider implements CatalogProvider {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogProvider.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonCatalogProvider(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public Catalog load() {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Catalog file not found: " + path.toAbsolutePath());
        }
        try {
            Catalog catalog = objectMapper.readValue(path.toFile(), Catalog.class);
            log.info("Loaded catalog from {}: {} streams, {} selected",
                    path, catalog.getStreams().size(), catalog.selectedStreams().size());
            return catalog;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read catalog " + path + ": " + e.getMessage(), e);
        }
    }
}
