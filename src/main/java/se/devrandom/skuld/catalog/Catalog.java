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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Catalog {

    private List<StreamCatalogEntry> streams = new ArrayList<>();

    public Catalog() {
    }

    public Catalog(List<StreamCatalogEntry> streams) {
        this.streams = new ArrayList<>(streams);
    }

    public List<StreamCatalogEntry> selectedStreams() {
        return streams.stream().filter(StreamCatalogEntry::isSelected).toList();
    }

    public List<StreamCatalogEntry> getStreams() {
        return streams;
    }

    public void setStreams(List<StreamCatalogEntry> streams) {
        this.streams = streams == null ? new ArrayList<>() : new ArrayList<>(streams);
    }
}
