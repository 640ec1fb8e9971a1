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
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import se.devrandom.skuld.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog metadata for one stream (a Zuora object): which fields to extract, their declared types,
 * the replication key, deletion tracking and the joined-object mapping of related fields.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamCatalogEntry {

    public static final String DELETED_FIELD = "Deleted";
    public static final String EXTRACTED_AT_FIELD = "_extracted_at";

    private String stream;
    private boolean selected = true;
    private String replicationKey;
    private List<String> keyProperties = List.of("Id");
    private Map<String, FieldType> fields = new LinkedHashMap<>();
    private List<String> selectedFields;
    private List<List<String>> fieldSets;
    private boolean supportsDeleted;
    private Map<String, String> relatedObjects = Map.of();
    private ExtractionMode mode;

    /**
     * @throws ConfigurationException when the entry cannot be synced incrementally
     */
    public void validate() {
        if (stream == null || stream.isBlank()) {
            throw new ConfigurationException("Catalog entry without a stream name");
        }
        if (replicationKey == null || replicationKey.isBlank()) {
            throw new ConfigurationException("Stream " + stream + " has no replication key");
        }
        if (!fields.containsKey(replicationKey)) {
            throw new ConfigurationException("Stream " + stream + " does not declare its replication key " + replicationKey);
        }
        FieldType keyType = fields.get(replicationKey);
        if (keyType != FieldType.DATETIME && keyType != FieldType.DATE) {
            throw new ConfigurationException("Replication key " + stream + "." + replicationKey + " must be a date or datetime, was " + keyType);
        }
        for (List<String> fieldSet : queryFieldSets()) {
            for (String field : fieldSet) {
                if (!fields.containsKey(field)) {
                    throw new ConfigurationException("Stream " + stream + " selects undeclared field " + field);
                }
            }
        }
    }

    /**
     * Selected field names, all declared fields when no explicit selection exists.
     */
    public List<String> selectedFieldNames() {
        if (selectedFields == null || selectedFields.isEmpty()) {
            return new ArrayList<>(fields.keySet());
        }
        return selectedFields;
    }

    /**
     * Field lists to query, one export query each. Every set carries the key properties and the
     * replication key. {@value #DELETED_FIELD} is never queried directly.
     */
    public List<List<String>> queryFieldSets() {
        List<List<String>> sets = fieldSets == null || fieldSets.isEmpty()
                ? List.of(selectedFieldNames())
                : fieldSets;
        List<List<String>> result = new ArrayList<>();
        for (List<String> set : sets) {
            Set<String> fieldsInSet = new LinkedHashSet<>(keyProperties);
            fieldsInSet.add(replicationKey);
            fieldsInSet.addAll(set);
            fieldsInSet.remove(DELETED_FIELD);
            result.add(List.copyOf(fieldsInSet));
        }
        return result;
    }

    public boolean isDeletionTracked() {
        return supportsDeleted && selectedFieldNames().contains(DELETED_FIELD);
    }

    public FieldType fieldType(String field) {
        return fields.get(field);
    }

    /**
     * Joined object a related field is read through, or null for the stream's own fields.
     */
    public String relatedObjectFor(String field) {
        return relatedObjects.get(field);
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (String field : selectedFieldNames()) {
            FieldType type = fields.get(field);
            if (type != null) {
                properties.put(field, type.toJsonSchema());
            }
        }
        if (isDeletionTracked()) {
            properties.put(DELETED_FIELD, FieldType.BOOLEAN.toJsonSchema());
        }
        properties.put(EXTRACTED_AT_FIELD, FieldType.DATETIME.toJsonSchema());

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        return schema;
    }

    public String getStream() {
        return stream;
    }

    public void setStream(String stream) {
        this.stream = stream;
    }

    public boolean isSelected() {
        return selected;
    }

    public void setSelected(boolean selected) {
        this.selected = selected;
    }

    public String getReplicationKey() {
        return replicationKey;
    }

    public void setReplicationKey(String replicationKey) {
        this.replicationKey = replicationKey;
    }

    public List<String> getKeyProperties() {
        return keyProperties;
    }

    public void setKeyProperties(List<String> keyProperties) {
        this.keyProperties = keyProperties == null ? List.of() : List.copyOf(keyProperties);
    }

    public Map<String, FieldType> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public void setFields(Map<String, FieldType> fields) {
        this.fields = fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields);
    }

    public List<String> getSelectedFields() {
        return selectedFields;
    }

    public void setSelectedFields(List<String> selectedFields) {
        this.selectedFields = selectedFields == null ? null : List.copyOf(selectedFields);
    }

    public List<List<String>> getFieldSets() {
        return fieldSets;
    }

    public void setFieldSets(List<List<String>> fieldSets) {
        this.fieldSets = fieldSets == null ? null : fieldSets.stream().map(List::copyOf).toList();
    }

    public boolean isSupportsDeleted() {
        return supportsDeleted;
    }

    public void setSupportsDeleted(boolean supportsDeleted) {
        this.supportsDeleted = supportsDeleted;
    }

    public Map<String, String> getRelatedObjects() {
        return relatedObjects;
    }

    public void setRelatedObjects(Map<String, String> relatedObjects) {
        this.relatedObjects = relatedObjects == null ? Map.of() : Map.copyOf(relatedObjects);
    }

    public ExtractionMode getMode() {
        return mode;
    }

    public void setMode(ExtractionMode mode) {
        this.mode = mode;
    }
}
