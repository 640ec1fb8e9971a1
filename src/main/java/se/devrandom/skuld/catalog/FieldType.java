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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a field, as written in the catalog.
 */
public enum FieldType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATETIME("datetime");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the catalog names plus the Zuora describe type names they map to.
     */
    @JsonCreator
    public static FieldType fromValue(String value) {
        if (value == null) {
            return STRING;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "integer":
            case "int":
            case "long":
                return INTEGER;
            case "number":
            case "decimal":
            case "double":
                return NUMBER;
            case "boolean":
                return BOOLEAN;
            case "date":
                return DATE;
            case "datetime":
            case "date-time":
            case "timestamp":
                return DATETIME;
            default:
                return STRING;
        }
    }

    /**
     * JSON schema fragment announced to the sink.
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        switch (this) {
            case INTEGER -> schema.put("type", List.of("integer", "null"));
            case NUMBER -> schema.put("type", List.of("number", "null"));
            case BOOLEAN -> schema.put("type", List.of("boolean", "null"));
            case DATE, DATETIME -> {
                schema.put("type", List.of("string", "null"));
                schema.put("format", "date-time");
            }
            default -> schema.put("type", List.of("string", "null"));
        }
        return schema;
    }
}
