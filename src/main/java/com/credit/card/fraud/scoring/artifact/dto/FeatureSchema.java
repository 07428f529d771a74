package com.credit.card.fraud.scoring.artifact.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 학습 시점에 고정된 출력 컬럼 목록
 */
public final class FeatureSchema {

    private final List<String> columns;
    private final String schemaHash;

    public FeatureSchema(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Frozen schema has no columns");
        }
        if (new LinkedHashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Frozen schema has duplicate columns: " + columns);
        }
        this.columns = List.copyOf(columns);
        this.schemaHash = sha256(String.join("|", this.columns));
    }

    @JsonCreator
    public static FeatureSchema fromJson(@JsonProperty("columns") List<String> columns,
                                         @JsonProperty("schemaHash") String schemaHash) {
        FeatureSchema schema = new FeatureSchema(columns);
        if (schemaHash != null && !schemaHash.equals(schema.schemaHash)) {
            throw new IllegalArgumentException("Schema hash mismatch: stored=" + schemaHash
                    + " computed=" + schema.schemaHash);
        }
        return schema;
    }

    @JsonProperty("columns")
    public List<String> columns() {
        return columns;
    }

    @JsonProperty("schemaHash")
    public String schemaHash() {
        return schemaHash;
    }

    public Set<String> columnSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(columns));
    }

    public boolean contains(String column) {
        return columns.contains(column);
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSchema)) return false;
        return columns.equals(((FeatureSchema) o).columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns);
    }

    @Override
    public String toString() {
        return "FeatureSchema{" + columns.size() + " columns, hash=" + schemaHash + "}";
    }
}
