package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.features.exceptions.PipelineStageException;
import com.credit.card.fraud.scoring.features.model.CategoryValues;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;
import com.credit.card.fraud.scoring.features.model.RawRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 스테이지 사이를 흐르는 작업 테이블. 행 순서는 입력 순서를 유지한다.
 */
public final class FeatureFrame {

    private final List<RawRecord> sources;
    private final List<Map<String, Object>> rows;
    private final Set<String> columns = new LinkedHashSet<>();

    private FeatureFrame(List<RawRecord> sources) {
        this.sources = List.copyOf(sources);
        this.rows = new ArrayList<>(sources.size());
    }

    /**
     * 원본 필드 중 컨텍스트/식별자 필드를 제외한 나머지를 그대로 컬럼으로 옮긴다.
     */
    public static FeatureFrame fromRecords(List<RawRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new PipelineStageException("input", "Cannot build a feature frame from an empty batch");
        }
        FeatureFrame frame = new FeatureFrame(records);
        for (RawRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            record.fields().forEach((name, value) -> {
                if (isPassthrough(name)) {
                    row.put(name, value);
                    frame.columns.add(name);
                }
            });
            frame.rows.add(row);
        }
        frame.verifyRectangular("input");
        return frame;
    }

    private static boolean isPassthrough(String name) {
        return !FeatureColumns.CONTEXT_FIELDS.contains(name) && !FeatureColumns.TRANSACTION_ID.equals(name);
    }

    public int size() {
        return rows.size();
    }

    public RawRecord source(int row) {
        return sources.get(row);
    }

    public List<String> columns() {
        return List.copyOf(columns);
    }

    public void put(int row, String column, Object value) {
        if (value instanceof Number && !(value instanceof Double)) {
            value = ((Number) value).doubleValue();
        }
        rows.get(row).put(column, value);
        columns.add(column);
    }

    public double numeric(int row, String column, String stage) {
        Object value = rows.get(row).get(column);
        if (!(value instanceof Double)) {
            throw new PipelineStageException(stage,
                    "Row " + row + " column '" + column + "' is not numeric: " + value);
        }
        return (Double) value;
    }

    public String category(int row, String column, String stage) {
        Object value = rows.get(row).get(column);
        if (value == null) {
            throw new PipelineStageException(stage, "Row " + row + " column '" + column + "' is absent");
        }
        return CategoryValues.asCategory(value);
    }

    public boolean isNumericColumn(String column) {
        for (Map<String, Object> row : rows) {
            if (!(row.get(column) instanceof Double)) return false;
        }
        return true;
    }

    /**
     * 모든 행이 같은 컬럼 집합을 가져야 한다.
     */
    public void verifyRectangular(String stage) {
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            if (row.size() != columns.size() || !row.keySet().containsAll(columns)) {
                Set<String> missing = new LinkedHashSet<>(columns);
                missing.removeAll(row.keySet());
                throw new PipelineStageException(stage, "Row " + i + " is missing columns " + missing);
            }
        }
    }

    public List<EngineeredFeatureVector> toVectors() {
        List<EngineeredFeatureVector> vectors = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> ordered = new LinkedHashMap<>();
            for (String column : columns) {
                ordered.put(column, row.get(column));
            }
            vectors.add(new EngineeredFeatureVector(ordered));
        }
        return vectors;
    }
}
