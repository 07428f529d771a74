package com.credit.card.fraud.scoring.features.model;

import com.credit.card.fraud.scoring.contract.exceptions.FeatureContractViolationException;
import com.credit.card.fraud.scoring.contract.service.ContractViolation;
import com.credit.card.fraud.scoring.features.exceptions.PipelineStageException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 한 건의 엔지니어링 피처. 컬럼 순서를 유지하며 값은 Double(수치) 또는 String(범주)이다.
 */
public final class EngineeredFeatureVector {

    private final Map<String, Object> values;

    public EngineeredFeatureVector(Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (!(value instanceof Double) && !(value instanceof String)) {
                throw new IllegalArgumentException("Column '" + name + "' has unsupported value: " + value);
            }
            copy.put(name, value);
        });
        this.values = Collections.unmodifiableMap(copy);
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public Set<String> columnSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values.keySet()));
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object value(String column) {
        Object value = values.get(column);
        if (value == null) {
            throw new FeatureContractViolationException(ContractViolation.of(Set.of(column), Set.of()));
        }
        return value;
    }

    public double numeric(String column) {
        Object value = value(column);
        if (!(value instanceof Double)) {
            throw new PipelineStageException("vector", "Column '" + column + "' is categorical, not numeric");
        }
        return (Double) value;
    }

    public String categorical(String column) {
        return CategoryValues.asCategory(value(column));
    }

    /**
     * 모델 입력용 슬라이스. 이름 순서대로 값을 담는다.
     */
    public double[] numericSlice(List<String> columns) {
        Set<String> missing = new LinkedHashSet<>();
        for (String column : columns) {
            if (!values.containsKey(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw new FeatureContractViolationException(ContractViolation.of(missing, Set.of()));
        }

        double[] x = new double[columns.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = numeric(columns.get(i));
        }
        return x;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EngineeredFeatureVector)) return false;
        EngineeredFeatureVector other = (EngineeredFeatureVector) o;
        return columns().equals(other.columns()) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "EngineeredFeatureVector" + values;
    }
}
