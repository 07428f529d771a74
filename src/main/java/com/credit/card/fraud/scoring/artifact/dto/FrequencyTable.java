package com.credit.card.fraud.scoring.artifact.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 범주 값별 학습 시점 출현 횟수
 */
@Value
@Builder
@Jacksonized
public class FrequencyTable {

    Map<String, Long> counts;
    long totalRows;

    public static FrequencyTable fit(Collection<String> values) {
        Map<String, Long> counts = new TreeMap<>();
        for (String value : values) {
            counts.merge(value, 1L, Long::sum);
        }
        return FrequencyTable.builder()
                .counts(Collections.unmodifiableMap(counts))
                .totalRows(values.size())
                .build();
    }

    /**
     * 학습 때 보지 못한 값은 0
     */
    public long count(String value) {
        Long count = counts.get(value);
        return count != null ? count : 0L;
    }

    public double frequency(String value) {
        if (totalRows == 0) return 0.0;
        return (double) count(value) / totalRows;
    }
}
