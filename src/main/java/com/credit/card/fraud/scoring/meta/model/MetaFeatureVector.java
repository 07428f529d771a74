package com.credit.card.fraud.scoring.meta.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * 스태커 입력. 이름 순서가 곧 위치 계약이다.
 */
@ToString
@EqualsAndHashCode
public final class MetaFeatureVector {

    private final List<String> names;
    private final double[] values;

    public MetaFeatureVector(List<String> names, double[] values) {
        if (names.size() != values.length) {
            throw new IllegalArgumentException("Meta vector has " + names.size() + " names but "
                    + values.length + " values");
        }
        this.names = List.copyOf(names);
        this.values = values.clone();
    }

    public List<String> names() {
        return names;
    }

    public double[] values() {
        return values.clone();
    }

    public double value(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Meta vector has no slot '" + name + "'");
        }
        return values[index];
    }

    public int size() {
        return values.length;
    }
}
