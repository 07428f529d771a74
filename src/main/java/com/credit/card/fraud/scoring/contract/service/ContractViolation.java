package com.credit.card.fraud.scoring.contract.service;

import lombok.Value;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 고정 스키마 대비 누락/초과 컬럼
 */
@Value
public class ContractViolation {

    Set<String> missing;
    Set<String> extra;

    public static ContractViolation of(Set<String> missing, Set<String> extra) {
        return new ContractViolation(
                Collections.unmodifiableSet(new TreeSet<>(missing)),
                Collections.unmodifiableSet(new TreeSet<>(extra)));
    }

    public boolean isEmpty() {
        return missing.isEmpty() && extra.isEmpty();
    }
}
