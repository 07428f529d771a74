package com.credit.card.fraud.scoring.contract.service;

import com.credit.card.fraud.scoring.artifact.dto.FeatureSchema;
import com.credit.card.fraud.scoring.contract.exceptions.FeatureContractViolationException;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 엔지니어링 피처와 고정 스키마의 컬럼 집합 비교.
 * 불일치를 고치지 않는다 (자르기, 채우기, 재정렬 없음).
 */
@Slf4j
@Component
public class FeatureContractValidator {

    public Optional<ContractViolation> check(EngineeredFeatureVector vector, FeatureSchema frozenSchema) {
        Set<String> expected = frozenSchema.columnSet();
        Set<String> produced = vector.columnSet();

        Set<String> missing = new LinkedHashSet<>(expected);
        missing.removeAll(produced);
        Set<String> extra = new LinkedHashSet<>(produced);
        extra.removeAll(expected);

        ContractViolation violation = ContractViolation.of(missing, extra);
        return violation.isEmpty() ? Optional.empty() : Optional.of(violation);
    }

    public void validate(EngineeredFeatureVector vector, FeatureSchema frozenSchema) {
        Optional<ContractViolation> violation = check(vector, frozenSchema);
        if (violation.isPresent()) {
            log.error("Feature contract violation against schema {}: missing={} extra={}",
                    frozenSchema.schemaHash(), violation.get().getMissing(), violation.get().getExtra());
            throw new FeatureContractViolationException(violation.get());
        }
    }
}
