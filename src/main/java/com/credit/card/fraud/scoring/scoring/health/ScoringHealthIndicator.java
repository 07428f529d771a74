package com.credit.card.fraud.scoring.scoring.health;

import com.credit.card.fraud.scoring.artifact.service.LoadedModelBundle;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * 묶음은 시작 시 로드에 실패하면 컨텍스트가 뜨지 않으므로, 여기까지 오면 항상 UP이다.
 */
@Component
@RequiredArgsConstructor
public class ScoringHealthIndicator implements HealthIndicator {

    private final LoadedModelBundle bundle;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("modelVersion", bundle.modelVersion())
                .withDetail("schemaHash", bundle.getArtifacts().frozenSchema().schemaHash())
                .withDetail("engineeredColumns", bundle.getArtifacts().frozenSchema().columns().size())
                .withDetail("members", bundle.getEnsemble().memberNames())
                .withDetail("decisionThreshold", bundle.getDecisionModel().threshold())
                .build();
    }
}
