package com.credit.card.fraud.scoring.scoring.health;

import com.credit.card.fraud.scoring.ScoringFixtures;
import com.credit.card.fraud.scoring.artifact.service.ArtifactBundleLoader;
import com.credit.card.fraud.scoring.artifact.service.InMemoryArtifactStore;
import com.credit.card.fraud.scoring.artifact.service.LoadedModelBundle;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringHealthIndicatorTest {

    @Test
    void health_shouldReportLoadedBundleDetails() {
        ObjectMapper mapper = new ObjectMapper();
        InMemoryArtifactStore store = new InMemoryArtifactStore();
        ScoringFixtures.writeBundle(store, mapper, ScoringFixtures.VERSION, 0.35);
        LoadedModelBundle bundle = new ArtifactBundleLoader(store, mapper).loadOrFail(ScoringFixtures.VERSION);

        Health health = new ScoringHealthIndicator(bundle).health();
        Map<String, Object> details = health.getDetails();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(ScoringFixtures.VERSION, details.get("modelVersion"));
        assertEquals(bundle.getArtifacts().frozenSchema().schemaHash(), details.get("schemaHash"));
        assertEquals(64, ((String) details.get("schemaHash")).length());
        assertEquals(bundle.getArtifacts().frozenSchema().columns().size(), details.get("engineeredColumns"));
        assertEquals(List.of("classifier", "isolation_forest", "autoencoder", "clustering"), details.get("members"));
        assertEquals(0.35, details.get("decisionThreshold"));
    }
}
