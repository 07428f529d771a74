package com.credit.card.fraud.scoring.features.stage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionStageTest {

    @Test
    void orientSign_shouldMakeLargestComponentPositive() {
        assertArrayEquals(new double[]{0.2, 0.9, -0.1}, ProjectionStage.orientSign(new double[]{-0.2, -0.9, 0.1}));
        assertArrayEquals(new double[]{0.6, -0.3}, ProjectionStage.orientSign(new double[]{0.6, -0.3}));
    }
}
