package com.credit.card.fraud.scoring.decision.service;

import com.credit.card.fraud.scoring.decision.model.ThresholdSelection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostWeightedThresholdSelectorTest {

    private final CostWeightedThresholdSelector selector = new CostWeightedThresholdSelector();

    @Test
    void select_shouldMinimizeWeightedCost() {
        ThresholdSelection selection = selector.select(
                new double[]{0.1, 0.4, 0.6, 0.9}, new int[]{0, 0, 1, 1}, 5.0, 1.0);

        assertEquals(0.6, selection.getThreshold());
        assertEquals(0.0, selection.getExpectedCost());
    }

    @Test
    void select_shouldTradeFalsePositivesForMissedFraud_whenMissesAreExpensive() {
        // 사기 하나가 정상보다 낮은 점수를 받음
        double[] scores = {0.2, 0.3, 0.5, 0.8};
        int[] labels = {0, 1, 0, 1};

        ThresholdSelection cheapMisses = selector.select(scores, labels, 1.0, 10.0);
        ThresholdSelection costlyMisses = selector.select(scores, labels, 10.0, 1.0);

        assertEquals(0.8, cheapMisses.getThreshold());
        assertEquals(1, cheapMisses.getFalseNegatives());
        assertEquals(0.3, costlyMisses.getThreshold());
        assertEquals(1, costlyMisses.getFalsePositives());
        assertEquals(0, costlyMisses.getFalseNegatives());
    }

    @Test
    void select_shouldPreferHigherThreshold_onEqualCost() {
        ThresholdSelection selection = selector.select(new double[]{0.2, 0.8}, new int[]{1, 0}, 1.0, 1.0);

        assertEquals(Math.nextUp(0.8), selection.getThreshold());
        assertEquals(1.0, selection.getExpectedCost());
    }

    @Test
    void select_shouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> selector.select(new double[]{}, new int[]{}, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> selector.select(new double[]{0.5}, new int[]{2}, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> selector.select(new double[]{1.5}, new int[]{1}, 1, 1));
    }
}
