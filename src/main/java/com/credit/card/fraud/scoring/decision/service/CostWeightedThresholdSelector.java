package com.credit.card.fraud.scoring.decision.service;

import com.credit.card.fraud.scoring.decision.model.ThresholdSelection;
import lombok.extern.slf4j.Slf4j;

import java.util.TreeSet;

/**
 * 오프라인 임계값 스윕. 비용 = fnCost * FN + fpCost * FP 를 최소화한다.
 * 비용이 같으면 더 높은 임계값 (알림 수가 적은 쪽).
 */
@Slf4j
public class CostWeightedThresholdSelector {

    public ThresholdSelection select(double[] scores, int[] labels, double fnCost, double fpCost) {
        if (scores.length == 0 || scores.length != labels.length) {
            throw new IllegalArgumentException("scores and labels must be non-empty and of equal length");
        }
        if (fnCost < 0 || fpCost < 0) {
            throw new IllegalArgumentException("costs must be non-negative");
        }

        TreeSet<Double> candidates = new TreeSet<>();
        for (int i = 0; i < scores.length; i++) {
            if (!(scores[i] >= 0.0 && scores[i] <= 1.0)) {
                throw new IllegalArgumentException("score out of [0, 1] at index " + i + ": " + scores[i]);
            }
            if (labels[i] != 0 && labels[i] != 1) {
                throw new IllegalArgumentException("label must be 0 or 1 at index " + i);
            }
            candidates.add(scores[i]);
        }
        // 아무것도 사기로 보지 않는 임계값 (1 이하일 때만)
        double flagNothing = Math.nextUp(candidates.last());
        if (flagNothing <= 1.0) {
            candidates.add(flagNothing);
        }

        ThresholdSelection best = null;
        for (double threshold : candidates.descendingSet()) {
            int fn = 0;
            int fp = 0;
            for (int i = 0; i < scores.length; i++) {
                boolean flagged = scores[i] >= threshold;
                if (labels[i] == 1 && !flagged) fn++;
                if (labels[i] == 0 && flagged) fp++;
            }
            double cost = fnCost * fn + fpCost * fp;
            if (best == null || cost < best.getExpectedCost()) {
                best = ThresholdSelection.builder()
                        .threshold(threshold)
                        .expectedCost(cost)
                        .falseNegatives(fn)
                        .falsePositives(fp)
                        .build();
            }
        }

        log.info("Selected threshold {} (cost={}, FN={}, FP={})",
                best.getThreshold(), best.getExpectedCost(), best.getFalseNegatives(), best.getFalsePositives());
        return best;
    }
}
