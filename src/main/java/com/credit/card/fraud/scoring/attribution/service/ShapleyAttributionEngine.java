package com.credit.card.fraud.scoring.attribution.service;

import com.credit.card.fraud.scoring.attribution.model.Attribution;
import com.credit.card.fraud.scoring.attribution.model.Explanation;
import com.credit.card.fraud.scoring.ensemble.exceptions.ModelScoringException;
import com.credit.card.fraud.scoring.ensemble.model.ProbabilisticClassifier;
import com.credit.card.fraud.scoring.ensemble.service.EnsembleMember;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;

/**
 * 분류기 확률에 대한 Shapley 기여도.
 * 빠진 피처는 분류기의 참조 입력(background) 값으로 채운다: v(S) = f(x_S, b_rest).
 * 피처 수가 exactFeatureLimit 이하이면 모든 부분집합을 열거하고, 그보다 많으면
 * 시드 고정 순열을 정/역 쌍으로 샘플링한다. 어느 쪽이든 기여도 합은 prediction - baseline.
 */
@Slf4j
public class ShapleyAttributionEngine {

    private final int permutations;
    private final long seed;
    private final int exactFeatureLimit;

    public ShapleyAttributionEngine(int permutations, long seed, int exactFeatureLimit) {
        if (permutations < 2) {
            throw new IllegalArgumentException("permutations must be >= 2");
        }
        if (exactFeatureLimit < 0 || exactFeatureLimit > 20) {
            throw new IllegalArgumentException("exactFeatureLimit must be in [0, 20]");
        }
        this.permutations = permutations;
        this.seed = seed;
        this.exactFeatureLimit = exactFeatureLimit;
    }

    public Explanation explain(EnsembleMember<ProbabilisticClassifier> member, double[] slice, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        List<String> features = member.requiredFeatures();
        if (slice.length != features.size()) {
            throw new IllegalArgumentException("Slice has " + slice.length + " values but classifier expects "
                    + features.size());
        }

        ProbabilisticClassifier classifier = member.model();
        double[] background = classifier.background();
        double[] contributions;
        double baseline;
        double prediction;
        try {
            baseline = classifier.predictProbability(background);
            prediction = classifier.predictProbability(slice);
            contributions = features.size() <= exactFeatureLimit
                    ? exact(classifier, slice, background)
                    : sampled(classifier, slice, background);
        } catch (FraudScoringException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelScoringException(member.name(), e.getMessage(), e);
        }

        List<Attribution> ranked = new ArrayList<>(features.size());
        for (int i = 0; i < features.size(); i++) {
            ranked.add(new Attribution(features.get(i), contributions[i], slice[i]));
        }
        // 안정 정렬: 동률이면 피처 목록 순서
        ranked.sort(Comparator.comparingDouble((Attribution a) -> Math.abs(a.getContribution())).reversed());

        log.debug("Explained classifier output {} against baseline {} over {} features",
                prediction, baseline, features.size());
        return Explanation.builder()
                .baseline(baseline)
                .prediction(prediction)
                .attributions(List.copyOf(ranked.subList(0, Math.min(k, ranked.size()))))
                .build();
    }

    /**
     * 모든 연합의 값을 한 번씩 계산한 뒤 Shapley 가중치로 합산한다.
     */
    double[] exact(ProbabilisticClassifier classifier, double[] x, double[] background) {
        int d = x.length;
        int coalitions = 1 << d;
        double[] value = new double[coalitions];
        double[] z = new double[d];
        for (int mask = 0; mask < coalitions; mask++) {
            for (int j = 0; j < d; j++) {
                z[j] = (mask & (1 << j)) != 0 ? x[j] : background[j];
            }
            value[mask] = classifier.predictProbability(z);
        }

        // weight[s] = s! (d - s - 1)! / d!
        double[] weight = new double[d];
        for (int s = 0; s < d; s++) {
            weight[s] = 1.0 / (d * binomial(d - 1, s));
        }

        double[] phi = new double[d];
        for (int i = 0; i < d; i++) {
            int bit = 1 << i;
            for (int mask = 0; mask < coalitions; mask++) {
                if ((mask & bit) != 0) continue;
                phi[i] += weight[Integer.bitCount(mask)] * (value[mask | bit] - value[mask]);
            }
        }
        return phi;
    }

    /**
     * 순열 샘플링. 각 순열의 한계 기여 합은 f(x) - f(b)로 telescoping 된다.
     */
    double[] sampled(ProbabilisticClassifier classifier, double[] x, double[] background) {
        int d = x.length;
        SplittableRandom random = new SplittableRandom(seed);
        int pairs = (permutations + 1) / 2;
        double[] phi = new double[d];
        int[] order = new int[d];
        int[] reversed = new int[d];

        for (int p = 0; p < pairs; p++) {
            for (int j = 0; j < d; j++) order[j] = j;
            for (int j = d - 1; j > 0; j--) {
                int swap = random.nextInt(j + 1);
                int tmp = order[j];
                order[j] = order[swap];
                order[swap] = tmp;
            }
            for (int j = 0; j < d; j++) reversed[j] = order[d - 1 - j];

            walk(classifier, x, background, order, phi);
            walk(classifier, x, background, reversed, phi);
        }

        int walks = pairs * 2;
        for (int j = 0; j < d; j++) phi[j] /= walks;
        return phi;
    }

    private static void walk(ProbabilisticClassifier classifier, double[] x, double[] background,
                             int[] order, double[] phi) {
        double[] z = background.clone();
        double previous = classifier.predictProbability(z);
        for (int feature : order) {
            z[feature] = x[feature];
            double current = classifier.predictProbability(z);
            phi[feature] += current - previous;
            previous = current;
        }
    }

    private static double binomial(int n, int r) {
        double result = 1.0;
        for (int i = 1; i <= r; i++) {
            result = result * (n - r + i) / i;
        }
        return result;
    }
}
