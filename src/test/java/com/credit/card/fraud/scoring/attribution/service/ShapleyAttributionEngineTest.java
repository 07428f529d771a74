package com.credit.card.fraud.scoring.attribution.service;

import com.credit.card.fraud.scoring.attribution.model.Attribution;
import com.credit.card.fraud.scoring.attribution.model.Explanation;
import com.credit.card.fraud.scoring.ensemble.model.ProbabilisticClassifier;
import com.credit.card.fraud.scoring.ensemble.service.EnsembleMember;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShapleyAttributionEngineTest {

    /**
     * 상호작용 항이 있는 로지스틱 모델. 마지막 피처는 쓰지 않는다.
     */
    private static final class InteractingClassifier implements ProbabilisticClassifier {

        private final int dimension;

        InteractingClassifier(int dimension) {
            this.dimension = dimension;
        }

        @Override
        public double predictProbability(double[] x) {
            double z = -1.0;
            for (int j = 0; j < dimension - 1; j++) {
                z += (j + 1) * 0.3 * x[j];
            }
            z += 0.5 * x[0] * x[1];
            return 1.0 / (1.0 + Math.exp(-z));
        }

        @Override
        public double[] background() {
            return new double[dimension];
        }

        @Override
        public int inputDimension() {
            return dimension;
        }
    }

    private static EnsembleMember<ProbabilisticClassifier> member(int dimension) {
        List<String> names = new ArrayList<>();
        for (int j = 0; j < dimension; j++) names.add("f" + j);
        return new EnsembleMember<>("classifier", names, new InteractingClassifier(dimension));
    }

    private static double[] input(int dimension) {
        double[] x = new double[dimension];
        for (int j = 0; j < dimension; j++) x[j] = 1.0 + 0.25 * j;
        return x;
    }

    private static double sum(Explanation explanation) {
        return explanation.getAttributions().stream().mapToDouble(Attribution::getContribution).sum();
    }

    @Test
    void explain_shouldSatisfySumLaw_withExactEnumeration() {
        ShapleyAttributionEngine engine = new ShapleyAttributionEngine(64, 7L, 10);

        Explanation explanation = engine.explain(member(4), input(4), 4);

        assertEquals(explanation.getPrediction() - explanation.getBaseline(), sum(explanation), 1e-9);
    }

    @Test
    void explain_shouldSatisfySumLaw_withPermutationSampling() {
        ShapleyAttributionEngine engine = new ShapleyAttributionEngine(64, 7L, 5);

        Explanation explanation = engine.explain(member(12), input(12), 12);

        assertEquals(explanation.getPrediction() - explanation.getBaseline(), sum(explanation), 1e-9);
    }

    @Test
    void explain_shouldAssignZero_toFeatureTheModelIgnores() {
        ShapleyAttributionEngine exact = new ShapleyAttributionEngine(64, 7L, 10);
        ShapleyAttributionEngine sampled = new ShapleyAttributionEngine(64, 7L, 0);

        for (ShapleyAttributionEngine engine : List.of(exact, sampled)) {
            Explanation explanation = engine.explain(member(4), input(4), 4);
            Attribution unused = explanation.getAttributions().stream()
                    .filter(a -> a.getFeature().equals("f3"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(0.0, unused.getContribution(), 1e-15);
        }
    }

    @Test
    void explain_shouldAgreeBetweenExactAndSampled_forSmallInput() {
        Explanation exact = new ShapleyAttributionEngine(64, 7L, 10).explain(member(3), input(3), 3);
        // 3개 피처의 순열은 6개뿐이므로 충분한 샘플에서 정확값에 가깝다
        Explanation sampled = new ShapleyAttributionEngine(20000, 7L, 0).explain(member(3), input(3), 3);

        for (Attribution attribution : exact.getAttributions()) {
            double approx = sampled.getAttributions().stream()
                    .filter(a -> a.getFeature().equals(attribution.getFeature()))
                    .findFirst()
                    .orElseThrow()
                    .getContribution();
            assertEquals(attribution.getContribution(), approx, 0.01);
        }
    }

    @Test
    void explain_shouldRankByAbsoluteContribution_andTruncate() {
        ShapleyAttributionEngine engine = new ShapleyAttributionEngine(64, 7L, 10);
        double[] x = input(4);

        Explanation explanation = engine.explain(member(4), x, 2);

        assertEquals(2, explanation.getAttributions().size());
        Attribution first = explanation.getAttributions().get(0);
        Attribution second = explanation.getAttributions().get(1);
        assertTrue(Math.abs(first.getContribution()) >= Math.abs(second.getContribution()));
        int index = Integer.parseInt(first.getFeature().substring(1));
        assertEquals(x[index], first.getValue());
    }

    @Test
    void explain_shouldBeDeterministic_forSameSeed() {
        Explanation first = new ShapleyAttributionEngine(32, 11L, 0).explain(member(6), input(6), 6);
        Explanation second = new ShapleyAttributionEngine(32, 11L, 0).explain(member(6), input(6), 6);

        assertEquals(first, second);
    }

    @Test
    void explain_shouldGiveWholeDifference_toSingleFeature() {
        Explanation explanation = new ShapleyAttributionEngine(8, 1L, 10).explain(member(2), new double[]{2.0, 0.0}, 5);

        Attribution f0 = explanation.getAttributions().get(0);
        assertEquals("f0", f0.getFeature());
        assertEquals(explanation.getPrediction() - explanation.getBaseline(), f0.getContribution(), 1e-12);
    }

    @Test
    void explain_shouldRejectSliceOfWrongLength() {
        ShapleyAttributionEngine engine = new ShapleyAttributionEngine(8, 1L, 10);

        assertThrows(IllegalArgumentException.class, () -> engine.explain(member(3), new double[]{1.0}, 2));
        assertThrows(IllegalArgumentException.class, () -> engine.explain(member(3), input(3), 0));
    }
}
