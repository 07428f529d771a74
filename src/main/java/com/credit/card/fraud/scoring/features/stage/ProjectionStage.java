package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.artifact.dto.LinearProjection;
import com.credit.card.fraud.scoring.contract.exceptions.FeatureContractViolationException;
import com.credit.card.fraud.scoring.contract.service.ContractViolation;
import com.credit.card.fraud.scoring.features.exceptions.PipelineStageException;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * 9. 현재까지의 수치 컬럼을 2차원 주성분 축으로 투영 (pca_x, pca_y).
 * APPLY에서는 학습 때 저장한 입력 컬럼 목록과 축을 그대로 쓴다.
 */
@Slf4j
public class ProjectionStage implements FeatureStage {

    static final int COMPONENTS = 2;

    @Override
    public String name() {
        return "projection";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        if (context.isFit()) {
            List<String> inputs = new ArrayList<>();
            for (String column : frame.columns()) {
                if (frame.isNumericColumn(column)) inputs.add(column);
            }
            LinearProjection projection = fit(frame, inputs);
            context.recordProjection(projection);
            log.debug("Fitted {}-component projection over {} numeric columns", COMPONENTS, inputs.size());
        }

        LinearProjection projection = context.projection();
        List<String> inputs = projection.getInputColumns();
        requireInputs(frame, inputs);

        for (int i = 0; i < frame.size(); i++) {
            double[] projected = projection.project(row(frame, i, inputs));
            frame.put(i, FeatureColumns.PCA_X, projected[0]);
            frame.put(i, FeatureColumns.PCA_Y, projected[1]);
        }
    }

    private LinearProjection fit(FeatureFrame frame, List<String> inputs) {
        int d = inputs.size();
        if (d < COMPONENTS) {
            throw new PipelineStageException(name(), "Projection needs at least " + COMPONENTS
                    + " numeric columns, found " + inputs);
        }

        double[][] data = new double[frame.size()][];
        for (int i = 0; i < frame.size(); i++) {
            data[i] = row(frame, i, inputs);
        }

        double[] means = new double[d];
        for (double[] x : data) {
            for (int j = 0; j < d; j++) means[j] += x[j];
        }
        for (int j = 0; j < d; j++) means[j] /= data.length;

        double[][] components = new double[COMPONENTS][];
        if (data.length < 2) {
            // 공분산을 정의할 수 없으면 처음 두 축을 그대로 쓴다
            for (int c = 0; c < COMPONENTS; c++) {
                components[c] = new double[d];
                components[c][c] = 1.0;
            }
        } else {
            RealMatrix covariance = new Covariance(new Array2DRowRealMatrix(data, false)).getCovarianceMatrix();
            EigenDecomposition eigen = new EigenDecomposition(covariance);
            double[] eigenvalues = eigen.getRealEigenvalues();

            int[] ranked = IntStream.range(0, eigenvalues.length)
                    .boxed()
                    .sorted(Comparator.comparingDouble((Integer k) -> -eigenvalues[k]).thenComparingInt(k -> k))
                    .mapToInt(Integer::intValue)
                    .toArray();

            for (int c = 0; c < COMPONENTS; c++) {
                components[c] = orientSign(eigen.getEigenvector(ranked[c]).toArray());
            }
        }

        return new LinearProjection(inputs, means, components);
    }

    /**
     * 절댓값이 가장 큰 성분이 양수가 되도록 부호를 고정한다.
     */
    static double[] orientSign(double[] axis) {
        int largest = 0;
        for (int j = 1; j < axis.length; j++) {
            if (Math.abs(axis[j]) > Math.abs(axis[largest])) largest = j;
        }
        if (axis[largest] < 0) {
            for (int j = 0; j < axis.length; j++) axis[j] = -axis[j];
        }
        return axis;
    }

    private void requireInputs(FeatureFrame frame, List<String> inputs) {
        Set<String> missing = new LinkedHashSet<>(inputs);
        missing.removeAll(frame.columns());
        if (!missing.isEmpty()) {
            log.error("Projection inputs missing from working table: {}", missing);
            throw new FeatureContractViolationException(ContractViolation.of(missing, Set.of()));
        }
    }

    private double[] row(FeatureFrame frame, int i, List<String> inputs) {
        double[] x = new double[inputs.size()];
        for (int j = 0; j < x.length; j++) {
            x[j] = frame.numeric(i, inputs.get(j), name());
        }
        return x;
    }
}
