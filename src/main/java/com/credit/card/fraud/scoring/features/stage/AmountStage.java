package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.artifact.dto.ScalingParameters;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * 2. 금액 로그 변환 + 중앙값/IQR 로버스트 스케일링
 */
@Slf4j
public class AmountStage implements FeatureStage {

    @Override
    public String name() {
        return "amount";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        if (context.isFit()) {
            double[] amounts = new double[frame.size()];
            for (int i = 0; i < amounts.length; i++) {
                amounts[i] = frame.numeric(i, FeatureColumns.AMOUNT, name());
            }
            ScalingParameters scaling = fitRobustScaling(amounts);
            context.recordAmountScaling(scaling);
            log.debug("Fitted amount scaling center={} scale={}", scaling.getCenter(), scaling.getScale());
        }

        ScalingParameters scaling = context.amountScaling();
        for (int i = 0; i < frame.size(); i++) {
            double amount = frame.numeric(i, FeatureColumns.AMOUNT, name());
            frame.put(i, FeatureColumns.AMOUNT_LOG, Math.log1p(amount));
            frame.put(i, FeatureColumns.AMOUNT_SCALED, scaling.apply(amount));
        }
    }

    static ScalingParameters fitRobustScaling(double[] values) {
        // numpy 기본값과 같은 선형 보간 분위수
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        double median = percentile.evaluate(50.0);
        double iqr = percentile.evaluate(75.0) - percentile.evaluate(25.0);

        return ScalingParameters.builder()
                .center(median)
                .scale(iqr == 0.0 ? 1.0 : iqr)
                .build();
    }
}
