package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.artifact.dto.FrequencyTable;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;

/**
 * 7. 범주형 필드의 빈도 인코딩 컬럼 (*_fe). 빈도 테이블은 4단계에서 적합된 것을 쓴다.
 */
public class CategoricalEncodingStage implements FeatureStage {

    @Override
    public String name() {
        return "categorical-encoding";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        for (String column : FeatureColumns.CATEGORICAL_FIELDS) {
            FrequencyTable table = context.frequencyTable(column);
            for (int i = 0; i < frame.size(); i++) {
                frame.put(i, column + FeatureColumns.ENCODED_SUFFIX,
                        table.frequency(frame.category(i, column, name())));
            }
        }
    }
}
