package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.features.model.FeatureColumns;
import com.credit.card.fraud.scoring.features.model.RawRecord;

/**
 * 6. 원본에 없어서 합성된 컨텍스트 필드 표시
 */
public class MissingIndicatorStage implements FeatureStage {

    @Override
    public String name() {
        return "missing-indicators";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        for (int i = 0; i < frame.size(); i++) {
            RawRecord record = frame.source(i);
            for (String field : FeatureColumns.CONTEXT_FIELDS) {
                frame.put(i, field + FeatureColumns.MISSING_SUFFIX, record.has(field) ? 0.0 : 1.0);
            }
        }
    }
}
