package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.artifact.dto.FrequencyTable;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;

/**
 * 8. 금액 x 계좌 나이, 신규 가맹점 여부 (학습 때 정확히 한 번 등장)
 */
public class InteractionStage implements FeatureStage {

    @Override
    public String name() {
        return "interactions";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        FrequencyTable merchants = context.frequencyTable(FeatureColumns.MERCHANT_ID);

        for (int i = 0; i < frame.size(); i++) {
            double amount = frame.numeric(i, FeatureColumns.AMOUNT, name());
            double accountAge = frame.numeric(i, FeatureColumns.ACCOUNT_AGE_DAYS, name());
            long merchantCount = merchants.count(frame.category(i, FeatureColumns.MERCHANT_ID, name()));

            frame.put(i, FeatureColumns.AMOUNT_TIMES_AGE, amount * accountAge);
            frame.put(i, FeatureColumns.IS_NEW_MERCHANT, merchantCount == 1 ? 1.0 : 0.0);
        }
    }
}
