package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.artifact.dto.FrequencyTable;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 4. 학습 모집단 기준 범주 빈도. FIT에서 범주형 필드 전체의 빈도 테이블을 만든다.
 */
@Slf4j
public class FrequencyAggregateStage implements FeatureStage {

    @Override
    public String name() {
        return "frequency-aggregates";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        if (context.isFit()) {
            for (String column : FeatureColumns.CATEGORICAL_FIELDS) {
                List<String> values = new ArrayList<>(frame.size());
                for (int i = 0; i < frame.size(); i++) {
                    values.add(frame.category(i, column, name()));
                }
                FrequencyTable table = FrequencyTable.fit(values);
                context.recordFrequencyTable(column, table);
                log.debug("Fitted frequency table {} with {} categories over {} rows",
                        column, table.getCounts().size(), table.getTotalRows());
            }
        }

        FrequencyTable merchants = context.frequencyTable(FeatureColumns.MERCHANT_ID);
        FrequencyTable devices = context.frequencyTable(FeatureColumns.DEVICE_TYPE);
        FrequencyTable accounts = context.frequencyTable(FeatureColumns.ACCOUNT_ID);

        for (int i = 0; i < frame.size(); i++) {
            frame.put(i, FeatureColumns.MERCHANT_FREQ,
                    merchants.frequency(frame.category(i, FeatureColumns.MERCHANT_ID, name())));
            frame.put(i, FeatureColumns.DEVICE_FREQ,
                    devices.frequency(frame.category(i, FeatureColumns.DEVICE_TYPE, name())));
            frame.put(i, FeatureColumns.ACCOUNT_TXN_COUNT,
                    (double) accounts.count(frame.category(i, FeatureColumns.ACCOUNT_ID, name())));
        }
    }
}
