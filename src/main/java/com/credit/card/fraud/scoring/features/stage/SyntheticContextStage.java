package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.features.exceptions.InvalidRawRecordException;
import com.credit.card.fraud.scoring.features.model.CategoryValues;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;
import com.credit.card.fraud.scoring.features.model.RawRecord;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 3. 원본에 없는 컨텍스트 필드를 합성. 원본에 있는 값은 그대로 쓴다.
 */
public class SyntheticContextStage implements FeatureStage {

    private final ConcurrentMap<Long, SyntheticContextGenerator> generators = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "synthetic-context";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        SyntheticContextGenerator generator =
                generators.computeIfAbsent(context.syntheticSeed(), SyntheticContextGenerator::new);

        for (int i = 0; i < frame.size(); i++) {
            RawRecord record = frame.source(i);
            SyntheticContextGenerator.SyntheticContext synthetic = generator.generate(record.identityKey());

            String accountId = provided(record, FeatureColumns.ACCOUNT_ID, synthetic.getAccountId());

            frame.put(i, FeatureColumns.MERCHANT_ID, provided(record, FeatureColumns.MERCHANT_ID, synthetic.getMerchantId()));
            frame.put(i, FeatureColumns.DEVICE_TYPE, provided(record, FeatureColumns.DEVICE_TYPE, synthetic.getDeviceType()));
            frame.put(i, FeatureColumns.GEO_BUCKET, provided(record, FeatureColumns.GEO_BUCKET, synthetic.getGeoBucket()));
            frame.put(i, FeatureColumns.ACCOUNT_ID, accountId);
            frame.put(i, FeatureColumns.ACCOUNT_AGE_DAYS, accountAge(record, generator, accountId, i));
        }
    }

    private static String provided(RawRecord record, String field, String fallback) {
        return record.get(field).map(CategoryValues::asCategory).orElse(fallback);
    }

    private double accountAge(RawRecord record, SyntheticContextGenerator generator, String accountId, int row) {
        Object age = record.get(FeatureColumns.ACCOUNT_AGE_DAYS).orElse(null);
        if (age == null) {
            return generator.accountAge(accountId);
        }
        if (!(age instanceof Double)) {
            throw new InvalidRawRecordException(
                    FeatureColumns.ACCOUNT_AGE_DAYS,
                    "Row " + row + " account_age_days must be numeric: " + age);
        }
        return (Double) age;
    }
}
