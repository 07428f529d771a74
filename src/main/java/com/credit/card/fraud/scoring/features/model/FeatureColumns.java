package com.credit.card.fraud.scoring.features.model;

import java.util.List;

/**
 * 파이프라인이 생성하는 컬럼 이름
 */
public final class FeatureColumns {

    public static final String TIME = "Time";
    public static final String AMOUNT = "Amount";
    public static final String TRANSACTION_ID = "transaction_id";

    public static final String TIMESTAMP = "timestamp";
    public static final String HOUR = "hour";
    public static final String DAY_OF_WEEK = "dayofweek";

    public static final String AMOUNT_LOG = "amount_log";
    public static final String AMOUNT_SCALED = "amount_scaled";

    public static final String MERCHANT_ID = "merchant_id";
    public static final String DEVICE_TYPE = "device_type";
    public static final String GEO_BUCKET = "geo_bucket";
    public static final String ACCOUNT_ID = "account_id";
    public static final String ACCOUNT_AGE_DAYS = "account_age_days";

    public static final String MERCHANT_FREQ = "merchant_freq";
    public static final String DEVICE_FREQ = "device_freq";
    public static final String ACCOUNT_TXN_COUNT = "account_txn_count";

    public static final String LAST_5_MEAN_AMOUNT = "last_5_mean_amount";
    public static final String LAST_5_COUNT = "last_5_count";

    public static final String MISSING_SUFFIX = "_missing";
    public static final String ENCODED_SUFFIX = "_fe";

    public static final String AMOUNT_TIMES_AGE = "amount_times_age";
    public static final String IS_NEW_MERCHANT = "is_new_merchant";

    public static final String PCA_X = "pca_x";
    public static final String PCA_Y = "pca_y";

    /** 원본 레코드에 없으면 합성되는 컨텍스트 필드 */
    public static final List<String> CONTEXT_FIELDS = List.of(
            MERCHANT_ID, DEVICE_TYPE, GEO_BUCKET, ACCOUNT_ID, ACCOUNT_AGE_DAYS);

    /** 빈도 테이블을 갖는 범주형 필드 */
    public static final List<String> CATEGORICAL_FIELDS = List.of(
            MERCHANT_ID, DEVICE_TYPE, GEO_BUCKET, ACCOUNT_ID);

    private FeatureColumns() {
    }
}
