package com.credit.card.fraud.scoring.meta.model;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 메타 벡터에서 베이스 모델 신호가 들어가는 슬롯 이름
 */
public final class MetaFeatureSlots {

    public static final String SUPERVISED_PROBABILITY = "xgb_oof_proba";
    public static final String ANOMALY_SCORE = "anomaly_score";
    public static final String RECONSTRUCTION_ERROR = "ae_recon_error";
    public static final String CLUSTER_ID = "cluster_id";
    public static final String LATENT_PREFIX = "latent_";

    public static final List<String> FIXED_SIGNALS =
            List.of(SUPERVISED_PROBABILITY, ANOMALY_SCORE, RECONSTRUCTION_ERROR, CLUSTER_ID);

    private static final Pattern LATENT = Pattern.compile(Pattern.quote(LATENT_PREFIX) + "(\\d+)");

    private MetaFeatureSlots() {
    }

    public static boolean isSignal(String name) {
        return FIXED_SIGNALS.contains(name) || latentIndex(name).isPresent();
    }

    public static OptionalInt latentIndex(String name) {
        Matcher m = LATENT.matcher(name);
        return m.matches() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    public static String latent(int index) {
        return LATENT_PREFIX + index;
    }
}
