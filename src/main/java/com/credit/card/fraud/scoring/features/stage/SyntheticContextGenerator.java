package com.credit.card.fraud.scoring.features.stage;

import lombok.Value;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Random;
import java.util.SplittableRandom;
import java.util.regex.Pattern;

/**
 * 아직 연동되지 않은 상위 시스템(가맹점, 단말, 지역, 계좌)을 대신하는 결정적 합성기.
 * 전역 seed로 모집단 가중치를 한 번 만들고, 레코드별 값은 seed와 식별 키의 해시로 뽑는다.
 */
public final class SyntheticContextGenerator {

    static final int MERCHANTS = 1000;
    static final int GEO_BUCKETS = 50;
    static final int ACCOUNTS = 10000;
    static final int MAX_ACCOUNT_AGE_DAYS = 2000;

    static final String[] DEVICE_TYPES = {"mobile", "desktop", "pos", "tablet"};
    private static final double[] DEVICE_PROBABILITIES = {0.60, 0.25, 0.10, 0.05};
    private static final Pattern ACCOUNT_INDEX = Pattern.compile("\\d{1,5}");

    private final long seed;
    private final double[] merchantCdf;
    private final double[] deviceCdf;
    private final double[] geoCdf;
    private final double[] accountCdf;
    private final int[] accountAges;

    public SyntheticContextGenerator(long seed) {
        this.seed = seed;
        Random universe = new Random(seed);
        this.merchantCdf = exponentialCdf(universe, MERCHANTS);
        this.geoCdf = exponentialCdf(universe, GEO_BUCKETS);
        this.accountCdf = exponentialCdf(universe, ACCOUNTS);
        this.deviceCdf = cumulative(DEVICE_PROBABILITIES);
        this.accountAges = new int[ACCOUNTS];
        for (int i = 0; i < ACCOUNTS; i++) {
            accountAges[i] = universe.nextInt(MAX_ACCOUNT_AGE_DAYS);
        }
    }

    public long seed() {
        return seed;
    }

    /**
     * 같은 키는 항상 같은 컨텍스트를 돌려준다. 일부 필드만 필요하더라도 뽑는 순서는 고정이다.
     */
    public SyntheticContext generate(String identityKey) {
        SplittableRandom random = new SplittableRandom(mix(seed, identityKey));

        int merchant = pick(merchantCdf, random.nextDouble());
        int device = pick(deviceCdf, random.nextDouble());
        int geo = pick(geoCdf, random.nextDouble());
        int account = pick(accountCdf, random.nextDouble());

        return new SyntheticContext(
                Integer.toString(merchant),
                DEVICE_TYPES[device],
                Integer.toString(geo),
                Integer.toString(account),
                accountAges[account]);
    }

    /**
     * 계좌 나이는 계좌마다 고정. 외부에서 들어온 계좌 ID도 같은 테이블로 매핑한다.
     */
    public int accountAge(String accountId) {
        return accountAges[accountIndex(accountId)];
    }

    private int accountIndex(String accountId) {
        if (ACCOUNT_INDEX.matcher(accountId).matches()) {
            int index = Integer.parseInt(accountId);
            if (index < ACCOUNTS) return index;
        }
        // 숫자가 아닌 외부 ID는 해시로 매핑
        return (int) Math.floorMod(mix(seed, "account:" + accountId), (long) ACCOUNTS);
    }

    private static double[] exponentialCdf(Random random, int size) {
        double[] weights = new double[size];
        double total = 0.0;
        for (int i = 0; i < size; i++) {
            weights[i] = -Math.log(1.0 - random.nextDouble());
            total += weights[i];
        }
        for (int i = 0; i < size; i++) {
            weights[i] /= total;
        }
        return cumulative(weights);
    }

    private static double[] cumulative(double[] probabilities) {
        double[] cdf = new double[probabilities.length];
        double running = 0.0;
        for (int i = 0; i < probabilities.length; i++) {
            running += probabilities[i];
            cdf[i] = running;
        }
        cdf[cdf.length - 1] = 1.0;
        return cdf;
    }

    private static int pick(double[] cdf, double u) {
        int index = Arrays.binarySearch(cdf, u);
        if (index < 0) index = -index - 1;
        return Math.min(index, cdf.length - 1);
    }

    static long mix(long seed, String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest((seed + ":" + key).getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }

    @Value
    public static class SyntheticContext {
        String merchantId;
        String deviceType;
        String geoBucket;
        String accountId;
        int accountAgeDays;
    }
}
