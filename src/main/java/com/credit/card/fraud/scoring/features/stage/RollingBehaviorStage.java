package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.features.model.FeatureColumns;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.stream.IntStream;

/**
 * 5. 계좌별 직전 거래(현재 행 제외) 최대 5건의 평균 금액과 건수.
 * 작업 집합을 계좌, 시간 순으로 정렬해서 계산하고 결과는 원래 행에 기록한다.
 */
public class RollingBehaviorStage implements FeatureStage {

    static final int WINDOW = 5;

    @Override
    public String name() {
        return "rolling-behavior";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        int[] order = IntStream.range(0, frame.size())
                .boxed()
                .sorted(Comparator
                        .comparing((Integer i) -> frame.category(i, FeatureColumns.ACCOUNT_ID, name()))
                        .thenComparingDouble(i -> frame.numeric(i, FeatureColumns.TIME, name()))
                        .thenComparingInt(i -> i))
                .mapToInt(Integer::intValue)
                .toArray();

        Deque<Double> window = new ArrayDeque<>(WINDOW);
        double windowSum = 0.0;
        String currentAccount = null;

        for (int row : order) {
            String account = frame.category(row, FeatureColumns.ACCOUNT_ID, name());
            if (!account.equals(currentAccount)) {
                window.clear();
                windowSum = 0.0;
                currentAccount = account;
            }

            int count = window.size();
            // 이력이 없으면 평균은 중립값 0
            double mean = count == 0 ? 0.0 : windowSum / count;
            frame.put(row, FeatureColumns.LAST_5_MEAN_AMOUNT, mean);
            frame.put(row, FeatureColumns.LAST_5_COUNT, (double) count);

            double amount = frame.numeric(row, FeatureColumns.AMOUNT, name());
            window.addLast(amount);
            windowSum += amount;
            if (window.size() > WINDOW) {
                windowSum -= window.removeFirst();
            }
        }
    }
}
