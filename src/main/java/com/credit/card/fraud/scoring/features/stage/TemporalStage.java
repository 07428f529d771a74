package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.features.model.FeatureColumns;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 1. Time(초)을 기준 시각에 더해 시간대/요일로 분해
 */
public class TemporalStage implements FeatureStage {

    public static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 1, 0, 0, 0);
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String name() {
        return "temporal";
    }

    @Override
    public void apply(FeatureFrame frame, StageContext context) {
        for (int i = 0; i < frame.size(); i++) {
            LocalDateTime timestamp = toTimestamp(frame.numeric(i, FeatureColumns.TIME, name()));

            frame.put(i, FeatureColumns.TIMESTAMP, timestamp.format(FORMATTER));
            frame.put(i, FeatureColumns.HOUR, (double) timestamp.getHour());
            // 월요일 = 0
            frame.put(i, FeatureColumns.DAY_OF_WEEK, (double) (timestamp.getDayOfWeek().getValue() - 1));
        }
    }

    static LocalDateTime toTimestamp(double seconds) {
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1_000_000_000L);
        return BASE_TIME.plusSeconds(whole).plusNanos(nanos);
    }
}
