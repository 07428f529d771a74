package com.credit.card.fraud.scoring.features.model;

import com.credit.card.fraud.scoring.features.exceptions.InvalidRawRecordException;
import com.credit.card.fraud.scoring.features.stage.TemporalStage;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 거래 한 건의 원본 필드. 값은 Double 또는 String으로 정규화된다.
 */
public final class RawRecord {

    /** 기준 시각에 더해 LocalDateTime으로 표현 가능한 최대 초 */
    static final long MAX_TIME_SECONDS = ChronoUnit.SECONDS.between(TemporalStage.BASE_TIME, LocalDateTime.MAX);

    private final Map<String, Object> fields;

    private RawRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static RawRecord of(Map<String, ?> payload) {
        return of(payload, null);
    }

    /**
     * @param labelField 학습 라벨 컬럼. 피처로 흘러가지 않도록 버린다.
     */
    public static RawRecord of(Map<String, ?> payload, String labelField) {
        if (payload == null) {
            throw new InvalidRawRecordException("payload", "Raw record payload is null");
        }

        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            String name = entry.getKey();
            if (name == null || name.equals(labelField)) continue;

            Object value = normalize(name, entry.getValue());
            if (value != null) {
                normalized.put(name, value);
            }
        }

        requireNonNegative(normalized, FeatureColumns.TIME);
        requireNonNegative(normalized, FeatureColumns.AMOUNT);
        return new RawRecord(normalized);
    }

    private static Object normalize(String name, Object value) {
        if (value == null) return null;

        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else if (value instanceof Boolean) {
            return ((Boolean) value) ? 1.0 : 0.0;
        } else if (value instanceof CharSequence) {
            String text = value.toString().trim();
            return text.isEmpty() ? null : text;
        }
        throw new InvalidRawRecordException(name,
                "Unsupported value type for field '" + name + "': " + value.getClass().getSimpleName());
    }

    private static void requireNonNegative(Map<String, Object> fields, String name) {
        Object value = fields.get(name);
        if (value == null) {
            throw new InvalidRawRecordException(name, "Mandatory field '" + name + "' is missing");
        }
        if (!(value instanceof Double)) {
            throw new InvalidRawRecordException(name, "Mandatory field '" + name + "' must be numeric: " + value);
        }
        double v = (Double) value;
        if (!Double.isFinite(v) || v < 0) {
            throw new InvalidRawRecordException(name, "Mandatory field '" + name + "' must be finite and >= 0: " + v);
        }
        if (FeatureColumns.TIME.equals(name) && (long) Math.floor(v) >= MAX_TIME_SECONDS) {
            throw new InvalidRawRecordException(name,
                    "Mandatory field '" + name + "' is beyond the representable time range: " + v);
        }
    }

    public double time() {
        return (Double) fields.get(FeatureColumns.TIME);
    }

    public double amount() {
        return (Double) fields.get(FeatureColumns.AMOUNT);
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * 합성 컨텍스트의 결정성 키. transaction_id가 있으면 그것을, 없으면 (Time, Amount) 비트 패턴을 쓴다.
     * 행 번호는 학습/서빙 사이에 달라지므로 쓰지 않는다.
     */
    public String identityKey() {
        Object id = fields.get(FeatureColumns.TRANSACTION_ID);
        if (id != null) {
            return "id:" + CategoryValues.asCategory(id);
        }
        return "t:" + Long.toHexString(Double.doubleToLongBits(time()))
                + "|a:" + Long.toHexString(Double.doubleToLongBits(amount()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawRecord)) return false;
        return fields.equals(((RawRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "RawRecord" + fields;
    }
}
