package com.credit.card.fraud.scoring.features.model;

/**
 * 범주형 값 문자열화. 정수형 숫자는 소수점 없이 표기한다 (421.0 -> "421").
 */
public final class CategoryValues {

    private CategoryValues() {
    }

    public static String asCategory(Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return String.valueOf(value);
    }
}
