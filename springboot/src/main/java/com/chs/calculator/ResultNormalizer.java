package com.chs.calculator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 계산 결과를 JSON 응답용 숫자로 변환합니다.
 * 정수 값이면 정수로, 아니면 소수점 10자리로 반올림해 부동소수점 오차(0.1 + 0.2 등)를 숨깁니다.
 */
public final class ResultNormalizer {

    public static final int DECIMAL_PLACES = 10;

    private ResultNormalizer() {
    }

    public static Number normalize(double value) {
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("Result is not a finite number: " + value);
        }

        if (value == Math.rint(value)) {
            if (Math.abs(value) < Long.MAX_VALUE) {
                return (long) value;
            }
            return new BigDecimal(value).toBigInteger();
        }

        return new BigDecimal(value)
                .setScale(DECIMAL_PLACES, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
