package com.chs.calculator;

/**
 * 클라이언트 입력 때문에 계산할 수 없는 경우. 모두 400 으로 응답합니다.
 */
public abstract class CalculationException extends RuntimeException {

    protected CalculationException(String message) {
        super(message);
    }
}
