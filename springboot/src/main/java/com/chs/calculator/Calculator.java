package com.chs.calculator;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

import static java.util.Collections.unmodifiableMap;

/**
 * 사칙연산 계산기. 상태가 없으므로 여러 요청에서 동시에 사용해도 안전합니다.
 */
@Component
public class Calculator {

    public static final String MULTIPLY_SIGN = "\u00d7"; // ×
    public static final String DIVIDE_SIGN = "\u00f7";   // ÷

    private final Map<String, DoubleBinaryOperator> operations;

    public Calculator() {
        Map<String, DoubleBinaryOperator> table = new LinkedHashMap<>();
        table.put("+", this::add);
        table.put("-", this::subtract);
        table.put("*", this::multiply);
        table.put(MULTIPLY_SIGN, this::multiply);
        table.put("/", this::divide);
        table.put(DIVIDE_SIGN, this::divide);
        this.operations = unmodifiableMap(table);
    }

    public double add(double a, double b) {
        return a + b;
    }

    public double subtract(double a, double b) {
        return a - b;
    }

    public double multiply(double a, double b) {
        return a * b;
    }

    public double divide(double a, double b) {
        if (b == 0) { // -0.0 포함
            throw new DivisionByZeroException();
        }
        return a / b;
    }

    /**
     * @throws InvalidOperatorException 지원하지 않는 연산자인 경우
     * @throws DivisionByZeroException  0으로 나누는 경우
     */
    public double calculate(double num1, String operator, double num2) {
        DoubleBinaryOperator operation = operator == null ? null : operations.get(operator);
        if (operation == null) {
            throw new InvalidOperatorException(operator);
        }
        return operation.applyAsDouble(num1, num2);
    }
}
