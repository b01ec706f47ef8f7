package com.chs.calculator;

import lombok.Getter;

@Getter
public class InvalidOperatorException extends CalculationException {

    private final String operator;

    public InvalidOperatorException(String operator) {
        super("Invalid operator: " + operator);
        this.operator = operator;
    }
}
