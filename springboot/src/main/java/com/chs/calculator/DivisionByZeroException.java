package com.chs.calculator;

public class DivisionByZeroException extends CalculationException {

    public DivisionByZeroException() {
        super("Division by zero is not allowed");
    }
}
