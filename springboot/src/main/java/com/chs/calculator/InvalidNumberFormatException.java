package com.chs.calculator;

public class InvalidNumberFormatException extends CalculationException {

    public InvalidNumberFormatException() {
        super("Invalid number format");
    }
}
