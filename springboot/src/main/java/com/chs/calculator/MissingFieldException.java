package com.chs.calculator;

import lombok.Getter;

@Getter
public class MissingFieldException extends CalculationException {

    private final String field;

    public MissingFieldException(String field) {
        super("Missing required field: " + field);
        this.field = field;
    }
}
