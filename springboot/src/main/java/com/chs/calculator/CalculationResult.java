package com.chs.calculator;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CalculationResult {

    private final boolean success;
    private final Number result;
    private final String error;

    public static CalculationResult success(Number result) {
        return new CalculationResult(true, result, null);
    }

    public static CalculationResult failure(String error) {
        return new CalculationResult(false, null, error);
    }
}
