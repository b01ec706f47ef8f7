package com.chs.calculator;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * {@code POST /api/calculate} 요청 본문을 검증한 결과.
 *
 * 피연산자는 JSON 숫자 또는 숫자 문자열("3.5", " -2e3 ")을 받습니다.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class CalculationRequest {

    public static final List<String> REQUIRED_FIELDS = List.of("num1", "operator", "num2");

    private final double num1;
    private final String operator;
    private final double num2;

    // 로그용 원본 입력값
    private final String num1Text;
    private final String num2Text;

    public static CalculationRequest from(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()
                || (body.isContainerNode() && body.isEmpty())) {
            throw new NoDataProvidedException();
        }

        for (String field : REQUIRED_FIELDS) {
            if (!body.has(field)) {
                throw new MissingFieldException(field);
            }
        }

        // 숫자 검증이 연산자 검증보다 먼저
        double num1 = parseOperand(body.get("num1"));
        double num2 = parseOperand(body.get("num2"));

        JsonNode op = body.get("operator");
        String operator = op.isTextual() ? op.asText() : op.toString();

        return new CalculationRequest(num1, operator, num2,
                body.get("num1").asText(), body.get("num2").asText());
    }

    static double parseOperand(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = new BigDecimal(node.asText().trim()).doubleValue();
            } catch (NumberFormatException e) {
                throw new InvalidNumberFormatException();
            }
        } else {
            // boolean, null, 객체, 배열
            throw new InvalidNumberFormatException();
        }

        if (!Double.isFinite(value)) {
            throw new InvalidNumberFormatException();
        }
        return value;
    }
}
