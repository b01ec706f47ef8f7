package com.chs.calculator;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "${calculator.cors.allowed-origins:*}")
public class CalculatorController {

    @Autowired
    private Calculator calculator;

    /**
     * 요청 예시: {"num1": 6, "operator": "÷", "num2": "4"}
     * 응답 예시: {"success": true, "result": 1.5}
     *
     * 검증 실패와 0으로 나누기는 {@link ApiExceptionHandler}에서 400 으로 변환됩니다.
     */
    @PostMapping(value = "/calculate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CalculationResult calculate(@RequestBody(required = false) JsonNode body) {
        CalculationRequest request = CalculationRequest.from(body);

        double raw = calculator.calculate(request.getNum1(), request.getOperator(), request.getNum2());
        Number result = ResultNormalizer.normalize(raw);

        log.info("Calculation: {} {} {} = {}", request.getNum1Text(), request.getOperator(), request.getNum2Text(), result);
        return CalculationResult.success(result);
    }
}
