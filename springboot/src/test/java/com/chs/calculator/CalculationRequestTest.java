package com.chs.calculator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class CalculationRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void acceptsNumbersAndNumericStrings() throws Exception {
        CalculationRequest request = CalculationRequest.from(
                json("{\"num1\": \" -2.5e1 \", \"operator\": \"+\", \"num2\": 4}"));

        assertThat(request.getNum1()).isEqualTo(-25.0);
        assertThat(request.getOperator()).isEqualTo("+");
        assertThat(request.getNum2()).isEqualTo(4.0);
    }

    @Test
    void keepsOperandsAsSent() throws Exception {
        CalculationRequest request = CalculationRequest.from(
                json("{\"num1\": 2, \"operator\": \"*\", \"num2\": 123456789012345678901234567890}"));

        assertThat(request.getNum1Text()).isEqualTo("2");
        assertThat(request.getNum2Text()).isEqualTo("123456789012345678901234567890");
        assertThat(request.getNum1()).isEqualTo(2.0);
    }

    @Test
    void emptyBodyMeansNoData() throws Exception {
        assertThatThrownBy(() -> CalculationRequest.from(null))
                .isInstanceOf(NoDataProvidedException.class);
        assertThatThrownBy(() -> CalculationRequest.from(json("{}")))
                .hasMessage("No data provided");
    }

    @Test
    void missingFieldNamesTheField() throws Exception {
        MissingFieldException e = catchThrowableOfType(
                () -> CalculationRequest.from(json("{\"num1\": 1, \"num2\": 1}")),
                MissingFieldException.class);

        assertThat(e.getField()).isEqualTo("operator");
    }

    @Test
    void reportsFirstMissingField() throws Exception {
        assertThatThrownBy(() -> CalculationRequest.from(json("{\"num2\": 1}")))
                .isInstanceOf(MissingFieldException.class)
                .hasMessage("Missing required field: num1");
        assertThatThrownBy(() -> CalculationRequest.from(json("{\"num1\": 1, \"num2\": 1}")))
                .hasMessage("Missing required field: operator");
        assertThatThrownBy(() -> CalculationRequest.from(json("{\"num1\": 1, \"operator\": \"+\"}")))
                .hasMessage("Missing required field: num2");
    }

    @Test
    void rejectsNonNumericOperands() throws Exception {
        for (String operand : new String[]{"\"abc\"", "\"\"", "true", "null", "[1]", "{}", "\"NaN\"", "\"1e400\"", "\"0x10\""}) {
            JsonNode body = json("{\"num1\": " + operand + ", \"operator\": \"+\", \"num2\": 1}");
            assertThatThrownBy(() -> CalculationRequest.from(body))
                    .as(operand)
                    .isInstanceOf(InvalidNumberFormatException.class)
                    .hasMessage("Invalid number format");
        }
    }

    @Test
    void operandsAreCheckedBeforeOperator() throws Exception {
        assertThatThrownBy(() -> CalculationRequest.from(
                json("{\"num1\": 1, \"operator\": \"^\", \"num2\": \"x\"}")))
                .isInstanceOf(InvalidNumberFormatException.class);
    }

    @Test
    void nonTextOperatorIsKeptForErrorMessage() throws Exception {
        CalculationRequest request = CalculationRequest.from(
                json("{\"num1\": 1, \"operator\": null, \"num2\": 2}"));

        assertThat(request.getOperator()).isEqualTo("null");
    }
}
