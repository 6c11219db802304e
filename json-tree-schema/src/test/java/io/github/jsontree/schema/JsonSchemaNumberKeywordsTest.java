package io.github.jsontree.schema;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaNumberKeywordsTest extends JsonSchemaTestBase {

  @Test
  void exclusiveMinimumAndInclusiveMaximum() {
    var schema = """
        {"type": "number", "minimum": 0, "maximum": 100, "exclusiveMinimum": true}
        """;
    var low = validate("0", schema);
    assertThat(low.errors()).hasSize(1);
    assertThat(low.errors().get(0).keyword()).isEqualTo(Keyword.MINIMUM);
    assertThat(low.errors().get(0).message()).isEqualTo("Below minimum: 0, expected more than 0");

    assertThat(validate("100", schema).valid()).isTrue();
    assertThat(validate("0.0001", schema).valid()).isTrue();
  }

  @Test
  void exclusiveMaximum() {
    var schema = "{\"maximum\": 10, \"exclusiveMaximum\": true}";
    assertThat(validate("9.999", schema).valid()).isTrue();
    assertThat(validate("10", schema).errors()).extracting(ValidationError::message)
        .containsExactly("Above maximum: 10, expected less than 10");
  }

  @Test
  void inclusiveBoundsByDefault() {
    var schema = "{\"minimum\": -5, \"maximum\": 5}";
    assertThat(validate("-5", schema).valid()).isTrue();
    assertThat(validate("5.0", schema).valid()).isTrue();
    assertThat(validate("-5.1", schema).errors()).extracting(ValidationError::keyword)
        .containsExactly(Keyword.MINIMUM);
    assertThat(validate("6", schema).errors()).extracting(ValidationError::keyword)
        .containsExactly(Keyword.MAXIMUM);
  }

  @Test
  void comparisonIsExact() {
    var schema = "{\"maximum\": 0.3}";
    assertThat(validate("0.30000000000000000001", schema).valid()).isFalse();
    assertThat(validate("0.3", schema).valid()).isTrue();
  }

  @Test
  void divisibleByIntegralDivisor() {
    var schema = "{\"divisibleBy\": 3}";
    assertThat(validate("9", schema).valid()).isTrue();
    assertThat(validate("-12", schema).valid()).isTrue();
    assertThat(validate("0", schema).valid()).isTrue();

    var result = validate("10", schema);
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).keyword()).isEqualTo(Keyword.DIVISIBLE_BY);
    assertThat(result.errors().get(0).message()).isEqualTo("Not divisible by 3: 10");
  }

  @Test
  void divisibleByDecimalDivisorUsesExactRemainder() {
    var schema = "{\"divisibleBy\": 0.01}";
    assertThat(validate("4.35", schema).valid()).isTrue();
    assertThat(validate("0.07", schema).valid()).isTrue();
    assertThat(validate("4.355", schema).valid()).isFalse();
  }

  @Test
  @Timeout(5)
  void divisibleByHandlesHugeExponentsWithoutExpanding() {
    var result = validate("1e100000000", "{\"divisibleBy\": 7}");
    assertThat(result.errors()).extracting(ValidationError::keyword)
        .containsExactly(Keyword.DIVISIBLE_BY);

    assertThat(validate("1e100000000", "{\"divisibleBy\": 5}").valid()).isTrue();
    assertThat(validate("-3e100000000", "{\"divisibleBy\": 2.5}").valid()).isTrue();
    assertThat(validate("1e-100000000", "{\"divisibleBy\": 0.5}").valid()).isFalse();
  }

  @Test
  void multipleOfAlignsScales() {
    assertThat(NumberKeywords.isMultipleOf(new BigDecimal("100"), new BigDecimal("1E+1"))).isTrue();
    assertThat(NumberKeywords.isMultipleOf(new BigDecimal("105"), new BigDecimal("1E+1"))).isFalse();
    assertThat(NumberKeywords.isMultipleOf(new BigDecimal("7.50"), new BigDecimal("2.5"))).isTrue();
    assertThat(NumberKeywords.isMultipleOf(new BigDecimal("1E+20"), new BigDecimal("3"))).isFalse();
    assertThat(NumberKeywords.isMultipleOf(new BigDecimal("6E+20"), new BigDecimal("3"))).isTrue();
    assertThat(NumberKeywords.isMultipleOf(new BigDecimal("0.000"), new BigDecimal("0.7"))).isTrue();
  }

  @Test
  void numberKeywordsIgnoreOtherKinds() {
    var schema = "{\"minimum\": 10, \"divisibleBy\": 7}";
    assertThat(validate("\"3\"", schema).valid()).isTrue();
    assertThat(validate("true", schema).valid()).isTrue();
  }

  @Test
  void allNumberFailuresAreCollected() {
    var result = validate("7.5", """
        {"type": "integer", "minimum": 10, "divisibleBy": 2}
        """);
    assertThat(result.errors()).extracting(ValidationError::keyword)
        .containsExactly(Keyword.TYPE, Keyword.MINIMUM, Keyword.DIVISIBLE_BY);
  }
}
