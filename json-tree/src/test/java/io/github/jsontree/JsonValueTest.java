package io.github.jsontree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonValueTest {

  @ParameterizedTest(name = "{0} == {1}")
  @CsvSource({"1, 1.0", "1, 1E0", "0, -0.0", "100, 1E2", "2.50, 2.5"})
  void numbersCompareByValue(String left, String right) {
    JsonNumber a = JsonNumber.of(left);
    JsonNumber b = JsonNumber.of(right);
    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
  }

  @Test
  void differentNumbersAreNotEqual() {
    assertThat(JsonNumber.of("1")).isNotEqualTo(JsonNumber.of("1.0001"));
    assertThat(JsonNumber.of(1)).isNotEqualTo(JsonString.of("1"));
  }

  @ParameterizedTest(name = "{0} integral={1}")
  @CsvSource({"1, true", "1.0, true", "1E3, true", "0, true", "-0.0, true", "1.5, false", "1E-1, false"})
  void integralMeansZeroFraction(String text, boolean integral) {
    assertThat(JsonNumber.of(text).isIntegral()).isEqualTo(integral);
  }

  @Test
  void ofDoubleUsesShortestDecimalForm() {
    assertThat(JsonNumber.of(0.1).value()).isEqualByComparingTo(new BigDecimal("0.1"));
    assertThatThrownBy(() -> JsonNumber.of(Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void objectEqualityIgnoresMemberOrder() {
    Map<String, JsonValue> first = new LinkedHashMap<>();
    first.put("a", JsonNumber.of(1));
    first.put("b", JsonString.of("x"));
    Map<String, JsonValue> second = new LinkedHashMap<>();
    second.put("b", JsonString.of("x"));
    second.put("a", JsonNumber.of("1.0"));

    assertThat(JsonObject.of(first)).isEqualTo(JsonObject.of(second));
    assertThat(JsonObject.of(first).hashCode()).isEqualTo(JsonObject.of(second).hashCode());
  }

  @Test
  void arrayEqualityIsOrdered() {
    assertThat(JsonArray.of(JsonNumber.of(1), JsonNumber.of(2)))
        .isEqualTo(JsonArray.of(JsonNumber.of("1.0"), JsonNumber.of(2)))
        .isNotEqualTo(JsonArray.of(JsonNumber.of(2), JsonNumber.of(1)));
  }

  @Test
  void stringsCompareCaseSensitively() {
    assertThat(JsonString.of("abc")).isNotEqualTo(JsonString.of("ABC"));
  }

  @Test
  void containersAreUnmodifiable() {
    JsonArray array = JsonArray.of(List.of(JsonNull.of()));
    assertThatThrownBy(() -> array.elements().add(JsonNull.of()))
        .isInstanceOf(UnsupportedOperationException.class);

    JsonObject object = JsonObject.of(Map.of("k", JsonBoolean.TRUE));
    assertThatThrownBy(() -> object.members().put("x", JsonNull.of()))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void toStringRendersJson() {
    JsonValue value = Json.parse("{\"s\":\"line\\n\\\"q\\\"\",\"n\":[1,true,null]}");
    assertThat(value.toString()).isEqualTo("{\"s\":\"line\\n\\\"q\\\"\",\"n\":[1,true,null]}");
    assertThat(Json.parse(value.toString())).isEqualTo(value);
  }
}
