package vgs;

import static com.google.common.truth.Truth.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LiteralTest {

  @Test
  public void integralNumbersHaveNoFraction() {
    assertThat(Literal.of(2.0).toSource()).isEqualTo("2");
    assertThat(Literal.of(new BigDecimal("100")).toSource()).isEqualTo("100");
    assertThat(Literal.of(new BigDecimal("1E+3")).toSource()).isEqualTo("1000");
  }

  @Test
  public void fractionalNumbers() {
    assertThat(Literal.of(new BigDecimal("1.50")).toSource()).isEqualTo("1.5");
    assertThat(Literal.of(-0.25).toSource()).isEqualTo("-0.25");
    assertThat(Literal.of(new BigDecimal("1E-7")).toSource()).isEqualTo("0.0000001");
  }

  @Test
  public void stringsAreQuotedAndEscaped() {
    assertThat(Literal.of("hi").toSource()).isEqualTo("\"hi\"");
    assertThat(Literal.of("say \"hi\"\n").toSource()).isEqualTo("\"say \\\"hi\\\"\\n\"");
    assertThat(Literal.of("a\\b").rawText()).isEqualTo("a\\b");
  }

  @Test
  public void arrays() {
    Literal array =
        Literal.array(ImmutableList.of(Literal.of(1), Literal.of("x"), Literal.of(true)));

    assertThat(array.toSource()).isEqualTo("[1, \"x\", true]");
    assertThat(Literal.array(ImmutableList.of()).toSource()).isEqualTo("[]");
  }

  @Test
  public void truthiness() {
    assertThat(Literal.nullValue().isTruthy()).isFalse();
    assertThat(Literal.of(false).isTruthy()).isFalse();
    assertThat(Literal.of(0).isTruthy()).isFalse();
    assertThat(Literal.of("").isTruthy()).isFalse();
    assertThat(Literal.of("0").isTruthy()).isTrue();
    assertThat(Literal.of(0.5).isTruthy()).isTrue();
    assertThat(Literal.array(ImmutableList.of()).isTruthy()).isTrue();
  }

  @Test
  public void nullValue() {
    assertThat(Literal.nullValue().isNull()).isTrue();
    assertThat(Literal.nullValue().toSource()).isEqualTo("null");
    assertThat(Literal.of(3).isNull()).isFalse();
  }
}
