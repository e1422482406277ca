package vgs;

import java.math.BigDecimal;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

public abstract class Literal {
  public enum Type {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY
  }

  private static final Escaper STRING_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  Literal() {}

  public abstract Type type();

  public abstract String toSource();

  public String rawText() {
    return toSource();
  }

  public abstract boolean isTruthy();

  public final boolean isNull() {
    return type() == Type.NULL;
  }

  public static String quote(String value) {
    return "\"" + STRING_ESCAPER.escape(value) + "\"";
  }

  public static Literal nullValue() {
    return NullLiteral.INSTANCE;
  }

  public static Literal of(boolean value) {
    return value ? BooleanLiteral.TRUE : BooleanLiteral.FALSE;
  }

  public static Literal of(long value) {
    return of(BigDecimal.valueOf(value));
  }

  public static Literal of(double value) {
    return of(BigDecimal.valueOf(value));
  }

  public static Literal of(BigDecimal value) {
    return new AutoValue_Literal_NumberLiteral(value);
  }

  public static Literal of(String value) {
    return new AutoValue_Literal_StringLiteral(value);
  }

  public static Literal array(Iterable<? extends Literal> elements) {
    return new AutoValue_Literal_ArrayLiteral(ImmutableList.copyOf(elements));
  }

  @AutoValue
  abstract static class NullLiteral extends Literal {
    private static final NullLiteral INSTANCE = new AutoValue_Literal_NullLiteral();

    @Override
    public final Type type() {
      return Type.NULL;
    }

    @Override
    public final String toSource() {
      return "null";
    }

    @Override
    public final boolean isTruthy() {
      return false;
    }
  }

  @AutoValue
  public abstract static class BooleanLiteral extends Literal {
    private static final BooleanLiteral TRUE = new AutoValue_Literal_BooleanLiteral(true);
    private static final BooleanLiteral FALSE = new AutoValue_Literal_BooleanLiteral(false);

    public abstract boolean value();

    @Override
    public final Type type() {
      return Type.BOOLEAN;
    }

    @Override
    public final String toSource() {
      return Boolean.toString(value());
    }

    @Override
    public final boolean isTruthy() {
      return value();
    }
  }

  @AutoValue
  public abstract static class NumberLiteral extends Literal {
    public abstract BigDecimal value();

    @Override
    public final Type type() {
      return Type.NUMBER;
    }

    // 2.0 prints as 2, 1.50 as 1.5; never in exponent form.
    @Override
    public final String toSource() {
      BigDecimal stripped = value().stripTrailingZeros();
      if (stripped.scale() <= 0) {
        return stripped.toBigInteger().toString();
      }
      return stripped.toPlainString();
    }

    @Override
    public final boolean isTruthy() {
      return value().signum() != 0;
    }
  }

  @AutoValue
  public abstract static class StringLiteral extends Literal {
    public abstract String value();

    @Override
    public final Type type() {
      return Type.STRING;
    }

    @Override
    public final String toSource() {
      return quote(value());
    }

    @Override
    public final String rawText() {
      return value();
    }

    @Override
    public final boolean isTruthy() {
      return !value().isEmpty();
    }
  }

  @AutoValue
  public abstract static class ArrayLiteral extends Literal {
    public abstract ImmutableList<Literal> elements();

    @Override
    public final Type type() {
      return Type.ARRAY;
    }

    @Override
    public final String toSource() {
      return elements()
          .stream()
          .map(Literal::toSource)
          .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public final boolean isTruthy() {
      return true;
    }
  }
}
