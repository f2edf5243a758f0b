package io.pagesync.core.state;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Closed set of values an entity, style or meta property may hold.
 *
 * <p>Arrays hold scalars only; nested arrays and objects are not representable.
 */
public sealed interface PropValue permits PropValue.Text, PropValue.Number, PropValue.Bool, PropValue.Date, PropValue.Array {

    static PropValue text(String value) {
        return new Text(value);
    }

    static PropValue number(BigDecimal value) {
        return new Number(value);
    }

    static PropValue number(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static PropValue bool(boolean value) {
        return new Bool(value);
    }

    static PropValue date(LocalDate value) {
        return new Date(value);
    }

    record Text(String value) implements PropValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Numeric value. Trailing zeros are stripped so {@code 1.0} and {@code 1} compare equal.
     */
    record Number(BigDecimal value) implements PropValue {
        public Number {
            Objects.requireNonNull(value, "value");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }
    }

    record Bool(boolean value) implements PropValue {}

    record Date(LocalDate value) implements PropValue {
        public Date {
            Objects.requireNonNull(value, "value");
        }
    }

    record Array(List<PropValue> items) implements PropValue {
        public Array {
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
            for (PropValue item : items) {
                if (item instanceof Array) {
                    throw new IllegalArgumentException("arrays may only contain scalar values");
                }
            }
        }
    }
}
