package com.questrail.designer.api;

/**
 * SignalValue
 * -----------------------------------------------------------------------------
 * Initial value of a signal: either a boolean or a number.
 *
 * The value is stored as written by the user. Conversion to the signal's
 * declared {@link SignalType} happens only when a configuration is generated,
 * via {@link #asBoolean()} and {@link #asDouble()}:
 * <ul>
 *   <li>a numeric value is {@code true} when it is non-zero</li>
 *   <li>a boolean value is {@code 1} or {@code 0} as a number</li>
 * </ul>
 */
public sealed interface SignalValue
        permits SignalValue.BoolValue, SignalValue.NumericValue
{
    boolean asBoolean();

    double asDouble();

    static SignalValue of(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static SignalValue of(double value) {
        return new NumericValue(value);
    }

    /**
     * Returns the zero value for the given type: {@code false} for
     * {@link SignalType#BOOL}, {@code 0} otherwise.
     */
    static SignalValue defaultFor(SignalType type) {
        return type == SignalType.BOOL ? BoolValue.FALSE : new NumericValue(0);
    }

    record BoolValue(boolean value) implements SignalValue {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        @Override
        public boolean asBoolean() {
            return value;
        }

        @Override
        public double asDouble() {
            return value ? 1 : 0;
        }
    }

    record NumericValue(double value) implements SignalValue {
        public NumericValue {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Signal value must be finite (was " + value + ")");
            }
        }

        @Override
        public boolean asBoolean() {
            return value != 0;
        }

        @Override
        public double asDouble() {
            return value;
        }
    }
}
