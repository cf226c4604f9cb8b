package jsonrpc.messaging;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Call identifier. An opaque scalar chosen by the caller and echoed back unchanged by
 * the callee: either a string or a number.
 * <p>
 * Integral numbers are normalised to {@code long} (or {@link BigInteger} beyond the
 * {@code long} range) so that equality does not depend on how a codec happened to read
 * them. Floating point numbers never equal integral ones.
 */
public final class Id {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final Object value;

    private Id(Object value) {
        this.value = value;
    }

    public static Id of(long value) {
        return new Id(value);
    }

    /** Identifier for a 32-bit counter value read as unsigned. */
    public static Id ofUnsigned(int value) {
        return new Id(Integer.toUnsignedLong(value));
    }

    public static Id of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return new Id(value.longValue());
        }
        return new Id(value);
    }

    public static Id of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Identifier must be a finite number, but was: " + value);
        }
        return new Id(value);
    }

    public static Id of(String value) {
        return new Id(Objects.requireNonNull(value, "value"));
    }

    /** The underlying {@code Long}, {@code BigInteger}, {@code Double} or {@code String}. */
    public Object value() {
        return value;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isIntegral() {
        return value instanceof Long || value instanceof BigInteger;
    }

    /** True if this is an integer in the unsigned 32-bit range. */
    public boolean isUnsigned32() {
        return value instanceof Long && (Long) value >= 0 && (Long) value <= 0xFFFF_FFFFL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Id)) return false;
        return value.equals(((Id) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /** Strings as-is, numbers in their decimal form. */
    @Override
    public String toString() {
        return value.toString();
    }
}
