package jsonrpc.wire;

/**
 * Storage policy for text carried on the wire (method tags, string identifiers and
 * error messages). Full deployments grow strings freely; constrained ones cap them at a
 * fixed capacity.
 */
public interface TextStorage {

    /** Maximum number of characters, {@link Integer#MAX_VALUE} if unbounded. */
    int capacity();

    /**
     * Accepts decoded text.
     *
     * @throws IllegalArgumentException if the text exceeds the capacity
     */
    String admit(String text);

    /** Truncates locally produced text to the capacity without splitting a surrogate pair. */
    String fit(String text);

    static TextStorage unbounded() {
        return Unbounded.INSTANCE;
    }

    static TextStorage bounded(int capacity) {
        return new Bounded(capacity);
    }

    final class Unbounded implements TextStorage {
        private static final Unbounded INSTANCE = new Unbounded();

        private Unbounded() {}

        @Override public int capacity() { return Integer.MAX_VALUE; }
        @Override public String admit(String text) { return text; }
        @Override public String fit(String text) { return text; }
        @Override public String toString() { return "unbounded"; }
    }

    final class Bounded implements TextStorage {
        private final int capacity;

        private Bounded(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("capacity must be positive");
            }
            this.capacity = capacity;
        }

        @Override public int capacity() { return capacity; }

        @Override
        public String admit(String text) {
            if (text != null && text.length() > capacity) {
                throw new IllegalArgumentException("text of " + text.length()
                        + " characters exceeds capacity " + capacity);
            }
            return text;
        }

        @Override
        public String fit(String text) {
            if (text == null || text.length() <= capacity) {
                return text;
            }
            int end = capacity;
            if (Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            return text.substring(0, end);
        }

        @Override public String toString() { return "bounded(" + capacity + ")"; }
    }
}
