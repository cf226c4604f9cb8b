package jsonrpc.wire;

import jsonrpc.messaging.Id;

import java.util.Locale;

/**
 * Deployment profile: which identifiers are accepted and how text is stored.
 */
public enum Profile {
    /** Identifiers may be any string or number; text is unbounded. */
    STANDARD(TextStorage.unbounded()) {
        @Override
        public boolean accepts(Id id) {
            return true;
        }
    },
    /** Identifiers are unsigned 32-bit integers; text holds at most 128 characters. */
    CONSTRAINED(TextStorage.bounded(128)) {
        @Override
        public boolean accepts(Id id) {
            return id.isUnsigned32();
        }
    };

    private final TextStorage textStorage;

    Profile(TextStorage textStorage) {
        this.textStorage = textStorage;
    }

    public TextStorage textStorage() {
        return textStorage;
    }

    public abstract boolean accepts(Id id);

    public static Profile parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Profile name cannot be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown profile: " + name, e);
        }
    }
}
