package com.bulkvalidate.engine;

public final class Verdict {
    private static final Verdict VALID = new Verdict(true, null);

    public final boolean valid;
    public final String message;

    private Verdict(boolean valid, String message) {
        this.valid = valid;
        this.message = message;
    }

    public static Verdict valid() {
        return VALID;
    }

    public static Verdict invalid(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("an invalid verdict needs a message");
        }
        return new Verdict(false, message);
    }

    @Override
    public String toString() {
        return valid ? "Verdict{valid}" : "Verdict{invalid: " + message + "}";
    }
}
