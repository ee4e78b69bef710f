package io.surfworks.flowgrinder.core.padding;

/**
 * Padding of one spatial axis.
 */
public record PadPair(int before, int after) {

    public static final PadPair NONE = new PadPair(0, 0);

    public PadPair {
        if (before < 0 || after < 0) {
            throw new IllegalArgumentException("Padding must be non-negative: (" + before + ", " + after + ")");
        }
    }

    public int total() {
        return before + after;
    }

    public PadPair swap() {
        return new PadPair(after, before);
    }
}
