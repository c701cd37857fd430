package com.example.assoc.btb;

/**
 * Unsigned counter that sticks at 0 and at {@code 2^bits - 1}.
 */
public class SaturatingCounter {

    private final int max;
    private int value;

    public SaturatingCounter(int bits, int initial) {
        validate(bits, initial);
        this.max = (1 << bits) - 1;
        this.value = initial;
    }

    /**
     * @throws IllegalArgumentException if the width is outside 1..8 or the
     *         initial value does not fit in it
     */
    public static void validate(int bits, int initial) {
        if (bits < 1 || bits > 8) {
            throw new IllegalArgumentException("Counter width must be between 1 and 8 bits: " + bits);
        }
        if (initial < 0 || initial > (1 << bits) - 1) {
            throw new IllegalArgumentException("Initial value " + initial + " does not fit in " + bits + " bits");
        }
    }

    public void increment() {
        if (value < max) {
            value++;
        }
    }

    public void decrement() {
        if (value > 0) {
            value--;
        }
    }

    public int get() {
        return value;
    }

    public boolean isSaturated() {
        return value == max;
    }

    @Override
    public String toString() {
        return value + "/" + max;
    }
}
