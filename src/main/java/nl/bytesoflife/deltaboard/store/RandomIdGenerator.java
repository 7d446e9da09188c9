package nl.bytesoflife.deltaboard.store;

import java.security.SecureRandom;

/**
 * URL-safe random ids, 12 characters by default.
 */
public class RandomIdGenerator implements IdGenerator {

    private static final char[] ALPHABET =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz_-".toCharArray();

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public RandomIdGenerator() {
        this(12);
    }

    public RandomIdGenerator(int length) {
        if (length < 6) {
            throw new IllegalArgumentException("Id length must be >= 6");
        }
        this.length = length;
    }

    @Override
    public String nextId() {
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(out);
    }
}
