package ai.coursedoc.transcoder.content;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates 8-character lower-case alphanumeric content item ids.
 */
public class RandomIdGenerator implements IdGenerator {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int LENGTH = 8;

    private final Random random;

    public RandomIdGenerator() {
        this(new SecureRandom());
    }

    public RandomIdGenerator(Random random) {
        this.random = random;
    }

    @Override
    public String nextId() {
        StringBuilder builder = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }
}
