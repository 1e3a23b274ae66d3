package com.codefarm.shortlink.service.util;

import com.codefarm.shortlink.service.config.ShortLinkProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Draws every character independently from the configured alphabet.
 * With the default 62 symbols and 6 characters that is roughly 5.68e10 possible ids.
 */
@Component
public class RandomShortIdGenerator implements ShortIdGenerator {

    private final char[] alphabet;
    private final int length;
    private final Random random;

    @Autowired
    public RandomShortIdGenerator(ShortLinkProperties properties) {
        this(properties.id(), new SecureRandom());
    }

    RandomShortIdGenerator(ShortLinkProperties.Id id, Random random) {
        this.alphabet = id.alphabet().toCharArray();
        this.length = id.length();
        this.random = random;
    }

    @Override
    public String generate() {
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet[random.nextInt(alphabet.length)];
        }
        return new String(chars);
    }
}
