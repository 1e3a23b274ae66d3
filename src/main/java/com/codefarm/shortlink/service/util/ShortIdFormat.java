package com.codefarm.shortlink.service.util;

import com.codefarm.shortlink.service.config.ShortLinkProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.BitSet;

/**
 * Checks that a string has the shape of a generated identifier: the configured
 * length, every character taken from the configured alphabet.
 */
@Component
public class ShortIdFormat {

    private final BitSet allowed = new BitSet(128);
    private final int length;

    @Autowired
    public ShortIdFormat(ShortLinkProperties properties) {
        this(properties.id());
    }

    ShortIdFormat(ShortLinkProperties.Id id) {
        id.alphabet().chars().forEach(allowed::set);
        this.length = id.length();
    }

    public boolean matches(String candidate) {
        if (candidate == null || candidate.length() != length) {
            return false;
        }
        for (int i = 0; i < candidate.length(); i++) {
            if (!allowed.get(candidate.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
