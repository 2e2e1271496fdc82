package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.directory.Member;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Address list matching.
 *
 * <p>Entries starting with {@code ^} are case insensitive regular expressions, others are exact addresses.
 */
final class AddressPatterns {
    private static final Logger log = LogManager.getLogger(AddressPatterns.class);

    /**
     * Private constructor for utility class.
     */
    private AddressPatterns() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks an address against a pattern list.
     *
     * @param patterns Patterns.
     * @param address  Address.
     * @return Boolean.
     */
    static boolean matches(List<String> patterns, String address) {
        if (address == null || address.isEmpty()) {
            return false;
        }
        String normalized = Member.normalize(address);
        for (String pattern : patterns) {
            if (pattern.startsWith("^")) {
                try {
                    if (Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(normalized).find()) {
                        return true;
                    }
                } catch (PatternSyntaxException e) {
                    log.warn("Bad address pattern skipped: pattern={}, error={}", pattern, e.getDescription());
                }
            } else if (Member.normalize(pattern).equals(normalized)) {
                return true;
            }
        }
        return false;
    }
}
