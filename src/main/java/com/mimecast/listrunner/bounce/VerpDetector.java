package com.mimecast.listrunner.bounce;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.message.ParsedMessage;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the recipient from a VERP encoded bounce address.
 *
 * <p>The pattern must define the named groups {@code bounces}, {@code mailbox} and {@code host}.
 * Detected addresses are reported as {@link BounceSeverity#HARD}, the scanner refines the severity
 * when another layer recognizes the same address.
 */
public class VerpDetector implements BounceDetector {
    private static final Logger log = LogManager.getLogger(VerpDetector.class);

    static final String[] HEADERS = {"To", "Delivered-To", "Envelope-To", "Apparently-To"};

    private final Pattern pattern;

    /**
     * Constructs a new VerpDetector instance.
     *
     * @param regex VERP pattern with named groups.
     */
    public VerpDetector(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public List<DetectedBounce> detect(ParsedMessage message, MailingList list) {
        String expected = StringUtils.substringBefore(list.getBouncesAddress(), "@");
        List<DetectedBounce> found = new ArrayList<>();

        for (String header : HEADERS) {
            for (String address : candidates(message, header)) {
                Matcher matcher = pattern.matcher(address);
                if (!matcher.matches()) {
                    continue;
                }
                try {
                    if (!expected.equalsIgnoreCase(matcher.group("bounces"))) {
                        log.debug("VERP bounces part mismatch: list={}, address={}", list.getName(), address);
                        continue;
                    }
                    String decoded = (matcher.group("mailbox") + "@" + matcher.group("host")).toLowerCase(Locale.ROOT);
                    if (found.stream().noneMatch(bounce -> bounce.address().equals(decoded))) {
                        found.add(new DetectedBounce(decoded, BounceSeverity.HARD));
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("VERP pattern lacks a named group: pattern={}", pattern.pattern());
                    return found;
                }
            }
            if (!found.isEmpty()) {
                break;
            }
        }
        return found;
    }

    private static List<String> candidates(ParsedMessage message, String header) {
        List<String> addresses = message.getAddresses(header);
        if (addresses.isEmpty()) {
            for (String value : message.getHeaders(header)) {
                addresses.add(StringUtils.strip(value.trim(), "<>").toLowerCase(Locale.ROOT));
            }
        }
        return addresses;
    }
}
