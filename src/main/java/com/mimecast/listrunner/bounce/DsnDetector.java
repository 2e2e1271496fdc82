package com.mimecast.listrunner.bounce;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.message.ParsedMessage;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * RFC 3464 delivery status notification parser.
 *
 * <p>Reads every per-recipient block of each {@code message/delivery-status} part.
 * <ul>
 *     <li>{@code failed} with a 5.x.x status or without a status is hard.</li>
 *     <li>{@code failed} with a 4.x.x status is soft.</li>
 *     <li>{@code delayed} is soft.</li>
 * </ul>
 * <p>Other actions, like {@code delivered} or {@code relayed}, are ignored.
 */
public class DsnDetector implements BounceDetector {

    @Override
    public List<DetectedBounce> detect(ParsedMessage message, MailingList list) {
        List<DetectedBounce> found = new ArrayList<>();
        for (ParsedMessage.LeafPart part : message.getLeafParts()) {
            if (!part.isType("message/delivery-status")) {
                continue;
            }
            List<Map<String, String>> blocks = blocks(part.getText());
            // First block holds the per-message fields.
            for (int i = 1; i < blocks.size(); i++) {
                DetectedBounce bounce = classify(blocks.get(i));
                if (bounce != null && found.stream().noneMatch(b -> b.address().equals(bounce.address()))) {
                    found.add(bounce);
                }
            }
        }
        return found;
    }

    private static DetectedBounce classify(Map<String, String> fields) {
        String action = fields.getOrDefault("action", "").toLowerCase(Locale.ROOT).trim();
        String status = fields.getOrDefault("status", "").trim();

        BounceSeverity severity;
        if (action.startsWith("delayed")) {
            severity = BounceSeverity.SOFT;
        } else if (action.startsWith("fail") || action.startsWith("error")) {
            severity = status.startsWith("4") ? BounceSeverity.SOFT : BounceSeverity.HARD;
        } else {
            return null;
        }

        String address = address(fields.get("original-recipient"));
        if (address == null) {
            address = address(fields.get("final-recipient"));
        }
        return address == null ? null : new DetectedBounce(address, severity);
    }

    /**
     * Extracts the address of a recipient field like {@code rfc822; user@example.com}.
     */
    private static String address(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String type = StringUtils.substringBefore(value, ";").trim();
        String address = value.contains(";") ? StringUtils.substringAfter(value, ";") : value;
        if (value.contains(";") && !type.equalsIgnoreCase("rfc822")) {
            return null;
        }
        address = StringUtils.strip(address.trim(), "<>").trim().toLowerCase(Locale.ROOT);
        return address.contains("@") ? address : null;
    }

    /**
     * Splits a delivery-status body into header blocks.
     */
    static List<Map<String, String>> blocks(String text) {
        List<Map<String, String>> blocks = new ArrayList<>();
        Map<String, String> current = new LinkedHashMap<>();
        String lastName = null;

        for (String line : text.split("\\r?\\n", -1)) {
            if (line.isBlank()) {
                if (!current.isEmpty()) {
                    blocks.add(current);
                    current = new LinkedHashMap<>();
                }
                lastName = null;
            } else if ((line.startsWith(" ") || line.startsWith("\t")) && lastName != null) {
                current.put(lastName, current.get(lastName) + " " + line.trim());
            } else if (line.contains(":")) {
                lastName = StringUtils.substringBefore(line, ":").trim().toLowerCase(Locale.ROOT);
                current.putIfAbsent(lastName, StringUtils.substringAfter(line, ":").trim());
            }
        }
        if (!current.isEmpty()) {
            blocks.add(current);
        }
        return blocks;
    }
}
