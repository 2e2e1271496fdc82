package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.pipeline.AbstractHoldCriterion;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Remaining hold criteria, every one evaluated.
 *
 * <ul>
 *     <li>Administrivia in the subject or first body lines.</li>
 *     <li>Too many explicit recipients.</li>
 *     <li>Implicit destination.</li>
 *     <li>Suspicious headers.</li>
 *     <li>Oversized body.</li>
 *     <li>HTML viewer required text.</li>
 * </ul>
 */
public class HoldCriteriaHandler extends AbstractHoldCriterion {
    private static final Logger log = LogManager.getLogger(HoldCriteriaHandler.class);

    /**
     * Administrative keywords with their minimum and maximum argument counts.
     */
    static final Map<String, int[]> ADMINISTRIVIA = Map.ofEntries(
            Map.entry("confirm", new int[]{1, 1}),
            Map.entry("help", new int[]{0, 0}),
            Map.entry("info", new int[]{0, 0}),
            Map.entry("lists", new int[]{0, 0}),
            Map.entry("options", new int[]{0, 0}),
            Map.entry("password", new int[]{2, 2}),
            Map.entry("remove", new int[]{0, 0}),
            Map.entry("set", new int[]{3, 3}),
            Map.entry("subscribe", new int[]{0, 3}),
            Map.entry("unsubscribe", new int[]{0, 1}),
            Map.entry("who", new int[]{0, 1})
    );

    /**
     * Non-blank body lines looked at before giving up on administrivia detection.
     */
    static final int ADMINISTRIVIA_MAX_LINES = 5;

    static final String HTML_VIEWER_TEXT = "An HTML viewer is required to see this message";

    @Override
    public String getName() {
        return "hold";
    }

    @Override
    protected Outcome evaluate(PipelineContext context, List<HoldReason> reasons) throws IOException {
        MailingList list = context.getList();
        ListConfig policy = list.getPolicy();
        ParsedMessage message = context.getParsed();

        if (policy.isAdministrivia() && isAdministrivia(message)) {
            reasons.add(HoldReason.ADMINISTRIVIA);
        }

        List<String> recipients = message.getRecipientAddresses();
        if (policy.getMaxNumRecipients() > 0 && recipients.size() >= policy.getMaxNumRecipients()) {
            reasons.add(HoldReason.TOO_MANY_RECIPIENTS);
        }

        if (policy.isRequireExplicitDestination() && !isExplicit(list, recipients)) {
            reasons.add(HoldReason.IMPLICIT_DESTINATION);
        }

        if (hasSuspiciousHeader(message, policy.getBounceMatchingHeaders())) {
            reasons.add(HoldReason.SUSPICIOUS_HEADERS);
        }

        if (policy.getMaxMessageSizeKb() > 0 && message.getBodySize() / 1024.0 > policy.getMaxMessageSizeKb()) {
            reasons.add(HoldReason.MESSAGE_TOO_BIG);
        }

        if (requiresHtmlViewer(message)) {
            reasons.add(HoldReason.HTML_VIEWER_REQUIRED);
        }

        if (!reasons.isEmpty()) {
            log.debug("Hold criteria matched: list={}, id={}, reasons={}", list.getName(), context.getId(), reasons);
        }
        return null;
    }

    /**
     * Guesses whether a message is an administrative request sent to the posting address.
     *
     * @param message Message.
     * @return Boolean.
     */
    static boolean isAdministrivia(ParsedMessage message) {
        List<String> lines = new ArrayList<>();
        int nonBlank = 0;
        for (String line : message.getTextBody().split("\\r?\\n")) {
            if (line.startsWith("-- ")) {
                break;
            }
            if (!line.isBlank()) {
                nonBlank++;
                if (nonBlank > ADMINISTRIVIA_MAX_LINES) {
                    return false;
                }
                lines.add(line);
            }
        }

        if (ADMINISTRIVIA.containsKey(String.join("\n", lines).trim().toLowerCase(Locale.ROOT))) {
            return true;
        }

        lines.add(message.getSubject());
        for (String line : lines) {
            String[] words = StringUtils.split(line.toLowerCase(Locale.ROOT));
            if (words == null || words.length == 0) {
                continue;
            }
            int[] range = ADMINISTRIVIA.get(words[0]);
            if (range == null) {
                continue;
            }
            int args = words.length - 1;
            if (args >= range[0] && args <= range[1]) {
                if (words[0].equals("set") && !words[2].equals("on") && !words[2].equals("off")) {
                    continue;
                }
                return true;
            }
        }
        return false;
    }

    private static boolean isExplicit(MailingList list, List<String> recipients) {
        String posting = Member.normalize(list.getPostingAddress());
        List<String> aliases = list.getPolicy().getAcceptableAliases();
        for (String recipient : recipients) {
            if (Member.normalize(recipient).equals(posting)) {
                return true;
            }
            if (AddressPatterns.matches(aliases, recipient)
                    || AddressPatterns.matches(aliases, StringUtils.substringBefore(recipient, "@"))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rules are lines of {@code Header: regex}, blank lines and {@code #} comments are skipped.
     */
    private static boolean hasSuspiciousHeader(ParsedMessage message, List<String> rules) {
        for (String rule : rules) {
            String line = rule.trim();
            if (line.isEmpty() || line.startsWith("#") || !line.contains(":")) {
                continue;
            }
            String header = StringUtils.substringBefore(line, ":").trim();
            String regex = StringUtils.substringAfter(line, ":").trim();
            try {
                Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
                for (String value : message.getHeaders(header)) {
                    if (pattern.matcher(value).find()) {
                        return true;
                    }
                }
            } catch (PatternSyntaxException e) {
                log.warn("Bad header rule skipped: rule={}, error={}", rule, e.getDescription());
            }
        }
        return false;
    }

    private static boolean requiresHtmlViewer(ParsedMessage message) {
        for (ParsedMessage.LeafPart part : message.getLeafParts()) {
            if (part.isType("text/plain") && part.getText().contains(HTML_VIEWER_TEXT)) {
                return true;
            }
        }
        return false;
    }
}
