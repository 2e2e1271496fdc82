package com.mimecast.listrunner.bounce;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.message.ParsedMessage;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Matches text parts against known bounce templates.
 *
 * <p>Permanent templates are tried first. The first template yielding addresses wins.
 */
public class PatternDetector implements BounceDetector {

    @Override
    public List<DetectedBounce> detect(ParsedMessage message, MailingList list) {
        List<String> lines = lines(message);

        List<DetectedBounce> found = match(lines, BounceTemplates.PERMANENT, BounceSeverity.HARD);
        if (found.isEmpty()) {
            found = match(lines, BounceTemplates.TRANSIENT, BounceSeverity.SOFT);
        }
        return found;
    }

    private static List<DetectedBounce> match(List<String> lines, List<BounceTemplates.Template> templates, BounceSeverity severity) {
        for (BounceTemplates.Template template : templates) {
            Set<String> addresses = new LinkedHashSet<>();
            boolean started = false;
            for (String line : lines) {
                if (!started && template.start().matcher(line).find()) {
                    started = true;
                }
                if (started) {
                    Matcher matcher = template.address().matcher(line);
                    if (matcher.find()) {
                        String address = StringUtils.strip(StringUtils.stripEnd(StringUtils.defaultString(matcher.group("addr")).trim(), ".,;:"), "<>");
                        if (!address.isEmpty()) {
                            addresses.add(address.toLowerCase(Locale.ROOT));
                        }
                    } else if (template.end().matcher(line).find()) {
                        break;
                    }
                }
            }

            List<DetectedBounce> found = new ArrayList<>();
            for (String address : addresses) {
                if (BounceTemplates.VALID.matcher(address).matches()) {
                    found.add(new DetectedBounce(address, severity));
                }
            }
            if (!found.isEmpty()) {
                return found;
            }
        }
        return new ArrayList<>();
    }

    private static List<String> lines(ParsedMessage message) {
        List<String> lines = new ArrayList<>();
        for (String body : message.getTextBodies()) {
            for (String line : body.split("\\r?\\n")) {
                lines.add(line);
            }
        }
        return lines;
    }
}
