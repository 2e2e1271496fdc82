package com.mimecast.listrunner.bounce;

import com.mimecast.listrunner.config.site.BounceConfig;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.message.ParsedMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered bounce detection.
 *
 * <p>VERP first, then RFC 3464 reports, then known templates.
 * <p>A VERP address takes the severity the report or template gives it, hard otherwise.
 */
public class BounceScanner {
    private static final Logger log = LogManager.getLogger(BounceScanner.class);

    private final BounceDetector verp;
    private final BounceDetector dsn;
    private final BounceDetector patterns;

    /**
     * Constructs a new BounceScanner instance.
     *
     * @param config Bounce config.
     */
    public BounceScanner(BounceConfig config) {
        this(new VerpDetector(config.getVerpRegex()), new DsnDetector(), new PatternDetector());
    }

    /**
     * Constructs a new BounceScanner instance with the given layers.
     *
     * @param verp     VERP detector.
     * @param dsn      Delivery status detector.
     * @param patterns Template detector.
     */
    public BounceScanner(BounceDetector verp, BounceDetector dsn, BounceDetector patterns) {
        this.verp = verp;
        this.dsn = dsn;
        this.patterns = patterns;
    }

    /**
     * Scans a bounce message.
     *
     * @param message Bounce message.
     * @param list    Mailing list.
     * @return Detected bounces, one per address, empty when nothing was recognized.
     */
    public List<DetectedBounce> scan(ParsedMessage message, MailingList list) {
        List<DetectedBounce> reported = dsn.detect(message, list);
        if (reported.isEmpty()) {
            reported = patterns.detect(message, list);
        }

        List<DetectedBounce> encoded = verp.detect(message, list);
        List<DetectedBounce> found;
        if (!encoded.isEmpty()) {
            found = new ArrayList<>();
            for (DetectedBounce bounce : encoded) {
                BounceSeverity severity = reported.stream()
                        .filter(r -> r.address().equalsIgnoreCase(bounce.address()))
                        .map(DetectedBounce::severity)
                        .findFirst()
                        .orElse(BounceSeverity.HARD);
                found.add(new DetectedBounce(bounce.address(), severity));
            }
        } else {
            found = reported;
        }

        found = merge(found);
        log.debug("Bounce scan: list={}, verp={}, found={}", list.getName(), !encoded.isEmpty(), found);
        return found;
    }

    /**
     * One entry per address, hard wins over soft.
     */
    private static List<DetectedBounce> merge(List<DetectedBounce> bounces) {
        Map<String, DetectedBounce> merged = new LinkedHashMap<>();
        for (DetectedBounce bounce : bounces) {
            merged.merge(bounce.address(), bounce,
                    (a, b) -> a.severity() == BounceSeverity.HARD ? a : b);
        }
        return new ArrayList<>(merged.values());
    }
}
