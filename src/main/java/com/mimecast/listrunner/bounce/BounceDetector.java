package com.mimecast.listrunner.bounce;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.message.ParsedMessage;

import java.util.List;

/**
 * One layer of bounce detection.
 */
public interface BounceDetector {

    /**
     * Extracts failed recipients.
     *
     * @param message Bounce message.
     * @param list    Mailing list the bounce was addressed to.
     * @return Detected bounces, empty when the format is not recognized.
     */
    List<DetectedBounce> detect(ParsedMessage message, MailingList list);
}
