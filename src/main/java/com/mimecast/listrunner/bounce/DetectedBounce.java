package com.mimecast.listrunner.bounce;

/**
 * Original recipient extracted from a bounce.
 *
 * @param address  Lower case recipient address.
 * @param severity Severity.
 */
public record DetectedBounce(String address, BounceSeverity severity) {
}
