package com.mimecast.listrunner.message;

import com.mimecast.listrunner.queue.MessageMetadata;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies recorded decorations to a raw message at delivery time.
 *
 * <p>Pipeline handlers only record what to change in metadata, the queued payload stays as received.
 * <p>Headers are handled as ISO-8859-1 text so unknown bytes survive unchanged.
 * <p>Body decoration is limited to single part text/plain bodies in a compatible charset.
 */
public final class MessageRenderer {
    private static final Logger log = LogManager.getLogger(MessageRenderer.class);

    private static final Pattern CHARSET = Pattern.compile("charset\\s*=\\s*\"?([^\";\\s]+)", Pattern.CASE_INSENSITIVE);

    /**
     * Private constructor for utility class.
     */
    private MessageRenderer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Renders a message with the decorations recorded in metadata.
     *
     * @param payload  Raw message bytes.
     * @param metadata Metadata.
     * @return Rendered message bytes.
     */
    public static byte[] render(byte[] payload, MessageMetadata metadata) {
        int split = headerLength(payload);
        String eol = detectEol(payload, split);
        List<String> fields = parseFields(new String(payload, 0, split, StandardCharsets.ISO_8859_1));

        // Headers.
        Set<String> strip = new HashSet<>();
        metadata.getStringList(MessageMetadata.STRIP_HEADERS).forEach(name -> strip.add(name.toLowerCase(Locale.ROOT)));
        List<String[]> added = new ArrayList<>();
        for (String header : metadata.getStringList(MessageMetadata.ADD_HEADERS)) {
            int colon = header.indexOf(':');
            if (colon > 0) {
                String name = header.substring(0, colon).trim();
                added.add(new String[]{name, header.substring(colon + 1).trim()});
                strip.add(name.toLowerCase(Locale.ROOT));
            }
        }

        String prefix = metadata.getString(MessageMetadata.SUBJECT_PREFIX, "");
        List<String> output = new ArrayList<>();
        boolean hasSubject = false;
        for (String field : fields) {
            String name = fieldName(field).toLowerCase(Locale.ROOT);
            if (strip.contains(name)) {
                continue;
            }
            if (name.equals("subject")) {
                hasSubject = true;
                field = prefixSubject(field, prefix);
            }
            output.add(field);
        }
        if (!hasSubject && StringUtils.isNotBlank(prefix)) {
            output.add("Subject: " + prefix.trim() + " (no subject)");
        }
        for (String[] header : added) {
            output.add(header[0] + ": " + header[1]);
        }

        ByteArrayOutputStream stream = new ByteArrayOutputStream(payload.length + 512);
        for (String field : output) {
            stream.writeBytes(normalizeEol(field, eol).getBytes(StandardCharsets.ISO_8859_1));
            stream.writeBytes(eol.getBytes(StandardCharsets.ISO_8859_1));
        }
        stream.writeBytes(eol.getBytes(StandardCharsets.ISO_8859_1));

        // Body.
        byte[] body = bodyOf(payload, split);
        String header = metadata.getString(MessageMetadata.MSG_HEADER, "");
        String footer = metadata.getString(MessageMetadata.MSG_FOOTER, "");
        if ((StringUtils.isNotEmpty(header) || StringUtils.isNotEmpty(footer))
                && !metadata.getBoolean(MessageMetadata.NODECORATE)) {
            if (isDecoratable(fields)) {
                body = decorate(body, header, footer, eol);
            } else {
                log.debug("Body left undecorated: non plain text content");
            }
        }
        stream.writeBytes(body);
        return stream.toByteArray();
    }

    /**
     * Gets length of the header block including the separating blank line.
     *
     * @param payload Raw message bytes.
     * @return Offset of the body, payload length if there is no body.
     */
    public static int headerLength(byte[] payload) {
        for (int i = 0; i < payload.length; i++) {
            if (payload[i] != '\n') {
                continue;
            }
            if (i + 1 < payload.length && payload[i + 1] == '\n') {
                return i + 2;
            }
            if (i + 2 < payload.length && payload[i + 1] == '\r' && payload[i + 2] == '\n') {
                return i + 3;
            }
        }
        return payload.length;
    }

    /**
     * Checks the payload starts with at least one well formed header field.
     *
     * @param payload Raw message bytes.
     * @return Boolean.
     */
    public static boolean hasHeaderBlock(byte[] payload) {
        if (payload.length == 0) {
            return false;
        }
        List<String> fields = parseFields(new String(payload, 0, headerLength(payload), StandardCharsets.ISO_8859_1));
        return !fields.isEmpty() && fields.stream().allMatch(field -> field.indexOf(':') > 0
                && !fieldName(field).contains(" "));
    }

    private static List<String> parseFields(String headerBlock) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = null;
        for (String line : headerBlock.split("\r?\n", -1)) {
            if (line.isEmpty()) {
                continue;
            }
            if ((line.startsWith(" ") || line.startsWith("\t")) && current != null) {
                current.append("\n").append(line);
            } else {
                if (current != null) {
                    fields.add(current.toString());
                }
                current = new StringBuilder(line);
            }
        }
        if (current != null) {
            fields.add(current.toString());
        }
        return fields;
    }

    private static String fieldName(String field) {
        int colon = field.indexOf(':');
        return colon > 0 ? field.substring(0, colon).trim() : field;
    }

    private static String fieldValue(String field) {
        int colon = field.indexOf(':');
        return colon > 0 ? field.substring(colon + 1).trim() : "";
    }

    private static String prefixSubject(String field, String prefix) {
        if (StringUtils.isBlank(prefix)) {
            return field;
        }
        String trimmed = prefix.trim();
        String value = fieldValue(field);
        if (StringUtils.containsIgnoreCase(value, trimmed)) {
            return field;
        }
        return fieldName(field) + ": " + trimmed + " " + value;
    }

    private static boolean isDecoratable(List<String> fields) {
        String contentType = "text/plain";
        String encoding = "7bit";
        for (String field : fields) {
            String name = fieldName(field).toLowerCase(Locale.ROOT);
            if (name.equals("content-type")) {
                contentType = fieldValue(field).replaceAll("\\s+", " ");
            } else if (name.equals("content-transfer-encoding")) {
                encoding = fieldValue(field);
            }
        }
        if (!contentType.toLowerCase(Locale.ROOT).startsWith("text/plain")) {
            return false;
        }
        if (!encoding.equalsIgnoreCase("7bit") && !encoding.equalsIgnoreCase("8bit")) {
            return false;
        }
        Matcher matcher = CHARSET.matcher(contentType);
        if (matcher.find()) {
            String charset = matcher.group(1).toLowerCase(Locale.ROOT);
            return charset.equals("utf-8") || charset.equals("us-ascii");
        }
        return true;
    }

    private static byte[] decorate(byte[] body, String header, String footer, String eol) {
        ByteArrayOutputStream stream = new ByteArrayOutputStream(body.length + header.length() + footer.length() + 8);
        if (StringUtils.isNotEmpty(header)) {
            stream.writeBytes(normalizeEol(StringUtils.appendIfMissing(header, "\n"), eol).getBytes(StandardCharsets.UTF_8));
        }
        stream.writeBytes(body);
        if (StringUtils.isNotEmpty(footer)) {
            if (body.length > 0 && body[body.length - 1] != '\n') {
                stream.writeBytes(eol.getBytes(StandardCharsets.US_ASCII));
            }
            stream.writeBytes(normalizeEol(StringUtils.appendIfMissing(footer, "\n"), eol).getBytes(StandardCharsets.UTF_8));
        }
        return stream.toByteArray();
    }

    private static byte[] bodyOf(byte[] payload, int split) {
        byte[] body = new byte[payload.length - split];
        System.arraycopy(payload, split, body, 0, body.length);
        return body;
    }

    private static String detectEol(byte[] payload, int split) {
        for (int i = 0; i < split; i++) {
            if (payload[i] == '\n') {
                return i > 0 && payload[i - 1] == '\r' ? "\r\n" : "\n";
            }
        }
        return "\r\n";
    }

    private static String normalizeEol(String text, String eol) {
        return text.replace("\r\n", "\n").replace("\n", eol);
    }
}
