package com.mimecast.listrunner.message;

import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import jakarta.mail.util.ByteArrayDataSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Read only view of a queued payload.
 *
 * <p>Parses the raw bytes with Jakarta Mail on demand, the payload itself is never altered.
 */
public class ParsedMessage {
    private static final Logger log = LogManager.getLogger(ParsedMessage.class);

    private static final Session session = Session.getInstance(new Properties());

    private final byte[] payload;
    private final MimeMessage mime;
    private List<LeafPart> leaves;

    /**
     * Constructs a new ParsedMessage instance.
     */
    private ParsedMessage(byte[] payload, MimeMessage mime) {
        this.payload = payload;
        this.mime = mime;
    }

    /**
     * Parses a payload.
     *
     * @param payload Raw message bytes.
     * @return ParsedMessage instance.
     * @throws IOException Unable to parse headers.
     */
    public static ParsedMessage parse(byte[] payload) throws IOException {
        try {
            return new ParsedMessage(payload, new MimeMessage(session, new ByteArrayInputStream(payload)));
        } catch (MessagingException e) {
            throw new IOException("Unable to parse message: " + e.getMessage(), e);
        }
    }

    public byte[] getPayload() {
        return payload;
    }

    public MimeMessage getMimeMessage() {
        return mime;
    }

    /**
     * Gets first value of a header, unfolded and decoded.
     *
     * @param name Header name.
     * @return Value or null.
     */
    public String getHeader(String name) {
        List<String> values = getHeaders(name);
        if (values.isEmpty()) {
            return null;
        }
        return decode(MimeUtility.unfold(values.get(0))).trim();
    }

    /**
     * Gets all raw values of a header.
     *
     * @param name Header name.
     * @return List of values, empty if missing.
     */
    public List<String> getHeaders(String name) {
        try {
            String[] values = mime.getHeader(name);
            return values == null ? new ArrayList<>() : new ArrayList<>(Arrays.asList(values));
        } catch (MessagingException e) {
            return new ArrayList<>();
        }
    }

    /**
     * Gets subject.
     *
     * @return Subject or empty string.
     */
    public String getSubject() {
        return StringUtils.defaultString(getHeader("Subject"));
    }

    /**
     * Gets Message-ID.
     *
     * @return Message-ID or n/a.
     */
    public String getMessageId() {
        return StringUtils.defaultIfBlank(getHeader("Message-ID"), "n/a");
    }

    /**
     * Gets sender address.
     * <p>From first, then Sender, then the envelope sender.
     *
     * @param envelopeSender Envelope sender from metadata, may be null.
     * @return Lower case address or empty string.
     */
    public String getSender(String envelopeSender) {
        for (String header : new String[]{"From", "Sender"}) {
            List<String> addresses = getAddresses(header);
            if (!addresses.isEmpty()) {
                return addresses.get(0);
            }
        }
        return StringUtils.defaultString(envelopeSender).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Gets addresses listed in a header.
     * <p>Parsing is lenient, unparsable entries are skipped.
     *
     * @param name Header name.
     * @return Lower case addresses.
     */
    public List<String> getAddresses(String name) {
        List<String> addresses = new ArrayList<>();
        for (String value : getHeaders(name)) {
            try {
                for (Address address : InternetAddress.parseHeader(MimeUtility.unfold(value), false)) {
                    if (address instanceof InternetAddress internet && StringUtils.isNotBlank(internet.getAddress())) {
                        addresses.add(internet.getAddress().trim().toLowerCase(Locale.ROOT));
                    }
                }
            } catch (AddressException e) {
                log.debug("Unparsable address header: name={}, value={}", name, value);
            }
        }
        return addresses;
    }

    /**
     * Gets To and Cc addresses.
     *
     * @return Lower case addresses.
     */
    public List<String> getRecipientAddresses() {
        List<String> addresses = getAddresses("To");
        addresses.addAll(getAddresses("Cc"));
        return addresses;
    }

    /**
     * Gets body size.
     *
     * @return Bytes after the header block.
     */
    public int getBodySize() {
        return payload.length - MessageRenderer.headerLength(payload);
    }

    /**
     * Gets decoded text of the first text/plain part.
     *
     * @return Text or empty string.
     */
    public String getTextBody() {
        for (LeafPart part : getLeafParts()) {
            if (part.isType("text/plain")) {
                return part.getText();
            }
        }
        return "";
    }

    /**
     * Gets decoded text of every text part.
     *
     * @return List of text bodies.
     */
    public List<String> getTextBodies() {
        List<String> texts = new ArrayList<>();
        for (LeafPart part : getLeafParts()) {
            if (part.isType("text/plain") || part.isType("text/html")) {
                texts.add(part.getText());
            }
        }
        return texts;
    }

    /**
     * Gets non-multipart parts in document order.
     * <p>Attached messages are not descended into.
     *
     * @return List of LeafPart.
     */
    public List<LeafPart> getLeafParts() {
        if (leaves == null) {
            leaves = new ArrayList<>();
            try {
                collect(mime, leaves, 0);
            } catch (MessagingException | IOException e) {
                log.warn("Unable to walk message parts: error={}", e.getMessage());
            }
        }
        return leaves;
    }

    private static void collect(MimePart part, List<LeafPart> leaves, int depth) throws MessagingException, IOException {
        String contentType = StringUtils.defaultIfBlank(part.getContentType(), "text/plain");
        ContentType type = parseType(contentType);
        byte[] raw = readAll(part instanceof MimeMessage message ? message.getRawInputStream() : rawStream(part));

        if (type.getPrimaryType().equalsIgnoreCase("multipart") && depth < 10) {
            MimeMultipart multipart = new MimeMultipart(new ByteArrayDataSource(raw, contentType));
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart child = multipart.getBodyPart(i);
                if (child instanceof MimePart mimePart) {
                    collect(mimePart, leaves, depth + 1);
                }
            }
            return;
        }

        leaves.add(new LeafPart(type, decodeTransfer(raw, part.getEncoding())));
    }

    private static InputStream rawStream(MimePart part) throws MessagingException {
        if (part instanceof MimeBodyPart bodyPart) {
            return bodyPart.getRawInputStream();
        }
        throw new MessagingException("Unsupported part " + part.getClass().getName());
    }

    private static byte[] decodeTransfer(byte[] raw, String encoding) {
        if (encoding == null || encoding.equalsIgnoreCase("7bit") || encoding.equalsIgnoreCase("8bit")
                || encoding.equalsIgnoreCase("binary")) {
            return raw;
        }
        try (InputStream decoded = MimeUtility.decode(new ByteArrayInputStream(raw), encoding.trim())) {
            return decoded.readAllBytes();
        } catch (MessagingException | IOException e) {
            return raw;
        }
    }

    private static ContentType parseType(String contentType) {
        try {
            return new ContentType(contentType);
        } catch (ParseException e) {
            return new ContentType("text", "plain", null);
        }
    }

    private static byte[] readAll(InputStream stream) throws IOException {
        try (stream) {
            return stream.readAllBytes();
        }
    }

    private static String decode(String value) {
        try {
            return MimeUtility.decodeText(value);
        } catch (UnsupportedEncodingException e) {
            return value;
        }
    }

    /**
     * Decoded leaf part.
     */
    public static class LeafPart {
        private final ContentType type;
        private final byte[] content;

        LeafPart(ContentType type, byte[] content) {
            this.type = type;
            this.content = content;
        }

        /**
         * Checks base type, case insensitive.
         *
         * @param baseType Type like text/plain.
         * @return Boolean.
         */
        public boolean isType(String baseType) {
            return type.getBaseType().equalsIgnoreCase(baseType);
        }

        public String getBaseType() {
            return type.getBaseType().toLowerCase(Locale.ROOT);
        }

        public byte[] getContent() {
            return content;
        }

        /**
         * Gets content as text using the declared charset, UTF-8 by default.
         *
         * @return Text.
         */
        public String getText() {
            return new String(content, charset());
        }

        private Charset charset() {
            String name = type.getParameter("charset");
            if (StringUtils.isBlank(name)) {
                return StandardCharsets.UTF_8;
            }
            try {
                return Charset.forName(MimeUtility.javaCharset(name.trim()));
            } catch (IllegalArgumentException e) {
                return StandardCharsets.UTF_8;
            }
        }
    }
}
