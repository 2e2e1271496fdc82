package com.mimecast.listrunner.notice;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.commons.lang3.StringUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Builds plain text notification messages.
 *
 * <p>Optionally attaches an original message unchanged as {@code message/rfc822}.
 */
public class NoticeBuilder {

    private static final Session session = Session.getInstance(new Properties());

    private final String from;
    private final List<String> to = new ArrayList<>();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String subject = "";
    private String text = "";
    private byte[] attachment;
    private Instant date = Instant.now();

    /**
     * Constructs a new NoticeBuilder instance.
     *
     * @param from Sender address.
     */
    public NoticeBuilder(String from) {
        this.from = from;
    }

    public NoticeBuilder to(List<String> recipients) {
        to.addAll(recipients);
        return this;
    }

    public NoticeBuilder to(String recipient) {
        to.add(recipient);
        return this;
    }

    public NoticeBuilder subject(String subject) {
        this.subject = subject;
        return this;
    }

    public NoticeBuilder text(String text) {
        this.text = text;
        return this;
    }

    public NoticeBuilder header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public NoticeBuilder attach(byte[] original) {
        this.attachment = original;
        return this;
    }

    public NoticeBuilder date(Instant date) {
        this.date = date;
        return this;
    }

    /**
     * Builds the message.
     *
     * @return Message bytes.
     * @throws IOException Unable to build.
     */
    public byte[] build() throws IOException {
        try {
            MimeMessage message = new MimeMessage(session) {
                @Override
                protected void updateMessageID() throws MessagingException {
                    // Avoids the local host name lookup of the default implementation.
                    setHeader("Message-ID", "<" + UUID.randomUUID() + "@" + StringUtils.substringAfter(from, "@") + ">");
                }
            };
            message.setFrom(new InternetAddress(from));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(String.join(", ", to), false));
            message.setSubject(subject, "UTF-8");
            message.setSentDate(Date.from(date));
            for (Map.Entry<String, String> header : headers.entrySet()) {
                message.setHeader(header.getKey(), header.getValue());
            }

            if (attachment == null) {
                message.setText(text, "UTF-8");
            } else {
                MimeBodyPart textPart = new MimeBodyPart();
                textPart.setText(text, "UTF-8");

                InternetHeaders attachmentHeaders = new InternetHeaders();
                attachmentHeaders.setHeader("Content-Type", "message/rfc822");
                attachmentHeaders.setHeader("Content-Disposition", "inline");
                MimeBodyPart originalPart = new MimeBodyPart(attachmentHeaders, attachment);

                MimeMultipart multipart = new MimeMultipart("mixed");
                multipart.addBodyPart(textPart);
                multipart.addBodyPart(originalPart);
                message.setContent(multipart);
            }
            message.saveChanges();

            ByteArrayOutputStream stream = new ByteArrayOutputStream();
            message.writeTo(stream);
            return stream.toByteArray();
        } catch (MessagingException e) {
            throw new IOException("Unable to build notice: " + e.getMessage(), e);
        }
    }
}
