package com.mimecast.listrunner.message;

import com.mimecast.listrunner.queue.MessageMetadata;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageRendererTest {

    private static final String POST = "From: alice@example.com\r\n" +
            "To: test@lists.example.com\r\n" +
            "Subject: Hello\r\n" +
            "Approved: secret\r\n" +
            "Content-Type: text/plain; charset=utf-8\r\n" +
            "\r\n" +
            "Hi all\r\n";

    private static String render(String message, MessageMetadata metadata) {
        return new String(MessageRenderer.render(message.getBytes(StandardCharsets.UTF_8), metadata), StandardCharsets.UTF_8);
    }

    @Test
    void untouchedWithoutDecorations() {
        assertEquals(POST, render(POST, new MessageMetadata()));
    }

    @Test
    void headersAddedAndStripped() {
        MessageMetadata metadata = new MessageMetadata()
                .setStringList(MessageMetadata.STRIP_HEADERS, List.of("approved"))
                .setStringList(MessageMetadata.ADD_HEADERS, List.of("List-Id: Test <test.lists.example.com>", "Precedence: list"));

        String rendered = render(POST, metadata);

        assertFalse(rendered.contains("Approved:"));
        assertTrue(rendered.contains("List-Id: Test <test.lists.example.com>\r\nPrecedence: list\r\n\r\nHi all"));
    }

    @Test
    void addedHeaderReplacesExisting() {
        String message = "From: a@example.com\r\nPrecedence: bulk\r\nSubject: x\r\n\r\nbody\r\n";
        MessageMetadata metadata = new MessageMetadata().setStringList(MessageMetadata.ADD_HEADERS, List.of("Precedence: list"));

        String rendered = render(message, metadata);

        assertFalse(rendered.contains("Precedence: bulk"));
        assertTrue(rendered.contains("Precedence: list"));
    }

    @Test
    void subjectPrefixAppliedOnce() {
        MessageMetadata metadata = new MessageMetadata().setString(MessageMetadata.SUBJECT_PREFIX, "[Test] ");

        assertTrue(render(POST, metadata).contains("Subject: [Test] Hello\r\n"));
        String reply = POST.replace("Subject: Hello", "Subject: Re: [Test] Hello");
        assertTrue(render(reply, metadata).contains("Subject: Re: [Test] Hello\r\n"));
    }

    @Test
    void missingSubjectGetsPrefix() {
        String message = "From: a@example.com\r\n\r\nbody\r\n";
        MessageMetadata metadata = new MessageMetadata().setString(MessageMetadata.SUBJECT_PREFIX, "[Test] ");

        assertTrue(render(message, metadata).contains("Subject: [Test] (no subject)\r\n"));
    }

    @Test
    void footerAppendedToPlainText() {
        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.MSG_HEADER, "header line")
                .setString(MessageMetadata.MSG_FOOTER, "--\nfooter line");

        String rendered = render(POST, metadata);

        assertTrue(rendered.endsWith("\r\n\r\nheader line\r\nHi all\r\n--\r\nfooter line\r\n"));
    }

    @Test
    void footerAddsLineBreakWhenBodyLacksOne() {
        String message = "From: a@example.com\r\nSubject: x\r\n\r\nno newline";
        MessageMetadata metadata = new MessageMetadata().setString(MessageMetadata.MSG_FOOTER, "footer");

        assertTrue(render(message, metadata).endsWith("no newline\r\nfooter\r\n"));
    }

    @Test
    void nonTextBodyIsNotDecorated() {
        String message = "From: a@example.com\r\nSubject: x\r\nContent-Type: multipart/mixed; boundary=\"b\"\r\n\r\n" +
                "--b\r\nContent-Type: text/plain\r\n\r\nhi\r\n--b--\r\n";
        MessageMetadata metadata = new MessageMetadata().setString(MessageMetadata.MSG_FOOTER, "footer");

        assertFalse(render(message, metadata).contains("footer"));
    }

    @Test
    void encodedBodyIsNotDecorated() {
        String message = "From: a@example.com\r\nSubject: x\r\nContent-Transfer-Encoding: base64\r\n\r\naGk=\r\n";
        MessageMetadata metadata = new MessageMetadata().setString(MessageMetadata.MSG_FOOTER, "footer");

        assertFalse(render(message, metadata).contains("footer"));
    }

    @Test
    void noDecorateFlagWins() {
        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.MSG_FOOTER, "footer")
                .setBoolean(MessageMetadata.NODECORATE, true);

        assertFalse(render(POST, metadata).contains("footer"));
    }

    @Test
    void bareLineFeedsArePreserved() {
        String message = "From: a@example.com\nSubject: x\n\nbody\n";
        MessageMetadata metadata = new MessageMetadata()
                .setStringList(MessageMetadata.ADD_HEADERS, List.of("X-Test: 1"))
                .setString(MessageMetadata.MSG_FOOTER, "footer");

        assertEquals("From: a@example.com\nSubject: x\nX-Test: 1\n\nbody\nfooter\n", render(message, metadata));
    }

    @Test
    void headerBlockDetection() {
        assertTrue(MessageRenderer.hasHeaderBlock(POST.getBytes(StandardCharsets.UTF_8)));
        assertFalse(MessageRenderer.hasHeaderBlock("just some text\r\n".getBytes(StandardCharsets.UTF_8)));
        assertFalse(MessageRenderer.hasHeaderBlock(new byte[0]));
        assertEquals(POST.indexOf("Hi all"), MessageRenderer.headerLength(POST.getBytes(StandardCharsets.UTF_8)));
    }
}
