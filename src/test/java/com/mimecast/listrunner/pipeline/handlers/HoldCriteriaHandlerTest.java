package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HoldCriteriaHandlerTest {

    @TempDir
    Path root;

    private final HoldCriteriaHandler handler = new HoldCriteriaHandler();
    private MailingList list;
    private Services services;

    @BeforeEach
    void setUp() throws Exception {
        TestLists.install(root.resolve("lists"));
        Clock clock = TestLists.clock("2026-10-19");
        list = TestLists.resolve(root);
        services = TestLists.services(root, new TestLists.Queues(clock), clock);
    }

    private List<String> reasons(byte[] payload) throws Exception {
        PipelineContext context = TestLists.context(list, services, payload, new MessageMetadata());
        assertEquals(Outcome.Kind.CONTINUE, handler.process(context).getKind());
        return context.getMetadata().getHoldReasons();
    }

    @Test
    void plainPostHasNoReasons() throws Exception {
        assertTrue(reasons(TestLists.message("alice@example.com", "test@lists.example.com", "Hello", "Hi all\r\n")).isEmpty());
    }

    @Test
    void oversizeBody() throws Exception {
        String body = "x".repeat(41 * 1024) + "\r\n";

        assertEquals(List.of("MESSAGE_TOO_BIG"),
                reasons(TestLists.message("alice@example.com", "test@lists.example.com", "Big", body)));
    }

    @Test
    void tooManyRecipients() throws Exception {
        StringBuilder to = new StringBuilder("test@lists.example.com");
        for (int i = 0; i < 9; i++) {
            to.append(", user").append(i).append("@example.org");
        }

        assertEquals(List.of("TOO_MANY_RECIPIENTS"),
                reasons(TestLists.message("alice@example.com", to.toString(), "Many", "Hi\r\n")));
    }

    @Test
    void implicitDestination() throws Exception {
        assertEquals(List.of("IMPLICIT_DESTINATION"),
                reasons(TestLists.message("alice@example.com", "someone@example.org", "Bcc", "Hi\r\n")));
    }

    @Test
    void acceptableAliasIsExplicit() throws Exception {
        TestLists.policy(root.resolve("lists"), "{acceptableAliases: [\"^test-alias$\"]}");
        list = TestLists.resolve(root);

        assertTrue(reasons(TestLists.message("alice@example.com", "test-alias@example.org", "Alias", "Hi\r\n")).isEmpty());
    }

    @Test
    void administriviaInBody() throws Exception {
        assertEquals(List.of("ADMINISTRIVIA"),
                reasons(TestLists.message("alice@example.com", "test@lists.example.com", "Please", "unsubscribe\r\n")));
    }

    @Test
    void administriviaInSubject() throws Exception {
        assertEquals(List.of("ADMINISTRIVIA"),
                reasons(TestLists.message("alice@example.com", "test@lists.example.com", "subscribe", "I would like to join.\r\n")));
    }

    @Test
    void longBodyIsNotAdministrivia() throws Exception {
        String body = "subscribe\r\nline two\r\nline three\r\nline four\r\nline five\r\nline six\r\n";

        assertTrue(reasons(TestLists.message("alice@example.com", "test@lists.example.com", "Chat", body)).isEmpty());
    }

    @Test
    void suspiciousHeader() throws Exception {
        TestLists.policy(root.resolve("lists"), "{bounceMatchingHeaders: [\"# comment\", \"X-Spam-Flag: ^yes\"]}");
        list = TestLists.resolve(root);
        String text = "From: alice@example.com\r\nTo: test@lists.example.com\r\nSubject: Spam\r\nX-Spam-Flag: YES\r\n\r\nBuy\r\n";

        assertEquals(List.of("SUSPICIOUS_HEADERS"), reasons(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void htmlViewerRequired() throws Exception {
        String body = "This is a multipart message. " + HoldCriteriaHandler.HTML_VIEWER_TEXT + ".\r\n";

        assertEquals(List.of("HTML_VIEWER_REQUIRED"),
                reasons(TestLists.message("alice@example.com", "test@lists.example.com", "Html", body)));
    }

    @Test
    void reasonsAccumulate() throws Exception {
        String body = "x".repeat(41 * 1024) + "\r\n";

        assertEquals(List.of("IMPLICIT_DESTINATION", "MESSAGE_TOO_BIG"),
                reasons(TestLists.message("alice@example.com", "someone@example.org", "Big", body)));
    }

    @Test
    void administriviaDetection() throws Exception {
        assertTrue(HoldCriteriaHandler.isAdministrivia(ParsedMessage.parse(
                TestLists.message("a@example.com", "test@lists.example.com", "x", "set digest on secret\r\n"))));
        assertFalse(HoldCriteriaHandler.isAdministrivia(ParsedMessage.parse(
                TestLists.message("a@example.com", "test@lists.example.com", "x", "set digest maybe secret\r\n"))));
        assertFalse(HoldCriteriaHandler.isAdministrivia(ParsedMessage.parse(
                TestLists.message("a@example.com", "test@lists.example.com", "x", "help me with my code please\r\n"))));
    }
}
