package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.InMemorySwitchboard;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryHandlersTest {

    @TempDir
    Path root;

    private TestLists.Queues queues;
    private MailingList list;
    private Services services;

    @BeforeEach
    void setUp() throws Exception {
        TestLists.install(root.resolve("lists"));
        Clock clock = TestLists.clock("2026-10-19");
        queues = new TestLists.Queues(clock);
        list = TestLists.resolve(root);
        services = TestLists.services(root, queues, clock);
    }

    private PipelineContext context(String headers) {
        String text = "From: alice@example.com\r\nTo: test@lists.example.com\r\nSubject: Hello\r\n" + headers + "\r\nHi\r\n";
        return TestLists.context(list, services, text.getBytes(StandardCharsets.UTF_8), new MessageMetadata());
    }

    @Test
    void outgoingSkipsDisabledAndDigestMembers() throws Exception {
        PipelineContext context = context("");

        Outcome outcome = new ToOutgoingHandler().process(context);

        // alice and bob only: carol takes digests and dave is disabled.
        assertEquals(Outcome.Kind.DELIVER, outcome.getKind());
        assertEquals(List.of("alice@example.com", "bob@example.com"),
                context.getMetadata().getStringList(MessageMetadata.RECIPS));
    }

    @Test
    void outgoingKeepsPresetRecipients() throws Exception {
        PipelineContext context = context("");
        context.getMetadata().setStringList(MessageMetadata.RECIPS, List.of("someone@example.org"));

        new ToOutgoingHandler().process(context);

        assertEquals(List.of("someone@example.org"), context.getMetadata().getStringList(MessageMetadata.RECIPS));
    }

    @Test
    void outgoingWithoutRecipientsDiscards() throws Exception {
        list.getRoster().removeMember("alice@example.com");
        list.getRoster().removeMember("bob@example.com");

        assertEquals(Outcome.Kind.DISCARD, new ToOutgoingHandler().process(context("")).getKind());
    }

    @Test
    void ownersReceiveUndecorated() throws Exception {
        PipelineContext context = context("");

        Outcome outcome = new ToOwnersHandler().process(context);

        assertEquals(Outcome.Kind.DELIVER, outcome.getKind());
        assertEquals(List.of("owner@example.com", "moderator@example.com"),
                context.getMetadata().getStringList(MessageMetadata.RECIPS));
        assertTrue(context.getMetadata().getBoolean(MessageMetadata.NODECORATE));
    }

    @Test
    void ownerlessListFallsBackToSiteOwner() throws Exception {
        TestLists.policy(root.resolve("lists"), "{}");
        list = TestLists.resolve(root);
        PipelineContext context = context("");

        new ToOwnersHandler().process(context);

        assertEquals(List.of("postmaster@example.com"), context.getMetadata().getStringList(MessageMetadata.RECIPS));
    }

    @Test
    void archiveCopyIsCooked() throws Exception {
        PipelineContext context = context("");
        context.getMetadata().setString(MessageMetadata.SUBJECT_PREFIX, "[Test] ")
                .setString(MessageMetadata.MSG_FOOTER, "footer");

        assertEquals(Outcome.Kind.CONTINUE, new ToArchiveHandler().process(context).getKind());

        InMemorySwitchboard archive = queues.get(QueueKind.ARCHIVE);
        assertEquals(1, archive.size());
        String copy = new String(archive.dequeue(archive.files().get(0)).orElseThrow().getPayload(), StandardCharsets.UTF_8);
        assertTrue(copy.contains("Subject: [Test] Hello"));
        assertFalse(copy.contains("footer"));
    }

    @Test
    void archiveOptOut() throws Exception {
        new ToArchiveHandler().process(context("X-No-Archive: yes\r\n"));
        new ToArchiveHandler().process(context("X-Archive: No\r\n"));

        assertEquals(0, queues.get(QueueKind.ARCHIVE).size());
    }

    @Test
    void digestCopyWhenDigestMembersExist() throws Exception {
        new ToDigestHandler().process(context(""));

        assertEquals(1, queues.get(QueueKind.DIGEST).size());
    }

    @Test
    void noDigestCopyWithoutDigestMembers() throws Exception {
        list.getRoster().removeMember("carol@example.com");

        new ToDigestHandler().process(context(""));

        assertEquals(0, queues.get(QueueKind.DIGEST).size());
    }
}
