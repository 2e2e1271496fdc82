package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ApproveHandlerTest {

    @TempDir
    Path root;

    private MailingList list;

    @BeforeEach
    void setUp() throws Exception {
        TestLists.install(root.resolve("lists"));
        list = TestLists.resolve(root);
    }

    private PipelineContext context(String header) {
        String text = "From: stranger@elsewhere.org\r\nTo: test@lists.example.com\r\n" + header +
                "Subject: Hi\r\n\r\nHello\r\n";
        return TestLists.context(list, null, text.getBytes(StandardCharsets.UTF_8), new MessageMetadata());
    }

    @Test
    void correctPasswordApproves() throws Exception {
        PipelineContext context = context("Approved: secret\r\n");

        new ApproveHandler().process(context);

        assertTrue(context.getMetadata().isApproved());
        assertTrue(context.getMetadata().getStringList(MessageMetadata.STRIP_HEADERS).contains("Approved"));
    }

    @Test
    void wrongPasswordIsStrippedButIgnored() throws Exception {
        PipelineContext context = context("X-Approve: guess\r\n");

        new ApproveHandler().process(context);

        assertFalse(context.getMetadata().isApproved());
        assertTrue(context.getMetadata().getStringList(MessageMetadata.STRIP_HEADERS).contains("X-Approve"));
    }

    @Test
    void noPasswordConfigured() throws Exception {
        TestLists.policy(root.resolve("lists"), "{}");
        list = TestLists.resolve(root);
        PipelineContext context = context("Approved: \r\n");

        new ApproveHandler().process(context);

        assertFalse(context.getMetadata().isApproved());
    }
}
