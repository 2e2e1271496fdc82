package com.mimecast.listrunner.pipeline;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueuedMessage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PipelineExecutorTest {

    private final PipelineExecutor executor = new PipelineExecutor();

    private static PipelineContext context(MessageMetadata metadata) {
        QueuedMessage message = new QueuedMessage("1+0000000000000000000000000000000000000000",
                "Subject: a\r\n\r\nbody".getBytes(StandardCharsets.UTF_8), metadata);
        return new PipelineContext(mock(MailingList.class), message, null);
    }

    /**
     * Handler returning a fixed outcome and counting calls.
     */
    private static class Step implements Handler {
        private final String name;
        private final Outcome outcome;
        private final AtomicInteger calls = new AtomicInteger();

        Step(String name, Outcome outcome) {
            this.name = name;
            this.outcome = outcome;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Outcome process(PipelineContext context) {
            calls.incrementAndGet();
            return outcome;
        }
    }

    @Test
    void stopsAtFirstTerminalOutcome() throws Exception {
        // Given: continue, hold, continue.
        Step first = new Step("first", Outcome.proceed());
        Step hold = new Step("hold", Outcome.hold(List.of(HoldReason.NON_MEMBER_POST)));
        Step last = new Step("last", Outcome.proceed());
        List<Integer> saved = new ArrayList<>();

        // When: executed.
        Outcome outcome = executor.execute(new Pipeline("post", List.of(first, hold, last)), context(new MessageMetadata()),
                metadata -> saved.add(metadata.getPipelinePosition()));

        // Then: the third handler never runs and only the first step was checkpointed.
        assertEquals(Outcome.Kind.HOLD, outcome.getKind());
        assertEquals(List.of(HoldReason.NON_MEMBER_POST), outcome.getHoldReasons());
        assertEquals(1, first.calls.get());
        assertEquals(1, hold.calls.get());
        assertEquals(0, last.calls.get());
        assertEquals(List.of(1), saved);
    }

    @Test
    void resumesFromPersistedPosition() throws Exception {
        // Given: a message that already passed two handlers.
        Step first = new Step("first", Outcome.proceed());
        Step second = new Step("second", Outcome.proceed());
        Step third = new Step("third", Outcome.deliver());
        MessageMetadata metadata = new MessageMetadata().setInt(MessageMetadata.PIPELINE_POSITION, 2);

        // When: executed again.
        Outcome outcome = executor.execute(new Pipeline("post", List.of(first, second, third)), context(metadata), m -> {
        });

        // Then: handlers before the position are skipped.
        assertEquals(Outcome.Kind.DELIVER, outcome.getKind());
        assertEquals(0, first.calls.get());
        assertEquals(0, second.calls.get());
        assertEquals(1, third.calls.get());
    }

    @Test
    void exhaustedPipelineDiscards() throws Exception {
        Outcome outcome = executor.execute(new Pipeline("empty", List.of(new Step("a", Outcome.proceed()))),
                context(new MessageMetadata()), m -> {
                });

        assertEquals(Outcome.Kind.DISCARD, outcome.getKind());
        assertEquals("pipeline completed", outcome.getReason());
    }

    @Test
    void handlerFailureIsWrapped() {
        Handler failing = new Handler() {
            @Override
            public String getName() {
                return "failing";
            }

            @Override
            public Outcome process(PipelineContext context) throws IOException {
                throw new IOException("disk gone");
            }
        };

        PipelineException e = assertThrows(PipelineException.class, () ->
                executor.execute(new Pipeline("post", List.of(failing)), context(new MessageMetadata()), m -> {
                }));
        assertTrue(e.getMessage().contains("failing"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void unrecoverableFailurePassesThrough() {
        Handler broken = new Handler() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public Outcome process(PipelineContext context) throws PipelineException {
                throw new UnrecoverableMessageException("cannot parse");
            }
        };

        UnrecoverableMessageException e = assertThrows(UnrecoverableMessageException.class, () ->
                executor.execute(new Pipeline("post", List.of(broken)), context(new MessageMetadata()), m -> {
                }));
        assertEquals("cannot parse", e.getMessage());
    }

    @Test
    void nullOutcomeIsAFailure() {
        assertThrows(PipelineException.class, () ->
                executor.execute(new Pipeline("post", List.of(new Step("null", null))), context(new MessageMetadata()), m -> {
                }));
    }

    @Test
    void checkpointFailurePropagates() {
        assertThrows(IOException.class, () ->
                executor.execute(new Pipeline("post", List.of(new Step("a", Outcome.proceed()), new Step("b", Outcome.deliver()))),
                        context(new MessageMetadata()), m -> {
                            throw new IOException("read only");
                        }));
    }
}
