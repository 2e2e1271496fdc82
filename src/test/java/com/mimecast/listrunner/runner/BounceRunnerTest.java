package com.mimecast.listrunner.runner;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.bounce.BounceRecord;
import com.mimecast.listrunner.config.site.RunnerConfig;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.queue.QueueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BounceRunnerTest {

    @TempDir
    Path root;

    private TestLists.MutableClock clock;
    private MailingList list;
    private BounceRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        TestLists.install(root.resolve("lists"));
        clock = new TestLists.MutableClock("2026-10-19");
        TestLists.Queues queues = new TestLists.Queues(clock);
        Services services = TestLists.services(root, queues, clock);
        list = TestLists.resolve(root);
        runner = new BounceRunner(new RunnerConfig(Map.of("name", "bounce", "queue", "bounces", "pipeline", "bounce")),
                queues.get(QueueKind.BOUNCES), TestLists.directory(root), services);
    }

    private void formerMember() throws Exception {
        list.getLedger().update("gone@example.org", current -> new BounceRecord("gone@example.org", 7)
                .setScore(1.0)
                .setLastBounceDate(LocalDate.parse("2026-10-18")));
    }

    @Test
    void maintenanceRunsOncePerInterval() throws Exception {
        // Given:
        formerMember();

        // When: the first cycle runs maintenance.
        runner.doPeriodic();

        // Then:
        assertTrue(list.getLedger().records().isEmpty());

        // When: a later cycle within the interval.
        formerMember();
        runner.doPeriodic();

        // Then: nothing ran.
        assertEquals(1, list.getLedger().records().size());

        // When: the interval passed.
        clock.plusDays(1);
        runner.doPeriodic();

        // Then:
        assertTrue(list.getLedger().records().isEmpty());
    }

    @Test
    void emptyQueueCycle() {
        assertEquals(0, runner.runOnce());
        assertEquals("bounce", runner.getName());
    }
}
