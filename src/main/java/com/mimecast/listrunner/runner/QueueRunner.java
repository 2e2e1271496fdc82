package com.mimecast.listrunner.runner;

import com.mimecast.listrunner.config.site.RunnerConfig;
import com.mimecast.listrunner.directory.ListDirectory;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.pipeline.Disposition;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.Pipeline;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.pipeline.PipelineExecutor;
import com.mimecast.listrunner.pipeline.PipelineRegistry;
import com.mimecast.listrunner.pipeline.UnrecoverableMessageException;
import com.mimecast.listrunner.queue.MessageClaim;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueException;
import com.mimecast.listrunner.queue.QueuedMessage;
import com.mimecast.listrunner.queue.Switchboard;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Polling worker driving one switchboard through its pipelines.
 *
 * <p>Each cycle works on a snapshot of the queue, entries enqueued meanwhile wait for the next cycle.
 * <p>Failures are isolated per message: counted in metadata, retried on later cycles and shunted at the limit.
 * <p>Several runners may share a switchboard, ownership is taken per message through {@link Switchboard#claim(String)}.
 */
public class QueueRunner implements Runnable {
    private static final Logger log = LogManager.getLogger(QueueRunner.class);

    protected final RunnerConfig config;
    protected final Switchboard switchboard;
    protected final ListDirectory directory;
    protected final Services services;

    private final PipelineExecutor executor = new PipelineExecutor();
    private final Disposition disposition;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean running = true;

    /**
     * Constructs a new QueueRunner instance.
     *
     * @param config      Runner config.
     * @param switchboard Switchboard to consume.
     * @param directory   List directory.
     * @param services    Shared collaborators.
     */
    public QueueRunner(RunnerConfig config, Switchboard switchboard, ListDirectory directory, Services services) {
        this.config = config;
        this.switchboard = switchboard;
        this.directory = directory;
        this.services = services;
        this.disposition = new Disposition(services);
    }

    public String getName() {
        return config.getName();
    }

    /**
     * Polls until stopped.
     * <p>Sleeps for the poll interval only after a cycle found nothing to do.
     */
    @Override
    public void run() {
        log.info("Runner started: name={}, queue={}, pollIntervalMillis={}, batchSize={}, maxFailures={}",
                getName(), switchboard.getKind().getDirectory(), config.getPollIntervalMillis(),
                config.getBatchSize(), config.getMaxFailures());

        while (running) {
            int processed;
            try {
                processed = runOnce();
            } catch (RuntimeException e) {
                log.error("Runner cycle error: name={}, error={}", getName(), e.getMessage(), e);
                processed = 0;
            } catch (Error e) {
                log.fatal("Runner died: name={}, error={}", getName(), e.getMessage(), e);
                running = false;
                throw e;
            }
            try {
                doPeriodic();
            } catch (Exception e) {
                log.error("Runner periodic task error: name={}, error={}", getName(), e.getMessage());
            }

            if (processed == 0 && running) {
                try {
                    if (stopped.await(config.getPollIntervalMillis(), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Runner stopped: name={}", getName());
    }

    /**
     * Requests stop.
     * <p>The in-flight cycle finishes its current message before the loop exits.
     */
    public void stop() {
        running = false;
        stopped.countDown();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs a single cycle.
     *
     * @return Number of messages claimed and processed.
     */
    public int runOnce() {
        List<String> ids;
        try {
            ids = switchboard.files();
        } catch (QueueException e) {
            log.error("Unable to list queue: name={}, queue={}, error={}", getName(), switchboard.getKind().getDirectory(), e.getMessage());
            return 0;
        }

        int batchSize = config.getBatchSize();
        int processed = 0;
        for (String id : ids) {
            if (!running || (batchSize > 0 && processed >= batchSize)) {
                break;
            }

            Optional<MessageClaim> claim;
            try {
                claim = switchboard.claim(id);
            } catch (QueueException e) {
                log.error("Unable to claim: name={}, id={}, error={}", getName(), id, e.getMessage());
                continue;
            }
            if (claim.isEmpty()) {
                log.trace("Claimed elsewhere: name={}, id={}", getName(), id);
                continue;
            }

            try (MessageClaim ignored = claim.get()) {
                process(id);
                processed++;
            } catch (Exception e) {
                log.error("Message processing error: name={}, id={}, error={}", getName(), id, e.getMessage());
            }
        }

        if (processed > 0) {
            log.debug("Cycle done: name={}, listed={}, processed={}", getName(), ids.size(), processed);
        }
        return processed;
    }

    /**
     * Hook run after every cycle.
     *
     * @throws Exception Task failure, logged by the loop.
     */
    protected void doPeriodic() throws Exception {
        // Nothing by default.
    }

    /**
     * Processes one claimed message.
     *
     * @param id Message id.
     * @throws QueueException Unable to update, finish or shunt the entry.
     */
    void process(String id) throws QueueException {
        Optional<QueuedMessage> dequeued;
        try {
            dequeued = switchboard.dequeue(id);
        } catch (QueueException e) {
            shunt(id, "unreadable entry: " + e.getMessage());
            return;
        }
        if (dequeued.isEmpty()) {
            return;
        }

        QueuedMessage message = dequeued.get();
        MessageMetadata metadata = message.getMetadata();
        String listName = metadata.getListName();
        String pipelineName = StringUtils.defaultIfBlank(metadata.getString(MessageMetadata.PIPELINE), config.getPipeline());

        Optional<MailingList> list;
        try {
            list = StringUtils.isBlank(listName) ? Optional.empty() : directory.resolve(listName);
        } catch (Exception e) {
            failed(message, pipelineName, e);
            return;
        }
        if (list.isEmpty()) {
            shunt(id, "unknown list");
            return;
        }

        Optional<Pipeline> pipeline = PipelineRegistry.get(pipelineName);
        if (pipeline.isEmpty()) {
            shunt(id, "unknown pipeline " + pipelineName);
            return;
        }

        PipelineContext context = new PipelineContext(list.get(), message, services);
        try {
            Outcome outcome = executor.execute(pipeline.get(), context, updated -> switchboard.update(id, updated));
            if (outcome.getKind() == Outcome.Kind.REQUEUE) {
                log.debug("Requeued: name={}, id={}, reason={}", getName(), id, outcome.getReason());
                return;
            }

            disposition.apply(context, outcome);
            switchboard.finish(id);
        } catch (UnrecoverableMessageException e) {
            QueueMetrics.incrementFailure(pipelineName);
            log.error("Unrecoverable message: name={}, list={}, id={}, error={}", getName(), listName, id, e.getMessage());
            shunt(id, e.getMessage());
        } catch (Exception e) {
            failed(message, pipelineName, e);
        }
    }

    /**
     * Counts a failed attempt on the last persisted metadata, shunting at the limit.
     */
    private void failed(QueuedMessage message, String pipelineName, Exception e) throws QueueException {
        String id = message.getId();
        MessageMetadata metadata = switchboard.dequeue(id)
                .map(QueuedMessage::getMetadata)
                .orElse(message.getMetadata());

        int failures = metadata.getFailures() + 1;
        String error = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
        metadata.setInt(MessageMetadata.FAILURES, failures)
                .setString(MessageMetadata.LAST_ERROR, error);
        QueueMetrics.incrementFailure(pipelineName);
        log.error("Message failed: name={}, list={}, id={}, failures={}, error={}",
                getName(), metadata.getListName(), id, failures, error);

        switchboard.update(id, metadata);
        if (failures >= config.getMaxFailures()) {
            shunt(id, "failed " + failures + " times: " + error);
        }
    }

    private void shunt(String id, String reason) throws QueueException {
        switchboard.shunt(id, reason);
        QueueMetrics.incrementShunted(switchboard.getKind().getDirectory());
        log.warn("Message shunted: name={}, queue={}, id={}, reason={}",
                getName(), switchboard.getKind().getDirectory(), id, reason);
    }
}
