package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.message.MessageRenderer;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Locale;

/**
 * Feeds the archiver queue.
 *
 * <p>The archived copy carries the list headers but no header or footer text.
 * Messages asking not to be archived are skipped.
 */
public class ToArchiveHandler implements Handler {
    private static final Logger log = LogManager.getLogger(ToArchiveHandler.class);

    @Override
    public String getName() {
        return "to-archive";
    }

    @Override
    public Outcome process(PipelineContext context) throws IOException {
        if (!context.getList().getPolicy().isArchive() || optedOut(context.getParsed())) {
            return Outcome.proceed();
        }

        MessageMetadata cooked = context.getMetadata().copy()
                .remove(MessageMetadata.MSG_HEADER)
                .remove(MessageMetadata.MSG_FOOTER);
        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.LISTNAME, context.getList().getName())
                .setString(MessageMetadata.WHICHQ, QueueKind.ARCHIVE.getDirectory())
                .setLong(MessageMetadata.RECEIVED_TIME, context.getServices().getClock().millis());

        String id = context.getServices().switchboard(QueueKind.ARCHIVE)
                .enqueue(MessageRenderer.render(context.getPayload(), cooked), metadata);
        QueueMetrics.incrementEnqueued(QueueKind.ARCHIVE.getDirectory());
        log.debug("Archive copy queued: list={}, id={}, archiveId={}", context.getList().getName(), context.getId(), id);
        return Outcome.proceed();
    }

    private static boolean optedOut(ParsedMessage message) {
        if (message.getHeader("X-No-Archive") != null) {
            return true;
        }
        String archive = message.getHeader("X-Archive");
        return archive != null && archive.toLowerCase(Locale.ROOT).startsWith("no");
    }
}
