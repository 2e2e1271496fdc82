package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Feeds the digest queue when the list has enabled digest members.
 */
public class ToDigestHandler implements Handler {
    private static final Logger log = LogManager.getLogger(ToDigestHandler.class);

    @Override
    public String getName() {
        return "to-digest";
    }

    @Override
    public Outcome process(PipelineContext context) throws IOException {
        if (!context.getList().getPolicy().isDigestable()) {
            return Outcome.proceed();
        }
        boolean digesters = false;
        for (Member member : context.getList().getRoster().members()) {
            if (member.isDigest() && member.isEnabled()) {
                digesters = true;
                break;
            }
        }
        if (!digesters) {
            return Outcome.proceed();
        }

        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.LISTNAME, context.getList().getName())
                .setString(MessageMetadata.WHICHQ, QueueKind.DIGEST.getDirectory())
                .setLong(MessageMetadata.RECEIVED_TIME, context.getServices().getClock().millis());
        String id = context.getServices().switchboard(QueueKind.DIGEST).enqueue(context.getPayload(), metadata);
        QueueMetrics.incrementEnqueued(QueueKind.DIGEST.getDirectory());
        log.debug("Digest copy queued: list={}, id={}, digestId={}", context.getList().getName(), context.getId(), id);
        return Outcome.proceed();
    }
}
