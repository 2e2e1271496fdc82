package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.bounce.BounceProcessor;
import com.mimecast.listrunner.bounce.DetectedBounce;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;

/**
 * Terminus of the bounce pipeline.
 *
 * <p>Every recognized address is scored against the bounce ledger, the bounce itself is always discarded.
 */
public class BounceHandler implements Handler {
    private static final Logger log = LogManager.getLogger(BounceHandler.class);

    @Override
    public String getName() {
        return "bounce-processor";
    }

    @Override
    public Outcome process(PipelineContext context) throws IOException {
        MailingList list = context.getList();
        if (!list.getPolicy().isBounceProcessing()) {
            log.debug("Bounce processing off: list={}, id={}", list.getName(), context.getId());
            return Outcome.discard("bounce processing disabled");
        }

        ParsedMessage message = context.getParsed();
        List<DetectedBounce> bounces = context.getServices().getBounceScanner().scan(message, list);

        if (bounces.isEmpty()) {
            QueueMetrics.incrementUnrecognizedBounce();
            log.warn("Unrecognized bounce: list={}, id={}, from={}, subject={}",
                    list.getName(), context.getId(), message.getHeader("From"), message.getSubject());
            if (list.getPolicy().isBounceUnrecognizedGoesToOwner()) {
                context.getServices().getNotifier().forwardUnrecognizedBounce(list, context.getPayload());
            }
            return Outcome.discard("unrecognized bounce");
        }

        BounceProcessor processor = context.getServices().getBounceProcessor();
        for (DetectedBounce bounce : bounces) {
            BounceProcessor.Result result = processor.register(list, bounce.address(), bounce.severity(), context.getPayload());
            log.debug("Bounce registered: list={}, address={}, severity={}, result={}",
                    list.getName(), bounce.address(), bounce.severity(), result);
        }
        return Outcome.discard("bounce processed");
    }
}
