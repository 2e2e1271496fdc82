package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the accumulated hold reasons into one decision.
 *
 * <p>A list whose pending holds reached {@code maxHeldMessages} rejects instead of holding.
 */
public class HoldDecisionHandler implements Handler {
    private static final Logger log = LogManager.getLogger(HoldDecisionHandler.class);

    public static final String QUEUE_FULL = "moderation queue is full";

    @Override
    public String getName() {
        return "hold-decision";
    }

    @Override
    public Outcome process(PipelineContext context) throws IOException {
        MessageMetadata metadata = context.getMetadata();
        if (metadata.isApproved()) {
            return Outcome.proceed();
        }

        List<HoldReason> reasons = new ArrayList<>();
        for (String code : metadata.getHoldReasons()) {
            HoldReason.fromName(code).ifPresent(reasons::add);
        }
        if (reasons.isEmpty()) {
            return Outcome.proceed();
        }

        int capacity = context.getList().getPolicy().getMaxHeldMessages();
        if (capacity > 0) {
            int pending = context.getServices().getHoldStore().countPending(context.getList().getName());
            if (pending >= capacity) {
                log.warn("Hold capacity reached: list={}, id={}, pending={}, capacity={}",
                        context.getList().getName(), context.getId(), pending, capacity);
                return Outcome.reject(QUEUE_FULL);
            }
        }
        return Outcome.hold(reasons);
    }
}
