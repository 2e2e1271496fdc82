package com.mimecast.listrunner.pipeline;

import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.queue.MessageMetadata;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for hold evaluation handlers.
 *
 * <p>Subclasses only need to implement {@link #evaluate(PipelineContext, List)} and add every reason that applies.
 * <p>The {@link #process(PipelineContext)} method skips evaluation for moderator approved messages and
 * appends the found reasons to {@code hold_reasons} without deciding anything.
 * The combined decision is made later by the hold decision handler so moderators see every reason.
 * <p>A criterion may still end the run immediately with a reject or discard outcome.
 */
public abstract class AbstractHoldCriterion implements Handler {

    @Override
    public final Outcome process(PipelineContext context) throws PipelineException, IOException {
        MessageMetadata metadata = context.getMetadata();
        if (metadata.isApproved()) {
            return Outcome.proceed();
        }

        List<HoldReason> reasons = new ArrayList<>();
        Outcome outcome = evaluate(context, reasons);
        for (HoldReason reason : reasons) {
            metadata.addToList(MessageMetadata.HOLD_REASONS, reason.name());
        }
        return outcome != null ? outcome : Outcome.proceed();
    }

    /**
     * Evaluates the criterion.
     *
     * @param context PipelineContext instance.
     * @param reasons Reasons found, appended by the implementation.
     * @return Terminal outcome, or null to continue.
     * @throws PipelineException Handler failure.
     * @throws IOException       On I/O error.
     */
    protected abstract Outcome evaluate(PipelineContext context, List<HoldReason> reasons) throws PipelineException, IOException;
}
