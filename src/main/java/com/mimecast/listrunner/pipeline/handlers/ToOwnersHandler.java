package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Delivers mail sent to the owner address to the owners and moderators, undecorated.
 *
 * <p>Lists without owners fall back to the site owner rather than looping through the owner address.
 */
public class ToOwnersHandler implements Handler {

    @Override
    public String getName() {
        return "to-owners";
    }

    @Override
    public Outcome process(PipelineContext context) {
        ListConfig policy = context.getList().getPolicy();
        List<String> recipients = new ArrayList<>();
        if (policy.getOwners().isEmpty() && policy.getModerators().isEmpty()) {
            recipients.add(context.getServices().getSite().getSiteOwner());
        } else {
            recipients.addAll(context.getList().getModerationRecipients());
        }

        context.getMetadata()
                .setStringList(MessageMetadata.RECIPS, recipients)
                .setBoolean(MessageMetadata.NODECORATE, true);
        return Outcome.deliver();
    }
}
