package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the recipient set and hands the message to delivery.
 *
 * <p>Explicit {@code recips} win. Otherwise every enabled regular member receives the post,
 * members disabled for any reason and digest members are left out.
 */
public class ToOutgoingHandler implements Handler {

    @Override
    public String getName() {
        return "to-outgoing";
    }

    @Override
    public Outcome process(PipelineContext context) throws IOException {
        MessageMetadata metadata = context.getMetadata();
        if (!metadata.getStringList(MessageMetadata.RECIPS).isEmpty()) {
            return Outcome.deliver();
        }

        List<String> recipients = new ArrayList<>();
        for (Member member : context.getList().getRoster().members()) {
            if (member.isEnabled() && !member.isDigest()) {
                recipients.add(member.getAddress());
            }
        }
        if (recipients.isEmpty()) {
            return Outcome.discard("no recipients");
        }
        metadata.setStringList(MessageMetadata.RECIPS, recipients);
        return Outcome.deliver();
    }
}
