package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;

import java.util.List;

/**
 * Marks headers that must not reach the members.
 */
public class CleanseHandler implements Handler {

    static final List<String> HEADERS = List.of(
            "Approved", "Approve", "X-Approved", "X-Approve", "Urgent",
            "Return-Receipt-To", "Disposition-Notification-To", "X-Confirm-Reading-To", "X-PMRQC"
    );

    @Override
    public String getName() {
        return "cleanse";
    }

    @Override
    public Outcome process(PipelineContext context) {
        MessageMetadata metadata = context.getMetadata();
        for (String header : HEADERS) {
            metadata.addToList(MessageMetadata.STRIP_HEADERS, header);
        }
        return Outcome.proceed();
    }
}
