package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Pre-approval by moderator password.
 *
 * <p>An {@code Approved} or {@code Approve} header carrying the list moderator password marks the message approved.
 * The header is always stripped at delivery so the password never reaches the members.
 */
public class ApproveHandler implements Handler {
    private static final Logger log = LogManager.getLogger(ApproveHandler.class);

    static final String[] HEADERS = {"Approved", "Approve", "X-Approved", "X-Approve"};

    @Override
    public String getName() {
        return "approve";
    }

    @Override
    public Outcome process(PipelineContext context) throws IOException {
        MessageMetadata metadata = context.getMetadata();
        ParsedMessage message = context.getParsed();
        String password = context.getList().getPolicy().getModeratorPassword();

        for (String header : HEADERS) {
            String value = message.getHeader(header);
            if (value == null) {
                continue;
            }
            metadata.addToList(MessageMetadata.STRIP_HEADERS, header);
            if (StringUtils.isNotEmpty(password) && password.equals(value)) {
                metadata.setBoolean(MessageMetadata.APPROVED, true);
                log.info("Message pre-approved: list={}, id={}", context.getList().getName(), context.getId());
            }
        }
        return Outcome.proceed();
    }
}
