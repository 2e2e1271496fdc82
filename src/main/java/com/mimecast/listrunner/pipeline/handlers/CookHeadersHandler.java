package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Records RFC 2369 list headers and the subject prefix.
 *
 * <p>Notices ({@code nodecorate}) only get {@code List-Id} and {@code X-BeenThere}.
 */
public class CookHeadersHandler implements Handler {

    @Override
    public String getName() {
        return "cook-headers";
    }

    @Override
    public Outcome process(PipelineContext context) {
        MailingList list = context.getList();
        ListConfig policy = list.getPolicy();
        MessageMetadata metadata = context.getMetadata();
        boolean notice = metadata.getBoolean(MessageMetadata.NODECORATE);

        List<String> headers = new ArrayList<>();
        headers.add("List-Id: " + list.getListId());
        headers.add("X-BeenThere: " + list.getPostingAddress());
        if (!notice) {
            headers.add("List-Post: <mailto:" + list.getPostingAddress() + ">");
            headers.add("List-Unsubscribe: <mailto:" + list.getLeaveAddress() + ">");
            headers.add("List-Subscribe: <mailto:" + list.getJoinAddress() + ">");
            headers.add("List-Help: <mailto:" + list.getRequestAddress() + "?subject=help>");
            headers.add("Precedence: list");
            if (policy.isReplyGoesToList()) {
                headers.add("Reply-To: " + list.getPostingAddress());
            }
            if (StringUtils.isNotBlank(policy.getSubjectPrefix())) {
                metadata.setString(MessageMetadata.SUBJECT_PREFIX, policy.getSubjectPrefix());
            }
        }

        List<String> existing = metadata.getStringList(MessageMetadata.ADD_HEADERS);
        for (String header : headers) {
            if (!existing.contains(header)) {
                existing.add(header);
            }
        }
        metadata.setStringList(MessageMetadata.ADD_HEADERS, existing);
        return Outcome.proceed();
    }
}
