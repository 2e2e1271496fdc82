package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * Records the list message header and footer.
 *
 * <p>Supports {@code %(list_name)s}, {@code %(real_name)s}, {@code %(host_name)s},
 * {@code %(description)s} and {@code %(posting_address)s}.
 */
public class DecorateHandler implements Handler {

    @Override
    public String getName() {
        return "decorate";
    }

    @Override
    public Outcome process(PipelineContext context) {
        MessageMetadata metadata = context.getMetadata();
        if (metadata.getBoolean(MessageMetadata.NODECORATE)) {
            return Outcome.proceed();
        }

        ListConfig policy = context.getList().getPolicy();
        Map<String, String> values = values(context.getList());
        if (StringUtils.isNotEmpty(policy.getMsgHeader())) {
            metadata.setString(MessageMetadata.MSG_HEADER, substitute(policy.getMsgHeader(), values));
        }
        if (StringUtils.isNotEmpty(policy.getMsgFooter())) {
            metadata.setString(MessageMetadata.MSG_FOOTER, substitute(policy.getMsgFooter(), values));
        }
        return Outcome.proceed();
    }

    static String substitute(String template, Map<String, String> values) {
        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace("%(" + entry.getKey() + ")s", entry.getValue());
        }
        return result;
    }

    private static Map<String, String> values(MailingList list) {
        return Map.of(
                "list_name", list.getName(),
                "real_name", list.getRealName(),
                "host_name", list.getHostname(),
                "description", list.getPolicy().getDescription(),
                "posting_address", list.getPostingAddress()
        );
    }
}
