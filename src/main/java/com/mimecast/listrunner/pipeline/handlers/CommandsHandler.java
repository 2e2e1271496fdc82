package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.config.list.SubscriptionPolicy;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.pipeline.Handler;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Email command processor for the request, join and leave addresses.
 *
 * <p>Commands come from the subject and the body lines, up to {@code maxCommandLines}.
 * <p>Results are mailed back and the message is discarded, unless a membership change needs moderator approval,
 * in which case the whole message is held and replayed once approved.
 */
public class CommandsHandler implements Handler {
    private static final Logger log = LogManager.getLogger(CommandsHandler.class);

    private static final Pattern REPLY_PREFIX = Pattern.compile("^((re|aw|sv|fw|fwd)\\s*:\\s*)+", Pattern.CASE_INSENSITIVE);

    static final String HELP = String.join("\n",
            "Available commands:",
            "",
            "    subscribe",
            "    join",
            "        Subscribe the sender address to the list.",
            "",
            "    unsubscribe",
            "    leave",
            "        Remove the sender address from the list.",
            "",
            "    help",
            "        Show this text.",
            "",
            "    end",
            "        Stop processing commands, useful before a signature."
    );

    @Override
    public String getName() {
        return "commands";
    }

    @Override
    public Outcome process(PipelineContext context) throws IOException {
        MailingList list = context.getList();
        ParsedMessage message = context.getParsed();
        String sender = context.getSender();

        if (StringUtils.isBlank(sender)) {
            return Outcome.discard("command without sender");
        }
        String precedence = StringUtils.defaultString(message.getHeader("Precedence")).toLowerCase(Locale.ROOT);
        if (precedence.equals("bulk") || precedence.equals("junk") || precedence.equals("list")) {
            log.info("Command mail ignored: list={}, id={}, precedence={}", list.getName(), context.getId(), precedence);
            return Outcome.discard("automated command mail");
        }

        List<String> results = new ArrayList<>();
        for (String line : commandLines(context)) {
            String[] words = StringUtils.split(line);
            String command = words[0].toLowerCase(Locale.ROOT);

            Outcome outcome = null;
            switch (command) {
                case "subscribe", "join" -> outcome = subscribe(context, sender, results);
                case "unsubscribe", "leave" -> outcome = unsubscribe(context, sender, results);
                case "help" -> {
                    results.add(">>>> " + line);
                    results.add(HELP);
                }
                case "end", "stop", "--" -> {
                    results.add(">>>> " + line);
                    results.add("End of commands.");
                }
                default -> {
                    results.add(">>>> " + line);
                    results.add("Command? " + command);
                }
            }
            if (outcome != null) {
                return outcome;
            }
            if (command.equals("end") || command.equals("stop") || command.equals("--")) {
                break;
            }
        }

        if (results.isEmpty()) {
            results.add("No commands found.");
            results.add(HELP);
        }
        context.getServices().getNotifier().commandResults(list, sender, results);
        return Outcome.discard("command processed");
    }

    /**
     * Implied command of the join and leave addresses, otherwise the subject and body lines.
     */
    private List<String> commandLines(PipelineContext context) throws IOException {
        MessageMetadata metadata = context.getMetadata();
        List<String> lines = new ArrayList<>();
        if (metadata.getBoolean(MessageMetadata.TO_JOIN)) {
            lines.add("join");
            return lines;
        }
        if (metadata.getBoolean(MessageMetadata.TO_LEAVE)) {
            lines.add("leave");
            return lines;
        }

        int max = Math.max(1, context.getList().getPolicy().getMaxCommandLines());
        String subject = REPLY_PREFIX.matcher(context.getParsed().getSubject().trim()).replaceFirst("");
        if (StringUtils.isNotBlank(subject) && isKnown(subject)) {
            lines.add(subject.trim());
        }
        for (String line : context.getParsed().getTextBody().split("\\r?\\n")) {
            if (lines.size() >= max) {
                break;
            }
            if (line.startsWith("-- ")) {
                break;
            }
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }
        return lines;
    }

    private static boolean isKnown(String line) {
        String command = StringUtils.split(line)[0].toLowerCase(Locale.ROOT);
        return List.of("subscribe", "join", "unsubscribe", "leave", "help").contains(command);
    }

    private Outcome subscribe(PipelineContext context, String sender, List<String> results) throws IOException {
        MailingList list = context.getList();
        ListConfig policy = list.getPolicy();
        results.add(">>>> subscribe " + sender);

        if (list.getRoster().isMember(sender)) {
            results.add("You are already subscribed to " + list.getPostingAddress());
            return null;
        }
        SubscriptionPolicy subscribe = policy.getSubscribePolicy();
        if (!context.getMetadata().isApproved()) {
            if (subscribe == SubscriptionPolicy.CLOSED) {
                results.add("Subscriptions to " + list.getPostingAddress() + " are closed.");
                return null;
            }
            if (subscribe == SubscriptionPolicy.MODERATE) {
                log.info("Subscription awaits approval: list={}, address={}", list.getName(), sender);
                return Outcome.hold(List.of(HoldReason.SUBSCRIPTION_APPROVAL));
            }
        }

        list.getRoster().addMember(new Member(sender).setModerated(policy.isDefaultMemberModeration()));
        results.add("Subscription succeeded, welcome to " + list.getPostingAddress());
        log.info("Subscribed: list={}, address={}", list.getName(), sender);
        return null;
    }

    private Outcome unsubscribe(PipelineContext context, String sender, List<String> results) throws IOException {
        MailingList list = context.getList();
        results.add(">>>> unsubscribe " + sender);

        if (!list.getRoster().isMember(sender)) {
            results.add("You are not a member of " + list.getPostingAddress());
            return null;
        }
        if (!context.getMetadata().isApproved() && list.getPolicy().getUnsubscribePolicy() != SubscriptionPolicy.OPEN) {
            log.info("Unsubscription awaits approval: list={}, address={}", list.getName(), sender);
            return Outcome.hold(List.of(HoldReason.UNSUBSCRIPTION_APPROVAL));
        }

        list.getRoster().removeMember(sender);
        list.getLedger().remove(sender);
        results.add("Unsubscription succeeded, you are no longer a member of " + list.getPostingAddress());
        log.info("Unsubscribed: list={}, address={}", list.getName(), sender);
        return null;
    }
}
