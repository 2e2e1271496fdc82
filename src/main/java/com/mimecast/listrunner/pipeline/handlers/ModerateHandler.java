package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.config.list.ModerationAction;
import com.mimecast.listrunner.config.list.NonMemberAction;
import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.pipeline.AbstractHoldCriterion;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Member moderation and non-member posting policy.
 *
 * <p>Hold actions add a reason and let the remaining criteria run.
 * Reject and discard actions end the run at once.
 */
public class ModerateHandler extends AbstractHoldCriterion {
    private static final Logger log = LogManager.getLogger(ModerateHandler.class);

    @Override
    public String getName() {
        return "moderate";
    }

    @Override
    protected Outcome evaluate(PipelineContext context, List<HoldReason> reasons) throws IOException {
        ListConfig policy = context.getList().getPolicy();
        String sender = context.getSender();

        Optional<Member> member = context.getList().getRoster().getMember(sender);
        if (member.isPresent()) {
            if (!member.get().isModerated()) {
                return null;
            }
            ModerationAction action = policy.getMemberModerationAction();
            log.debug("Moderated member post: list={}, sender={}, action={}", context.getList().getName(), sender, action);
            return switch (action) {
                case HOLD -> {
                    reasons.add(HoldReason.MODERATED_POST);
                    yield null;
                }
                case REJECT -> Outcome.reject(StringUtils.defaultIfBlank(policy.getMemberModerationNotice(),
                        HoldReason.MODERATED_POST.getRejection()));
                case DISCARD -> Outcome.discard("moderated member post");
            };
        }

        NonMemberAction action = nonMemberAction(policy, sender);
        log.debug("Non-member post: list={}, sender={}, action={}", context.getList().getName(), sender, action);
        return switch (action) {
            case ACCEPT -> null;
            case HOLD -> {
                reasons.add(HoldReason.NON_MEMBER_POST);
                yield null;
            }
            case REJECT -> Outcome.reject(StringUtils.defaultIfBlank(policy.getNonMemberRejectionNotice(),
                    HoldReason.NON_MEMBER_POST.getRejection()));
            case DISCARD -> Outcome.discard("non-member post");
        };
    }

    /**
     * Address lists first, in accept, hold, reject, discard order, then the generic action.
     */
    private static NonMemberAction nonMemberAction(ListConfig policy, String sender) {
        for (NonMemberAction action : NonMemberAction.values()) {
            if (AddressPatterns.matches(policy.getNonMemberPatterns(action), sender)) {
                return action;
            }
        }
        return policy.getNonMemberAction();
    }
}
