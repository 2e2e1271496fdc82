package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.pipeline.AbstractHoldCriterion;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;

import java.util.List;

/**
 * Holds all list traffic while the emergency flag is set.
 */
public class EmergencyHandler extends AbstractHoldCriterion {

    @Override
    public String getName() {
        return "emergency";
    }

    @Override
    protected Outcome evaluate(PipelineContext context, List<HoldReason> reasons) {
        if (context.getList().getPolicy().isEmergency()) {
            reasons.add(HoldReason.EMERGENCY);
        }
        return null;
    }
}
