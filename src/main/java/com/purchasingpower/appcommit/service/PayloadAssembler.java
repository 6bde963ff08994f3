package com.purchasingpower.appcommit.service;

import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.model.commit.PlannedAction;

import java.util.List;

/**
 * Turns planned actions into the request body of one commit strategy.
 *
 * @param <P> payload type submitted to GitHub
 */
public interface PayloadAssembler<P> {

    P assemble(CommitRequest target, List<PlannedAction> actions);
}
