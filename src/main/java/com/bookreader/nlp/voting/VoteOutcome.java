package com.bookreader.nlp.voting;

import com.bookreader.nlp.core.CompleteDescription;

import java.util.List;

/**
 * Result of one ensemble vote.
 *
 * @param accepted       scored descriptions that passed the vote
 * @param rejectedGroups number of groups that failed both acceptance rules
 * @param activeCount    extractors counted as voters
 */
public record VoteOutcome(List<CompleteDescription> accepted, int rejectedGroups, int activeCount) {

    public VoteOutcome {
        accepted = List.copyOf(accepted);
    }
}
