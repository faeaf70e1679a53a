package com.flamingo.ai.climatechat.service.rag.query;

/**
 * Advisory guess whether a query depends on earlier turns.
 *
 * @param followUp whether the query looks like a follow-up
 * @param confidence how strongly the cues point to a follow-up, in {@code [0, 1]}
 */
public record FollowUpSignal(boolean followUp, double confidence) {}
