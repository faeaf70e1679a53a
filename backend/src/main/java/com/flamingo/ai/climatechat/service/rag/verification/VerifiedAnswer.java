package com.flamingo.ai.climatechat.service.rag.verification;

import com.flamingo.ai.climatechat.service.rag.generation.GeneratedAnswer;

/** A generated answer with its faithfulness score. */
public record VerifiedAnswer(GeneratedAnswer answer, double faithfulness) {}
