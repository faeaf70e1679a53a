package com.flamingo.ai.climatechat.service.rag.verification;

/** One result returned by the web search provider. */
public record WebSearchResult(String title, String url, String content) {}
