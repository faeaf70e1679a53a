package com.flamingo.ai.climatechat.service.guard;

/** Top label returned by the topic classifier and its confidence. */
public record TopicClassification(String label, double score) {}
