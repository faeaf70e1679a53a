package com.flamingo.ai.climatechat.service.rag.generation;

import com.flamingo.ai.climatechat.domain.model.Citation;
import com.flamingo.ai.climatechat.domain.model.Document;
import java.util.List;

/**
 * An answer together with the documents it was grounded on.
 *
 * @param answer the formatted answer text
 * @param citations one citation per grounding document, in prompt order
 * @param documents the grounding documents, used for faithfulness scoring
 */
public record GeneratedAnswer(String answer, List<Citation> citations, List<Document> documents) {

  public GeneratedAnswer {
    citations = List.copyOf(citations);
    documents = List.copyOf(documents);
  }
}
