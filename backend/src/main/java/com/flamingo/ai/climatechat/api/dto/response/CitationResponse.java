package com.flamingo.ai.climatechat.api.dto.response;

import com.flamingo.ai.climatechat.domain.model.Citation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a source an answer was grounded on. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CitationResponse {

  private String title;
  private String url;
  private String snippet;

  public static CitationResponse from(Citation citation) {
    return CitationResponse.builder()
        .title(citation.title())
        .url(citation.url())
        .snippet(citation.snippet())
        .build();
  }
}
