package com.flamingo.ai.climatechat.service.guard;

import com.flamingo.ai.climatechat.config.RagConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Sequence-classification model (ClimateBERT detector) served by the TEI {@code /predict} API. */
@Component
@Slf4j
public class TeiTopicClassifierClient implements TopicClassifierClient {

  private static final ParameterizedTypeReference<List<Prediction>> RESPONSE_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final int readTimeoutMs;

  public TeiTopicClassifierClient(RagConfig ragConfig) {
    RagConfig.Gate.Classifier classifier = ragConfig.getGate().getClassifier();
    this.readTimeoutMs = classifier.getReadTimeoutMs();
    this.webClient = WebClient.builder().baseUrl(classifier.getBaseUrl()).build();
    log.info(
        "TEI topic classifier client initialized: baseUrl={}, model={}",
        classifier.getBaseUrl(),
        classifier.getModelId());
  }

  @Override
  @CircuitBreaker(name = "classifier")
  @Retry(name = "classifier")
  public TopicClassification classify(String text) {
    List<Prediction> predictions =
        webClient
            .post()
            .uri("/predict")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new PredictRequest(text, true))
            .retrieve()
            .bodyToMono(RESPONSE_TYPE)
            .timeout(Duration.ofMillis(readTimeoutMs))
            .block();

    if (predictions == null || predictions.isEmpty()) {
      throw new IllegalStateException("Topic classifier returned no predictions");
    }

    Prediction top =
        predictions.stream().max(Comparator.comparingDouble(Prediction::score)).orElseThrow();
    return new TopicClassification(top.label(), top.score());
  }

  record PredictRequest(String inputs, boolean truncate) {}

  /** TEI predict response element. */
  public record Prediction(String label, double score) {}
}
