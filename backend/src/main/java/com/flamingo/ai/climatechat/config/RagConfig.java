package com.flamingo.ai.climatechat.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the climate question-answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Pipeline pipeline = new Pipeline();
  private Cache cache = new Cache();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Reranking reranking = new Reranking();
  private Gate gate = new Gate();
  private Context context = new Context();
  private Generation generation = new Generation();
  private Faithfulness faithfulness = new Faithfulness();
  private WebSearch webSearch = new WebSearch();

  @Getter
  @Setter
  public static class Pipeline {
    /** Language all retrieval, gating and generation happen in. */
    private String pivotLanguage = "en";

    /** Upper bound for any single external call. */
    private long externalCallTimeoutSeconds = 300;

    /** Deadline applied to a request when the caller does not supply one. */
    private long defaultDeadlineSeconds = 300;

    private int minQueryLength = 3;
    private int maxQueryLength = 1000;

    /** Share one computation between concurrent requests for the same cache key. */
    private boolean singleFlight = false;
  }

  @Getter
  @Setter
  public static class Cache {
    /** Backend: "redis" (default) or "memory". */
    private String type = "redis";

    private long ttlSeconds = 3600;
    private String keyPrefix = "";
  }

  /** TEI endpoint serving the sparse (lexical) query encoder. */
  @Getter
  @Setter
  public static class Embedding {
    private String sparseBaseUrl = "http://localhost:8081";
    private int readTimeoutMs = 30000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 15;

    /** Weight of the dense vector; the sparse vector gets {@code 1 - alpha}. */
    private double alpha = 0.5;

    private int numCandidatesMultiplier = 2;
    private int minContentLength = 10;

    private Elasticsearch elasticsearch = new Elasticsearch();

    @Getter
    @Setter
    public static class Elasticsearch {
      private String indexName = "climate-documents";
      private String denseField = "dense_embedding";
      private String sparseField = "sparse_embedding";
    }
  }

  @Getter
  @Setter
  public static class Reranking {
    private int topK = 5;

    /** Largest candidate set sent to the cross-encoder in one call. */
    private int maxCandidates = 15;

    private Tei tei = new Tei();

    /** Configuration for TEI (Text Embeddings Inference) cross-encoder reranker. */
    @Getter
    @Setter
    public static class Tei {
      private String baseUrl = "http://localhost:8090";
      private String modelId = "BAAI/bge-reranker-base";
      private boolean truncate = true;
      private boolean rawScores = false;
      private int readTimeoutMs = 30000;
    }
  }

  @Getter
  @Setter
  public static class Gate {
    /** Phrases signalling intent to cause harm; matched on whole words. */
    private List<String> harmfulPhrases =
        new ArrayList<>(
            List.of(
                "start a fire",
                "set a fire",
                "set fire to",
                "burn down",
                "poison the water",
                "poison someone",
                "contaminate the water supply",
                "make toxic gas",
                "kill someone",
                "kill people",
                "harm someone",
                "harm people",
                "hurt someone",
                "make a bomb",
                "build a bomb",
                "sabotage"));

    /** Phrases typical of climate denial or conspiracy framing. */
    private List<String> misinformationPhrases =
        new ArrayList<>(
            List.of(
                "hoax",
                "fake",
                "fraud",
                "scam",
                "conspiracy",
                "not real",
                "isn't real",
                "propaganda"));

    private Semantic semantic = new Semantic();
    private Classifier classifier = new Classifier();

    /** Optional exemplar-similarity tier. */
    @Getter
    @Setter
    public static class Semantic {
      private boolean enabled = false;
      private double acceptThreshold = 0.5;
      private double ambiguousFloor = 0.3;

      private List<String> exemplars =
          new ArrayList<>(
              List.of(
                  "What is climate change?",
                  "How do greenhouse gases warm the planet?",
                  "What can I do to reduce my carbon footprint?",
                  "How does global warming affect extreme weather like floods and heatwaves?",
                  "Why are sea levels rising?",
                  "How do solar and wind energy help fight climate change?",
                  "How will climate change affect food and water security?",
                  "What is my city doing about climate change?"));
    }

    /** Binary topic classifier served by TEI. */
    @Getter
    @Setter
    public static class Classifier {
      private String baseUrl = "http://localhost:8091";
      private String modelId = "climatebert/distilroberta-base-climate-detector";
      private String positiveLabel = "yes";
      private double threshold = 0.5;
      private int readTimeoutMs = 10000;
    }
  }

  @Getter
  @Setter
  public static class Context {
    /** Number of most recent turns given to the rewriter and the generator. */
    private int historyWindow = 5;

    private int maxQueryLength = 500;
  }

  @Getter
  @Setter
  public static class Generation {
    private int maxTokens = 2000;
    private double temperature = 0.7;
  }

  @Getter
  @Setter
  public static class Faithfulness {
    /** Below this score the web-search fallback is attempted. */
    private double fallbackThreshold = 0.1;

    private int maxContextWords = 450;
    private int maxContexts = 5;
    private double neutralScore = 0.5;
  }

  @Getter
  @Setter
  public static class WebSearch {
    private boolean enabled = true;
    private String baseUrl = "https://api.tavily.com";
    private String apiKey = "";
    private int maxResults = 5;
    private int readTimeoutMs = 30000;
  }
}
