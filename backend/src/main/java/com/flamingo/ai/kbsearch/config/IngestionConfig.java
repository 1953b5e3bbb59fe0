package com.flamingo.ai.kbsearch.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  private Corpus corpus = new Corpus();
  private Chunking chunking = new Chunking();
  private Extraction extraction = new Extraction();
  private Embedding embedding = new Embedding();
  private Orchestrator orchestrator = new Orchestrator();
  private Queue queue = new Queue();
  private Worker worker = new Worker();

  @Getter
  @Setter
  public static class Corpus {
    /** Root folder of the knowledge base; metadata is parsed relative to it. */
    private String root = "/mnt/kb";

    /** Extensions skipped at scan time (archives, binaries, media). */
    private List<String> skipExtensions =
        List.of(
            "zip", "rar", "7z", "tar", "gz", "exe", "dll", "so", "mpp", "vsd", "mdb", "accdb",
            "mp3", "mp4", "avi", "mov", "wav");
  }

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1500;
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Extraction {
    private String rendererCommand = "soffice";
    private Duration rendererTimeout = Duration.ofSeconds(60);
    private String ocrCommand = "tesseract";
    private String ocrLanguages = "ita+eng";
    private Duration ocrTimeout = Duration.ofSeconds(120);
    private int ocrDpi = 300;
    private int ocrMaxPages = 10;

    /** Below this many non-whitespace characters the text layer is considered empty. */
    private int minTextChars = 50;

    /** Per-page share of the OCR threshold for paginated formats. */
    private int minCharsPerPage = 20;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Device selection: auto, cpu or accelerator. */
    private String device = "auto";

    private int acceleratedBatchSize = 48;
    private int cpuBatchSize = 16;

    /** Free accelerator memory required before the accelerated path is chosen. */
    private long minFreeMemoryMb = 2048;

    private String defaultModel = "sentence-transformer";
    private Map<String, Model> models = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class Model {
    /** One of in-process, ollama, openai. */
    private String provider = "in-process";

    private String modelName;
    private int dimensions;

    /** Elasticsearch index holding this model's chunk vectors. */
    private String collection;

    private String acceleratedBaseUrl;
    private String cpuBaseUrl;
    private String apiKey;
    private Duration timeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Orchestrator {
    private int quarantineThreshold = 3;
    private int failureLogSize = 100;
    private int indexWriteRetries = 3;
    private Duration indexWriteBackoff = Duration.ofMillis(200);
    private Duration pausePollInterval = Duration.ofSeconds(2);
    private int lexicalContentChars = 5000;
  }

  @Getter
  @Setter
  public static class Queue {
    /** redis or memory. */
    private String type = "redis";

    private String keyPrefix = "kbsearch:jobs";
    private Duration visibilityTimeout = Duration.ofMinutes(30);
    private Duration pollTimeout = Duration.ofSeconds(5);
    private int maxDeliveries = 3;
    private Duration deadLetterTtl = Duration.ofDays(7);
  }

  @Getter
  @Setter
  public static class Worker {
    private boolean enabled = true;
    private int concurrency = 1;
  }
}
