package com.voiceledger.categorizer.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "categorizer")
public class ApplicationProperties {

  private Training training = new Training();
  private Classification classification = new Classification();
  private Correction correction = new Correction();
  private Embedding embedding = new Embedding();
  private Index index = new Index();
  private Storage storage = new Storage();
  private Cache cache = new Cache();

  @Data
  public static class Training {
    private int minSamplesPerCategory = 3;
    private int minTrainingSamples = 10;
    private int folds = 5;
    private long shuffleSeed = 42L;
    private Duration timeout = Duration.ofMinutes(30);
    private String schedule = "-";
  }

  @Data
  public static class Classification {
    private int neighbors = 5;
    private double acceptThreshold = 0.85;
    private double rejectThreshold = 0.3;
    private double confirmationThreshold = 0.8;
    private int inferenceRetries = 1;
    private String fallbackCategory = "Other";
  }

  @Data
  public static class Correction {
    private double vendorMatchCutoff = 0.75;
    private List<String> knownVendors = new ArrayList<>();
    private String termsResource = "/reference/category-terms.json";
  }

  @Data
  public static class Embedding {
    private String provider = "bedrock";
    private String modelId;
    private String region = "us-east-1";
    private int dimension = 1024;
  }

  @Data
  public static class Index {
    private String type = "memory";
    private String bucket;
    private String prefix = "vectors/";
    private String region = "us-east-1";
    private String mainPartition = "expenses";
    private String ephemeralPrefix = "cv";
  }

  @Data
  public static class Storage {
    private String expensesFile = "data/expenses.json";
    private String metricsFile = "data/model-metrics.jsonl";
    private int metricsHistoryLimit = 50;
  }

  @Data
  public static class Cache {
    private boolean enabled;
    private long maxSize;
    private long expireAfterWriteMinutes;
  }
}
