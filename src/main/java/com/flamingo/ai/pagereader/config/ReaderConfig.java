package com.flamingo.ai.pagereader.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for document processing, ingestion and the reading assistant. */
@Configuration
@ConfigurationProperties(prefix = "reader")
@Getter
@Setter
public class ReaderConfig {

  private Processing processing = new Processing();
  private Ingestion ingestion = new Ingestion();
  private Retrieval retrieval = new Retrieval();
  private Assistant assistant = new Assistant();
  private AccountStatus accountStatus = new AccountStatus();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Processing {
    /** Uploads strictly smaller than this are processed before the upload call returns. */
    private long asyncThresholdBytes = 2L * 1024 * 1024;

    private long maxUploadBytes = 50L * 1024 * 1024;

    /** Hard limit for extracting a single PDF page. */
    private Duration pageTimeout = Duration.ofSeconds(90);

    /** Pages between two partial snapshots (page 1 is always written). */
    private int partialWriteInterval = 12;

    /** Character budget for synthetic pages of unpaginated formats. */
    private int syntheticPageChars = 2600;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int pageWorkers = 15;
    private int embedWorkers = 8;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private double minSimilarity = 0.3;
    private int maxPromptChars = 2000;
  }

  @Getter
  @Setter
  public static class Assistant {
    /** Plans that include the reading assistant. */
    private Set<String> plans =
        new LinkedHashSet<>(Set.of("pro_monthly", "pro_yearly", "founder_lifetime"));

    /** Monthly token budget per plan; plans without an entry have no budget. */
    private Map<String, Long> monthlyTokenBudgets =
        new LinkedHashMap<>(
            Map.of(
                "pro_monthly", 2_000_000L,
                "pro_yearly", 2_000_000L,
                "founder_lifetime", 2_000_000L));
  }

  @Getter
  @Setter
  public static class AccountStatus {
    private Duration ttl = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Storage {
    private String basePath = "./data/uploads";

    /** Storage allowance for paid plans (decimal gigabytes). */
    private long paidLimitBytes = 50_000_000_000L;

    private long freeLimitBytes = 15L * 1024 * 1024;
  }
}
