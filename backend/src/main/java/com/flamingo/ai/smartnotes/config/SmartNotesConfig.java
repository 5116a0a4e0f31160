package com.flamingo.ai.smartnotes.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the topic graph engine. */
@Configuration
@ConfigurationProperties(prefix = "smartnotes")
@Getter
@Setter
public class SmartNotesConfig {

  private Granularity granularity = new Granularity();
  private Segmentation segmentation = new Segmentation();
  private Synthesis synthesis = new Synthesis();
  private Revision revision = new Revision();
  private Document document = new Document();
  private Concurrency concurrency = new Concurrency();
  private Collaborator collaborator = new Collaborator();
  private Store store = new Store();
  private Media media = new Media();

  @Getter
  @Setter
  public static class Granularity {
    /** Topic-count ceiling at granularity 0. */
    private int minTopics = 2;

    /** Topic-count ceiling at granularity 100. */
    private int maxTopics = 24;
  }

  @Getter
  @Setter
  public static class Segmentation {
    private int minContentChars = 80;
    private int maxInputChars = 60_000;
    private int maxRetries = 2;

    /** Accept a final answer that leaves blocks unassigned instead of failing. */
    private boolean allowUnassigned = true;
  }

  @Getter
  @Setter
  public static class Synthesis {
    /** Topics with less source text than this are enriched. */
    private int thinTopicChars = 400;

    private double similarityThreshold = 0.1;
    private int maxOutDegree = 5;
    private int minAnchorLength = 4;
    private boolean adoptRefinedNames = true;
    private int maxSourceChars = 20_000;
  }

  @Getter
  @Setter
  public static class Revision {
    /** Number of previous turns for the same topic sent with an instruction. */
    private int historyWindow = 6;

    private int maxInstructionChars = 2_000;
  }

  @Getter
  @Setter
  public static class Document {
    private int maxContentChars = 500_000;
  }

  @Getter
  @Setter
  public static class Concurrency {
    /** How long a mutation waits for the document lock; 0 fails immediately. */
    private long lockWaitMs = 0;
  }

  @Getter
  @Setter
  public static class Collaborator {
    private long timeoutSeconds = 60;
    private int maxAttempts = 3;
    private long backoffInitialMs = 500;
  }

  @Getter
  @Setter
  public static class Store {
    /** {@code jpa} or {@code memory}. */
    private String type = "jpa";
  }

  @Getter
  @Setter
  public static class Media {
    /** Directory media locations are resolved against; files outside it are never read. */
    private String baseDir = "media";
  }
}
