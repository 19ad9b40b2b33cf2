package ca.gc.cra.guardian.domain.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Mutable record threaded through every stage for one conversational turn.
 * <p><strong>Ownership:</strong> Created per turn and owned by the orchestrator for the duration of one
 * {@code process} call. Stages receive exclusive access, mutate and return it; none may keep a reference.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@link #inputText()} never changes after construction.</li>
 *   <li>Safety flags are append-only.</li>
 *   <li>Metadata values must not be {@code null}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; never share an instance across concurrent turns.</p>
 *
 * @since 1.0.0
 */
public final class PipelineContext {
  private final String sessionId;
  private final String profileId;
  private final String childName;
  private final int childAge;
  private final String inputText;
  private final Instant timestamp;
  private final List<String> safetyFlags = new ArrayList<>();
  private final Map<String, Object> metadata = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> stageDetails = new LinkedHashMap<>();
  private String responseText;

  private PipelineContext(Builder builder) {
    this.sessionId = builder.sessionId;
    this.profileId = builder.profileId;
    this.childName = builder.childName;
    this.childAge = builder.childAge;
    this.inputText = builder.inputText;
    this.timestamp = builder.timestamp;
    this.responseText = builder.responseText;
    this.metadata.putAll(builder.metadata);
  }

  /** @return session identifier */
  public String sessionId() {
    return sessionId;
  }

  /** @return child profile identifier */
  public String profileId() {
    return profileId;
  }

  /** @return child's first name; empty when unknown */
  public String childName() {
    return childName;
  }

  /** @return child's age in whole years, as supplied (not yet validated) */
  public int childAge() {
    return childAge;
  }

  /** @return raw child input; immutable for the life of the context */
  public String inputText() {
    return inputText;
  }

  /** @return time the turn was received */
  public Instant timestamp() {
    return timestamp;
  }

  /** @return current response text, progressively rewritten by stages; empty when none */
  public String responseText() {
    return responseText;
  }

  /**
   * Replaces the response text.
   *
   * @param responseText new response; {@code null} is stored as an empty string
   */
  public void setResponseText(String responseText) {
    this.responseText = responseText == null ? "" : responseText;
  }

  /**
   * Appends one safety flag.
   *
   * @param flag flag such as {@code violence:knife}; blank flags are ignored
   */
  public void addSafetyFlag(String flag) {
    if (flag != null && !flag.isBlank()) {
      safetyFlags.add(flag);
    }
  }

  /**
   * Appends several safety flags in order.
   *
   * @param flags flags to append
   */
  public void addSafetyFlags(Collection<String> flags) {
    if (flags != null) {
      flags.forEach(this::addSafetyFlag);
    }
  }

  /**
   * Returns a read-only view of the accumulated flags.
   *
   * @return unmodifiable flag list
   */
  public List<String> safetyFlags() {
    return Collections.unmodifiableList(safetyFlags);
  }

  /**
   * Adds or replaces a free-form metadata entry shared between stages.
   *
   * @param key metadata key
   * @param value non-null value
   */
  public void putMetadata(String key, Object value) {
    metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  /**
   * Reads one metadata entry.
   *
   * @param key metadata key
   * @return value when present
   */
  public Optional<Object> metadataValue(String key) {
    return Optional.ofNullable(metadata.get(key));
  }

  /**
   * Returns a read-only view of the shared metadata.
   *
   * @return unmodifiable metadata map
   */
  public Map<String, Object> metadata() {
    return Collections.unmodifiableMap(metadata);
  }

  /**
   * Records a diagnostic value that the orchestrator reports under {@code stage} in the turn's stage metadata.
   *
   * @param stage stage name
   * @param key diagnostic key
   * @param value non-null value
   */
  public void putStageDetail(String stage, String key, Object value) {
    stageDetails
        .computeIfAbsent(Objects.requireNonNull(stage, "stage"), ignored -> new LinkedHashMap<>())
        .put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  /**
   * Returns the diagnostics recorded for {@code stage}.
   *
   * @param stage stage name
   * @return copy of the stage's diagnostics; empty when none
   */
  public Map<String, Object> stageDetails(String stage) {
    Map<String, Object> details = stageDetails.get(stage);
    return details == null ? Map.of() : Map.copyOf(details);
  }

  @Override
  public String toString() {
    return "PipelineContext{session=" + sessionId
        + ", profile=" + profileId
        + ", age=" + childAge
        + ", flags=" + safetyFlags
        + '}';
  }

  /** Builder for {@link PipelineContext}. */
  public static final class Builder {
    private final String sessionId;
    private final String profileId;
    private final int childAge;
    private final String inputText;
    private String childName = "";
    private String responseText = "";
    private Instant timestamp = Instant.now();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private Builder(String sessionId, String profileId, int childAge, String inputText) {
      this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
      this.profileId = Objects.requireNonNull(profileId, "profileId");
      this.childAge = childAge;
      this.inputText = Objects.requireNonNull(inputText, "inputText");
    }

    /**
     * Creates a builder.
     *
     * @param sessionId session identifier
     * @param profileId child profile identifier
     * @param childAge age in whole years; validated later by the safety stage
     * @param inputText raw child input
     * @return builder instance
     */
    public static Builder create(String sessionId, String profileId, int childAge, String inputText) {
      return new Builder(sessionId, profileId, childAge, inputText);
    }

    /**
     * Sets the child's name used for greetings.
     *
     * @param childName name (may be {@code null})
     * @return this builder
     */
    public Builder childName(String childName) {
      this.childName = childName == null ? "" : childName.trim();
      return this;
    }

    /**
     * Sets the model response to be screened and adapted.
     *
     * @param responseText response (may be {@code null})
     * @return this builder
     */
    public Builder responseText(String responseText) {
      this.responseText = responseText == null ? "" : responseText;
      return this;
    }

    /**
     * Sets the turn timestamp.
     *
     * @param timestamp time the turn was received
     * @return this builder
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
      return this;
    }

    /**
     * Seeds one metadata entry.
     *
     * @param key metadata key
     * @param value non-null value
     * @return this builder
     */
    public Builder metadata(String key, Object value) {
      this.metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /**
     * Builds the context.
     *
     * @return new context
     */
    public PipelineContext build() {
      return new PipelineContext(this);
    }
  }
}
