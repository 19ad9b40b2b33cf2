package ca.gc.cra.guardian.application.safety;

/**
 * Source of a text under evaluation. Context analysis (overlong input, keyboard mashing, shouting) only
 * applies to what the child typed.
 *
 * @since 1.0.0
 */
public enum TextOrigin {
  /** Text typed by the child. */
  CHILD_INPUT("child_input"),
  /** Text produced by the tutoring model. */
  MODEL_OUTPUT("model_output");

  private final String key;

  TextOrigin(String key) {
    this.key = key;
  }

  /** @return lower-case label used in result details */
  public String key() {
    return key;
  }
}
