package ca.gc.cra.guardian.config;

/**
 * Raised when the configuration is missing, malformed or incomplete. Fatal at startup: no request may be served
 * with a partially loaded safety table.
 *
 * @since 1.0.0
 */
public final class ConfigurationException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the problem
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message description of the problem
   * @param cause underlying parse or IO failure
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
