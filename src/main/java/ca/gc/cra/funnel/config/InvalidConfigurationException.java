package ca.gc.cra.funnel.config;

/**
 * Raised when configuration values describe a setup that cannot work, such as a sink with no destination.
 *
 * @since FUNNEL 0.1
 */
public class InvalidConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the unusable configuration
   */
  public InvalidConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates the exception with a cause.
   *
   * @param message description of the unusable configuration
   * @param cause underlying parse failure
   */
  public InvalidConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
