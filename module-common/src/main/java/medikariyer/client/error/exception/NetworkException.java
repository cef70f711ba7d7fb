package medikariyer.client.error.exception;

import medikariyer.client.error.ErrorCode;
import medikariyer.client.error.exception.base.ServerBaseException;

/**
 * Thrown when no HTTP response reached the client.
 *
 * <p>Never triggers a token refresh. UI layers use {@link #getKind()} to offer a "retry" action
 * instead of a logout.
 */
public class NetworkException extends ServerBaseException {

  public NetworkException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  /** No response was received, so there is no status code. */
  @Override
  public int getStatusCode() {
    return 0;
  }
}
