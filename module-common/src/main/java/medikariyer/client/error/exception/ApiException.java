package medikariyer.client.error.exception;

import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.base.ClientBaseException;

/**
 * Any HTTP failure that is not an auth, permission or credentials problem.
 *
 * <p>Carries the original status code and the most specific message the backend provided.
 */
public class ApiException extends ClientBaseException {

  private final int statusCode;

  public ApiException(int statusCode, String message) {
    super(PipelineErrorCode.API_ERROR, message);
    this.statusCode = statusCode;
  }

  @Override
  public int getStatusCode() {
    return statusCode;
  }
}
