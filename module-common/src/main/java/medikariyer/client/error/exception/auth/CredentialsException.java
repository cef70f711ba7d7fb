package medikariyer.client.error.exception.auth;

import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.base.ClientBaseException;

/**
 * 401 returned by the login or registration call.
 *
 * <p>Wrong credentials, not an expired session: no refresh is attempted and nothing is cleared.
 */
public class CredentialsException extends ClientBaseException {

  public CredentialsException(String message) {
    super(PipelineErrorCode.INVALID_CREDENTIALS, message);
  }
}
