package medikariyer.client.error.exception;

import medikariyer.client.error.PipelineErrorCode;

/** HTTP 403 carrying the backend's {@code ACCOUNT_DISABLED} code. */
public class AccountDisabledException extends ForbiddenException {

  public AccountDisabledException(String message) {
    super(PipelineErrorCode.ACCOUNT_DISABLED, message);
  }
}
