package medikariyer.client.core.port.out;

import medikariyer.client.domain.model.session.AuthenticatedUser;

/**
 * Port for the application's view of the session.
 *
 * <p>Implemented by module-app (Spring application events). The pipeline only signals transitions;
 * navigation to the login screen is the application's concern.
 */
public interface SessionState {

  void markAuthenticated(AuthenticatedUser user);

  void markUnauthenticated();

  /** Backend reported the account as disabled (structured {@code ACCOUNT_DISABLED} code). */
  void markAccountDisabled();
}
