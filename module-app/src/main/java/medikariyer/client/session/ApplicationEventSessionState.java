package medikariyer.client.session;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.port.out.SessionState;
import medikariyer.client.domain.model.session.AuthenticatedUser;
import org.springframework.context.ApplicationEventPublisher;

/**
 * {@link SessionState} 구현체 (Spring ApplicationEvent)
 *
 * <p>현재 principal을 보관하고, 상태가 바뀔 때마다 {@link SessionChangedEvent}를 발행합니다. 이미 비로그인 상태에서
 * 다시 비로그인으로 전이하면 이벤트를 발행하지 않습니다. 같은 갱신 실패로 여러 요청이 동시에 끝나도 로그인 화면 이동은 한 번이면
 * 충분합니다.
 *
 * <p>로그아웃 여부는 principal과 따로 추적합니다. 저장소에서 토큰만 복원해 principal이 없는 세션도 종료 시 이벤트를 받습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ApplicationEventSessionState implements SessionState {

  private final ApplicationEventPublisher publisher;
  private final AtomicReference<AuthenticatedUser> principal = new AtomicReference<>();
  private final AtomicBoolean signedOut = new AtomicBoolean();

  @Override
  public void markAuthenticated(AuthenticatedUser user) {
    principal.set(user);
    signedOut.set(false);
    publisher.publishEvent(new SessionChangedEvent(SessionChangedEvent.Type.AUTHENTICATED, user));
  }

  @Override
  public void markUnauthenticated() {
    AuthenticatedUser previous = principal.getAndSet(null);
    if (!signedOut.compareAndSet(false, true)) {
      return;
    }
    log.info("[SessionState] Session ended: userId={}", previous != null ? previous.id() : null);
    publisher.publishEvent(new SessionChangedEvent(SessionChangedEvent.Type.UNAUTHENTICATED, null));
  }

  @Override
  public void markAccountDisabled() {
    AuthenticatedUser disabled =
        principal.updateAndGet(user -> user != null ? user.deactivated() : null);
    publisher.publishEvent(
        new SessionChangedEvent(SessionChangedEvent.Type.ACCOUNT_DISABLED, disabled));
  }

  public Optional<AuthenticatedUser> getCurrentUser() {
    return Optional.ofNullable(principal.get());
  }

  public boolean isAuthenticated() {
    return principal.get() != null;
  }
}
