package medikariyer.client.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

import medikariyer.client.domain.model.session.AuthenticatedUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApplicationEventSessionState 테스트")
class ApplicationEventSessionStateTest {

  private static final AuthenticatedUser USER =
      new AuthenticatedUser(7L, "doktor@example.com", "doctor", "Ayşe", "Yılmaz", true, true);

  @Mock private ApplicationEventPublisher publisher;

  @Test
  @DisplayName("인증 전이 시 principal 보관 및 이벤트 발행")
  void markAuthenticated() {
    ApplicationEventSessionState state = new ApplicationEventSessionState(publisher);

    state.markAuthenticated(USER);

    assertThat(state.getCurrentUser()).contains(USER);
    assertThat(state.isAuthenticated()).isTrue();
    then(publisher)
        .should()
        .publishEvent(new SessionChangedEvent(SessionChangedEvent.Type.AUTHENTICATED, USER));
  }

  @Test
  @DisplayName("비로그인 전이는 중복 발행하지 않음")
  void markUnauthenticated_once() {
    ApplicationEventSessionState state = new ApplicationEventSessionState(publisher);
    state.markAuthenticated(USER);

    state.markUnauthenticated();
    state.markUnauthenticated();

    assertThat(state.isAuthenticated()).isFalse();
    then(publisher)
        .should(times(1))
        .publishEvent(new SessionChangedEvent(SessionChangedEvent.Type.UNAUTHENTICATED, null));
  }

  @Test
  @DisplayName("principal 없이 복원된 세션도 종료 시 한 번 발행")
  void markUnauthenticated_withoutPrincipal() {
    ApplicationEventSessionState state = new ApplicationEventSessionState(publisher);

    state.markUnauthenticated();
    state.markUnauthenticated();

    then(publisher)
        .should(times(1))
        .publishEvent(new SessionChangedEvent(SessionChangedEvent.Type.UNAUTHENTICATED, null));
  }

  @Test
  @DisplayName("재로그인 후 종료는 다시 발행")
  void markUnauthenticated_afterReLogin() {
    ApplicationEventSessionState state = new ApplicationEventSessionState(publisher);
    state.markAuthenticated(USER);
    state.markUnauthenticated();
    state.markAuthenticated(USER);

    state.markUnauthenticated();

    then(publisher)
        .should(times(2))
        .publishEvent(new SessionChangedEvent(SessionChangedEvent.Type.UNAUTHENTICATED, null));
  }

  @Test
  @DisplayName("계정 비활성화 시 principal을 비활성으로 표시")
  void markAccountDisabled() {
    ApplicationEventSessionState state = new ApplicationEventSessionState(publisher);
    state.markAuthenticated(USER);

    state.markAccountDisabled();

    ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
    then(publisher).should(times(2)).publishEvent(events.capture());
    SessionChangedEvent last = (SessionChangedEvent) events.getAllValues().get(1);
    assertThat(last.type()).isEqualTo(SessionChangedEvent.Type.ACCOUNT_DISABLED);
    assertThat(last.user().active()).isFalse();
    assertThat(state.getCurrentUser()).get().extracting(AuthenticatedUser::active).isEqualTo(false);
  }
}
