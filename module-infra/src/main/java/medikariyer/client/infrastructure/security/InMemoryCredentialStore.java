package medikariyer.client.infrastructure.security;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.port.out.CredentialStore;

/**
 * 메모리 기반 {@link CredentialStore}
 *
 * <p>access token, refresh token, 기기 fingerprint를 하나의 불변 스냅샷으로 교체하므로 두 토큰이 서로 다른 갱신에서 온
 * 값으로 섞여 읽히지 않습니다. 만료 시각은 access token의 {@code exp}에서 읽습니다.
 */
@Slf4j
public class InMemoryCredentialStore implements CredentialStore {

  private record StoredCredentials(String accessToken, String refreshToken, String fingerprint) {}

  private final AtomicReference<StoredCredentials> current = new AtomicReference<>();
  private final JwtClaimsReader jwtClaimsReader;
  private final DeviceFingerprintProvider fingerprintProvider;

  public InMemoryCredentialStore(
      JwtClaimsReader jwtClaimsReader, DeviceFingerprintProvider fingerprintProvider) {
    this.jwtClaimsReader = jwtClaimsReader;
    this.fingerprintProvider = fingerprintProvider;
  }

  @Override
  public Optional<String> getAccessToken() {
    return Optional.ofNullable(current.get()).map(StoredCredentials::accessToken);
  }

  @Override
  public Optional<String> getRefreshToken() {
    return Optional.ofNullable(current.get()).map(StoredCredentials::refreshToken);
  }

  @Override
  public Optional<Instant> getExpiry() {
    return getAccessToken().flatMap(jwtClaimsReader::readExpiry);
  }

  /**
   * @throws IllegalArgumentException 토큰이 비어 있는 경우
   */
  @Override
  public void saveTokens(String accessToken, String refreshToken) {
    requireText(accessToken, "accessToken");
    requireText(refreshToken, "refreshToken");
    String fingerprint = fingerprintProvider != null ? fingerprintProvider.current() : null;
    current.set(new StoredCredentials(accessToken, refreshToken, fingerprint));
    log.debug("[CredentialStore] Tokens saved");
  }

  /**
   * 영속 저장소에서 읽은 값을 그대로 복원합니다. fingerprint는 저장 당시 기기의 값이며 null이면 바인딩 검사를 통과합니다.
   */
  public void restore(String accessToken, String refreshToken, String fingerprint) {
    requireText(accessToken, "accessToken");
    requireText(refreshToken, "refreshToken");
    current.set(new StoredCredentials(accessToken, refreshToken, fingerprint));
  }

  @Override
  public void clearTokens() {
    current.set(null);
    log.debug("[CredentialStore] Tokens cleared");
  }

  /** fingerprint가 기록되지 않은 저장 값은 통과시킵니다. */
  @Override
  public boolean validateDeviceBinding() {
    StoredCredentials stored = current.get();
    if (stored == null || stored.fingerprint() == null || fingerprintProvider == null) {
      return true;
    }
    return fingerprintProvider.matches(stored.fingerprint());
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
