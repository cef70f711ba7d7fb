package medikariyer.client.core.policy;

import java.util.List;
import java.util.Objects;

/**
 * 요청 경로를 {@link EndpointType}으로 분류합니다.
 *
 * <p>경로 조각(substring) 매칭입니다. 우선순위는 refresh, credentials, public, protected 순입니다.
 */
public class EndpointPolicy {

  private final String refreshPath;
  private final List<String> unauthenticatedPaths;
  private final List<String> credentialPaths;

  public EndpointPolicy(
      String refreshPath, List<String> unauthenticatedPaths, List<String> credentialPaths) {
    this.refreshPath = Objects.requireNonNull(refreshPath, "refreshPath");
    this.unauthenticatedPaths = List.copyOf(unauthenticatedPaths);
    this.credentialPaths = List.copyOf(credentialPaths);
  }

  public EndpointType classify(String path) {
    if (path == null || path.isEmpty()) {
      return EndpointType.PROTECTED;
    }
    if (path.contains(refreshPath)) {
      return EndpointType.REFRESH;
    }
    if (matchesAny(path, credentialPaths)) {
      return EndpointType.CREDENTIALS;
    }
    if (matchesAny(path, unauthenticatedPaths)) {
      return EndpointType.PUBLIC;
    }
    return EndpointType.PROTECTED;
  }

  private boolean matchesAny(String path, List<String> fragments) {
    return fragments.stream().anyMatch(path::contains);
  }
}
