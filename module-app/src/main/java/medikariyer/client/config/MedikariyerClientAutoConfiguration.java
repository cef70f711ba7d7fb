package medikariyer.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.channel.ChannelOption;
import java.net.InetAddress;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.policy.EndpointPolicy;
import medikariyer.client.core.policy.ProactiveRefreshPolicy;
import medikariyer.client.core.port.out.CredentialStore;
import medikariyer.client.core.port.out.RefreshEndpoint;
import medikariyer.client.core.port.out.SessionState;
import medikariyer.client.core.refresh.RefreshCoordinator;
import medikariyer.client.core.refresh.SessionRefresher;
import medikariyer.client.core.retry.RetryLedger;
import medikariyer.client.external.AuthApiClient;
import medikariyer.client.infrastructure.executor.DefaultLogicExecutor;
import medikariyer.client.infrastructure.executor.LogicExecutor;
import medikariyer.client.infrastructure.executor.TaskContext;
import medikariyer.client.infrastructure.external.WebClientRefreshEndpoint;
import medikariyer.client.infrastructure.http.ErrorClassifier;
import medikariyer.client.infrastructure.http.PipelineRefreshListener;
import medikariyer.client.infrastructure.http.RequestPipeline;
import medikariyer.client.infrastructure.monitoring.PipelineMetrics;
import medikariyer.client.infrastructure.security.DeviceFingerprintProvider;
import medikariyer.client.infrastructure.security.InMemoryCredentialStore;
import medikariyer.client.infrastructure.security.JwtClaimsReader;
import medikariyer.client.session.ApplicationEventSessionState;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * MediKariyer 인증 클라이언트 자동 구성
 *
 * <h3>구성 요소</h3>
 *
 * <ul>
 *   <li><b>medikariyerApiWebClient</b>: {@link RequestPipeline} 필터가 걸린 WebClient (일반 API 호출용)
 *   <li><b>medikariyerPlainWebClient</b>: 필터 없는 WebClient (토큰 갱신, 로그아웃)
 *   <li><b>RefreshCoordinator</b>: 단일 갱신 + FIFO 대기열
 *   <li><b>CredentialStore / SessionState</b>: 호스트 애플리케이션이 직접 등록하면 그 빈을 사용
 * </ul>
 *
 * <p>{@code medikariyer.api.enabled=false}로 전체를 끌 수 있습니다.
 *
 * @see ApiClientProperties
 */
@Slf4j
@AutoConfiguration(
    after = JacksonAutoConfiguration.class,
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(ApiClientProperties.class)
@ConditionalOnProperty(
    prefix = "medikariyer.api",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MedikariyerClientAutoConfiguration {

  public static final String API_WEB_CLIENT = "medikariyerApiWebClient";
  public static final String PLAIN_WEB_CLIENT = "medikariyerPlainWebClient";
  public static final String REFRESH_EXECUTOR = "medikariyerRefreshExecutor";

  private static final String UNKNOWN_DEVICE = "unknown-device";

  // ==================== 공통 ====================

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry) {
    return new PipelineMetrics(meterRegistry);
  }

  // ==================== 자격 증명 / 세션 ====================

  @Bean
  @ConditionalOnMissingBean
  public JwtClaimsReader jwtClaimsReader(ObjectMapper objectMapper, LogicExecutor executor) {
    return new JwtClaimsReader(objectMapper, executor);
  }

  /** fingerprint-secret이 설정된 경우에만 토큰을 기기에 바인딩합니다. */
  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "medikariyer.api", name = "fingerprint-secret")
  public DeviceFingerprintProvider deviceFingerprintProvider(
      ApiClientProperties properties, LogicExecutor executor) {
    return new DeviceFingerprintProvider(
        properties.getFingerprintSecret(), resolveDeviceId(properties, executor), executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialStore credentialStore(
      JwtClaimsReader jwtClaimsReader, ObjectProvider<DeviceFingerprintProvider> fingerprint) {
    return new InMemoryCredentialStore(jwtClaimsReader, fingerprint.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionState sessionState(ApplicationEventPublisher publisher) {
    return new ApplicationEventSessionState(publisher);
  }

  // ==================== 토큰 갱신 ====================

  @Bean(PLAIN_WEB_CLIENT)
  @ConditionalOnMissingBean(name = PLAIN_WEB_CLIENT)
  public WebClient medikariyerPlainWebClient(ApiClientProperties properties) {
    return webClientBuilder(properties).build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RefreshEndpoint refreshEndpoint(
      @Qualifier(PLAIN_WEB_CLIENT) WebClient plainWebClient, ApiClientProperties properties) {
    return new WebClientRefreshEndpoint(
        plainWebClient, properties.getRefreshPath(), properties.getRequestTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionRefresher sessionRefresher(
      CredentialStore credentialStore,
      SessionState sessionState,
      RefreshEndpoint refreshEndpoint) {
    return new SessionRefresher(credentialStore, sessionState, refreshEndpoint);
  }

  /**
   * 갱신 시작 전용 Executor
   *
   * <p>동시에 진행되는 갱신은 최대 1건이므로 스레드 1개로 충분합니다. 갱신 호출 자체는 Reactor Netty 이벤트 루프에서 진행됩니다.
   */
  @Bean(REFRESH_EXECUTOR)
  @ConditionalOnMissingBean(name = REFRESH_EXECUTOR)
  public Executor medikariyerRefreshExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(8);
    executor.setThreadNamePrefix("auth-refresh-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    executor.initialize();
    return executor;
  }

  @Bean
  @ConditionalOnMissingBean
  public RefreshCoordinator refreshCoordinator(
      SessionRefresher sessionRefresher,
      PipelineMetrics metrics,
      @Qualifier(REFRESH_EXECUTOR) Executor refreshExecutor,
      ApiClientProperties properties) {
    RefreshCoordinator coordinator =
        new RefreshCoordinator(
            sessionRefresher::refresh,
            refreshExecutor,
            properties.getRefreshDeadline(),
            new PipelineRefreshListener(metrics, sessionRefresher));
    metrics.bindPendingGauge(coordinator::getPendingCount);
    return coordinator;
  }

  // ==================== 요청 파이프라인 ====================

  @Bean
  @ConditionalOnMissingBean
  public RetryLedger retryLedger() {
    return new RetryLedger();
  }

  @Bean
  @ConditionalOnMissingBean
  public EndpointPolicy endpointPolicy(ApiClientProperties properties) {
    return new EndpointPolicy(
        properties.getRefreshPath(),
        properties.getUnauthenticatedPaths(),
        properties.getCredentialPaths());
  }

  @Bean
  @ConditionalOnMissingBean
  public ProactiveRefreshPolicy proactiveRefreshPolicy(ApiClientProperties properties) {
    return new ProactiveRefreshPolicy(Clock.systemUTC(), properties.getProactiveRefreshLeadTime());
  }

  @Bean
  @ConditionalOnMissingBean
  public ErrorClassifier errorClassifier(ObjectMapper objectMapper, LogicExecutor executor) {
    return new ErrorClassifier(objectMapper, executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public RequestPipeline requestPipeline(
      CredentialStore credentialStore,
      SessionState sessionState,
      RefreshCoordinator refreshCoordinator,
      RetryLedger retryLedger,
      EndpointPolicy endpointPolicy,
      ProactiveRefreshPolicy proactiveRefreshPolicy,
      ErrorClassifier errorClassifier,
      PipelineMetrics metrics,
      ApiClientProperties properties) {
    return RequestPipeline.builder()
        .credentialStore(credentialStore)
        .sessionState(sessionState)
        .refreshCoordinator(refreshCoordinator)
        .retryLedger(retryLedger)
        .endpointPolicy(endpointPolicy)
        .proactiveRefreshPolicy(proactiveRefreshPolicy)
        .errorClassifier(errorClassifier)
        .metrics(metrics)
        .requestTimeout(properties.getRequestTimeout())
        .build();
  }

  @Bean(API_WEB_CLIENT)
  @ConditionalOnMissingBean(name = API_WEB_CLIENT)
  public WebClient medikariyerApiWebClient(
      ApiClientProperties properties, RequestPipeline requestPipeline) {
    return webClientBuilder(properties).filter(requestPipeline).build();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthApiClient authApiClient(
      @Qualifier(API_WEB_CLIENT) WebClient apiWebClient,
      @Qualifier(PLAIN_WEB_CLIENT) WebClient plainWebClient,
      CredentialStore credentialStore,
      SessionState sessionState) {
    return new AuthApiClient(apiWebClient, plainWebClient, credentialStore, sessionState);
  }

  /**
   * Reactor Netty 기반 WebClient.Builder
   *
   * <p>connectTimeout은 TCP 연결, responseTimeout은 응답 수신 대기 시간입니다. 파이프라인은 요청마다 requestTimeout을
   * 한 번 더 적용합니다.
   */
  private WebClient.Builder webClientBuilder(ApiClientProperties properties) {
    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) properties.getConnectTimeout().toMillis())
            .responseTimeout(properties.getRequestTimeout())
            .compress(true);

    return WebClient.builder()
        .baseUrl(properties.getBaseUrl())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .clientConnector(new ReactorClientHttpConnector(httpClient));
  }

  private String resolveDeviceId(ApiClientProperties properties, LogicExecutor executor) {
    if (StringUtils.hasText(properties.getDeviceId())) {
      return properties.getDeviceId();
    }
    String hostName =
        executor.executeOrDefault(
            () -> InetAddress.getLocalHost().getHostName(),
            UNKNOWN_DEVICE,
            TaskContext.of("Fingerprint", "ResolveDeviceId"));
    log.debug("[ClientConfig] Device id resolved from host name");
    return hostName;
  }
}
