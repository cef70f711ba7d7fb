package medikariyer.client.external;

/** 모바일 인증 API 경로 (base URL 기준) */
public final class ApiEndpoints {

  public static final String LOGIN = "/auth/login";
  public static final String REGISTER_DOCTOR = "/auth/registerDoctor";
  public static final String REFRESH = "/auth/refresh";
  public static final String LOGOUT = "/auth/logout";
  public static final String ME = "/auth/me";

  private ApiEndpoints() {}
}
