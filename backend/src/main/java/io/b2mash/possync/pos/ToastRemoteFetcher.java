package io.b2mash.possync.pos;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.credential.PosCredentials;
import io.b2mash.possync.syncjob.SyncWindow;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Toast Orders API client.
 *
 * <p>Authenticates with the machine-client login endpoint and pages through {@code
 * /orders/v2/ordersBulk} by page number. A page shorter than the page size is the last one.
 */
@Component
public class ToastRemoteFetcher implements RemoteFetcher {

  private static final Logger log = LoggerFactory.getLogger(ToastRemoteFetcher.class);

  static final String AUTH_PATH = "/authentication/v1/authentication/login";
  static final String ORDERS_PATH = "/orders/v2/ordersBulk";
  static final String RESTAURANT_HEADER = "Toast-Restaurant-External-ID";
  static final String TOTAL_COUNT_HEADER = "X-Total-Count";
  private static final String MACHINE_CLIENT = "TOAST_MACHINE_CLIENT";
  private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofMinutes(1);
  private static final DateTimeFormatter TOAST_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ").withZone(ZoneOffset.UTC);

  private final RestClient restClient;
  private final RetryTemplate pageRetryTemplate;
  private final PosRateLimiter rateLimiter;
  private final int pageSize;
  private final Clock clock;
  private final Cache<String, CachedToken> tokenCache;

  @Autowired
  public ToastRemoteFetcher(PosSyncProperties properties, PosRateLimiter rateLimiter, Clock clock) {
    this(
        RestClient.builder()
            .baseUrl(properties.toast().baseUrl())
            .requestFactory(requestFactory(properties.toast())),
        pageRetryTemplate(properties.toast()),
        rateLimiter,
        properties.toast().pageSize(),
        clock);
  }

  ToastRemoteFetcher(
      RestClient.Builder restClientBuilder,
      RetryTemplate pageRetryTemplate,
      PosRateLimiter rateLimiter,
      int pageSize,
      Clock clock) {
    this.restClient = restClientBuilder.build();
    this.pageRetryTemplate = pageRetryTemplate;
    this.rateLimiter = rateLimiter;
    this.pageSize = pageSize;
    this.clock = clock;
    this.tokenCache = Caffeine.newBuilder().maximumSize(10_000).build();
  }

  @Override
  public String authenticate(PosCredentials credentials) {
    var cached = tokenCache.getIfPresent(credentials.clientId());
    if (cached != null && cached.expiresAt().isAfter(clock.instant())) {
      return cached.accessToken();
    }
    var token = login(credentials);
    tokenCache.put(credentials.clientId(), token);
    return token.accessToken();
  }

  @Override
  public void verifyCredentials(PosCredentials credentials) {
    tokenCache.put(credentials.clientId(), login(credentials));
  }

  @Override
  public PosPage fetchPage(
      String accessToken, String locationGuid, SyncWindow window, PageCursor cursor) {
    return pageRetryTemplate.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            log.warn(
                "Retrying Toast page {} for location {} (retry {}): {}",
                cursor.pageNumber(),
                locationGuid,
                context.getRetryCount(),
                context.getLastThrowable() != null
                    ? context.getLastThrowable().getMessage()
                    : "unknown");
          }
          return fetchPageOnce(accessToken, locationGuid, window, cursor);
        });
  }

  private PosPage fetchPageOnce(
      String accessToken, String locationGuid, SyncWindow window, PageCursor cursor) {
    acquireBudget(locationGuid);
    ResponseEntity<List<PosOrder>> response;
    try {
      response =
          restClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(ORDERS_PATH)
                          .queryParam("startDate", "{startDate}")
                          .queryParam("endDate", "{endDate}")
                          .queryParam("pageSize", "{pageSize}")
                          .queryParam("page", "{page}")
                          .build(
                              Map.of(
                                  "startDate", TOAST_TIMESTAMP.format(window.startDate()),
                                  "endDate", TOAST_TIMESTAMP.format(window.endDate()),
                                  "pageSize", pageSize,
                                  "page", cursor.pageNumber())))
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
              .header(RESTAURANT_HEADER, locationGuid)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .toEntity(new ParameterizedTypeReference<List<PosOrder>>() {});
    } catch (HttpClientErrorException e) {
      throw translateClientError(e, accessToken, cursor);
    } catch (HttpServerErrorException e) {
      throw new TransientNetworkException(
          "Toast returned " + e.getStatusCode().value() + " for page " + cursor.pageNumber(), e);
    } catch (ResourceAccessException e) {
      throw new TransientNetworkException(
          "I/O error fetching Toast page " + cursor.pageNumber() + ": " + e.getMessage(), e);
    }

    List<PosOrder> records = response.getBody() != null ? response.getBody() : List.of();
    Long estimatedTotal = parseTotalCount(response.getHeaders().getFirst(TOTAL_COUNT_HEADER));
    Integer totalPages = estimatedTotal != null ? pageCount(estimatedTotal) : null;
    boolean lastPage =
        records.size() < pageSize || (totalPages != null && cursor.pageNumber() >= totalPages);
    log.debug(
        "Fetched Toast page {} for location {}: {} orders (total={})",
        cursor.pageNumber(),
        locationGuid,
        records.size(),
        estimatedTotal);
    return new PosPage(records, lastPage ? null : cursor.nextPage(), estimatedTotal, totalPages);
  }

  private CachedToken login(PosCredentials credentials) {
    acquireBudget(credentials.locationGuid());
    AuthResponse response;
    try {
      response =
          restClient
              .post()
              .uri(AUTH_PATH)
              .contentType(MediaType.APPLICATION_JSON)
              .body(
                  new AuthRequest(
                      credentials.clientId(), credentials.clientSecret(), MACHINE_CLIENT))
              .retrieve()
              .body(AuthResponse.class);
    } catch (RestClientResponseException e) {
      throw new UpstreamAuthException(
          "Toast authentication failed with HTTP " + e.getStatusCode().value(), e);
    } catch (ResourceAccessException e) {
      throw new TransientNetworkException(
          "I/O error during Toast authentication: " + e.getMessage(), e);
    }
    if (response == null
        || response.token() == null
        || response.token().accessToken() == null
        || response.token().accessToken().isBlank()) {
      throw new UpstreamAuthException("Toast authentication returned no access token");
    }
    long expiresIn = response.token().expiresIn() != null ? response.token().expiresIn() : 0L;
    var expiresAt = clock.instant().plusSeconds(expiresIn).minus(TOKEN_EXPIRY_MARGIN);
    log.info("Authenticated with Toast for location {}", credentials.locationGuid());
    return new CachedToken(response.token().accessToken(), expiresAt);
  }

  private RuntimeException translateClientError(
      HttpClientErrorException e, String accessToken, PageCursor cursor) {
    int status = e.getStatusCode().value();
    if (status == 401 || status == 403) {
      tokenCache.asMap().values().removeIf(token -> token.accessToken().equals(accessToken));
      return new UpstreamAuthException(
          "Toast rejected the access token on page "
              + cursor.pageNumber()
              + " (HTTP "
              + status
              + ")",
          e);
    }
    if (status == 429) {
      return new TransientNetworkException(
          "Toast rate limited page " + cursor.pageNumber() + " (HTTP 429)", e);
    }
    return new UpstreamRequestException(
        "Toast rejected page " + cursor.pageNumber() + " with HTTP " + status, status, e);
  }

  private void acquireBudget(String locationGuid) {
    if (!rateLimiter.tryAcquire(locationGuid)) {
      throw new TransientNetworkException(
          "Hourly Toast request budget exhausted for location " + locationGuid);
    }
  }

  private int pageCount(long total) {
    return (int) Math.max(1, (total + pageSize - 1) / pageSize);
  }

  private static Long parseTotalCount(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(header.trim());
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric {} header: {}", TOTAL_COUNT_HEADER, header);
      return null;
    }
  }

  private static JdkClientHttpRequestFactory requestFactory(PosSyncProperties.Toast toast) {
    var httpClient = HttpClient.newBuilder().connectTimeout(toast.connectTimeout()).build();
    var factory = new JdkClientHttpRequestFactory(httpClient);
    factory.setReadTimeout(toast.readTimeout());
    return factory;
  }

  private static RetryTemplate pageRetryTemplate(PosSyncProperties.Toast toast) {
    return RetryTemplate.builder()
        .maxAttempts(toast.pageRetryAttempts())
        .exponentialBackoff(
            toast.pageRetryInitialBackoff().toMillis(), 2.0, toast.pageRetryMaxBackoff().toMillis())
        .retryOn(TransientNetworkException.class)
        .build();
  }

  record AuthRequest(String clientId, String clientSecret, String userAccessType) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AuthResponse(Token token, String status) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Token(String accessToken, Long expiresIn, String tokenType) {}
  }

  private record CachedToken(String accessToken, Instant expiresAt) {}
}
