package io.b2mash.possync.pos;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import io.b2mash.possync.credential.PosCredentials;
import io.b2mash.possync.syncjob.SyncWindow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseActions;
import org.springframework.web.client.RestClient;

class ToastRemoteFetcherTest {

  private static final String BASE_URL = "https://toast.test";
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
  private static final PosCredentials CREDENTIALS =
      new PosCredentials("client-1", "secret-1", "location-guid");
  private static final SyncWindow WINDOW =
      new SyncWindow(NOW.minus(Duration.ofDays(1)), NOW, false);

  private MockRestServiceServer server;
  private ToastRemoteFetcher fetcher;

  @BeforeEach
  void setUp() {
    fetcher = newFetcher(new PosRateLimiter(1000, () -> 0L));
  }

  @Test
  void authenticate_postsMachineClientLoginAndCachesToken() {
    server
        .expect(requestTo(BASE_URL + ToastRemoteFetcher.AUTH_PATH))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.clientId").value("client-1"))
        .andExpect(jsonPath("$.userAccessType").value("TOAST_MACHINE_CLIENT"))
        .andRespond(withSuccess(authBody("tok-1", 3600), MediaType.APPLICATION_JSON));

    assertThat(fetcher.authenticate(CREDENTIALS)).isEqualTo("tok-1");
    assertThat(fetcher.authenticate(CREDENTIALS)).isEqualTo("tok-1");
    server.verify();
  }

  @Test
  void authenticate_tokenInsideExpiryMargin_logsInAgain() {
    server
        .expect(requestTo(BASE_URL + ToastRemoteFetcher.AUTH_PATH))
        .andRespond(withSuccess(authBody("tok-1", 30), MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(BASE_URL + ToastRemoteFetcher.AUTH_PATH))
        .andRespond(withSuccess(authBody("tok-2", 3600), MediaType.APPLICATION_JSON));

    assertThat(fetcher.authenticate(CREDENTIALS)).isEqualTo("tok-1");
    assertThat(fetcher.authenticate(CREDENTIALS)).isEqualTo("tok-2");
    server.verify();
  }

  @Test
  void verifyCredentials_rejected_throwsUpstreamAuth() {
    server
        .expect(requestTo(BASE_URL + ToastRemoteFetcher.AUTH_PATH))
        .andRespond(withUnauthorizedRequest());

    assertThatThrownBy(() -> fetcher.verifyCredentials(CREDENTIALS))
        .isInstanceOf(UpstreamAuthException.class)
        .hasMessageContaining("401");
  }

  @Test
  void authenticate_responseWithoutToken_throwsUpstreamAuth() {
    server
        .expect(requestTo(BASE_URL + ToastRemoteFetcher.AUTH_PATH))
        .andRespond(withSuccess("{\"status\":\"SUCCESS\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fetcher.authenticate(CREDENTIALS))
        .isInstanceOf(UpstreamAuthException.class)
        .hasMessageContaining("no access token");
  }

  @Test
  void fetchPage_fullPageWithTotalCount_pointsToNextPage() {
    expectOrdersPage(1)
        .andExpect(header("Authorization", "Bearer tok-1"))
        .andExpect(header(ToastRemoteFetcher.RESTAURANT_HEADER, "location-guid"))
        .andRespond(
            withSuccess(orders("o1", "o2"), MediaType.APPLICATION_JSON)
                .header(ToastRemoteFetcher.TOTAL_COUNT_HEADER, "5"));

    var page = fetcher.fetchPage("tok-1", "location-guid", WINDOW, PageCursor.firstPage());

    assertThat(page.records()).extracting(PosOrder::guid).containsExactly("o1", "o2");
    assertThat(page.done()).isFalse();
    assertThat(page.nextCursor().pageNumber()).isEqualTo(2);
    assertThat(page.estimatedTotal()).isEqualTo(5L);
    assertThat(page.totalPages()).isEqualTo(3);
  }

  @Test
  void fetchPage_shortPage_isLast() {
    expectOrdersPage(2).andRespond(withSuccess(orders("o3"), MediaType.APPLICATION_JSON));

    var page = fetcher.fetchPage("tok-1", "location-guid", WINDOW, new PageCursor(2));

    assertThat(page.records()).hasSize(1);
    assertThat(page.done()).isTrue();
    assertThat(page.estimatedTotal()).isNull();
  }

  @Test
  void fetchPage_serverErrorThenSuccess_isRetried() {
    expectOrdersPage(1).andRespond(withServerError());
    expectOrdersPage(1).andRespond(withSuccess(orders(), MediaType.APPLICATION_JSON));

    var page = fetcher.fetchPage("tok-1", "location-guid", WINDOW, PageCursor.firstPage());

    assertThat(page.records()).isEmpty();
    assertThat(page.done()).isTrue();
    server.verify();
  }

  @Test
  void fetchPage_persistentServerError_throwsTransientAfterAllAttempts() {
    expectOrdersPage(1).andRespond(withServerError());
    expectOrdersPage(1).andRespond(withServerError());
    expectOrdersPage(1).andRespond(withServerError());

    assertThatThrownBy(
            () -> fetcher.fetchPage("tok-1", "location-guid", WINDOW, PageCursor.firstPage()))
        .isInstanceOf(TransientNetworkException.class);
    server.verify();
  }

  @Test
  void fetchPage_unauthorized_throwsUpstreamAuthWithoutRetry() {
    expectOrdersPage(1).andRespond(withUnauthorizedRequest());

    assertThatThrownBy(
            () -> fetcher.fetchPage("tok-1", "location-guid", WINDOW, PageCursor.firstPage()))
        .isInstanceOf(UpstreamAuthException.class)
        .hasMessageContaining("HTTP 401");
    server.verify();
  }

  @Test
  void fetchPage_badRequest_throwsUpstreamRequest() {
    expectOrdersPage(1).andRespond(withBadRequest());

    assertThatThrownBy(
            () -> fetcher.fetchPage("tok-1", "location-guid", WINDOW, PageCursor.firstPage()))
        .isInstanceOfSatisfying(
            UpstreamRequestException.class, ex -> assertThat(ex.getStatusCode()).isEqualTo(400));
  }

  @Test
  void fetchPage_budgetExhausted_failsWithoutCallingToast() {
    fetcher = newFetcher(new PosRateLimiter(0, () -> 0L));

    assertThatThrownBy(
            () -> fetcher.fetchPage("tok-1", "location-guid", WINDOW, PageCursor.firstPage()))
        .isInstanceOf(TransientNetworkException.class)
        .hasMessageContaining("budget exhausted");
    server.verify();
  }

  private ToastRemoteFetcher newFetcher(PosRateLimiter rateLimiter) {
    var builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    var retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(3)
            .noBackoff()
            .retryOn(TransientNetworkException.class)
            .build();
    return new ToastRemoteFetcher(
        builder, retryTemplate, rateLimiter, 2, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private ResponseActions expectOrdersPage(int page) {
    return server
        .expect(requestTo(startsWith(BASE_URL + ToastRemoteFetcher.ORDERS_PATH)))
        .andExpect(method(HttpMethod.GET))
        .andExpect(queryParam("page", String.valueOf(page)))
        .andExpect(queryParam("pageSize", "2"));
  }

  private static String authBody(String token, long expiresIn) {
    return """
        {"token": {"accessToken": "%s", "expiresIn": %d, "tokenType": "Bearer"},
         "status": "SUCCESS"}
        """
        .formatted(token, expiresIn);
  }

  private static String orders(String... guids) {
    var body = new StringBuilder("[");
    for (int i = 0; i < guids.length; i++) {
      if (i > 0) {
        body.append(',');
      }
      body.append(
          """
          {"guid": "%s", "openedDate": "2025-02-28T18:00:00.000+0000", "checks": []}
          """
              .formatted(guids[i]));
    }
    return body.append(']').toString();
  }
}
