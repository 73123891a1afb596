package io.b2mash.possync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.possync.TestcontainersConfiguration;
import io.b2mash.possync.credential.CredentialVault;
import io.b2mash.possync.pos.PageCursor;
import io.b2mash.possync.pos.PosOrder;
import io.b2mash.possync.pos.PosPage;
import io.b2mash.possync.pos.RemoteFetcher;
import io.b2mash.possync.pos.UpstreamAuthException;
import io.b2mash.possync.restaurant.PosType;
import io.b2mash.possync.restaurant.Restaurant;
import io.b2mash.possync.restaurant.RestaurantRepository;
import io.b2mash.possync.syncjob.AlreadyClaimedException;
import io.b2mash.possync.syncjob.SyncErrorCode;
import io.b2mash.possync.syncjob.SyncJobSpec;
import io.b2mash.possync.syncjob.SyncJobStatus;
import io.b2mash.possync.syncjob.SyncJobStore;
import io.b2mash.possync.syncjob.SyncTrigger;
import io.b2mash.possync.transaction.PosTransactionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SyncPipelineIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private RestaurantRepository restaurantRepository;
  @Autowired private PosTransactionRepository transactionRepository;
  @Autowired private CredentialVault credentialVault;
  @Autowired private SyncJobStore jobStore;
  @Autowired private SyncRequestService syncRequestService;
  @Autowired private SyncOrchestrator orchestrator;

  @MockitoBean private RemoteFetcher remoteFetcher;

  @Test
  void manualSync_importsOrdersAndRerunDoesNotDoubleCount() throws Exception {
    var restaurant = connectedRestaurant("location-a");
    var orders = List.of(order("a-1", "10.00"), order("a-2", "20.00"), order("a-3", "12.50"));
    when(remoteFetcher.authenticate(any())).thenReturn("token");
    when(remoteFetcher.fetchPage(eq("token"), eq("location-a"), any(), any(PageCursor.class)))
        .thenReturn(new PosPage(orders, null, 3L, 1));

    var response =
        mockMvc
            .perform(
                post("/api/pos/sync")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"restaurantId\": \"" + restaurant.getId() + "\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.syncType").value("full"))
            .andReturn();
    String firstJobId = JsonPath.read(response.getResponse().getContentAsString(), "$.jobId");

    assertThat(orchestrator.process(firstJobId)).isTrue();

    var firstJob = jobStore.getByJobId(firstJobId);
    assertThat(firstJob.getStatus()).isEqualTo(SyncJobStatus.COMPLETED);
    assertThat(firstJob.getResult().ordersImported()).isEqualTo(3);
    assertThat(transactionRepository.countByRestaurantId(restaurant.getId())).isEqualTo(3);
    assertThat(transactionRepository.sumTotalAmount(restaurant.getId()))
        .isEqualByComparingTo("42.50");
    var afterFirst = restaurantRepository.findById(restaurant.getId()).orElseThrow();
    assertThat(afterFirst.isInitialSyncComplete()).isTrue();
    assertThat(afterFirst.getLastSyncAt()).isNotNull();

    var second = syncRequestService.enqueueSync(restaurant.getId(), SyncTrigger.MANUAL, null);
    assertThat(second.window().fullSync()).isFalse();
    assertThat(orchestrator.process(second.jobId())).isTrue();

    var secondJob = jobStore.getByJobId(second.jobId());
    assertThat(secondJob.getResult().ordersImported()).isZero();
    assertThat(secondJob.getResult().skippedDuplicates()).isEqualTo(3);
    assertThat(transactionRepository.countByRestaurantId(restaurant.getId())).isEqualTo(3);
    assertThat(transactionRepository.sumTotalAmount(restaurant.getId()))
        .isEqualByComparingTo("42.50");
  }

  @Test
  void secondRequestWhileActive_returnsExistingJob() throws Exception {
    var restaurant = connectedRestaurant("location-b");
    var first = syncRequestService.enqueueSync(restaurant.getId(), SyncTrigger.LOGIN, null);

    mockMvc
        .perform(
            post("/api/pos/sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"restaurantId\": \"" + restaurant.getId() + "\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.jobId").value(first.jobId()));

    mockMvc
        .perform(get("/api/sync-status/{restaurantId}", restaurant.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("pending"))
        .andExpect(jsonPath("$.jobId").value(first.jobId()));
  }

  @Test
  void secondActiveJobInsert_isRejectedByDatabase() throws Exception {
    var restaurant = connectedRestaurant("location-c");
    var first = syncRequestService.enqueueSync(restaurant.getId(), SyncTrigger.MANUAL, null);
    Thread.sleep(5);

    var spec =
        new SyncJobSpec(
            restaurant.getId(), PosType.TOAST, SyncTrigger.SCHEDULED, first.window(), null, 3);

    assertThatThrownBy(() -> jobStore.create(spec))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(jobStore.findActiveFor(restaurant.getId())).hasSize(1);
  }

  @Test
  void claim_isExclusive() {
    var restaurant = connectedRestaurant("location-d");
    var queued = syncRequestService.enqueueSync(restaurant.getId(), SyncTrigger.MANUAL, null);

    jobStore.claim(queued.jobId());

    assertThatThrownBy(() -> jobStore.claim(queued.jobId()))
        .isInstanceOf(AlreadyClaimedException.class);
  }

  @Test
  void rejectedCredentials_failJobOnFirstAttempt() {
    var restaurant = connectedRestaurant("location-e");
    when(remoteFetcher.authenticate(any()))
        .thenThrow(new UpstreamAuthException("Toast authentication failed with HTTP 401"));
    var queued = syncRequestService.enqueueSync(restaurant.getId(), SyncTrigger.MANUAL, null);

    orchestrator.process(queued.jobId());

    var job = jobStore.getByJobId(queued.jobId());
    assertThat(job.getStatus()).isEqualTo(SyncJobStatus.FAILED);
    assertThat(job.getAttempts()).isEqualTo(1);
    assertThat(job.getError().code()).isEqualTo(SyncErrorCode.UPSTREAM_AUTH_ERROR);
    assertThat(transactionRepository.countByRestaurantId(restaurant.getId())).isZero();
  }

  private Restaurant connectedRestaurant(String locationGuid) {
    var restaurant = new Restaurant("Restaurant " + locationGuid, "owner@example.com");
    restaurant.connectPos(
        PosType.TOAST,
        credentialVault.encryptCredentialSet("client-" + locationGuid, "secret", locationGuid),
        Instant.now());
    return restaurantRepository.save(restaurant);
  }

  private static PosOrder order(String guid, String total) {
    var check =
        new PosOrder.Check(
            guid + "-check",
            BigDecimal.ZERO,
            new BigDecimal(total),
            false,
            "PAID",
            List.of(),
            List.of());
    return new PosOrder(
        guid,
        "20250228",
        "2025-02-28T18:30:00.000+0000",
        null,
        false,
        null,
        null,
        null,
        List.of(check));
  }
}
