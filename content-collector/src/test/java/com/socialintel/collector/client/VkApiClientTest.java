package com.socialintel.collector.client;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.AccessToken;
import com.socialintel.collector.model.Page;
import com.socialintel.collector.model.VkComment;
import com.socialintel.collector.model.VkGroup;
import com.socialintel.collector.model.VkPost;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

/**
 * Verifies request shape, pagination, classification and retry behaviour of the API gateway
 * against a mocked HTTP server.
 */
class VkApiClientTest {

    private static final String BASE = "https://api.test/method";
    private static final BooleanSupplier NOT_STOPPING = () -> false;

    private final AtomicInteger limiterSlots = new AtomicInteger();
    private final AtomicInteger tokensIssued = new AtomicInteger();

    private RestTemplate restTemplate;
    private CollectorProperties properties;
    private AccessTokenProvider tokens;
    private RetryRegistry retries;
    private MockRestServiceServer server;
    private VkApiClient client;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        properties = new CollectorProperties();
        properties.getApi().setBaseUrl(BASE);
        properties.getApi().setPageSize(2);

        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        tokens = new AccessTokenProvider(
                userId -> new AccessToken("token-" + tokensIssued.incrementAndGet(), userId,
                        clock.instant().plus(Duration.ofHours(1))),
                clock, Duration.ofMinutes(5), "service");

        retries = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(RetryableApiException.class)
                .build());

        client = clientWithLimiter(limiterSlots::incrementAndGet);
    }

    private VkApiClient clientWithLimiter(RateLimiter limiter) {
        return new VkApiClient(restTemplate, new ObjectMapper(), limiter, tokens, retries, properties);
    }

    @Test
    void listPosts_sendsCredentialAndVersionAndPagesByOffset() {
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andExpect(queryParam("owner_id", "-42"))
                .andExpect(queryParam("offset", "0"))
                .andExpect(queryParam("count", "2"))
                .andExpect(queryParam("access_token", "token-1"))
                .andExpect(queryParam("v", "5.199"))
                .andRespond(withSuccess("""
                        {"response": {"count": 5, "items": [
                          {"id": 10, "owner_id": -42, "text": "first", "comments": {"count": 3}},
                          {"id": 9, "owner_id": -42, "text": "second", "likes": {"count": 7}}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        Page<VkPost> page = client.listPosts(-42, 0, NOT_STOPPING);

        server.verify();
        assertEquals(2, page.items().size());
        assertEquals(3, page.items().get(0).commentCount());
        assertEquals(7, page.items().get(1).likeCount());
        assertEquals(2, page.nextOffset());
        assertEquals(5, page.totalCount());
        assertEquals(1, limiterSlots.get());
    }

    @Test
    void listComments_lastPageHasNoNextOffset() {
        server.expect(once(), requestTo(startsWith(BASE + "/wall.getComments")))
                .andExpect(queryParam("post_id", "10"))
                .andExpect(queryParam("offset", "2"))
                .andRespond(withSuccess("""
                        {"response": {"count": 3, "items": [{"id": 5, "from_id": 77, "text": "hi"}]}}
                        """, MediaType.APPLICATION_JSON));

        Page<VkComment> page = client.listComments(-42, 10, 2, NOT_STOPPING);

        assertEquals(1, page.items().size());
        assertEquals(77L, page.items().get(0).getFromId());
        assertFalse(page.hasNext());
        assertNull(page.nextOffset());
    }

    @Test
    void listGroups_acceptsWrappedAndPlainArrays() {
        server.expect(once(), requestTo(startsWith(BASE + "/groups.getById")))
                .andExpect(queryParam("group_ids", "1,durov"))
                .andRespond(withSuccess("""
                        {"response": {"groups": [
                          {"id": 1, "name": "One", "screen_name": "club1"},
                          {"id": 2, "name": "Two", "screen_name": "durov", "is_closed": 1}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        List<VkGroup> groups = client.listGroups(List.of("1", "durov"), NOT_STOPPING);

        assertEquals(2, groups.size());
        assertEquals("durov", groups.get(1).getScreenName());
        assertEquals(1, groups.get(1).getIsClosed());
    }

    @Test
    void rateLimitedCallIsRetriedAndEachAttemptTakesALimiterSlot() {
        server.expect(times(2), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withSuccess("""
                        {"error": {"error_code": 6, "error_msg": "Too many requests per second"}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withSuccess("""
                        {"response": {"count": 0, "items": []}}
                        """, MediaType.APPLICATION_JSON));

        Page<VkPost> page = client.listPosts(-1, 0, NOT_STOPPING);

        server.verify();
        assertEquals(0, page.items().size());
        assertEquals(3, limiterSlots.get());
    }

    @Test
    void persistentServerErrorsExhaustRetries() {
        server.expect(times(3), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        ApiRetriesExhaustedException e = assertThrows(ApiRetriesExhaustedException.class,
                () -> client.listPosts(-1, 0, NOT_STOPPING));

        server.verify();
        assertEquals(3, e.getAttempts());
        assertEquals(503, e.getCode());
    }

    @Test
    void fatalErrorIsNotRetried() {
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withSuccess("""
                        {"error": {"error_code": 15, "error_msg": "Access denied"}}
                        """, MediaType.APPLICATION_JSON));

        FatalApiException e = assertThrows(FatalApiException.class, () -> client.listPosts(-1, 0, NOT_STOPPING));

        server.verify();
        assertEquals(15, e.getCode());
        assertEquals(1, limiterSlots.get());
    }

    @Test
    void expiredCredentialIsRenewedOnceAndCallRepeated() {
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andExpect(queryParam("access_token", "token-1"))
                .andRespond(withSuccess("""
                        {"error": {"error_code": 5, "error_msg": "User authorization failed"}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andExpect(queryParam("access_token", "token-2"))
                .andRespond(withSuccess("""
                        {"response": {"count": 0, "items": []}}
                        """, MediaType.APPLICATION_JSON));

        client.listPosts(-1, 0, NOT_STOPPING);

        server.verify();
        assertEquals(2, tokensIssued.get());
    }

    @Test
    void secondAuthFailureAfterRenewalIsFatal() {
        server.expect(times(2), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThrows(FatalApiException.class, () -> client.listPosts(-1, 0, NOT_STOPPING));

        server.verify();
        assertEquals(2, tokensIssued.get());
    }

    @Test
    void responseWithoutPayloadIsFatal() {
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThrows(FatalApiException.class, () -> client.listPosts(-1, 0, NOT_STOPPING));
    }

    @Test
    void stopDuringRetryableFailureSendsNoFurtherRequest() {
        AtomicBoolean stopping = new AtomicBoolean();
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        VkApiClient stoppingClient = clientWithLimiter(() -> {
            limiterSlots.incrementAndGet();
            stopping.set(true);
        });

        assertThrows(CallCancelledException.class, () -> stoppingClient.listPosts(-1, 0, stopping::get));

        server.verify();
        assertEquals(1, limiterSlots.get());
    }

    @Test
    void stopSignalledBeforeRenewalSkipsTheRepeatedCall() {
        AtomicBoolean stopping = new AtomicBoolean();
        server.expect(once(), requestTo(startsWith(BASE + "/wall.get")))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        VkApiClient stoppingClient = clientWithLimiter(() -> stopping.set(true));

        assertThrows(CallCancelledException.class, () -> stoppingClient.listPosts(-1, 0, stopping::get));

        server.verify();
        assertEquals(1, tokensIssued.get());
    }

    @Test
    void alreadyStoppedCallerSendsNothing() {
        assertThrows(CallCancelledException.class, () -> client.listGroups(List.of("1"), () -> true));

        server.verify();
        assertEquals(0, limiterSlots.get());
    }
}
