package com.socialintel.collector.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.AccessToken;
import com.socialintel.collector.model.Page;
import com.socialintel.collector.model.VkComment;
import com.socialintel.collector.model.VkGroup;
import com.socialintel.collector.model.VkPost;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Gateway to the external content API ({@code groups.getById}, {@code wall.get}, {@code wall.getComments}).
 *
 * Every call takes a fresh credential, waits for a slot on the shared {@link RateLimiter}, then issues
 * the HTTP request. Failures are classified by {@link ApiErrorClassifier}:
 * <ul>
 *   <li>rate-limit and transient failures are retried by the {@code vkApi} Resilience4j retry
 *       (exponential backoff with jitter), each attempt taking its own limiter slot; when the attempts
 *       run out an {@link ApiRetriesExhaustedException} is thrown</li>
 *   <li>an expired credential is renewed once and the call repeated once</li>
 *   <li>fatal errors are thrown straight away</li>
 * </ul>
 * Callers pass a stop signal that is checked before every attempt, retries and the post-renewal call
 * included. Once it reads true no further request is sent and {@link CallCancelledException} is thrown.
 */
@Service
@Slf4j
public class VkApiClient {

    public static final String RETRY_NAME = "vkApi";

    static final String GROUP_FIELDS = "description,members_count,is_closed,type";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final AccessTokenProvider tokenProvider;
    private final CollectorProperties properties;
    private final Retry retry;

    public VkApiClient(RestTemplate restTemplate,
                       ObjectMapper objectMapper,
                       RateLimiter rateLimiter,
                       AccessTokenProvider tokenProvider,
                       RetryRegistry retryRegistry,
                       CollectorProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.tokenProvider = tokenProvider;
        this.properties = properties;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}): {}",
                event.getName(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
    }

    /**
     * Resolve groups by numeric id or screen name. Unknown identifiers are simply absent from the result.
     * Identifier lists longer than the API's per-call limit are split into several calls.
     */
    public List<VkGroup> listGroups(List<String> ids, BooleanSupplier stopping) {
        List<VkGroup> groups = new ArrayList<>();
        int batchSize = properties.getApi().getGroupsBatchSize();
        for (int i = 0; i < ids.size(); i += batchSize) {
            List<String> batch = ids.subList(i, Math.min(i + batchSize, ids.size()));
            MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
            params.add("group_ids", String.join(",", batch));
            params.add("fields", GROUP_FIELDS);

            JsonNode response = call("groups.getById", params, stopping);
            // Newer API versions wrap the array as {"groups": [...]}
            JsonNode items = response.isArray() ? response : response.path("groups");
            groups.addAll(objectMapper.convertValue(items, new TypeReference<List<VkGroup>>() {}));
        }
        return groups;
    }

    /**
     * One page of a wall, newest first.
     *
     * @param ownerId wall owner; negative for groups
     * @param offset  number of posts to skip
     */
    public Page<VkPost> listPosts(long ownerId, int offset, BooleanSupplier stopping) {
        int pageSize = properties.getApi().getPageSize();
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("owner_id", String.valueOf(ownerId));
        params.add("offset", String.valueOf(offset));
        params.add("count", String.valueOf(pageSize));

        JsonNode response = call("wall.get", params, stopping);
        List<VkPost> items = objectMapper.convertValue(response.path("items"), new TypeReference<List<VkPost>>() {});
        return page(items, offset, pageSize, response.path("count").asLong(items.size()));
    }

    /**
     * One page of top-level comments of a post, oldest first.
     */
    public Page<VkComment> listComments(long ownerId, long postId, int offset, BooleanSupplier stopping) {
        int pageSize = properties.getApi().getPageSize();
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("owner_id", String.valueOf(ownerId));
        params.add("post_id", String.valueOf(postId));
        params.add("offset", String.valueOf(offset));
        params.add("count", String.valueOf(pageSize));
        params.add("sort", "asc");

        JsonNode response = call("wall.getComments", params, stopping);
        List<VkComment> items = objectMapper.convertValue(response.path("items"), new TypeReference<List<VkComment>>() {});
        return page(items, offset, pageSize, response.path("count").asLong(items.size()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode call(String method, MultiValueMap<String, String> params, BooleanSupplier stopping) {
        AccessToken token = tokenProvider.current();
        try {
            return callWithRetry(method, params, token, stopping);
        } catch (AuthExpiredException e) {
            if (stopping.getAsBoolean()) {
                throw new CallCancelledException(method);
            }
            log.warn("Access token rejected on {} ({}), renewing once", method, e.getMessage());
            AccessToken renewed = tokenProvider.renew(token);
            try {
                return callWithRetry(method, params, renewed, stopping);
            } catch (AuthExpiredException again) {
                throw new FatalApiException(method, again.getCode(),
                        "Access token rejected again after renewal: " + again.getMessage(), again);
            }
        }
    }

    private JsonNode callWithRetry(String method, MultiValueMap<String, String> params, AccessToken token,
                                   BooleanSupplier stopping) {
        try {
            return retry.executeSupplier(() -> execute(method, params, token, stopping));
        } catch (RetryableApiException e) {
            throw new ApiRetriesExhaustedException(method, retry.getRetryConfig().getMaxAttempts(), e);
        }
    }

    private JsonNode execute(String method, MultiValueMap<String, String> params, AccessToken token,
                             BooleanSupplier stopping) {
        if (stopping.getAsBoolean()) {
            throw new CallCancelledException(method);
        }
        rateLimiter.acquire();

        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/" + method)
                .queryParams(params)
                .queryParam("access_token", token.value())
                .queryParam("v", properties.getApi().getVersion())
                .encode()
                .build()
                .toUri();

        log.debug("Calling API method {} with {}", method, params);
        JsonNode body;
        try {
            body = restTemplate.getForObject(uri, JsonNode.class);
        } catch (RestClientResponseException e) {
            throw ApiErrorClassifier.fromHttpStatus(method, e.getStatusCode().value(), e.getStatusText());
        } catch (ResourceAccessException e) {
            throw ApiErrorClassifier.fromIoFailure(method, e);
        } catch (RestClientException e) {
            // unreadable or truncated body
            throw ApiErrorClassifier.fromIoFailure(method, e);
        }

        if (body == null) {
            throw new TransientNetworkException(method, 0, "Empty response body from " + method);
        }
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            throw ApiErrorClassifier.fromApiError(method,
                    error.path("error_code").asInt(), error.path("error_msg").asText("unknown error"));
        }
        JsonNode response = body.get("response");
        if (response == null || response.isNull()) {
            throw new FatalApiException(method, 0, "Invalid response from " + method + ": missing response field");
        }
        return response;
    }

    private static <T> Page<T> page(List<T> items, int offset, int pageSize, long totalCount) {
        int reached = offset + items.size();
        boolean endOfData = items.size() < pageSize || reached >= totalCount;
        return new Page<>(items, endOfData ? null : reached, totalCount);
    }
}
