package com.linkresolver.resolver.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkresolver.common.exception.SerializationException;
import com.linkresolver.common.exception.UpstreamHttpException;
import com.linkresolver.common.util.SensitiveDataFilter;
import com.linkresolver.common.validation.ResolvedUrlValidator;
import com.linkresolver.resolver.constants.ResolverConstants;
import com.linkresolver.resolver.proxy.ProxyConfig;
import com.linkresolver.resolver.proxy.ProxyProvider;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Second RPC phase: posts the signed decode request to the aggregator's internal batch endpoint and
 * digs the article URL out of the response envelope.
 *
 * <p>Attempts are driven by a Resilience4j {@link Retry}: an empty result or a transient failure is
 * retried with exponential backoff, a 400/404 ends the call immediately. Blocking statuses
 * (403/407/429/502/503) are reported to the proxy provider and force a rotation before the next attempt.
 */
@Slf4j
public class BatchExecuteClient {

	private static final List<String> USER_AGENTS = List.of(
		"Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
		"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
		"Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36"
	);

	private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded;charset=UTF-8";
	private static final String ENVELOPE_DELIMITER = "\n\n";
	private static final int TRAILING_ELEMENTS = 2;
	private static final int MIN_URL_LENGTH = 11;

	private final HttpTransport transport;
	private final ObjectMapper objectMapper;
	private final ResolvedUrlValidator validator;
	private final String baseUrl;
	private final Duration requestTimeout;
	private final Retry retry;

	public BatchExecuteClient(HttpTransport transport, ObjectMapper objectMapper, ResolvedUrlValidator validator,
	                          String baseUrl, int maxAttempts, Duration requestTimeout,
	                          Duration backoffInitial, Duration backoffMax) {
		this.transport = transport;
		this.objectMapper = objectMapper;
		this.validator = validator;
		this.baseUrl = baseUrl;
		this.requestTimeout = requestTimeout;

		RetryConfig config = RetryConfig.<String>custom()
			.maxAttempts(maxAttempts)
			.intervalFunction(IntervalFunction.ofExponentialBackoff(backoffInitial.toMillis(), 2.0, backoffMax.toMillis()))
			.retryOnResult(Objects::isNull)
			.retryOnException(e -> !(e instanceof UpstreamHttpException upstream && upstream.isPermanent()))
			.failAfterMaxAttempts(false)
			.build();
		this.retry = Retry.of("batchExecute", config);
		this.retry.getEventPublisher()
			.onRetry(event -> log.debug("Batch decode attempt {} failed, retrying in {}ms",
				event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
	}

	/**
	 * @return the decoded article URL, or empty when every attempt failed
	 */
	public Optional<String> decode(SigningParams params, ProxyProvider proxyProvider) {
		AtomicInteger attempt = new AtomicInteger();
		try {
			String payload = buildPayload(params);
			String result = retry.executeCallable(() -> attemptOnce(payload, attempt.incrementAndGet(), proxyProvider));
			if (result == null) {
				log.debug("All batch decode attempts returned nothing for {}", params.articleId());
			}
			return Optional.ofNullable(result);
		} catch (UpstreamHttpException e) {
			log.debug("Batch decode aborted after {} attempt(s): HTTP {}", attempt.get(), e.getStatusCode());
			return Optional.empty();
		} catch (Exception e) {
			log.debug("Batch decode failed after {} attempt(s): {}", attempt.get(),
				SensitiveDataFilter.maskSensitiveData(e.getMessage()));
			return Optional.empty();
		}
	}

	String attemptOnce(String payload, int attempt, ProxyProvider proxyProvider) {
		String endpoint = endpoint();
		ProxyConfig proxy = proxyProvider.getProxyConfig(endpoint);
		log.debug("Batch decode attempt {} via {}", attempt,
			proxy.isEmpty() ? "direct connection" : SensitiveDataFilter.maskProxyUrl(proxy.proxyUrl()));

		String body;
		try {
			body = transport.post(endpoint, headers(attempt), payload, proxy, requestTimeout);
		} catch (UpstreamHttpException e) {
			if (e.isBlocked()) {
				log.warn("Proxy error {} in batch decode - rotating proxy", e.getStatusCode());
				proxyProvider.reportProxyError(endpoint, e, e.getStatusCode());
				proxyProvider.rotateProxy();
			}
			throw e;
		}
		if (StringUtils.isEmpty(body)) {
			throw new IllegalStateException("Empty batch decode response");
		}
		return parseResponse(body);
	}

	/**
	 * Envelope: {@code )]}'} line, blank line, then a JSON array whose first element carries the
	 * payload {@code ["garturlres","<url>",...]} as a string at index 2.
	 */
	String parseResponse(String body) {
		String[] segments = body.split(ENVELOPE_DELIMITER);
		if (segments.length < 2) {
			log.debug("Batch response has no data segment");
			return null;
		}
		try {
			JsonNode root = objectMapper.readTree(segments[1]);
			if (root == null || !root.isArray() || root.size() - TRAILING_ELEMENTS < 1) {
				log.debug("Batch response data segment has unexpected shape");
				return null;
			}
			JsonNode first = root.get(0);
			if (!first.isArray() || first.size() <= 2 || !first.get(2).isTextual()) {
				log.debug("Batch response entry has no payload");
				return null;
			}
			JsonNode decoded = objectMapper.readTree(first.get(2).asText());
			if (decoded == null || !decoded.isArray() || decoded.size() < 2 || !decoded.get(1).isTextual()) {
				log.debug("Batch response payload has unexpected shape");
				return null;
			}
			String candidate = decoded.get(1).asText();
			if (candidate.length() < MIN_URL_LENGTH || !validator.isValid(candidate)) {
				log.debug("Batch response candidate rejected: {}", candidate);
				return null;
			}
			return candidate;
		} catch (JsonProcessingException e) {
			log.debug("Failed to parse batch response: {}", e.getOriginalMessage());
			return null;
		}
	}

	/**
	 * {@code f.req=} followed by the component-encoded {@code [[["Fbv4je","<request>"]]]}.
	 */
	String buildPayload(SigningParams params) {
		String request = "[\"" + ResolverConstants.BATCH_REQUEST_TAG + "\","
			+ "[[\"X\",\"X\",[\"X\",\"X\"],null,null,1,1,\"US:en\",null,1,null,null,null,null,null,0,1],"
			+ "\"X\",\"X\",1,[1,1,1],1,1,null,0,0,null,0],"
			+ "\"" + params.articleId() + "\"," + params.timestamp() + ",\"" + params.signature() + "\"]";
		try {
			String envelope = objectMapper.writeValueAsString(
				List.of(List.of(List.of(ResolverConstants.BATCH_RPC_ID, request))));
			return "f.req=" + FormComponentEncoder.encode(envelope);
		} catch (JsonProcessingException e) {
			throw new SerializationException("Failed to build batch decode payload", e);
		}
	}

	HttpHeaders headers(int attempt) {
		HttpHeaders headers = new HttpHeaders();
		headers.set(HttpHeaders.CONTENT_TYPE, FORM_CONTENT_TYPE);
		headers.set(HttpHeaders.USER_AGENT, USER_AGENTS.get(attempt % USER_AGENTS.size()));
		headers.set(HttpHeaders.ACCEPT, "*/*");
		headers.set(HttpHeaders.ACCEPT_LANGUAGE, RequestProfile.ACCEPT_LANGUAGE);
		headers.set(HttpHeaders.REFERER, baseUrl + "/");
		headers.set(HttpHeaders.ORIGIN, baseUrl);
		headers.set(HttpHeaders.CACHE_CONTROL, "no-cache");
		headers.set(HttpHeaders.PRAGMA, "no-cache");
		return headers;
	}

	String endpoint() {
		return baseUrl + ResolverConstants.BATCH_EXECUTE_PATH;
	}

	public int getMaxAttempts() {
		return retry.getRetryConfig().getMaxAttempts();
	}
}
