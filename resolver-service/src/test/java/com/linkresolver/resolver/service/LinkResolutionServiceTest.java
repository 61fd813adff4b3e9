package com.linkresolver.resolver.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkresolver.common.config.SecureObjectMapperConfig;
import com.linkresolver.common.exception.ExternalApiException;
import com.linkresolver.common.exception.UpstreamHttpException;
import com.linkresolver.common.validation.ResolvedUrlValidator;
import com.linkresolver.resolver.browser.BrowserPage;
import com.linkresolver.resolver.browser.BrowserResolver;
import com.linkresolver.resolver.cache.CacheSnapshot;
import com.linkresolver.resolver.cache.CacheSnapshotStore;
import com.linkresolver.resolver.cache.ResolutionCache;
import com.linkresolver.resolver.client.BatchExecuteClient;
import com.linkresolver.resolver.client.HttpTransport;
import com.linkresolver.resolver.client.RpcResolver;
import com.linkresolver.resolver.client.SigningParamsFetcher;
import com.linkresolver.resolver.config.CostEnvironment;
import com.linkresolver.resolver.decoder.HeuristicExtractor;
import com.linkresolver.resolver.decoder.LegacyDecoder;
import com.linkresolver.resolver.dto.ResolverStatsDTO;
import com.linkresolver.resolver.metrics.ResolutionMetrics;
import com.linkresolver.resolver.proxy.NoProxyProvider;
import com.linkresolver.resolver.proxy.ProxyConfig;
import com.linkresolver.resolver.ratelimit.MinIntervalRateLimiter;
import com.linkresolver.resolver.strategy.BrowserStrategy;
import com.linkresolver.resolver.strategy.FreshProxyRpcStrategy;
import com.linkresolver.resolver.strategy.HeuristicStrategy;
import com.linkresolver.resolver.strategy.LegacyStrategy;
import com.linkresolver.resolver.strategy.ResolutionAttemptContext;
import com.linkresolver.resolver.strategy.ResolutionStrategy;
import com.linkresolver.resolver.strategy.RpcStrategy;
import com.linkresolver.resolver.strategy.StrategyChain;
import com.linkresolver.resolver.support.LegacyIdentifiers;
import com.linkresolver.resolver.support.MutableClock;
import com.linkresolver.resolver.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkResolutionServiceTest {
	
	private static final String BASE_URL = "https://news.google.com";
	private static final String RPC_LINK = BASE_URL + "/rss/articles/AU_yqLtest?oc=5";
	private static final String SIGNED_PAGE =
		"<html><c-wiz><div data-n-a-sg=\"SIG\" data-n-a-ts=\"1700000000\"></div></c-wiz></html>";
	private static final String BATCH_RESPONSE = ")]}'\n\n"
		+ "[[\"wrb.fr\",\"Fbv4je\",\"[\\\"garturlres\\\",\\\"https://example.com/a\\\",1]\",null,null,null,\"generic\"],"
		+ "[\"di\",10],[\"af.httprm\",10,\"x\",5]]";
	
	@Mock
	private HttpTransport transport;
	
	@TempDir
	Path tempDir;
	
	private MutableClock clock;
	private RecordingSleeper sleeper;
	private ResolvedUrlValidator validator;
	private ObjectMapper objectMapper;
	private SimpleMeterRegistry registry;
	
	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
		sleeper = new RecordingSleeper(clock);
		validator = new ResolvedUrlValidator("google.com");
		objectMapper = new SecureObjectMapperConfig().objectMapper();
		registry = new SimpleMeterRegistry();
	}
	
	private List<ResolutionStrategy> localChain() {
		SigningParamsFetcher fetcher = new SigningParamsFetcher(transport, BASE_URL, Duration.ofSeconds(15));
		BatchExecuteClient batchClient = new BatchExecuteClient(transport, objectMapper, validator, BASE_URL,
			3, Duration.ofSeconds(5), Duration.ofMillis(1), Duration.ofMillis(2));
		RpcResolver rpcResolver = new RpcResolver(fetcher, batchClient);
		return StrategyChain.ordered(CostEnvironment.local(),
			new HeuristicStrategy(new HeuristicExtractor(validator)),
			new RpcStrategy(rpcResolver),
			new FreshProxyRpcStrategy(rpcResolver),
			new LegacyStrategy(new LegacyDecoder(validator)),
			new BrowserStrategy(new BrowserResolver(validator, "news.google.com", Duration.ofSeconds(30), Duration.ofSeconds(3))));
	}
	
	private LinkResolutionService service(List<ResolutionStrategy> strategies) {
		return service(strategies, null, null);
	}
	
	private LinkResolutionService service(List<ResolutionStrategy> strategies, CacheSnapshotStore store,
	                                      CachePersistenceJob job) {
		return LinkResolutionService.builder()
			.cache(new ResolutionCache(Duration.ofHours(24), 1000, clock))
			.rateLimiter(new MinIntervalRateLimiter(Duration.ofSeconds(1), clock, sleeper))
			.strategies(strategies)
			.proxyProvider(new NoProxyProvider())
			.validator(validator)
			.aggregatorHost("news.google.com")
			.environment(CostEnvironment.local())
			.statistics(new ResolverStatistics())
			.metrics(new ResolutionMetrics(registry))
			.snapshotStore(store)
			.persistenceJob(job)
			.clock(clock)
			.build();
	}
	
	private static ResolutionStrategy fixed(String name, String result) {
		return new ResolutionStrategy() {
			@Override
			public String name() {
				return name;
			}
			
			@Override
			public Optional<String> attempt(ResolutionAttemptContext context) {
				return Optional.ofNullable(result);
			}
		};
	}
	
	private static ResolutionStrategy echo(String name) {
		return new ResolutionStrategy() {
			@Override
			public String name() {
				return name;
			}
			
			@Override
			public Optional<String> attempt(ResolutionAttemptContext context) {
				return Optional.of(context.getRequestUrl());
			}
		};
	}
	
	private double successes(String strategy) {
		return registry.get("link_resolution_success_total").tag("strategy", strategy).counter().count();
	}
	
	@Test
	void resolveUrl_nonAggregatorLink_returnedUnchanged() {
		LinkResolutionService service = service(localChain());
		
		assertEquals("https://example.com/story", service.resolveUrl("https://example.com/story"));
		
		verifyNoInteractions(transport);
		assertTrue(sleeper.getSleeps().isEmpty());
	}
	
	@Test
	void resolveUrl_rpcSuccess_secondCallServedFromCacheWithoutOutboundCalls() {
		when(transport.get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenReturn(SIGNED_PAGE);
		when(transport.post(anyString(), any(HttpHeaders.class), anyString(), any(ProxyConfig.class), any(Duration.class)))
			.thenReturn(BATCH_RESPONSE);
		LinkResolutionService service = service(localChain());
		
		assertEquals("https://example.com/a", service.resolveUrl(RPC_LINK));
		clearInvocations(transport);
		assertEquals("https://example.com/a", service.resolveUrl(RPC_LINK));
		
		verifyNoInteractions(transport);
		assertEquals(1.0, successes("rpc"));
		ResolverStatsDTO stats = service.stats();
		assertEquals(2, stats.getRequestCount());
		assertEquals(1, stats.getSuccessCount());
		assertEquals(1, stats.getCacheHits());
		assertEquals(1, stats.getTotalEntries());
		assertEquals("50.0%", stats.getSuccessRate());
		assertEquals("local", stats.getEnvironment());
	}
	
	@Test
	void resolveUrl_batchUnavailable_fallsThroughToLegacyAfterAttemptCeiling() {
		String link = BASE_URL + "/rss/articles/" + LegacyIdentifiers.encode("https://publisher.example.com/story");
		when(transport.get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenReturn(SIGNED_PAGE);
		when(transport.post(anyString(), any(HttpHeaders.class), anyString(), any(ProxyConfig.class), any(Duration.class)))
			.thenThrow(new UpstreamHttpException(503, "Service Unavailable"));
		LinkResolutionService service = service(localChain());
		
		assertEquals("https://publisher.example.com/story", service.resolveUrl(link));
		
		verify(transport, times(3)).post(anyString(), any(HttpHeaders.class), anyString(), any(ProxyConfig.class), any(Duration.class));
		assertEquals(1.0, successes("legacy"));
	}
	
	@Test
	void resolveUrl_everythingFails_returnsInput() {
		String link = BASE_URL + "/articles/AU_yqLqqqq";
		when(transport.get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenThrow(new ExternalApiException("connect timed out"));
		LinkResolutionService service = service(localChain());
		
		assertEquals(link, service.resolveUrl(link));
		
		assertEquals(1, service.stats().getUnresolvedCount());
		assertEquals(0, service.stats().getTotalEntries());
		verify(transport, never()).post(anyString(), any(HttpHeaders.class), anyString(), any(ProxyConfig.class), any(Duration.class));
	}
	
	@Test
	void resolveUrl_blankAndGarbageInput_returnedUnchanged() {
		LinkResolutionService service = service(List.of(fixed("never", "https://example.com/x")));
		
		assertNull(service.resolveUrl(null));
		assertEquals("", service.resolveUrl(""));
		assertEquals("   ", service.resolveUrl("   "));
		assertEquals("not a url at all", service.resolveUrl("not a url at all"));
		assertEquals(4, service.stats().getRequestCount());
	}
	
	@Test
	void resolveUrl_throwingStrategy_isSkipped() {
		ResolutionStrategy failing = new ResolutionStrategy() {
			@Override
			public String name() {
				return "failing";
			}
			
			@Override
			public Optional<String> attempt(ResolutionAttemptContext context) {
				throw new IllegalStateException("boom");
			}
		};
		LinkResolutionService service = service(List.of(failing, fixed("backup", "https://example.com/backup")));
		
		assertEquals("https://example.com/backup", service.resolveUrl(RPC_LINK));
		assertEquals(1.0, successes("backup"));
	}
	
	@Test
	void resolveUrl_unexpectedError_returnsInputAndCountsError() {
		ResolutionStrategy broken = new ResolutionStrategy() {
			@Override
			public String name() {
				return "broken";
			}
			
			@Override
			public boolean isApplicable(ResolutionAttemptContext context) {
				throw new IllegalStateException("unexpected");
			}
			
			@Override
			public Optional<String> attempt(ResolutionAttemptContext context) {
				return Optional.empty();
			}
		};
		LinkResolutionService service = service(List.of(broken));
		
		assertEquals(RPC_LINK, service.resolveUrl(RPC_LINK));
		assertEquals(1.0, registry.get("link_resolution_errors_total").counter().count());
	}
	
	@Test
	void resolveUrl_rejectsSelfReferenceAndAggregatorCandidates() {
		LinkResolutionService service = service(List.of(
			echo("echo"),
			fixed("aggregator", "https://news.google.com/topics/x"),
			fixed("relative", "/articles/abc"),
			fixed("good", "https://publisher.example.com/ok")));
		
		assertEquals("https://publisher.example.com/ok", service.resolveUrl(RPC_LINK));
		assertEquals(1.0, successes("good"));
	}
	
	@Test
	void resolveUrl_uncachedCalls_areSpacedByMinimumInterval() {
		LinkResolutionService service = service(List.of(fixed("fixed", "https://example.com/a")));
		
		service.resolveUrl(BASE_URL + "/articles/one");
		service.resolveUrl(BASE_URL + "/articles/two");
		service.resolveUrl(BASE_URL + "/articles/one");
		
		assertEquals(List.of(Duration.ofSeconds(1)), sleeper.getSleeps());
	}
	
	@Test
	void resolveUrl_browserStrategy_onlyRunsWithPage() {
		BrowserPage page = mock(BrowserPage.class);
		when(page.goTo(anyString(), any(Duration.class))).thenReturn(true);
		when(page.url()).thenReturn("https://publisher.example.com/from-browser");
		BrowserResolver browserResolver = new BrowserResolver(validator, "news.google.com",
			Duration.ofSeconds(30), Duration.ofSeconds(3));
		LinkResolutionService service = service(List.of(new BrowserStrategy(browserResolver)));
		String link = BASE_URL + "/topics/abc";
		
		assertEquals(link, service.resolveUrl(link));
		assertEquals("https://publisher.example.com/from-browser", service.resolveUrl(link, page));
		
		verify(page, times(1)).goTo(eq(link), any(Duration.class));
		assertEquals(1.0, successes("browser"));
	}
	
	@Test
	void persistence_survivesRestart() {
		CacheSnapshotStore store = new CacheSnapshotStore(tempDir.resolve("url-cache.json"), objectMapper);
		LinkResolutionService first = service(List.of(fixed("fixed", "https://example.com/a")), store, null);
		first.initialize();
		first.resolveUrl(RPC_LINK);
		first.cleanup();
		assertTrue(Files.exists(store.getFile()));
		
		AtomicInteger attempts = new AtomicInteger();
		ResolutionStrategy counting = new ResolutionStrategy() {
			@Override
			public String name() {
				return "counting";
			}
			
			@Override
			public Optional<String> attempt(ResolutionAttemptContext context) {
				attempts.incrementAndGet();
				return Optional.empty();
			}
		};
		LinkResolutionService second = service(List.of(counting), store, null);
		second.initialize();
		
		assertEquals("https://example.com/a", second.resolveUrl(RPC_LINK));
		assertEquals(0, attempts.get());
		assertEquals(2, second.stats().getRequestCount());
		assertEquals(1, second.stats().getSuccessCount());
	}
	
	@Test
	void clearCache_removesEntriesAndSnapshotFile() {
		CacheSnapshotStore store = new CacheSnapshotStore(tempDir.resolve("url-cache.json"), objectMapper);
		LinkResolutionService service = service(List.of(fixed("fixed", "https://example.com/a")), store, null);
		service.resolveUrl(RPC_LINK);
		service.persistCache();
		assertTrue(Files.exists(store.getFile()));
		
		service.clearCache();
		
		assertFalse(Files.exists(store.getFile()));
		assertEquals(0, service.stats().getTotalEntries());
	}
	
	@Test
	void initializeAndCleanup_areIdempotent() {
		CacheSnapshotStore store = mock(CacheSnapshotStore.class);
		CachePersistenceJob job = mock(CachePersistenceJob.class);
		when(store.load()).thenReturn(Optional.empty());
		LinkResolutionService service = service(List.of(), store, job);
		
		service.initialize();
		service.initialize();
		service.cleanup();
		service.cleanup();
		
		verify(store, times(1)).load();
		verify(job, times(1)).start(any(Runnable.class));
		verify(job, times(1)).stop();
		verify(store, times(1)).save(any(CacheSnapshot.class));
	}
}
