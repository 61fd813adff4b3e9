package com.linkresolver.resolver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkresolver.common.validation.ResolvedUrlValidator;
import com.linkresolver.resolver.browser.BrowserResolver;
import com.linkresolver.resolver.cache.CacheSnapshotStore;
import com.linkresolver.resolver.cache.ResolutionCache;
import com.linkresolver.resolver.client.BatchExecuteClient;
import com.linkresolver.resolver.client.HttpTransport;
import com.linkresolver.resolver.client.RestTemplateHttpTransport;
import com.linkresolver.resolver.client.RpcResolver;
import com.linkresolver.resolver.client.SigningParamsFetcher;
import com.linkresolver.resolver.decoder.HeuristicExtractor;
import com.linkresolver.resolver.decoder.LegacyDecoder;
import com.linkresolver.resolver.metrics.ResolutionMetrics;
import com.linkresolver.resolver.proxy.NoProxyProvider;
import com.linkresolver.resolver.proxy.ProxyProvider;
import com.linkresolver.resolver.proxy.StaticProxyPoolProvider;
import com.linkresolver.resolver.ratelimit.MinIntervalRateLimiter;
import com.linkresolver.resolver.ratelimit.Sleeper;
import com.linkresolver.resolver.ratelimit.ThreadSleeper;
import com.linkresolver.resolver.service.CachePersistenceJob;
import com.linkresolver.resolver.service.LinkResolutionService;
import com.linkresolver.resolver.service.ResolverStatistics;
import com.linkresolver.resolver.strategy.BrowserStrategy;
import com.linkresolver.resolver.strategy.FreshProxyRpcStrategy;
import com.linkresolver.resolver.strategy.HeuristicStrategy;
import com.linkresolver.resolver.strategy.LegacyStrategy;
import com.linkresolver.resolver.strategy.RpcStrategy;
import com.linkresolver.resolver.strategy.StrategyChain;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the resolution engine. Every collaborator is an explicit bean so tests can build the same
 * graph by hand.
 */
@Configuration
@Slf4j
public class ResolverConfig {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public Sleeper sleeper() {
		return new ThreadSleeper();
	}

	@Bean
	public CostEnvironment costEnvironment(ResolverProperties properties) {
		CostEnvironment environment = CostEnvironment.detect(properties.getEnvironment().getCloud(), System.getenv());
		log.info("Cost environment: {} (rpc attempts={}, batch timeout={}s)",
			environment, environment.rpcMaxAttempts(), environment.batchTimeout().toSeconds());
		return environment;
	}

	@Bean
	public ResolvedUrlValidator resolvedUrlValidator(ResolverProperties properties) {
		return new ResolvedUrlValidator(properties.getAggregator().getExcludedDomain());
	}

	@Bean
	public ResolutionCache resolutionCache(ResolverProperties properties, Clock clock) {
		return new ResolutionCache(properties.getCache().getTtl(), properties.getCache().getMaxSize(), clock);
	}

	@Bean
	public MinIntervalRateLimiter resolutionRateLimiter(ResolverProperties properties, Clock clock, Sleeper sleeper) {
		return new MinIntervalRateLimiter(properties.getRateLimit().getMinInterval(), clock, sleeper);
	}

	@Bean
	public ProxyProvider proxyProvider(ResolverProperties properties) {
		ResolverProperties.Proxy proxy = properties.getProxy();
		List<String> urls = proxy.getUrls() == null ? List.of() : proxy.getUrls().stream()
			.filter(StringUtils::isNotBlank)
			.map(String::trim)
			.toList();
		if (urls.isEmpty()) {
			log.info("No proxies configured, resolving over direct connections");
			return new NoProxyProvider();
		}
		log.info("Using static proxy pool of {} proxies", urls.size());
		return new StaticProxyPoolProvider(urls, proxy.getTimeout());
	}

	@Bean
	public HttpTransport httpTransport(RestTemplateBuilder restTemplateBuilder) {
		return new RestTemplateHttpTransport(restTemplateBuilder);
	}

	@Bean
	public RpcResolver rpcResolver(HttpTransport httpTransport, ObjectMapper objectMapper,
	                               ResolvedUrlValidator validator, CostEnvironment environment,
	                               ResolverProperties properties) {
		String baseUrl = properties.getAggregator().getBaseUrl();
		ResolverProperties.Rpc rpc = properties.getRpc();
		SigningParamsFetcher fetcher = new SigningParamsFetcher(httpTransport, baseUrl, rpc.getPageTimeout());
		BatchExecuteClient batchClient = new BatchExecuteClient(httpTransport, objectMapper, validator, baseUrl,
			environment.rpcMaxAttempts(), environment.batchTimeout(), rpc.getBackoffInitial(), rpc.getBackoffMax());
		return new RpcResolver(fetcher, batchClient);
	}

	@Bean
	public ThreadPoolTaskScheduler cachePersistenceScheduler() {
		ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
		scheduler.setPoolSize(1);
		scheduler.setThreadNamePrefix("cache-persist-");
		scheduler.setDaemon(true);
		return scheduler;
	}

	@Bean(initMethod = "initialize")
	public LinkResolutionService linkResolutionService(ResolverProperties properties,
	                                                   ResolutionCache cache,
	                                                   MinIntervalRateLimiter rateLimiter,
	                                                   RpcResolver rpcResolver,
	                                                   ProxyProvider proxyProvider,
	                                                   ResolvedUrlValidator validator,
	                                                   CostEnvironment environment,
	                                                   ResolutionMetrics metrics,
	                                                   ObjectMapper objectMapper,
	                                                   ThreadPoolTaskScheduler cachePersistenceScheduler,
	                                                   Clock clock) {
		ResolverProperties.Aggregator aggregator = properties.getAggregator();
		ResolverProperties.Browser browser = properties.getBrowser();
		ResolverProperties.Cache cacheProperties = properties.getCache();

		LinkResolutionService.LinkResolutionServiceBuilder builder = LinkResolutionService.builder()
			.cache(cache)
			.rateLimiter(rateLimiter)
			.strategies(StrategyChain.ordered(environment,
				new HeuristicStrategy(new HeuristicExtractor(validator)),
				new RpcStrategy(rpcResolver),
				new FreshProxyRpcStrategy(rpcResolver),
				new LegacyStrategy(new LegacyDecoder(validator)),
				new BrowserStrategy(new BrowserResolver(validator, aggregator.getHost(),
					browser.getNavigationTimeout(), browser.getSettleDelay()))))
			.proxyProvider(proxyProvider)
			.validator(validator)
			.aggregatorHost(aggregator.getHost())
			.environment(environment)
			.statistics(new ResolverStatistics())
			.metrics(metrics)
			.clock(clock);

		if (cacheProperties.isPersistenceEnabled()) {
			builder.snapshotStore(new CacheSnapshotStore(Path.of(cacheProperties.getFile()), objectMapper))
				.persistenceJob(new CachePersistenceJob(cachePersistenceScheduler,
					cacheProperties.getPersistInterval(), clock));
		}
		return builder.build();
	}
}
