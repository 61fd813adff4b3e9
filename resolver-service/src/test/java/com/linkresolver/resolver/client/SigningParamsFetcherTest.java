package com.linkresolver.resolver.client;

import com.linkresolver.common.exception.ExternalApiException;
import com.linkresolver.common.exception.UpstreamHttpException;
import com.linkresolver.resolver.proxy.ProxyConfig;
import com.linkresolver.resolver.proxy.ProxyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SigningParamsFetcherTest {
	
	private static final String BASE_URL = "https://news.google.com";
	private static final String ARTICLE_ID = "AU_yqLtest";
	private static final String SIGNED_PAGE =
		"<html><body><c-wiz jsrenderer=\"x\"><div jscontroller=\"y\" data-n-a-sg=\"AZ5r3sig\" data-n-a-ts=\"1700000000\">"
			+ "<h1>Headline</h1></div></c-wiz></body></html>";
	
	@Mock
	private HttpTransport transport;
	
	@Mock
	private ProxyProvider proxyProvider;
	
	private SigningParamsFetcher fetcher;
	
	@BeforeEach
	void setUp() {
		fetcher = new SigningParamsFetcher(transport, BASE_URL, Duration.ofSeconds(15));
		lenient().when(proxyProvider.getProxyConfig(anyString())).thenReturn(ProxyConfig.none());
	}
	
	@Test
	void fetch_standardProfileSucceeds_returnsParams() {
		when(transport.get(eq(BASE_URL + "/articles/" + ARTICLE_ID), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenReturn(SIGNED_PAGE);
		
		Optional<SigningParams> params = fetcher.fetch(ARTICLE_ID, proxyProvider);
		
		assertTrue(params.isPresent());
		assertEquals(ARTICLE_ID, params.get().articleId());
		assertEquals("AZ5r3sig", params.get().signature());
		assertEquals(1700000000L, params.get().timestamp());
		assertEquals(RequestProfile.STANDARD, params.get().strategyUsed());
		verify(transport, times(1)).get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class));
	}
	
	@Test
	void fetch_standardHeaders_includeDesktopAgentAndReferer() {
		when(transport.get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenReturn(SIGNED_PAGE);
		
		fetcher.fetch(ARTICLE_ID, proxyProvider);
		
		ArgumentCaptor<HttpHeaders> headers = ArgumentCaptor.forClass(HttpHeaders.class);
		verify(transport).get(anyString(), headers.capture(), any(ProxyConfig.class), any(Duration.class));
		assertTrue(headers.getValue().getFirst(HttpHeaders.USER_AGENT).contains("Windows NT 10.0"));
		assertEquals(BASE_URL + "/", headers.getValue().getFirst(HttpHeaders.REFERER));
	}
	
	@Test
	void fetch_blockedStatus_reportsRotatesAndTriesNextProfile() {
		UpstreamHttpException blocked = new UpstreamHttpException(429, "Too Many Requests");
		when(transport.get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenThrow(blocked)
			.thenReturn(SIGNED_PAGE);
		
		Optional<SigningParams> params = fetcher.fetch(ARTICLE_ID, proxyProvider);
		
		assertEquals(RequestProfile.MOBILE, params.orElseThrow().strategyUsed());
		verify(proxyProvider).reportProxyError(BASE_URL + "/articles/" + ARTICLE_ID, blocked, 429);
		verify(proxyProvider).rotateProxy();
	}
	
	@Test
	void fetch_notFound_triesNextProfileWithoutRotating() {
		when(transport.get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenThrow(new UpstreamHttpException(404, "Not Found"))
			.thenReturn(SIGNED_PAGE);
		
		assertTrue(fetcher.fetch(ARTICLE_ID, proxyProvider).isPresent());
		verify(proxyProvider, never()).rotateProxy();
	}
	
	@Test
	void fetch_pageWithoutSignedContainer_fallsThroughAllProfiles() {
		when(transport.get(anyString(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class)))
			.thenReturn("<html><body><div>consent page</div></body></html>")
			.thenReturn("<html><c-wiz><div data-n-a-sg=\"only-signature\"></div></c-wiz></html>")
			.thenThrow(new ExternalApiException("connect timed out"))
			.thenReturn("<html><c-wiz><div data-n-a-sg=\"s\" data-n-a-ts=\"not-a-number\"></div></c-wiz></html>");
		
		assertTrue(fetcher.fetch(ARTICLE_ID, proxyProvider).isEmpty());
		
		ArgumentCaptor<String> urls = ArgumentCaptor.forClass(String.class);
		verify(transport, times(4)).get(urls.capture(), any(HttpHeaders.class), any(ProxyConfig.class), any(Duration.class));
		assertEquals(List.of(
			BASE_URL + "/articles/" + ARTICLE_ID,
			BASE_URL + "/articles/" + ARTICLE_ID,
			BASE_URL + "/rss/articles/" + ARTICLE_ID,
			BASE_URL + "/articles/" + ARTICLE_ID), urls.getAllValues());
	}
	
	@Test
	void fetch_usesProxyFromProvider() {
		ProxyConfig proxy = new ProxyConfig("http://user:pw@proxy.example.net:8000", Duration.ofSeconds(30));
		when(proxyProvider.getProxyConfig(anyString())).thenReturn(proxy);
		when(transport.get(anyString(), any(HttpHeaders.class), eq(proxy), any(Duration.class))).thenReturn(SIGNED_PAGE);
		
		assertTrue(fetcher.fetch(ARTICLE_ID, proxyProvider).isPresent());
	}
}
