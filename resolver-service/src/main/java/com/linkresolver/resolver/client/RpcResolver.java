package com.linkresolver.resolver.client;

import com.linkresolver.resolver.proxy.ProxyProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Both RPC phases for one identifier: signing parameters, then the batch decode call.
 */
@Slf4j
@RequiredArgsConstructor
public class RpcResolver {

	private final SigningParamsFetcher signingParamsFetcher;
	private final BatchExecuteClient batchExecuteClient;

	public Optional<String> resolve(String articleId, ProxyProvider proxyProvider) {
		Optional<SigningParams> params = signingParamsFetcher.fetch(articleId, proxyProvider);
		if (params.isEmpty()) {
			log.debug("Failed to get signing params for {}", articleId);
			return Optional.empty();
		}
		return batchExecuteClient.decode(params.get(), proxyProvider);
	}
}
