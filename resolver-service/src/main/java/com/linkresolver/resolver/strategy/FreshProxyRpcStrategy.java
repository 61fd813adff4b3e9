package com.linkresolver.resolver.strategy;

import com.linkresolver.resolver.client.RpcResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Second RPC round after forcing the proxy provider onto a different exit.
 */
@Slf4j
@RequiredArgsConstructor
public class FreshProxyRpcStrategy implements ResolutionStrategy {

	public static final String NAME = "rpc-fresh-proxy";

	private final RpcResolver rpcResolver;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean isApplicable(ResolutionAttemptContext context) {
		return context.getIdentifier().isPresent() && context.getProxyProvider().canRotate();
	}

	@Override
	public Optional<String> attempt(ResolutionAttemptContext context) {
		log.debug("Rotating proxy and retrying RPC resolution");
		context.getProxyProvider().rotateProxy();
		return rpcResolver.resolve(context.getIdentifier().orElseThrow(), context.getProxyProvider());
	}
}
