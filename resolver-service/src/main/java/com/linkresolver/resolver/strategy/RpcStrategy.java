package com.linkresolver.resolver.strategy;

import com.linkresolver.resolver.client.RpcResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class RpcStrategy implements ResolutionStrategy {

	public static final String NAME = "rpc";

	private final RpcResolver rpcResolver;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean isApplicable(ResolutionAttemptContext context) {
		return context.getIdentifier().isPresent();
	}

	@Override
	public Optional<String> attempt(ResolutionAttemptContext context) {
		return rpcResolver.resolve(context.getIdentifier().orElseThrow(), context.getProxyProvider());
	}
}
