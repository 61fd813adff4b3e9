package com.linkresolver.resolver.strategy;

import com.linkresolver.resolver.config.CostEnvironment;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed priority order of the resolution strategies.
 * Only the heuristic's position depends on the environment: first in the cloud, otherwise
 * after the exact decoders and before the browser.
 */
public final class StrategyChain {

	private StrategyChain() {
		// utility
	}

	public static List<ResolutionStrategy> ordered(CostEnvironment environment,
	                                               HeuristicStrategy heuristic,
	                                               RpcStrategy rpc,
	                                               FreshProxyRpcStrategy freshProxyRpc,
	                                               LegacyStrategy legacy,
	                                               BrowserStrategy browser) {
		List<ResolutionStrategy> order = new ArrayList<>();
		if (environment.heuristicFirst()) {
			order.add(heuristic);
		}
		order.add(rpc);
		order.add(freshProxyRpc);
		order.add(legacy);
		if (!environment.heuristicFirst()) {
			order.add(heuristic);
		}
		order.add(browser);
		return List.copyOf(order);
	}
}
