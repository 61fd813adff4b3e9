package com.linkresolver.resolver.constants;

public final class ResolverConstants {

	private ResolverConstants() {
		// Utility class - prevent instantiation
	}

	public static final String ARTICLES_SEGMENT = "articles";
	public static final String ARTICLE_PATH = "/articles/";
	public static final String RSS_ARTICLE_PATH = "/rss/articles/";

	/**
	 * Identifiers with this prefix are in the current format and only resolvable over RPC.
	 */
	public static final String CURRENT_FORMAT_MARKER = "AU_yqL";
	/**
	 * Prefix of older identifiers, which may still carry the target URL inline.
	 */
	public static final String LEGACY_FORMAT_MARKER = "CBM";

	public static final String BATCH_EXECUTE_PATH = "/_/DotsSplashUi/data/batchexecute";
	public static final String BATCH_RPC_ID = "Fbv4je";
	public static final String BATCH_REQUEST_TAG = "garturlreq";

	public static final String SIGNED_CONTAINER_SELECTOR = "c-wiz > div";
	public static final String SIGNATURE_ATTRIBUTE = "data-n-a-sg";
	public static final String TIMESTAMP_ATTRIBUTE = "data-n-a-ts";

	public static final String SNAPSHOT_VERSION = "1.0";

	public static String articleUrl(String baseUrl, String articleId) {
		return baseUrl + ARTICLE_PATH + articleId;
	}

	public static String rssArticleUrl(String baseUrl, String articleId) {
		return baseUrl + RSS_ARTICLE_PATH + articleId;
	}
}
