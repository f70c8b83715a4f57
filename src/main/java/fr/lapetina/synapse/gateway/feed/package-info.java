/**
 * Operator terminal feed.
 *
 * <p>{@link fr.lapetina.synapse.gateway.feed.TerminalFeed} keeps a bounded history of
 * sanitized log lines and streams new ones to subscribers. Log lines enter through
 * {@link fr.lapetina.synapse.gateway.feed.TerminalFeedAppender}; replicas exchange
 * lines through a {@link fr.lapetina.synapse.gateway.feed.FeedDistributor} such as the
 * Redis bus in the {@code bus} subpackage.
 */
package fr.lapetina.synapse.gateway.feed;
