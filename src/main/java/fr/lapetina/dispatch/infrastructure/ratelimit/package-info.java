/**
 * Per-key rate limiting with token bucket and sliding window algorithms.
 */
package fr.lapetina.dispatch.infrastructure.ratelimit;
