/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.modelelector.config.ElectorConfig} - Wires backend discovery,
 *       the call executor, dispatcher, aggregator, selection policy and election service</li>
 *   <li>{@link com.phillippitts.modelelector.config.BackendClientConfig} - RestTemplate used for
 *       outbound prediction calls</li>
 *   <li>{@link com.phillippitts.modelelector.config.ThreadPoolConfig} - Executor that runs
 *       backend calls concurrently</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.modelelector.config;
