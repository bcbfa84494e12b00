/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.modelelector.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId} into MDC for every HTTP request</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [backend-call-1] [requestId] INFO logger.name - message
 * </pre>
 *
 * @see com.phillippitts.modelelector.config.ThreadPoolConfig
 */
package com.phillippitts.modelelector.config.logging;
