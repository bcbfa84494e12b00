/**
 * Immutable domain model of an election.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.modelelector.domain.BackendTarget} - one prediction backend,
 *       exactly one per registry is primary</li>
 *   <li>{@link com.phillippitts.modelelector.domain.CallResult} - tagged outcome of one call
 *       (success, timeout or error)</li>
 *   <li>{@link com.phillippitts.modelelector.domain.AggregateOutcome} - results collected in
 *       completion order before the aggregate deadline</li>
 *   <li>{@link com.phillippitts.modelelector.domain.Decision} - the selected payload, or no backend</li>
 * </ul>
 */
package com.phillippitts.modelelector.domain;
