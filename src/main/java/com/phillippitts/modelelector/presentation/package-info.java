/**
 * Presentation layer (HTTP boundary).
 *
 * <p>Controllers stay thin: they validate input, delegate to
 * {@link com.phillippitts.modelelector.service.election.ElectionService}, and map the decision to a
 * response. All error mapping lives in
 * {@link com.phillippitts.modelelector.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.modelelector.presentation;
