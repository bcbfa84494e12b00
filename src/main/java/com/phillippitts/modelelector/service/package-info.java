/**
 * Election pipeline services.
 *
 * <p>Flow of one request:
 * <ol>
 *   <li>{@code registry} - backends resolved once at startup, exactly one primary</li>
 *   <li>{@code dispatch} - one concurrent call per backend via {@code call}</li>
 *   <li>{@code aggregate} - results gathered in completion order until the aggregate deadline</li>
 *   <li>{@code select} - primary preference, then first successful secondary</li>
 *   <li>{@code election} - coordinates the above and validates the selected payload</li>
 * </ol>
 */
package com.phillippitts.modelelector.service;
