/**
 * REST controllers: {@code POST /predict} and the static {@code GET /health} liveness probe.
 */
package com.phillippitts.modelelector.presentation.controller;
