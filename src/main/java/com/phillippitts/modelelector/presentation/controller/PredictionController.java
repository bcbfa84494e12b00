package com.phillippitts.modelelector.presentation.controller;

import com.phillippitts.modelelector.config.logging.MdcFilter;
import com.phillippitts.modelelector.domain.Decision;
import com.phillippitts.modelelector.domain.PredictionFeatures;
import com.phillippitts.modelelector.exception.NoBackendAvailableException;
import com.phillippitts.modelelector.service.election.ElectionService;
import com.phillippitts.modelelector.service.election.PredictionPayloadDecoder;
import com.phillippitts.modelelector.service.registry.BackendRegistry;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound prediction endpoint. Elects one backend answer and returns it verbatim.
 */
@RestController
class PredictionController {

    private static final Logger LOG = LogManager.getLogger(PredictionController.class);

    private final ElectionService electionService;
    private final BackendRegistry registry;

    PredictionController(ElectionService electionService, BackendRegistry registry) {
        this.electionService = electionService;
        this.registry = registry;
    }

    @PostMapping(value = "/predict", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> predict(@Valid @RequestBody PredictionFeatures features) {
        LOG.info("Prediction request received: s_l={}, s_w={}, p_l={}, p_w={}",
                features.sepalLength(), features.sepalWidth(), features.petalLength(), features.petalWidth());
        Decision decision = electionService.elect(features);
        if (!decision.isSelected()) {
            throw new NoBackendAvailableException(registry.size());
        }
        ThreadContext.put(MdcFilter.MDC_ELECTED_BACKEND, decision.source().name());
        String body = PredictionPayloadDecoder.decode(decision);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Elected-Backend", decision.source().name())
                .body(body);
    }
}
