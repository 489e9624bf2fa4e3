package com.agentrelay.orchestrator.api;

import com.agentrelay.orchestrator.api.dto.ValidateContentRequest;
import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityGateService;
import com.agentrelay.orchestrator.quality.QualityStats;
import com.agentrelay.orchestrator.quality.ValidationRequest;
import com.agentrelay.orchestrator.quality.ValidationResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for the quality gate.
 *
 * POST /quality/validate        - score one piece of content
 * POST /quality/validate/batch  - score several, results in request order
 * GET  /quality/stats           - stats over recent validations, optionally per content type
 */
@RestController
@RequestMapping("/quality")
public class QualityController {

    private final QualityGateService qualityGate;

    public QualityController(QualityGateService qualityGate) {
        this.qualityGate = qualityGate;
    }

    @PostMapping("/validate")
    public ValidationResult validate(@Valid @RequestBody ValidateContentRequest req) {
        return qualityGate.validate(toRequest(req));
    }

    @PostMapping("/validate/batch")
    public List<ValidationResult> validateBatch(@RequestBody List<@Valid ValidateContentRequest> reqs) {
        return qualityGate.validateBatch(reqs.stream().map(QualityController::toRequest).toList());
    }

    @GetMapping("/stats")
    public QualityStats stats(@RequestParam(required = false) String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return qualityGate.getQualityStats();
        }
        return qualityGate.getQualityStats(parse(contentType));
    }

    private static ValidationRequest toRequest(ValidateContentRequest req) {
        if (req.content() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "content is required");
        }
        try {
            return req.toValidationRequest();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown content type: " + req.contentType(), e);
        }
    }

    private static ContentType parse(String contentType) {
        try {
            return ContentType.fromValue(contentType);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown content type: " + contentType, e);
        }
    }
}
