package com.overseer.dispatch.api;

import com.overseer.core.classifier.RequestClassifier;
import com.overseer.core.model.ClassificationResult;
import com.overseer.core.model.Dimension;
import com.overseer.core.model.Phase;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dry classification: scores a request and returns the plan it would get, without running it.
 */
@RestController
@RequestMapping("/api/v1/classify")
public class ClassifyController {

    private final RequestClassifier classifier;

    public ClassifyController(RequestClassifier classifier) {
        this.classifier = classifier;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> classify(@RequestBody WorkflowRequest body) {
        if (body.request() == null || body.request().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request text is required"));
        }
        ClassificationResult result = classifier.classify(body.toRequest());

        Map<String, Object> scores = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            scores.put(dimension.name().toLowerCase(), result.score().values().get(dimension));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("workflow_class", result.workflowClass().name());
        response.put("tier", result.tier().name());
        response.put("aggregate", result.score().aggregate());
        response.put("scores", scores);
        response.put("unscorable", result.score().unscorable());
        response.put("conservative", result.plan().conservative());
        response.put("phases", result.plan().phases().stream().map(Phase::name).toList());
        response.put("rule", result.rationale().rule());
        response.put("confidence", result.rationale().confidence());
        response.put("confidence_level", result.rationale().confidenceLevel());
        response.put("margin", result.rationale().margin());
        response.put("factors", result.rationale().factors());
        response.put("alternatives", result.rationale().alternatives().stream()
                .map(a -> Map.of("workflow_class", a.workflowClass().name(), "rule", a.rule(), "margin", a.margin()))
                .toList());
        return ResponseEntity.ok(response);
    }
}
