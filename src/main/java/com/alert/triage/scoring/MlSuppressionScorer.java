package com.alert.triage.scoring;

import com.alert.triage.domain.Alert;
import com.alert.triage.domain.SuppressionScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks the ML service how likely an alert is to be noise. Understands two response shapes:
 * <ul>
 *   <li>{@code {"probability": 0.9, "confidence": 0.95, "explanation": "..."}}</li>
 *   <li>classifier output {@code {"predicted_label": "suppress", "predicted_label_probs":
 *   [{"label": "suppress", "prob": 0.9}, ...]}}; probability is that of the suppress-like label,
 *   confidence that of the predicted label</li>
 * </ul>
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "alerting.ml.enabled", havingValue = "true", matchIfMissing = false)
public class MlSuppressionScorer implements SuppressionScorer {

    private static final int MAX_HISTORY_SENT = 20;

    private final RestTemplate restTemplate;
    private final String mlServiceUrl;

    @Autowired
    public MlSuppressionScorer(@Value("${alerting.ml.service.url:http://localhost:5000/predict}") String mlServiceUrl,
                               @Value("${alerting.ml.service.timeout:2000}") int timeoutMs) {
        this(buildRestTemplate(timeoutMs), mlServiceUrl);
    }

    MlSuppressionScorer(RestTemplate restTemplate, String mlServiceUrl) {
        this.restTemplate = restTemplate;
        this.mlServiceUrl = mlServiceUrl;
    }

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public SuppressionScore score(Alert alert, List<Alert> history) {
        Map<?, ?> response;
        try {
            response = restTemplate.postForObject(mlServiceUrl, buildRequest(alert, history), Map.class);
        } catch (RestClientException e) {
            throw new ScoringUnavailableException("ML service call failed for alert " + alert.getId() + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ScoringUnavailableException("ML service returned an empty body for alert " + alert.getId());
        }
        SuppressionScore score = response.containsKey("probability")
                ? fromProbability(response)
                : fromClassifierOutput(response);
        log.debug("ML service scored alertId={} probability={} confidence={}",
                alert.getId(), score.getProbability(), score.getConfidence());
        return score;
    }

    private Map<String, Object> buildRequest(Alert alert, List<Alert> history) {
        Map<String, Object> request = new HashMap<>();
        request.put("alert_id", alert.getId());
        request.put("source", alert.getSource());
        request.put("host", alert.getHost());
        request.put("title", alert.getTitle());
        request.put("category", alert.getCategory());
        request.put("severity", alert.getSeverity().name().toLowerCase(Locale.ROOT));
        request.put("status", alert.getStatus());
        request.put("created_at", alert.getTimestamp().toString());
        request.put("resolved_at", alert.getResolvedAt() != null ? alert.getResolvedAt().toString() : null);
        ZonedDateTime utc = alert.getTimestamp().atZone(ZoneOffset.UTC);
        request.put("hour_of_day", utc.getHour());
        request.put("day_of_week", utc.getDayOfWeek().getValue() - 1);

        List<Map<String, Object>> past = new ArrayList<>();
        int from = Math.max(0, history.size() - MAX_HISTORY_SENT);
        for (Alert a : history.subList(from, history.size())) {
            Map<String, Object> item = new HashMap<>();
            item.put("created_at", a.getTimestamp().toString());
            item.put("severity", a.getSeverity().name().toLowerCase(Locale.ROOT));
            item.put("status", a.getStatus());
            item.put("resolved_at", a.getResolvedAt() != null ? a.getResolvedAt().toString() : null);
            past.add(item);
        }
        request.put("history_count", history.size());
        request.put("history", past);
        return request;
    }

    private static SuppressionScore fromProbability(Map<?, ?> response) {
        double probability = toUnit(response.get("probability"), "probability");
        double confidence = response.containsKey("confidence") ? toUnit(response.get("confidence"), "confidence") : 1.0;
        Object explanation = response.get("explanation");
        return SuppressionScore.builder()
                .probability(probability)
                .confidence(confidence)
                .explanation(explanation != null ? explanation.toString() : "")
                .build();
    }

    private static SuppressionScore fromClassifierOutput(Map<?, ?> response) {
        Object label = response.get("predicted_label");
        Object probs = response.get("predicted_label_probs");
        if (label == null || !(probs instanceof List)) {
            throw new ScoringUnavailableException("ML service response has neither probability nor predicted_label_probs");
        }
        double suppressProb = 0.0;
        double predictedProb = 0.0;
        for (Object entry : (List<?>) probs) {
            if (!(entry instanceof Map)) continue;
            Map<?, ?> item = (Map<?, ?>) entry;
            if (item.get("label") == null) continue;
            String entryLabel = item.get("label").toString();
            double prob = toUnit(item.get("prob"), "prob");
            if (entryLabel.toLowerCase(Locale.ROOT).startsWith("suppress")) {
                suppressProb = Math.max(suppressProb, prob);
            }
            if (entryLabel.equals(label.toString())) {
                predictedProb = prob;
            }
        }
        return SuppressionScore.builder()
                .probability(suppressProb)
                .confidence(predictedProb)
                .explanation("predicted_label=" + label)
                .build();
    }

    private static double toUnit(Object value, String field) {
        if (value == null) {
            throw new ScoringUnavailableException("ML service response missing " + field);
        }
        double d;
        try {
            d = value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ScoringUnavailableException("ML service returned non-numeric " + field + ": " + value, e);
        }
        if (Double.isNaN(d)) {
            throw new ScoringUnavailableException("ML service returned NaN " + field);
        }
        return Math.max(0.0, Math.min(1.0, d));
    }
}
