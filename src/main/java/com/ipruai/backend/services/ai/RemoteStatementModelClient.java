package com.ipruai.backend.services.ai;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ipruai.backend.services.emails.parsers.IdentifierKind;
import com.ipruai.backend.services.emails.parsers.NormalizedText;

import lombok.extern.slf4j.Slf4j;

/**
 * Client for a model-serving endpoint ({@code POST {baseUrl}/predict}).
 */
@Slf4j
public class RemoteStatementModelClient implements StatementModelClient {

    private static final String DEFAULT_BASE_URL = "http://localhost:8000";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RemoteStatementModelClient(String baseUrl, Duration timeout) {
        this(baseUrl, createDefaultRestTemplate(timeout));
    }

    RemoteStatementModelClient(String baseUrl, RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
        String url = (baseUrl != null && !baseUrl.isBlank()) ? baseUrl.trim() : DEFAULT_BASE_URL;
        if (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        this.baseUrl = url;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String version() {
        return "remote";
    }

    @Override
    public ModelPrediction predict(NormalizedText text) {
        String url = baseUrl + "/predict";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<PredictRequest> request = new HttpEntity<>(
                new PredictRequest(text != null ? text.value() : ""), headers);

        try {
            ResponseEntity<PredictResponse> response = restTemplate.postForEntity(url, request, PredictResponse.class);
            PredictResponse body = response.getBody();
            if (body == null) {
                throw new StatementModelException("model service returned empty body", false, true, null);
            }
            return toPrediction(body);
        } catch (HttpStatusCodeException e) {
            String payload = e.getResponseBodyAsString();
            String msg = "model service error status=" + e.getStatusCode()
                    + " body=" + (payload.length() > 500 ? payload.substring(0, 500) : payload);
            throw new StatementModelException(msg, false, e.getStatusCode().is5xxServerError(), e);
        } catch (ResourceAccessException e) {
            boolean timedOut = e.getCause() instanceof SocketTimeoutException;
            throw new StatementModelException("model service unreachable: " + e.getMessage(), timedOut, true, e);
        } catch (RestClientException e) {
            throw new StatementModelException("model service call failed: " + e.getMessage(), false, false, e);
        }
    }

    private ModelPrediction toPrediction(PredictResponse body) {
        List<ModelPrediction.PredictedLabel> labels = body.labels() == null
                ? List.of()
                : body.labels().stream()
                        .filter(l -> l != null && l.category() != null && l.type() != null)
                        .map(l -> new ModelPrediction.PredictedLabel(
                                l.category(), l.type(), l.probability() != null ? l.probability() : 0.0))
                        .toList();

        Map<IdentifierKind, List<String>> identifiers = new EnumMap<>(IdentifierKind.class);
        if (body.identifiers() != null) {
            body.identifiers().forEach((key, values) -> IdentifierKind.fromKey(key)
                    .ifPresentOrElse(
                            kind -> identifiers.put(kind, values == null ? List.of() : List.copyOf(values)),
                            () -> log.debug("[StatementModel] Ignoring unknown identifier kind '{}'", key)));
        }

        LocalDate from = parseDate(body.fromDate());
        LocalDate to = parseDate(body.toDate());

        return new ModelPrediction(
                labels,
                body.confidence() != null ? body.confidence() : 0.0,
                identifiers,
                from,
                to,
                body.dateConfidence() != null ? body.dateConfidence() : 0.0,
                body.modelVersion() != null ? body.modelVersion() : version());
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.debug("[StatementModel] Ignoring unparseable date '{}'", value);
            return null;
        }
    }

    private static RestTemplate createDefaultRestTemplate(Duration timeout) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) timeout.toMillis());
        f.setReadTimeout((int) timeout.toMillis());
        return new RestTemplate(f);
    }

    record PredictRequest(String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PredictResponse(
            List<Label> labels,
            Double confidence,
            Map<String, List<String>> identifiers,
            @JsonProperty("from_date") String fromDate,
            @JsonProperty("to_date") String toDate,
            @JsonProperty("date_confidence") Double dateConfidence,
            @JsonProperty("model_version") String modelVersion
    ) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Label(String category, String type, Double probability) {
        }
    }
}
