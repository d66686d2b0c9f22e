package com.deepansh.collab.ws;

import com.deepansh.collab.exception.CollabException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;

/**
 * Binds an event payload to its request type and runs Bean Validation on it.
 * Any failure surfaces as {@code BadRequest}.
 */
@Component
@RequiredArgsConstructor
public class PayloadBinder {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public <T> T bind(JsonNode payload, Class<T> type) {
        if (payload == null || payload.isNull() || !payload.isObject()) {
            throw CollabException.badRequest("payload must be a JSON object");
        }
        T request;
        try {
            request = objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw CollabException.badRequest("Malformed payload: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw CollabException.badRequest("Malformed payload: " + e.getMessage());
        }

        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String msg = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .findFirst()
                    .orElse("Validation failed");
            throw CollabException.badRequest(msg);
        }
        return request;
    }
}
