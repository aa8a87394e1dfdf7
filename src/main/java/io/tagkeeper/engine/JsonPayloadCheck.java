package io.tagkeeper.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import io.tagkeeper.util.Jsons;

import java.util.Optional;

/** A payload is readable when it is absent or parses as a single JSON document. */
public final class JsonPayloadCheck implements PayloadCheck {
    // Appended bytes after a valid document count as corruption.
    private static final ObjectReader STRICT = Jsons.compactMapper().reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @Override
    public Optional<String> inspect(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        if (payload.isBlank()) {
            return Optional.of("empty payload");
        }
        try {
            JsonNode node = STRICT.readTree(payload);
            if (node == null || node.isMissingNode()) {
                return Optional.of("empty payload");
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.of(e.getOriginalMessage());
        }
    }
}
