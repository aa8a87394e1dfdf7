package io.tagkeeper.engine;

import java.util.Optional;

/**
 * Readability check for a record payload, used to detect corrupted stores.
 */
@FunctionalInterface
public interface PayloadCheck {
    PayloadCheck ACCEPT_ALL = payload -> Optional.empty();

    /** @return a description of the problem, or empty when the payload is readable */
    Optional<String> inspect(String payload);
}
