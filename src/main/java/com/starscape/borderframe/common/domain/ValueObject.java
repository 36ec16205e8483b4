package com.starscape.borderframe.common.domain;

/**
 * Marker for immutable values compared by their content.
 */
public interface ValueObject {
}
