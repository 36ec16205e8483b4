package com.starscape.borderframe.features.planframe.domain;

/**
 * How the configured border value is interpreted.
 */
public enum BorderMode {
    /** Border value is a pixel count. */
    FIXED,
    /** Border value is a unit scaled against the shorter image side. */
    PROPORTIONAL
}
