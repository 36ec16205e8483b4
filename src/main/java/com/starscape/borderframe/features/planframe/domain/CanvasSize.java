package com.starscape.borderframe.features.planframe.domain;

import com.starscape.borderframe.common.domain.ValueObject;

public record CanvasSize(
    int width,
    int height
) implements ValueObject {

    public CanvasSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive");
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
