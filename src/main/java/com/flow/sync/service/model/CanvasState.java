package com.flow.sync.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Pan and zoom of a graph. Last write wins.
 */
public record CanvasState(double offsetX, double offsetY, double zoom) {

    public static final CanvasState DEFAULT = new CanvasState(0, 0, 1);

    @JsonIgnore
    public boolean isValid() {
        return Double.isFinite(offsetX) && Double.isFinite(offsetY)
                && Double.isFinite(zoom) && zoom > 0;
    }
}
