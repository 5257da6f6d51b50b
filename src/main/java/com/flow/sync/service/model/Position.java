package com.flow.sync.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Canvas coordinates of a node.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
