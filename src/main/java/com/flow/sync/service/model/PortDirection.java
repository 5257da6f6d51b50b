package com.flow.sync.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PortDirection {
    @JsonProperty("input")
    INPUT,
    @JsonProperty("output")
    OUTPUT
}
