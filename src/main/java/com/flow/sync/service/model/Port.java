package com.flow.sync.service.model;

/**
 * Addressable connection point of a node.
 */
public record Port(String id, String label, PortDirection direction) {

    public static Port input(String id, String label) {
        return new Port(id, label, PortDirection.INPUT);
    }

    public static Port output(String id, String label) {
        return new Port(id, label, PortDirection.OUTPUT);
    }
}
