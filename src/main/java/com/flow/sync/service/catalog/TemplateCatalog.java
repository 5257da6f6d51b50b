package com.flow.sync.service.catalog;

/**
 * Read-only view of the node-template catalog.
 */
public interface TemplateCatalog {

    boolean templateExists(String templateId);
}
