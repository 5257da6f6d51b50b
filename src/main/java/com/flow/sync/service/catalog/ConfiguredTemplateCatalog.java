package com.flow.sync.service.catalog;

import com.flow.sync.service.config.SyncConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template catalog backed by the configured template IDs plus any
 * registered at runtime.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredTemplateCatalog implements TemplateCatalog {

    private final SyncConfig syncConfig;

    private final Set<String> templateIds = ConcurrentHashMap.newKeySet();

    @PostConstruct
    void init() {
        templateIds.addAll(syncConfig.getTemplates().getKnownIds());
        log.info("ConfiguredTemplateCatalog initialized with {} templates, validation enabled: {}",
                templateIds.size(), syncConfig.getTemplates().isValidationEnabled());
    }

    @Override
    public boolean templateExists(String templateId) {
        if (!syncConfig.getTemplates().isValidationEnabled()) return true;
        return templateId != null && templateIds.contains(templateId);
    }

    public void register(String templateId) {
        if (templateIds.add(templateId)) {
            log.debug("Template registered: {}", templateId);
        }
    }
}
