/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.compiler.resolution;

import com.saga.eventengine.api.ITemplateStore;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.compiler.TemplateLookup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Flattens a template's {@code extends} chain and applies its mixins.
 *
 * <p>Resolution steps:
 * <ol>
 *   <li>Collect ancestors depth-first, each at most once. The visited set starts with the
 *       template itself, so cycles terminate. Ancestors are ordered most distant first.</li>
 *   <li>Merge the raw ancestors in that order, then the template, with
 *       {@link TemplateMerger#inherit} semantics.</li>
 *   <li>Apply the template's own mixins in declaration order with
 *       {@link TemplateMerger#applyMixin} semantics. Ancestors' mixins are not applied.</li>
 * </ol>
 *
 * <p>Missing ancestors and mixins are logged and skipped.
 */
public class InheritanceResolver {

    private static final Logger logger = Logger.getLogger(InheritanceResolver.class.getName());

    private final TemplateLookup lookup;

    public InheritanceResolver(TemplateLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * @param template    the template to resolve
     * @param templateKey its store key, used for cycle detection and namespace-relative lookups (may be null)
     */
    public Template resolve(Template template, String templateKey) {
        List<Template> ancestors = ancestorChain(template, templateKey);

        Template resolved = template;
        if (!ancestors.isEmpty()) {
            Template accumulated = ancestors.get(0);
            for (int i = 1; i < ancestors.size(); i++) {
                accumulated = TemplateMerger.inherit(accumulated, ancestors.get(i));
            }
            resolved = TemplateMerger.inherit(accumulated, template);
        }

        for (String mixinId : template.mixins()) {
            Optional<TemplateLookup.ResolvedTemplate> mixin = lookup.resolve(mixinId, templateKey);
            if (mixin.isEmpty()) {
                logger.warning(String.format("Mixin '%s' of template '%s' not found, skipping",
                        mixinId, template.id()));
                continue;
            }
            resolved = TemplateMerger.applyMixin(resolved, mixin.get().template());
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Resolved template '%s': %d ancestors, %d mixins",
                    template.id(), ancestors.size(), template.mixins().size()));
        }
        return resolved;
    }

    /**
     * Ancestors of {@code template}, most distant first.
     */
    public List<Template> ancestorChain(Template template, String templateKey) {
        Set<String> visited = new HashSet<>();
        if (templateKey != null) {
            visited.add(templateKey);
        } else if (template.id() != null) {
            visited.add(ITemplateStore.customKey(template.id()));
        }
        List<Template> chain = new ArrayList<>();
        collect(template.parents(), templateKey, template.id(), visited, chain);
        return chain;
    }

    private void collect(List<String> parentIds, String referencingKey, String referencingId,
                         Set<String> visited, List<Template> chain) {
        for (String parentId : parentIds) {
            Optional<TemplateLookup.ResolvedTemplate> parent = lookup.resolve(parentId, referencingKey);
            if (parent.isEmpty()) {
                logger.warning(String.format("Parent '%s' of template '%s' not found, skipping",
                        parentId, referencingId));
                continue;
            }
            String parentKey = parent.get().key();
            if (!visited.add(parentKey)) {
                continue;
            }
            Template parentTemplate = parent.get().template();
            collect(parentTemplate.parents(), parentKey, parentTemplate.id(), visited, chain);
            chain.add(parentTemplate);
        }
    }
}
