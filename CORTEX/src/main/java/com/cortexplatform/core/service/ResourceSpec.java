package com.cortexplatform.core.service;

import com.cortexplatform.core.service.schema.UriTemplate;

/**
 * A resource declared by a service, addressed by a URI template such as
 * {@code history/{conversation_id}}.
 */
public record ResourceSpec(UriTemplate template, String description) {

    public String uriTemplate() {
        return template.getTemplate();
    }
}
