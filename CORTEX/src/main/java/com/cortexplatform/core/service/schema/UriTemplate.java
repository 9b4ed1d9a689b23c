package com.cortexplatform.core.service.schema;

import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resource address with {@code {name}} placeholders, e.g.
 * {@code message/{conversation_id}/{message_id}}.
 *
 * <p>Parsing, expansion and matching are delegated to Spring's
 * {@link org.springframework.web.util.UriTemplate}. Each variable stands for exactly one path
 * segment, so expanded values are strictly encoded ({@code /} included).
 */
public final class UriTemplate {

    private final String template;
    private final org.springframework.web.util.UriTemplate delegate;

    private UriTemplate(String template) {
        this.template = template;
        this.delegate = new org.springframework.web.util.UriTemplate(template);
    }

    public static UriTemplate of(String template) {
        Objects.requireNonNull(template, "template");
        return new UriTemplate(template);
    }

    public String getTemplate() {
        return template;
    }

    public List<String> getVariables() {
        return delegate.getVariableNames();
    }

    /**
     * Template variables with no (or a blank) value in {@code parameters}.
     */
    public List<String> missingParameters(Map<String, String> parameters) {
        Map<String, String> params = parameters != null ? parameters : Map.of();
        List<String> missing = new ArrayList<>();
        for (String name : getVariables()) {
            String value = params.get(name);
            if (value == null || value.isBlank()) {
                missing.add(name);
            }
        }
        return missing;
    }

    /**
     * Substitute every placeholder with its URL-encoded value.
     *
     * @throws IllegalArgumentException if a variable has no value
     */
    public String expand(Map<String, String> parameters) {
        List<String> missing = missingParameters(parameters);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing template parameters " + missing + " for " + template);
        }
        return UriComponentsBuilder.fromUriString(template)
                .encode()
                .buildAndExpand(parameters)
                .toUriString();
    }

    /**
     * Extract decoded variable values from a concrete URI produced by this template.
     */
    public Optional<Map<String, String>> match(String uri) {
        if (uri == null || !delegate.matches(uri)) {
            return Optional.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : delegate.match(uri).entrySet()) {
            String raw = entry.getValue();
            if (raw.isEmpty() || raw.indexOf('/') >= 0) {
                return Optional.empty();
            }
            values.put(entry.getKey(), UriUtils.decode(raw, StandardCharsets.UTF_8));
        }
        return Optional.of(values);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UriTemplate other && template.equals(other.template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }
}
