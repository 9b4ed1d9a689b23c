package com.cortexplatform.core.service.inprocess;

import com.cortexplatform.core.config.CortexProperties;
import com.cortexplatform.core.service.ConnectionException;
import com.cortexplatform.core.service.McpException;
import com.cortexplatform.core.service.RemoteException;
import com.cortexplatform.core.service.ResourceNotFoundException;
import com.cortexplatform.core.service.ResourceSpec;
import com.cortexplatform.core.service.ServiceClient;
import com.cortexplatform.core.service.ServiceDescriptor;
import com.cortexplatform.core.service.ToolNotSupportedException;
import com.cortexplatform.core.service.ToolSpec;
import com.cortexplatform.core.service.ValidationException;
import com.cortexplatform.core.service.schema.ToolSchema;
import com.cortexplatform.core.service.schema.UriTemplate;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Base class for services hosted in the same process.
 *
 * <p>Subclasses declare their tools and resources in their constructor through
 * {@link #registerTool} and {@link #registerResource}. The base class validates arguments,
 * retries transient failures with exponential backoff and enforces the caller's deadline
 * across all attempts.
 */
@Slf4j
public abstract class InProcessServiceClient implements ServiceClient {

    /**
     * Implementation of one tool.
     */
    @FunctionalInterface
    public interface ToolHandler {
        Mono<Map<String, Object>> handle(Map<String, Object> arguments);
    }

    /**
     * Implementation of one resource.
     */
    @FunctionalInterface
    public interface ResourceHandler {
        Mono<Map<String, Object>> read(Map<String, String> parameters);
    }

    private record ToolRegistration(ToolSpec spec, ToolHandler handler) {
    }

    private record ResourceRegistration(ResourceSpec spec, ResourceHandler handler) {
    }

    private final String name;
    private final Map<String, ToolRegistration> tools = new LinkedHashMap<>();
    private final Map<String, ResourceRegistration> resources = new LinkedHashMap<>();
    private final Retry retry;
    private final AtomicBoolean connected = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    protected InProcessServiceClient(String name, CortexProperties.RetryProperties retryConfig) {
        this.name = name;
        this.retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(retryConfig.getMaxRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        retryConfig.getInitialBackoff(),
                        retryConfig.getMultiplier(),
                        retryConfig.getJitter()))
                .retryOnException(InProcessServiceClient::isRetryable)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying call on {} (attempt {}): {}", name, event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof RemoteException remote && remote.isTransient();
    }

    protected final void registerTool(String toolName, String description, ToolSchema schema, ToolHandler handler) {
        if (tools.putIfAbsent(toolName, new ToolRegistration(new ToolSpec(toolName, description, schema), handler)) != null) {
            throw new IllegalStateException("Duplicate tool '" + toolName + "' on service " + name);
        }
    }

    protected final void registerResource(String uriTemplate, String description, ResourceHandler handler) {
        ResourceSpec spec = new ResourceSpec(UriTemplate.of(uriTemplate), description);
        if (resources.putIfAbsent(uriTemplate, new ResourceRegistration(spec, handler)) != null) {
            throw new IllegalStateException("Duplicate resource '" + uriTemplate + "' on service " + name);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ServiceDescriptor describe() {
        return ServiceDescriptor.inProcess(name);
    }

    @Override
    public Mono<Void> connect() {
        return Mono.fromRunnable(() -> {
            if (closed.get()) {
                throw new ConnectionException(name, "Client for '" + name + "' is closed");
            }
            if (connected.compareAndSet(false, true)) {
                onConnect();
                log.info("Connected to in-process service: {}", name);
            }
        });
    }

    @Override
    public boolean isConnected() {
        return connected.get() && !closed.get();
    }

    @Override
    public Mono<Map<String, Object>> callTool(String toolName, Map<String, Object> arguments, Duration deadline) {
        return Mono.defer(() -> {
            ToolRegistration tool = tools.get(toolName);
            if (tool == null) {
                return Mono.error(new ToolNotSupportedException(name, toolName));
            }
            Map<String, Object> args = arguments != null ? arguments : Map.of();
            List<String> violations = tool.spec().schema().validate(args);
            if (!violations.isEmpty()) {
                return Mono.error(new ValidationException(name, violations));
            }
            return invoke("Tool '" + toolName + "'", () -> tool.handler().handle(args), deadline);
        });
    }

    @Override
    public Mono<Map<String, Object>> readResource(String uriTemplate, Map<String, String> parameters,
                                                  Duration deadline) {
        return Mono.defer(() -> {
            Map<String, String> params = new HashMap<>(parameters != null ? parameters : Map.of());
            ResourceRegistration resource = resources.get(uriTemplate);
            if (resource == null) {
                Optional<ResourceRegistration> matched = matchConcreteUri(uriTemplate, params);
                if (matched.isEmpty()) {
                    return Mono.error(new ResourceNotFoundException(name, uriTemplate));
                }
                resource = matched.get();
            }
            List<String> missing = resource.spec().template().missingParameters(params);
            if (!missing.isEmpty()) {
                return Mono.error(new ValidationException(name, "missing template parameters " + missing));
            }
            ResourceHandler handler = resource.handler();
            return invoke("Resource '" + uriTemplate + "'", () -> handler.read(params), deadline);
        });
    }

    private Optional<ResourceRegistration> matchConcreteUri(String uri, Map<String, String> params) {
        for (ResourceRegistration registration : resources.values()) {
            Optional<Map<String, String>> values = registration.spec().template().match(uri);
            if (values.isPresent()) {
                values.get().forEach(params::putIfAbsent);
                return Optional.of(registration);
            }
        }
        return Optional.empty();
    }

    private Mono<Map<String, Object>> invoke(String operation, Supplier<Mono<Map<String, Object>>> call,
                                             Duration deadline) {
        Mono<Map<String, Object>> attempt = ensureConnected()
                .then(Mono.defer(call))
                .onErrorMap(e -> !(e instanceof McpException),
                        e -> RemoteException.permanent(name, operation + " failed: " + e.getMessage(), e));

        return attempt
                .transformDeferred(RetryOperator.of(retry))
                .timeout(deadline)
                .onErrorMap(TimeoutException.class, e -> RemoteException.timeout(name, operation, deadline));
    }

    private Mono<Void> ensureConnected() {
        if (closed.get()) {
            return Mono.error(new ConnectionException(name, "Client for '" + name + "' is closed"));
        }
        return connected.get() ? Mono.empty() : connect();
    }

    @Override
    public Mono<Boolean> probe() {
        if (closed.get()) {
            return Mono.just(false);
        }
        return ensureConnected().then(Mono.defer(this::checkHealth));
    }

    /**
     * Service-specific health check. Healthy unless overridden.
     */
    protected Mono<Boolean> checkHealth() {
        return Mono.just(true);
    }

    /**
     * Hook invoked once on first connect.
     */
    protected void onConnect() {
    }

    /**
     * Hook invoked once on close.
     */
    protected void onClose() {
    }

    @Override
    public List<ToolSpec> listTools() {
        return tools.values().stream().map(ToolRegistration::spec).toList();
    }

    @Override
    public List<ResourceSpec> listResources() {
        return resources.values().stream().map(ResourceRegistration::spec).toList();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            connected.set(false);
            onClose();
            log.info("Closed in-process service client: {}", name);
        }
    }
}
