package com.cortexplatform.core.mcp;

import com.cortexplatform.core.config.CortexProperties;
import com.cortexplatform.core.mcp.DispatchException.Kind;
import com.cortexplatform.core.service.ConnectionException;
import com.cortexplatform.core.service.McpException;
import com.cortexplatform.core.service.RemoteException;
import com.cortexplatform.core.service.ResourceNotFoundException;
import com.cortexplatform.core.service.ResourceSpec;
import com.cortexplatform.core.service.ServiceClient;
import com.cortexplatform.core.service.ServiceDescriptor;
import com.cortexplatform.core.service.ServiceNotFoundException;
import com.cortexplatform.core.service.ServiceRegistry;
import com.cortexplatform.core.service.ServiceStatus;
import com.cortexplatform.core.service.ToolNotSupportedException;
import com.cortexplatform.core.service.ToolSpec;
import com.cortexplatform.core.service.ValidationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Routes tool calls and resource reads to registered services.
 *
 * <p>Requests are checked before anything is sent: the service must be registered and
 * reachable, tool arguments must satisfy the tool schema and resource templates must be fully
 * parameterized. Every failure reaches the caller as a {@link DispatchException}.
 */
@Component
@Slf4j
public class McpDispatcher {

    private final ServiceRegistry registry;
    private final Duration defaultDeadline;
    private final MeterRegistry meterRegistry;
    private final Timer dispatchTimer;
    private final Counter dispatchCounter;

    @Autowired
    public McpDispatcher(ServiceRegistry registry, CortexProperties properties, MeterRegistry meterRegistry) {
        this(registry, properties.getDispatcher().getDefaultDeadline(), meterRegistry);
    }

    public McpDispatcher(ServiceRegistry registry, Duration defaultDeadline, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.defaultDeadline = defaultDeadline;
        this.meterRegistry = meterRegistry;
        this.dispatchTimer = Timer.builder("cortex.dispatch.latency")
                .description("Latency of dispatched tool calls and resource reads")
                .register(meterRegistry);
        this.dispatchCounter = Counter.builder("cortex.dispatch.calls")
                .description("Total dispatched tool calls and resource reads")
                .register(meterRegistry);
    }

    public Mono<Map<String, Object>> callTool(ToolCall call) {
        return callTool(call, defaultDeadline);
    }

    /**
     * Invoke a tool.
     *
     * @param call the tool call
     * @param deadline upper bound for the call
     * @return the tool result, or a {@link DispatchException}
     */
    public Mono<Map<String, Object>> callTool(ToolCall call, Duration deadline) {
        String service = call.service();
        return Mono.defer(() -> {
            ServiceClient client = resolveReachable(service);

            ToolSpec tool = client.listTools().stream()
                    .filter(t -> t.name().equals(call.name()))
                    .findFirst()
                    .orElseThrow(() -> new ToolNotSupportedException(service, call.name()));

            List<String> violations = tool.schema().validate(call.arguments());
            if (!violations.isEmpty()) {
                throw new ValidationException(service, violations);
            }

            log.debug("Dispatching tool {}/{}", service, call.name());
            return client.callTool(call.name(), call.arguments(), deadline);
        }).transform(mono -> instrument(mono, service, "tool " + call.name(), deadline));
    }

    public Mono<Map<String, Object>> readResource(ResourceRequest request) {
        return readResource(request, defaultDeadline);
    }

    /**
     * Read a resource.
     *
     * @param request the resource request
     * @param deadline upper bound for the read
     * @return the resource content, or a {@link DispatchException}
     */
    public Mono<Map<String, Object>> readResource(ResourceRequest request, Duration deadline) {
        String service = request.service();
        String template = stripServicePrefix(service, request.uriTemplate());
        return Mono.defer(() -> {
            ServiceClient client = resolveReachable(service);

            ResourceSpec resource = client.listResources().stream()
                    .filter(r -> r.uriTemplate().equals(template))
                    .findFirst()
                    .orElseThrow(() -> new ResourceNotFoundException(service, template));

            List<String> missing = resource.template().missingParameters(request.parameters());
            if (!missing.isEmpty()) {
                throw new ValidationException(service, "missing template parameters " + missing);
            }

            String uri = resource.template().expand(request.parameters());
            log.debug("Dispatching resource read {}/{}", service, uri);
            return client.readResource(uri, request.parameters(), deadline);
        }).transform(mono -> instrument(mono, service, "resource " + template, deadline));
    }

    /**
     * Summary of every registered service.
     */
    public List<ServiceSummary> listServices() {
        return registry.descriptors().stream()
                .map(descriptor -> {
                    ServiceClient client = registry.resolve(descriptor.name());
                    return new ServiceSummary(descriptor, client.listTools(), client.listResources());
                })
                .toList();
    }

    private ServiceClient resolveReachable(String service) {
        ServiceClient client = registry.resolve(service);
        Optional<ServiceDescriptor> descriptor = registry.descriptor(service);
        if (descriptor.map(d -> d.status() == ServiceStatus.UNREACHABLE).orElse(false)) {
            throw new DispatchException(Kind.UNAVAILABLE, service, "Service is unreachable");
        }
        return client;
    }

    private static String stripServicePrefix(String service, String uriTemplate) {
        String prefix = service + "/";
        return uriTemplate.startsWith(prefix) ? uriTemplate.substring(prefix.length()) : uriTemplate;
    }

    private Mono<Map<String, Object>> instrument(Mono<Map<String, Object>> mono, String service,
                                                 String operation, Duration deadline) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            dispatchCounter.increment();
            return mono
                    .timeout(deadline)
                    .onErrorMap(e -> translate(service, operation, deadline, e))
                    .doOnError(DispatchException.class, e -> {
                        meterRegistry.counter("cortex.dispatch.failures", "kind", e.getKind().name()).increment();
                        log.warn("Dispatch of {} on {} failed: {}", operation, service, e.getMessage());
                    })
                    .doFinally(signal -> dispatchTimer.record(Duration.ofNanos(System.nanoTime() - start)));
        });
    }

    static DispatchException translate(String service, String operation, Duration deadline, Throwable e) {
        if (e instanceof DispatchException dispatch) {
            return dispatch;
        }
        if (e instanceof ServiceNotFoundException
                || e instanceof ToolNotSupportedException
                || e instanceof ResourceNotFoundException) {
            return new DispatchException(Kind.NOT_FOUND, service, e.getMessage(), e);
        }
        if (e instanceof ValidationException) {
            return new DispatchException(Kind.INVALID, service, e.getMessage(), e);
        }
        if (e instanceof ConnectionException) {
            return new DispatchException(Kind.UNAVAILABLE, service, e.getMessage(), e);
        }
        if (e instanceof RemoteException remote) {
            if (remote.isTimeout()) {
                return new DispatchException(Kind.REMOTE, service, e.getMessage(), e);
            }
            if (remote.isTransient()) {
                return new DispatchException(Kind.UNAVAILABLE, service,
                        "Retries exhausted: " + e.getMessage(), e);
            }
            return new DispatchException(Kind.REMOTE, service, e.getMessage(), e);
        }
        if (e instanceof TimeoutException) {
            return new DispatchException(Kind.REMOTE, service,
                    operation + " exceeded deadline of " + deadline.toMillis() + "ms", e);
        }
        if (e instanceof McpException) {
            return new DispatchException(Kind.REMOTE, service, e.getMessage(), e);
        }
        return new DispatchException(Kind.REMOTE, service, "Unexpected failure: " + e, e);
    }
}
