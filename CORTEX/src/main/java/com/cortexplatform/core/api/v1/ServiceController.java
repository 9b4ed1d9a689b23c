package com.cortexplatform.core.api.v1;

import com.cortexplatform.core.api.dto.ServiceInfoResponse;
import com.cortexplatform.core.mcp.McpDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * REST controller listing registered services.
 */
@RestController
@RequestMapping("/api/v1/services")
@Tag(name = "Services", description = "Registered MCP services")
public class ServiceController {

    private final McpDispatcher dispatcher;

    public ServiceController(McpDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping
    @Operation(summary = "List services", description = "Registered services with status, tools and resources")
    @ApiResponse(responseCode = "200", description = "Services retrieved")
    public Flux<ServiceInfoResponse> listServices() {
        return Flux.defer(() -> Flux.fromIterable(dispatcher.listServices()))
                .map(ServiceInfoResponse::from);
    }
}
