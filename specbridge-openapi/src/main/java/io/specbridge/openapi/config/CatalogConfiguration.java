package io.specbridge.openapi.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Top level configuration. Either a list of <code>servers</code>, or the single-server layout with top level
 * <code>api</code>, <code>tool_generation</code> and <code>server</code> blocks.
 */
@Value
@Builder
@Jacksonized
public class CatalogConfiguration {

    /**
     * Name and description of the single server in the single-server layout
     */
    @Value
    @Builder
    @Jacksonized
    public static class ServerInfo {
        String name;
        String description;
    }

    @JsonAlias("mcp_servers")
    List<ApiServerConfig> servers;

    OpenApiSourceConfig api;

    @JsonProperty("tool_generation")
    ToolGenerationConfig toolGeneration;

    @JsonAlias("mcp_server")
    ServerInfo server;

    /**
     * Enabled servers of all types. The single-server layout is used only if no <code>servers</code> are listed.
     * A top level <code>tool_generation</code> block applies to every server that has none of its own.
     */
    public List<ApiServerConfig> enabledServers() {
        if (null != servers && !servers.isEmpty()) {
            return servers.stream()
                    .filter(ApiServerConfig::isEnabled)
                    .map(server -> null == server.getToolGeneration() && null != toolGeneration
                                   ? server.withToolGeneration(toolGeneration)
                                   : server)
                    .toList();
        }
        if (null == api) {
            return List.of();
        }
        final var info = Objects.requireNonNullElseGet(server, () -> ServerInfo.builder().build());
        return List.of(ApiServerConfig.builder()
                               .name(info.getName())
                               .description(info.getDescription())
                               .openapi(api)
                               .toolGeneration(toolGeneration)
                               .build());
    }
}
