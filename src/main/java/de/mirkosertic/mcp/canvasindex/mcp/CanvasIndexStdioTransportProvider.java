package de.mirkosertic.mcp.canvasindex.mcp;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * STDIO transport of the Canvas index server.
 * <p>
 * The SDK default offers only {@code 2024-11-05}; clients that speak a newer revision would
 * otherwise be downgraded. Revisions are offered newest first.
 */
public class CanvasIndexStdioTransportProvider extends StdioServerTransportProvider {

    static final List<String> OFFERED_REVISIONS = List.of(
            ProtocolVersions.MCP_2025_06_18,
            ProtocolVersions.MCP_2025_03_26,
            ProtocolVersions.MCP_2024_11_05
    );

    public CanvasIndexStdioTransportProvider(final McpJsonMapper jsonMapper) {
        super(jsonMapper);
    }

    /**
     * Transport over explicit streams instead of the process's stdin and stdout.
     */
    public CanvasIndexStdioTransportProvider(final McpJsonMapper jsonMapper, final InputStream in,
                                             final OutputStream out) {
        super(jsonMapper, in, out);
    }

    @Override
    public List<String> protocolVersions() {
        return OFFERED_REVISIONS;
    }
}
