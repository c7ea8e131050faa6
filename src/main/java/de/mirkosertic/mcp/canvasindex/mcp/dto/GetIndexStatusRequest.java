package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the getIndexStatus tool.
 */
public record GetIndexStatusRequest(
        @Nullable
        @Description("If true, fetch a fresh inventory from Canvas before reporting. "
                + "Default is false (reuse the last computed plan if there is one).")
        Boolean refresh
) {
    public static GetIndexStatusRequest fromMap(final Map<String, Object> args) {
        return new GetIndexStatusRequest(RequestArguments.optionalBoolean(args, "refresh"));
    }

    public boolean effectiveRefresh() {
        return refresh != null && refresh;
    }
}
