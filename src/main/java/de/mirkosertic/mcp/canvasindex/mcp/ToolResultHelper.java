package de.mirkosertic.mcp.canvasindex.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Map;

/**
 * Turns response records into MCP tool results.
 * <p>
 * Every response record carries a {@code success} component; {@code success=false} marks the
 * result as an error for the client.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(isErrorResponse(response))
                .build();
    }

    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(
                        toJson(Map.of("success", false, "error", errorMessage)))))
                .isError(true)
                .build();
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            logger.error("Cannot serialize tool response of type {}", value.getClass().getName(), e);
            return "{\"success\":false,\"error\":\"Response could not be serialized\"}";
        }
    }

    static boolean isErrorResponse(final Object response) {
        if (!(response instanceof Record record)) {
            return false;
        }
        for (final RecordComponent component : record.getClass().getRecordComponents()) {
            if (!"success".equals(component.getName())) {
                continue;
            }
            try {
                return Boolean.FALSE.equals(component.getAccessor().invoke(record));
            } catch (final IllegalAccessException | InvocationTargetException e) {
                logger.warn("Cannot read success flag of {}: {}", record.getClass().getSimpleName(), e.getMessage());
                return false;
            }
        }
        return false;
    }
}
