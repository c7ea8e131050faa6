package de.mirkosertic.mcp.canvasindex.mcp.dto;

/**
 * Response DTO for the resetInaccessible tool.
 */
public record ResetInaccessibleResponse(
        boolean success,
        Integer cleared,
        String message,
        String error
) {
    public static ResetInaccessibleResponse success(final int cleared) {
        return new ResetInaccessibleResponse(true, cleared,
                cleared + " inaccessible file(s) will be attempted again on the next sync.", null);
    }

    public static ResetInaccessibleResponse error(final String errorMessage) {
        return new ResetInaccessibleResponse(false, null, null, errorMessage);
    }
}
