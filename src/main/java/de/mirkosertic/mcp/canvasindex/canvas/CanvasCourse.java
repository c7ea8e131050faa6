package de.mirkosertic.mcp.canvasindex.canvas;

import org.jspecify.annotations.Nullable;

/**
 * An active course enrollment.
 *
 * @param id         Canvas course id
 * @param name       course name, never null (falls back to {@code Course_<id>})
 * @param courseCode short course code, if Canvas provides one
 */
public record CanvasCourse(long id, String name, @Nullable String courseCode) {
}
