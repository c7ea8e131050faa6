package de.mirkosertic.mcp.canvasindex.inventory;

import de.mirkosertic.mcp.canvasindex.canvas.CanvasCourse;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of one inventory fetch.
 *
 * @param courses       courses that were inventoried (failed ones included)
 * @param files         all remote files of the successfully fetched courses, unique by key
 * @param failedCourses course id to error message for courses whose fetch failed
 */
public record Inventory(
        List<CanvasCourse> courses,
        List<RemoteFile> files,
        Map<Long, String> failedCourses) {

    public Inventory {
        courses = List.copyOf(courses);
        files = List.copyOf(files);
        failedCourses = Map.copyOf(failedCourses);
    }

    public static Inventory empty() {
        return new Inventory(List.of(), List.of(), Map.of());
    }

    public Set<Long> courseIds() {
        return courses.stream().map(CanvasCourse::id).collect(Collectors.toUnmodifiableSet());
    }

    public boolean isPartial() {
        return !failedCourses.isEmpty();
    }
}
