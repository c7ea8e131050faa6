package de.mirkosertic.mcp.canvasindex.inventory;

import de.mirkosertic.mcp.canvasindex.canvas.CanvasCourse;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * File and folder name rules for the local mirror.
 */
public final class FileNames {

    private static final String ILLEGAL_CHARACTERS = "<>:\"/\\|?*";
    static final int MAX_LENGTH = 200;

    private FileNames() {
    }

    /**
     * Make a name safe as a single path segment on all common filesystems.
     */
    public static String sanitize(@Nullable final String name) {
        if (name == null) {
            return "unnamed";
        }
        final StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            builder.append(ILLEGAL_CHARACTERS.indexOf(c) >= 0 || Character.isISOControl(c) ? '_' : c);
        }

        int start = 0;
        int end = builder.length();
        while (start < end && isTrimmable(builder.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(builder.charAt(end - 1))) {
            end--;
        }
        String result = builder.substring(start, end);
        if (result.length() > MAX_LENGTH) {
            result = result.substring(0, MAX_LENGTH);
        }
        return result.isEmpty() ? "unnamed" : result;
    }

    /**
     * Folder name of a course: {@code <course_code>_<name>}, or just the name without a code.
     */
    public static String courseFolder(final CanvasCourse course) {
        final String name = sanitize(course.name());
        if (course.courseCode() == null || course.courseCode().isBlank()) {
            return name;
        }
        return sanitize(course.courseCode() + "_" + name);
    }

    /**
     * @return the extension including the dot, lower case, or an empty string
     */
    public static String extension(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static boolean isTrimmable(final char c) {
        return c == '.' || c == ' ';
    }
}
