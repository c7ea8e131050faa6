package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the readMirroredFile tool.
 */
public record ReadMirroredFileRequest(
        @Description("Canvas course id")
        Long courseId,

        @Description("Remote id of the file, as reported by listInaccessibleFiles or search metadata "
                + "(e.g. 'file:42', 'page:syllabus', 'assignment:7')")
        String remoteId,

        @Nullable
        @Description("Maximum number of characters of extracted text to return. Default is 100000.")
        Integer maxCharacters
) {
    public static final int DEFAULT_MAX_CHARACTERS = 100_000;

    public static ReadMirroredFileRequest fromMap(final Map<String, Object> args) {
        return new ReadMirroredFileRequest(
                RequestArguments.optionalLong(args, "courseId"),
                RequestArguments.optionalString(args, "remoteId"),
                RequestArguments.optionalInt(args, "maxCharacters"));
    }

    public int effectiveMaxCharacters() {
        return maxCharacters != null && maxCharacters > 0 ? maxCharacters : DEFAULT_MAX_CHARACTERS;
    }
}
