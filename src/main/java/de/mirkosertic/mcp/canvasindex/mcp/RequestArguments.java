package de.mirkosertic.mcp.canvasindex.mcp;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed access to raw tool arguments. JSON numbers arrive as Integer, Long or Double and
 * ids are sometimes sent as strings.
 */
public final class RequestArguments {

    private RequestArguments() {
    }

    public static @Nullable Long optionalLong(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a number, got: " + value, e);
        }
    }

    public static @Nullable Integer optionalInt(final Map<String, Object> args, final String name) {
        final Long value = optionalLong(args, name);
        return value != null ? Math.toIntExact(value) : null;
    }

    public static @Nullable Boolean optionalBoolean(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    public static @Nullable String optionalString(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        return value != null ? value.toString() : null;
    }

    public static @Nullable List<Long> optionalLongList(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Collection<?> values)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an array of numbers");
        }
        final List<Long> result = new ArrayList<>(values.size());
        for (final Object element : values) {
            result.add(optionalLong(Map.of(name, element), name));
        }
        return result;
    }
}
