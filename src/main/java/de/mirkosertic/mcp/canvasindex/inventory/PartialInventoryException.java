package de.mirkosertic.mcp.canvasindex.inventory;

import java.io.IOException;
import java.util.Map;

/**
 * Some, but not all, courses failed to inventory. The successfully fetched part is still usable.
 */
public class PartialInventoryException extends IOException {

    private final Inventory partialInventory;

    public PartialInventoryException(final Inventory partialInventory) {
        super("Inventory incomplete, failed courses: " + partialInventory.failedCourses().keySet());
        this.partialInventory = partialInventory;
    }

    public Inventory partialInventory() {
        return partialInventory;
    }

    public Map<Long, String> coursesFailed() {
        return partialInventory.failedCourses();
    }
}
