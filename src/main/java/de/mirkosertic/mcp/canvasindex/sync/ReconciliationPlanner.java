package de.mirkosertic.mcp.canvasindex.sync;

import de.mirkosertic.mcp.canvasindex.canvas.CanvasCourse;
import de.mirkosertic.mcp.canvasindex.index.IndexedEntry;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.Inventory;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import de.mirkosertic.mcp.canvasindex.mirror.LocalEntry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Computes the diff between the remote inventory, the local mirror manifest and the index manifest.
 * <p>
 * Every remote file gets exactly one classification, checked in this order:
 * <ol>
 *   <li>recorded as inaccessible: {@link FileClassification#KNOWN_INACCESSIBLE}</li>
 *   <li>no usable local copy: {@link FileClassification#MISSING_LOCALLY}</li>
 *   <li>local copy at another fingerprint: {@link FileClassification#CHANGED}</li>
 *   <li>indexed at another fingerprint, or indexable and not indexed: {@link FileClassification#MISSING_IN_INDEX}</li>
 *   <li>otherwise {@link FileClassification#UP_TO_DATE}</li>
 * </ol>
 * A current mirror copy of a file that cannot be indexed is up to date, but counted as not indexable.
 * An outdated index document of such a file is still missing in the index, so the pass removes it.
 * Index entries without a remote file are {@link FileClassification#EXTRA_IN_INDEX}, except for
 * courses whose inventory failed: their files are unknown, not gone.
 * <p>
 * The planner does no I/O.
 */
public class ReconciliationPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationPlanner.class);

    public SyncPlan plan(final Inventory inventory,
                         final Collection<LocalEntry> localManifest,
                         final Collection<IndexedEntry> indexManifest,
                         final Set<FileKey> inaccessibleKeys) {
        return plan(inventory, localManifest, indexManifest, inaccessibleKeys, file -> true);
    }

    /**
     * @param indexable files for which this returns false and that have no index entry are complete once mirrored
     */
    public SyncPlan plan(final Inventory inventory,
                         final Collection<LocalEntry> localManifest,
                         final Collection<IndexedEntry> indexManifest,
                         final Set<FileKey> inaccessibleKeys,
                         final Predicate<RemoteFile> indexable) {
        final long startTime = System.currentTimeMillis();

        final Map<FileKey, LocalEntry> localByKey = new HashMap<>();
        for (final LocalEntry entry : localManifest) {
            localByKey.put(entry.key(), entry);
        }
        final Map<FileKey, IndexedEntry> indexedByKey = new HashMap<>();
        for (final IndexedEntry entry : indexManifest) {
            indexedByKey.put(entry.key(), entry);
        }

        final List<PlannedFile> planned = new ArrayList<>(inventory.files().size());
        final Map<Long, EnumMap<FileClassification, Integer>> perCourse = new LinkedHashMap<>();
        final Map<Long, Integer> remotePerCourse = new HashMap<>();
        final Map<Long, Integer> notIndexablePerCourse = new HashMap<>();
        for (final CanvasCourse course : inventory.courses()) {
            perCourse.put(course.id(), new EnumMap<>(FileClassification.class));
        }

        for (final RemoteFile file : inventory.files()) {
            final FileKey key = file.key();
            final LocalEntry local = localByKey.get(key);
            final IndexedEntry indexed = indexedByKey.get(key);
            final FileClassification classification =
                    classify(file, local, indexed, inaccessibleKeys.contains(key), indexable.test(file));
            final PlannedFile plannedFile = new PlannedFile(file, classification, local, indexed);
            planned.add(plannedFile);
            increment(perCourse, file.courseId(), classification);
            if (plannedFile.notIndexable()) {
                notIndexablePerCourse.merge(file.courseId(), 1, Integer::sum);
            }
            remotePerCourse.merge(file.courseId(), 1, Integer::sum);
        }

        final Set<FileKey> remoteKeys = new HashSet<>();
        for (final RemoteFile file : inventory.files()) {
            remoteKeys.add(file.key());
        }
        final List<IndexedEntry> extra = new ArrayList<>();
        for (final IndexedEntry entry : indexManifest) {
            if (remoteKeys.contains(entry.key()) || inventory.failedCourses().containsKey(entry.courseId())) {
                continue;
            }
            extra.add(entry);
            increment(perCourse, entry.courseId(), FileClassification.EXTRA_IN_INDEX);
        }

        final Map<Long, String> courseNames = new HashMap<>();
        for (final CanvasCourse course : inventory.courses()) {
            courseNames.put(course.id(), course.name());
        }
        final Map<Long, CourseCounts> counts = new LinkedHashMap<>();
        perCourse.forEach((courseId, byClass) -> {
            final int notIndexable = notIndexablePerCourse.getOrDefault(courseId, 0);
            counts.put(courseId, new CourseCounts(
                    courseId,
                    courseNames.getOrDefault(courseId, "Course_" + courseId),
                    remotePerCourse.getOrDefault(courseId, 0),
                    byClass.getOrDefault(FileClassification.UP_TO_DATE, 0) - notIndexable,
                    notIndexable,
                    byClass.getOrDefault(FileClassification.MISSING_LOCALLY, 0),
                    byClass.getOrDefault(FileClassification.MISSING_IN_INDEX, 0),
                    byClass.getOrDefault(FileClassification.CHANGED, 0),
                    byClass.getOrDefault(FileClassification.KNOWN_INACCESSIBLE, 0),
                    byClass.getOrDefault(FileClassification.EXTRA_IN_INDEX, 0)));
        });

        final long duration = System.currentTimeMillis() - startTime;
        final SyncPlan plan = new SyncPlan(planned, extra, counts, inventory.failedCourses(),
                inventory.courses().size(), Instant.now(), duration);
        logger.info("Reconciliation plan computed in {}ms: upToDate={}, notIndexable={}, missingLocally={}, "
                        + "missingInIndex={}, changed={}, inaccessible={}, extra={}",
                duration,
                plan.upToDateCount(),
                plan.notIndexableCount(),
                plan.count(FileClassification.MISSING_LOCALLY),
                plan.count(FileClassification.MISSING_IN_INDEX),
                plan.count(FileClassification.CHANGED),
                plan.count(FileClassification.KNOWN_INACCESSIBLE),
                extra.size());
        return plan;
    }

    static FileClassification classify(final RemoteFile file,
                                       @Nullable final LocalEntry local,
                                       @Nullable final IndexedEntry indexed,
                                       final boolean inaccessible,
                                       final boolean indexable) {
        if (inaccessible) {
            return FileClassification.KNOWN_INACCESSIBLE;
        }
        if (local == null || !local.isUsable()) {
            return FileClassification.MISSING_LOCALLY;
        }
        if (!local.fingerprintAtDownload().equals(file.fingerprint())) {
            return FileClassification.CHANGED;
        }
        if (indexed != null && !indexed.fingerprintAtUpload().equals(local.fingerprintAtDownload())) {
            return FileClassification.MISSING_IN_INDEX;
        }
        if (indexed == null && indexable) {
            return FileClassification.MISSING_IN_INDEX;
        }
        return FileClassification.UP_TO_DATE;
    }

    private static void increment(final Map<Long, EnumMap<FileClassification, Integer>> perCourse,
                                  final long courseId, final FileClassification classification) {
        perCourse.computeIfAbsent(courseId, id -> new EnumMap<>(FileClassification.class))
                .merge(classification, 1, Integer::sum);
    }
}
