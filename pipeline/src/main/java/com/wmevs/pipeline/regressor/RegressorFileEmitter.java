package com.wmevs.pipeline.regressor;

import com.wmevs.db.EvManifestDao;
import com.wmevs.pipeline.EvPipelineException;
import com.wmevs.util.ContentHash;
import com.wmevs.util.Rounding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Set;

/**
 * Writes regressor matrices as three-column plain text files, one file per
 * {@link EvFileKey}:
 *
 * <pre>
 * &lt;outputRoot&gt;/&lt;subject&gt;/EVfiles/&lt;design&gt;_run&lt;runId&gt;_&lt;condition&gt;.txt
 * </pre>
 *
 * A key is written at most once per emitter. Files already on disk, or keys
 * already in the manifest, are only replaced when overwriting was explicitly
 * allowed; both are checked before anything is written.
 */
public class RegressorFileEmitter {

    private static final Logger logger = LoggerFactory.getLogger(RegressorFileEmitter.class);
    public static final String EV_DIRECTORY = "EVfiles";

    private final Path outputRoot;
    private final boolean overwriteExisting;
    private final EvManifestDao manifest;
    private final Set<EvFileKey> emitted = new HashSet<>();

    public RegressorFileEmitter(Path outputRoot, boolean overwriteExisting) {
        this(outputRoot, overwriteExisting, null);
    }

    public RegressorFileEmitter(Path outputRoot, boolean overwriteExisting, EvManifestDao manifest) {
        this.outputRoot = outputRoot;
        this.overwriteExisting = overwriteExisting;
        this.manifest = manifest;
    }

    public Path pathFor(EvFileKey key) {
        return outputRoot.resolve(key.getSubject()).resolve(EV_DIRECTORY).resolve(key.fileName());
    }

    public Path emit(EvFileKey key, RegressorMatrix matrix) {
        if (!emitted.add(key)) {
            throw new DuplicateOutputException(key, "was already written in this run");
        }
        Path target = pathFor(key);
        if (Files.exists(target) && !overwriteExisting) {
            throw new DuplicateOutputException(key, "already exists at " + target
                    + " (set overwriteExisting to replace it)");
        }
        if (!overwriteExisting && isRecorded(key)) {
            throw new DuplicateOutputException(key, "is already recorded in the EV manifest"
                    + " (set overwriteExisting to replace it)");
        }

        String content = format(matrix);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        record(key, target, content);
        logger.debug("Wrote {} ({} rows, {} flagged)", target, matrix.size(), matrix.flaggedCount());
        return target;
    }

    /**
     * One line per row: onset, duration and flag separated by single spaces,
     * numbers rounded to two decimals. No header.
     */
    public static String format(RegressorMatrix matrix) {
        StringBuilder sb = new StringBuilder();
        for (RegressorRow row : matrix.getRows()) {
            sb.append(Rounding.format2(row.onset))
                    .append(' ')
                    .append(Rounding.format2(row.duration))
                    .append(' ')
                    .append(row.flag)
                    .append('\n');
        }
        return sb.toString();
    }

    private boolean isRecorded(EvFileKey key) {
        if (manifest == null) {
            return false;
        }
        try {
            return manifest.findHash(key).isPresent();
        } catch (SQLException e) {
            throw new EvPipelineException("Failed to look up " + key + " in the EV manifest", e);
        }
    }

    private void record(EvFileKey key, Path target, String content) {
        if (manifest == null) {
            return;
        }
        String relPath = outputRoot.relativize(target).toString();
        String hash = ContentHash.sha256(content);
        try {
            if (overwriteExisting) {
                manifest.upsert(key, relPath, hash);
            } else {
                manifest.insert(key, relPath, hash);
            }
        } catch (SQLException e) {
            throw new EvPipelineException("Failed to record " + key + " in the EV manifest", e);
        }
    }
}
