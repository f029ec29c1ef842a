package com.wmevs.pipeline.regressor;

import com.wmevs.db.EvManifestDao;
import com.wmevs.db.SqliteInitializer;
import com.wmevs.util.ContentHash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RegressorFileEmitterTest {

    @TempDir
    Path outputRoot;

    private static RegressorMatrix sampleMatrix() {
        return new RegressorMatrix(Arrays.asList(
                new RegressorRow(0.0, 0.5, 1),
                new RegressorRow(104.6 - 100.0, 0.8, 0),
                new RegressorRow(12.345, 1.0, 0)));
    }

    @Test
    public void testFormat() {
        assertEquals("0 0.5 1\n4.6 0.8 0\n12.34 1 0\n", RegressorFileEmitter.format(sampleMatrix()));
    }

    @Test
    public void testPathFollowsNamingConvention() throws Exception {
        RegressorFileEmitter emitter = new RegressorFileEmitter(outputRoot, false);
        EvFileKey key = new EvFileKey("P7", "GLM2", "09", "missing37_onlypost");

        Path written = emitter.emit(key, sampleMatrix());

        assertEquals(outputRoot.resolve("P7").resolve("EVfiles").resolve("GLM2_run09_missing37_onlypost.txt"), written);
        assertEquals("0 0.5 1\n4.6 0.8 0\n12.34 1 0\n", new String(Files.readAllBytes(written), StandardCharsets.UTF_8));
    }

    @Test
    public void testSameKeyTwiceFails() {
        RegressorFileEmitter emitter = new RegressorFileEmitter(outputRoot, true);
        EvFileKey key = new EvFileKey("P6", "GLM1", "10", "noresponses");
        emitter.emit(key, sampleMatrix());

        assertThrows(DuplicateOutputException.class, () -> emitter.emit(key, sampleMatrix()));
    }

    @Test
    public void testExistingFileNeedsOverwritePermission() throws Exception {
        EvFileKey key = new EvFileKey("P6", "GLM1", "10", "testarrayretrocue");
        new RegressorFileEmitter(outputRoot, false).emit(key, sampleMatrix());

        RegressorFileEmitter strict = new RegressorFileEmitter(outputRoot, false);
        assertThrows(DuplicateOutputException.class, () -> strict.emit(key, sampleMatrix()));

        RegressorFileEmitter lenient = new RegressorFileEmitter(outputRoot, true);
        RegressorMatrix replacement = new RegressorMatrix(Arrays.asList(new RegressorRow(0.0, 0.5, 0)));
        Path written = lenient.emit(key, replacement);
        assertEquals("0 0.5 0\n", new String(Files.readAllBytes(written), StandardCharsets.UTF_8));
    }

    @Test
    public void testManifestRecordsHash() throws Exception {
        String dbPath = outputRoot.resolve("manifest.db").toString();
        SqliteInitializer.initialize(dbPath);
        EvManifestDao manifest = new EvManifestDao(dbPath);
        RegressorFileEmitter emitter = new RegressorFileEmitter(outputRoot, false, manifest);
        EvFileKey key = new EvFileKey("P8", "GLM2", "11", "testarraypostcue");

        emitter.emit(key, sampleMatrix());

        Optional<String> hash = manifest.findHash(key);
        assertTrue(hash.isPresent());
        assertEquals(ContentHash.sha256(RegressorFileEmitter.format(sampleMatrix())), hash.get());
    }

    @Test
    public void testEvFileKeyEquality() {
        EvFileKey a = new EvFileKey("P6", "GLM1", "10", "noresponses");
        EvFileKey b = new EvFileKey("P6", "GLM1", "10", "noresponses");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new EvFileKey("P6", "GLM2", "10", "noresponses"));
        assertEquals("GLM1_run10_noresponses.txt", a.fileName());
    }
}
