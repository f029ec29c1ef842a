package com.wmevs.pipeline.trial;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.wmevs.pipeline.trial.TrialFixtures.trial;
import static org.junit.jupiter.api.Assertions.*;

public class TrialClassifierTest {

    private final TrialClassifier classifier = TrialFixtures.defaultClassifier();

    @Test
    public void testAccuracyFollowsChangeFlag() {
        // no-change: "same" (6) is correct
        assertEquals(Accuracy.CORRECT, classifier.classify(trial(0, 3, 7, CueType.POST, 0, false, "6", 0.7, 0, 4)).accuracy);
        assertEquals(Accuracy.INCORRECT, classifier.classify(trial(1, 3, 7, CueType.POST, 0, false, "7", 0.7, 0, 4)).accuracy);
        // change: "different" (7) is correct
        assertEquals(Accuracy.CORRECT, classifier.classify(trial(2, 3, 7, CueType.POST, 0, true, "7", 0.7, 0, 4)).accuracy);
        assertEquals(Accuracy.INCORRECT, classifier.classify(trial(3, 3, 7, CueType.POST, 0, true, "6", 0.7, 0, 4)).accuracy);
    }

    @Test
    public void testNoResponseLeavesAccuracyUndefined() {
        TrialLabels labels = classifier.classify(trial(0, 3, 7, CueType.POST, 4, true, "None", null, 0, 4));
        assertFalse(labels.responsePresent);
        assertEquals(Accuracy.UNDEFINED, labels.accuracy);
        // the cue still resolves
        assertEquals(Integer.valueOf(5), labels.cuedImage);
    }

    @Test
    public void testAccuracyUndefinedExactlyWhenNoResponse() {
        List<Trial> trials = Arrays.asList(
                trial(0, 0, 1, CueType.POST, 0, false, "6", 0.5, 0, 4),
                trial(1, 2, 3, CueType.RETRO, null, true, "None", null, 10, 14),
                trial(2, 4, 5, CueType.POST, 7, true, "6", 1.1, 20, 24),
                trial(3, 8, 9, CueType.RETRO, 3, false, "None", null, 30, 34));
        for (Trial t : classifier.classifyAll(trials)) {
            TrialLabels labels = t.getLabels();
            assertEquals(!labels.responsePresent, labels.accuracy == Accuracy.UNDEFINED, t.toString());
        }
    }

    @Test
    public void testCuedImageIsZeroBasedOffsetIntoMemoryArray() {
        // images without 3 and 7: [0, 1, 2, 4, 5, 6, 8, 9]
        assertEquals(Integer.valueOf(0), classifier.classify(trial(0, 3, 7, CueType.POST, 0, false, "6", 1.0, 0, 4)).cuedImage);
        assertEquals(Integer.valueOf(4), classifier.classify(trial(0, 3, 7, CueType.POST, 3, false, "6", 1.0, 0, 4)).cuedImage);
        assertEquals(Integer.valueOf(9), classifier.classify(trial(0, 3, 7, CueType.POST, 7, false, "6", 1.0, 0, 4)).cuedImage);
        assertNull(classifier.classify(trial(0, 3, 7, CueType.RETRO, null, false, "6", 1.0, 0, 4)).cuedImage);
    }

    @Test
    public void testCueLocationOutOfRangeFails() {
        InvalidTrialException high = assertThrows(InvalidTrialException.class,
                () -> classifier.classify(trial(12, 3, 7, CueType.POST, 8, false, "6", 1.0, 0, 4)));
        assertEquals(12, high.getTrialOrdinal());
        assertThrows(InvalidTrialException.class,
                () -> classifier.classify(trial(12, 3, 7, CueType.POST, -1, false, "6", 1.0, 0, 4)));
    }

    @Test
    public void testMissingPairIsNormalizedAndCompletesUniverse() {
        Trial t = new Trial(0, Arrays.asList(9, 0, 5, 1, 2, 6, 4, 8), CueType.POST, 0, false, "6", 1.0, 0.0, 4.0);
        TrialLabels labels = classifier.classify(t);
        assertEquals(ImagePair.of(7, 3), labels.missingPair);
        assertEquals(3, labels.missingPair.getFirst());
        assertEquals(7, labels.missingPair.getSecond());

        Set<Integer> union = new HashSet<>(t.getMemoryImages());
        union.add(labels.missingPair.getFirst());
        union.add(labels.missingPair.getSecond());
        assertEquals(TrialFixtures.UNIVERSE, union.size());
    }

    @Test
    public void testNoMemoryArrayMeansNoMissingPair() {
        Trial filler = new Trial(0, null, CueType.RETRO, null, false, "6", 0.9, 0.0, 4.0);
        TrialLabels labels = classifier.classify(filler);
        assertNull(labels.missingPair);
        assertNull(labels.cuedImage);
    }

    @Test
    public void testMalformedMemoryArraysFail() {
        Trial duplicate = new Trial(0, Arrays.asList(0, 0, 1, 2, 3, 4, 5, 6), CueType.POST, 0, false, "6", 1.0, 0.0, 4.0);
        assertThrows(InvalidTrialException.class, () -> classifier.classify(duplicate));

        Trial outside = new Trial(1, Arrays.asList(0, 1, 2, 3, 4, 5, 6, 12), CueType.POST, 0, false, "6", 1.0, 0.0, 4.0);
        assertThrows(InvalidTrialException.class, () -> classifier.classify(outside));

        Trial tooFew = new Trial(2, Arrays.asList(0, 1, 2, 3, 4, 5, 6), CueType.POST, 0, false, "6", 1.0, 0.0, 4.0);
        assertThrows(InvalidTrialException.class, () -> classifier.classify(tooFew));
    }

    @Test
    public void testPairOutsideLowHighCatalogFails() {
        TrialClassifier lowHigh = new TrialClassifier("6", "7", "None", 10,
                ImagePairCatalog.lowHigh(Arrays.asList(0, 1, 2, 3, 4), Arrays.asList(5, 6, 7, 8, 9)));
        assertNotNull(lowHigh.classify(trial(0, 3, 7, CueType.POST, 0, false, "6", 1.0, 0, 4)).missingPair);
        assertThrows(InvalidTrialException.class,
                () -> lowHigh.classify(trial(0, 1, 2, CueType.POST, 0, false, "6", 1.0, 0, 4)));
    }

    @Test
    public void testUnknownResponseKeyFails() {
        assertThrows(InvalidTrialException.class,
                () -> classifier.classify(trial(0, 3, 7, CueType.POST, 0, false, "space", 1.0, 0, 4)));
    }

    @Test
    public void testResponseWithoutChangeFlagFails() {
        assertThrows(InvalidTrialException.class,
                () -> classifier.classify(trial(0, 3, 7, CueType.POST, 0, null, "6", 1.0, 0, 4)));
    }

    @Test
    public void testClassifyAllKeepsOrderAndAttachesLabels() {
        List<Trial> raw = Arrays.asList(
                TrialFixtures.correctPostCue(0, 3, 7, 0),
                TrialFixtures.correctPostCue(1, 0, 9, 10));
        List<Trial> classified = classifier.classifyAll(raw);
        assertEquals(2, classified.size());
        assertFalse(raw.get(0).isClassified());
        assertTrue(classified.get(0).isClassified());
        assertEquals(1, classified.get(1).getOrdinal());
        assertEquals(ImagePair.of(0, 9), classified.get(1).getLabels().missingPair);
    }

    @Test
    public void testUnclassifiedTrialRefusesLabels() {
        assertThrows(IllegalStateException.class, () -> TrialFixtures.correctPostCue(0, 3, 7, 0).getLabels());
    }
}
