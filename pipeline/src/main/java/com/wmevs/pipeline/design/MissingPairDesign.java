package com.wmevs.pipeline.design;

import com.wmevs.pipeline.condition.Condition;
import com.wmevs.pipeline.condition.TrialPredicate;
import com.wmevs.pipeline.regressor.EventType;
import com.wmevs.pipeline.trial.CueType;
import com.wmevs.pipeline.trial.ImagePair;
import com.wmevs.pipeline.trial.ImagePairCatalog;

import java.util.ArrayList;
import java.util.List;

/**
 * GLM2: one memory-array regressor per missing-image pair, flagging post-cue
 * trials only, followed by the three cue-type onset regressors.
 *
 * Every trial of the run gets a row unless {@code postCueRowsOnly} is set,
 * which lists only the post-cue trials of the run instead.
 */
public class MissingPairDesign extends GlmDesign {

    public static final String NAME = "GLM2";

    private final ImagePairCatalog catalog;
    private final boolean postCueRowsOnly;

    public MissingPairDesign(ImagePairCatalog catalog) {
        this(catalog, false);
    }

    public MissingPairDesign(ImagePairCatalog catalog, boolean postCueRowsOnly) {
        super(NAME);
        this.catalog = catalog;
        this.postCueRowsOnly = postCueRowsOnly;
    }

    public static String missingPairName(ImagePair pair) {
        return "missing" + pair.label() + "_onlypost";
    }

    @Override
    protected List<Condition> buildConditions() {
        List<Condition> list = new ArrayList<>();
        TrialPredicate postCue = TrialPredicate.cueType(CueType.POST);
        TrialPredicate rows = postCueRowsOnly ? postCue : TrialPredicate.all();
        for (ImagePair pair : catalog.getPairs()) {
            list.add(new Condition(missingPairName(pair), EventType.MEMORY_ARRAY, rows,
                    postCue.and(TrialPredicate.missingPair(pair))));
        }
        list.addAll(cueTypeConditions());
        return list;
    }
}
