package com.wmevs.pipeline.design;

import com.wmevs.pipeline.condition.AccuracyFilter;
import com.wmevs.pipeline.condition.Condition;
import com.wmevs.pipeline.condition.ResponseFilter;
import com.wmevs.pipeline.condition.TrialPredicate;
import com.wmevs.pipeline.regressor.EventType;
import com.wmevs.pipeline.trial.CueType;

import java.util.ArrayList;
import java.util.List;

/**
 * GLM1: WM+ and WM- memory-array regressors for every cued image, the three
 * cue-type onset regressors and a no-response regressor.
 */
public class CuedImageDesign extends GlmDesign {

    public static final String NAME = "GLM1";
    public static final String NO_RESPONSES = "noresponses";

    private final int universeSize;

    public CuedImageDesign(int universeSize) {
        super(NAME);
        this.universeSize = universeSize;
    }

    public static String wmPlusName(int image) {
        return "image" + image + "_WMplus";
    }

    public static String wmMinusName(int image) {
        return "image" + image + "_WMminus";
    }

    @Override
    protected List<Condition> buildConditions() {
        List<Condition> list = new ArrayList<>();
        TrialPredicate answeredPostCue = TrialPredicate.cueType(CueType.POST)
                .and(TrialPredicate.response(ResponseFilter.PRESENT));
        for (int image = 0; image < universeSize; image++) {
            TrialPredicate cued = TrialPredicate.cuedImage(image);
            list.add(new Condition(wmPlusName(image), EventType.MEMORY_ARRAY,
                    answeredPostCue.and(TrialPredicate.accuracy(AccuracyFilter.CORRECT)).and(cued)));
            list.add(new Condition(wmMinusName(image), EventType.MEMORY_ARRAY,
                    answeredPostCue.and(TrialPredicate.accuracy(AccuracyFilter.INCORRECT)).and(cued)));
        }
        list.addAll(cueTypeConditions());
        list.add(new Condition(NO_RESPONSES, EventType.MEMORY_ARRAY,
                TrialPredicate.response(ResponseFilter.ABSENT)));
        return list;
    }
}
