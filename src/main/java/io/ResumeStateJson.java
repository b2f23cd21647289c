package io;

import coach.ResumeState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import ebm.Sample;
import optimization.VariableId;
import options.CategoricalOption;
import options.ContinuousOption;
import options.Direction;
import options.InteractionOption;
import options.MainEffectOption;
import options.OptionKind;
import options.OptionSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON form of a {@link ResumeState}, so a search can be continued in a
 * later process. Options are flattened into tagged records.
 */
public final class ResumeStateJson {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private ResumeStateJson() {
    }

    public static String toJson(ResumeState state) {
        StateRecord record = new StateRecord();
        record.sample = state.getSample().asList();
        record.direction = state.getDirection().sign();
        record.scoreThreshold = state.getScoreThreshold();
        record.featuresToVary = new ArrayList<>(state.getFeaturesToVary());
        record.maxNumFeaturesToVary = state.getMaxNumFeaturesToVary();
        for (MainEffectOption option : state.getOptions().allMainOptions()) {
            record.mainOptions.add(MainRecord.of(option));
        }
        for (List<InteractionOption> options : state.getOptions().getInteractionOptions().values()) {
            for (InteractionOption option : options) {
                record.interactionOptions.add(InteractionRecord.of(option));
            }
        }
        for (VariableId id : state.getUsedVariables()) {
            record.usedVariables.add(VariableRecord.of(id));
        }
        return GSON.toJson(record);
    }

    public static ResumeState fromJson(String json) {
        StateRecord record = GSON.fromJson(json, StateRecord.class);
        if (record == null || record.sample == null || record.featuresToVary == null) {
            throw new JsonParseException("Resume state is missing its sample or features");
        }

        Map<Integer, List<MainEffectOption>> main = new LinkedHashMap<>();
        for (int feature : record.featuresToVary) {
            main.put(feature, new ArrayList<>());
        }
        for (MainRecord option : record.mainOptions) {
            main.computeIfAbsent(option.featureIndex, k -> new ArrayList<>()).add(option.toOption());
        }
        Map<Integer, List<InteractionOption>> interactions = new LinkedHashMap<>();
        for (InteractionRecord option : record.interactionOptions) {
            interactions.computeIfAbsent(option.interactionIndex, k -> new ArrayList<>()).add(option.toOption());
        }
        Set<VariableId> used = new LinkedHashSet<>();
        for (VariableRecord id : record.usedVariables) {
            used.add(id.toId());
        }
        return new ResumeState(Sample.of(record.sample), Direction.of(record.direction), record.scoreThreshold,
                new LinkedHashSet<>(record.featuresToVary), new OptionSet(main, interactions),
                record.maxNumFeaturesToVary, used);
    }

    private static final class StateRecord {
        List<Object> sample;
        int direction;
        double scoreThreshold;
        List<Integer> featuresToVary;
        Integer maxNumFeaturesToVary;
        List<MainRecord> mainOptions = new ArrayList<>();
        List<InteractionRecord> interactionOptions = new ArrayList<>();
        List<VariableRecord> usedVariables = new ArrayList<>();
    }

    private static final class MainRecord {
        OptionKind kind;
        int featureIndex;
        String featureName;
        int binIndex;
        double target;
        double scoreGain;
        double distance;
        Map<Integer, Double> interactionGains = new LinkedHashMap<>();

        static MainRecord of(MainEffectOption option) {
            MainRecord record = new MainRecord();
            record.kind = option.getKind();
            record.featureIndex = option.getFeatureIndex();
            record.featureName = option.getFeatureName();
            record.binIndex = option.getBinIndex();
            record.target = option.getEncodedTarget();
            record.scoreGain = option.getScoreGain();
            record.distance = option.getDistance();
            record.interactionGains = new LinkedHashMap<>(option.getInteractionGains());
            return record;
        }

        MainEffectOption toOption() {
            if (kind == OptionKind.CATEGORICAL) {
                return new CategoricalOption(featureIndex, featureName, binIndex, (int) target,
                        scoreGain, distance, interactionGains);
            }
            if (kind == OptionKind.CONTINUOUS) {
                return new ContinuousOption(featureIndex, featureName, binIndex, target,
                        scoreGain, distance, interactionGains);
            }
            throw new JsonParseException("Unexpected main option kind " + kind);
        }
    }

    private static final class InteractionRecord {
        int interactionIndex;
        String interactionName;
        int firstFeature;
        int firstBin;
        double firstTarget;
        int secondFeature;
        int secondBin;
        double secondTarget;
        double scoreGain;

        static InteractionRecord of(InteractionOption option) {
            InteractionRecord record = new InteractionRecord();
            record.interactionIndex = option.getInteractionIndex();
            record.interactionName = option.getInteractionName();
            record.firstFeature = option.getFirstFeature();
            record.firstBin = option.getFirstBin();
            record.firstTarget = option.getFirstTarget();
            record.secondFeature = option.getSecondFeature();
            record.secondBin = option.getSecondBin();
            record.secondTarget = option.getSecondTarget();
            record.scoreGain = option.getScoreGain();
            return record;
        }

        InteractionOption toOption() {
            return new InteractionOption(interactionIndex, interactionName, firstFeature, firstBin, firstTarget,
                    secondFeature, secondBin, secondTarget, scoreGain);
        }
    }

    private static final class VariableRecord {
        VariableId.Kind kind;
        int featureIndex;
        int binIndex;
        int secondFeatureIndex;
        int secondBinIndex;

        static VariableRecord of(VariableId id) {
            VariableRecord record = new VariableRecord();
            record.kind = id.getKind();
            record.featureIndex = id.getFeatureIndex();
            record.binIndex = id.getBinIndex();
            record.secondFeatureIndex = id.getSecondFeatureIndex();
            record.secondBinIndex = id.getSecondBinIndex();
            return record;
        }

        VariableId toId() {
            return kind == VariableId.Kind.INTERACTION
                    ? VariableId.interaction(featureIndex, binIndex, secondFeatureIndex, secondBinIndex)
                    : VariableId.main(featureIndex, binIndex);
        }
    }
}
