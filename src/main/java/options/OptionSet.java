package options;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * All options of one search: main-effect options keyed by feature index and
 * interaction options keyed by interaction term index. Immutable; the
 * rescaling methods return new sets.
 */
public final class OptionSet {
    private final Map<Integer, List<MainEffectOption>> mainOptions;
    private final Map<Integer, List<InteractionOption>> interactionOptions;

    public OptionSet(Map<Integer, ? extends List<? extends MainEffectOption>> mainOptions,
                     Map<Integer, ? extends List<InteractionOption>> interactionOptions) {
        Map<Integer, List<MainEffectOption>> main = new LinkedHashMap<>();
        mainOptions.forEach((feature, list) -> main.put(feature, Collections.unmodifiableList(new ArrayList<>(list))));
        Map<Integer, List<InteractionOption>> inter = new LinkedHashMap<>();
        interactionOptions.forEach((term, list) -> inter.put(term, Collections.unmodifiableList(new ArrayList<>(list))));
        this.mainOptions = Collections.unmodifiableMap(main);
        this.interactionOptions = Collections.unmodifiableMap(inter);
    }

    public Map<Integer, List<MainEffectOption>> getMainOptions() {
        return mainOptions;
    }

    public Map<Integer, List<InteractionOption>> getInteractionOptions() {
        return interactionOptions;
    }

    public List<MainEffectOption> mainOptionsOf(int featureIndex) {
        List<MainEffectOption> options = mainOptions.get(featureIndex);
        return options == null ? Collections.emptyList() : options;
    }

    /** The option of a feature that targets the given bin, or null. */
    public MainEffectOption findMain(int featureIndex, int binIndex) {
        for (MainEffectOption option : mainOptionsOf(featureIndex)) {
            if (option.getBinIndex() == binIndex) {
                return option;
            }
        }
        return null;
    }

    public List<MainEffectOption> allMainOptions() {
        List<MainEffectOption> all = new ArrayList<>();
        mainOptions.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        int total = 0;
        for (List<MainEffectOption> list : mainOptions.values()) {
            total += list.size();
        }
        for (List<InteractionOption> list : interactionOptions.values()) {
            total += list.size();
        }
        return total;
    }

    /**
     * Same options with every main-effect option replaced by the mapper's
     * result; interaction options are kept as they are.
     */
    public OptionSet mapMainOptions(Function<MainEffectOption, MainEffectOption> mapper) {
        Map<Integer, List<MainEffectOption>> mapped = new LinkedHashMap<>();
        mainOptions.forEach((feature, list) -> {
            List<MainEffectOption> copy = new ArrayList<>(list.size());
            for (MainEffectOption option : list) {
                copy.add(mapper.apply(option));
            }
            mapped.put(feature, copy);
        });
        return new OptionSet(mapped, interactionOptions);
    }
}
