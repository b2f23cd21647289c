package optimization;

import options.Option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An assembled problem together with the mapping between solver variable
 * names, typed identifiers and the options they select.
 */
public final class BuiltModel {
    private final OptimizationProblem problem;
    private final Map<String, VariableId> idsByName;
    private final Map<VariableId, String> namesById;
    private final Map<VariableId, Option> optionsById;

    BuiltModel(OptimizationProblem problem, Map<VariableId, String> namesById, Map<VariableId, Option> optionsById) {
        this.problem = problem;
        Map<String, VariableId> byName = new LinkedHashMap<>();
        namesById.forEach((id, name) -> byName.put(name, id));
        this.idsByName = Collections.unmodifiableMap(byName);
        this.namesById = Collections.unmodifiableMap(new LinkedHashMap<>(namesById));
        this.optionsById = Collections.unmodifiableMap(new LinkedHashMap<>(optionsById));
    }

    public OptimizationProblem getProblem() {
        return problem;
    }

    public VariableId idOf(String variableName) {
        return idsByName.get(variableName);
    }

    public String nameOf(VariableId id) {
        return namesById.get(id);
    }

    public Option optionOf(VariableId id) {
        return optionsById.get(id);
    }

    public Map<VariableId, String> getVariables() {
        return namesById;
    }

    public boolean hasMainVariables() {
        for (VariableId id : namesById.keySet()) {
            if (id.isMain()) {
                return true;
            }
        }
        return false;
    }
}
