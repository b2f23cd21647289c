package ebm;

import java.util.Collections;
import java.util.List;

public class ModelInfo {
    private List<String> classes;
    private String regressionName;

    public List<String> getClasses() {
        return classes == null ? Collections.emptyList() : Collections.unmodifiableList(classes);
    }

    public String getRegressionName() {
        return regressionName;
    }
}
