package options;

public enum OptionKind {
    CONTINUOUS,
    CATEGORICAL,
    INTERACTION
}
