package io.fnanalyzer.core.model;

/** The analysis a {@link StepTrace} belongs to. */
public enum TraceCategory {
    DOMAIN("Domain"),
    RANGE("Range"),
    INTERCEPTS("Intercepts"),
    EVALUATION("Evaluation");

    private final String title;

    TraceCategory(String title) {
        this.title = title;
    }

    /** Heading used by report renderers. */
    public String title() {
        return title;
    }
}
