package com.phillippitts.insightbot.domain;

/**
 * What caused an analysis cycle to run.
 */
public enum CycleTrigger {
    SCHEDULED,
    MANUAL,
    FINAL;

    public boolean isFinal() {
        return this == FINAL;
    }
}
