package com.parallax.core.scheduler;

import java.util.Set;

/**
 * The group predecessor graph contains at least one cycle.
 */
public class CycleDetectedException extends SchedulingException {

    public static final String CYCLIC_DEPENDENCY = "CYCLIC_DEPENDENCY";

    private final Set<String> cycleGroups;

    public CycleDetectedException(Set<String> cycleGroups) {
        super(CYCLIC_DEPENDENCY, "Dependency cycle between groups " + cycleGroups);
        this.cycleGroups = Set.copyOf(cycleGroups);
    }

    public Set<String> getCycleGroups() {
        return cycleGroups;
    }
}
