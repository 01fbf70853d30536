package com.ambient.core.workflow;

import com.ambient.core.model.WorkflowPhase;

/**
 * Progress of a workflow as derived from its workspace artifacts and linked sessions.
 *
 * @param progress percentage of the three artifacts present
 */
public record WorkflowSummary(
    WorkflowPhase phase,
    String status,
    double progress,
    Files files
) {

    public record Files(boolean spec, boolean plan, boolean tasks) {

        int count() {
            return (spec ? 1 : 0) + (plan ? 1 : 0) + (tasks ? 1 : 0);
        }

        boolean any() {
            return spec || plan || tasks;
        }

        boolean all() {
            return spec && plan && tasks;
        }
    }
}
