package io.lingualearn.core.execution;

import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.WorkflowDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Orders a workflow's steps into batches. Indices are zero-based.
 */
public final class StepPlanner {

    /**
     * One batch per step, in declared order.
     */
    public List<List<Integer>> sequential(WorkflowDescriptor workflow) {
        List<List<Integer>> plan = new ArrayList<>();
        for (int i = 0; i < workflow.steps().size(); i++) {
            plan.add(List.of(i));
        }
        return plan;
    }

    /**
     * Dependency levels: a step sits one level after the latest step producing one of its
     * placeholders; steps with no upstream producer are level 0. Within a level steps keep
     * declared order.
     */
    public List<List<Integer>> levels(WorkflowDescriptor workflow) {
        List<AgentDescriptor> steps = workflow.steps();
        int[] level = new int[steps.size()];
        TreeMap<Integer, List<Integer>> byLevel = new TreeMap<>();
        for (int i = 0; i < steps.size(); i++) {
            int current = 0;
            Set<String> placeholders = steps.get(i).placeholders();
            for (String placeholder : placeholders) {
                int producer = workflow.producerOf(placeholder);
                if (producer >= 0 && producer < i) {
                    current = Math.max(current, level[producer] + 1);
                }
            }
            level[i] = current;
            byLevel.computeIfAbsent(current, ignored -> new ArrayList<>()).add(i);
        }
        List<List<Integer>> plan = new ArrayList<>();
        byLevel.values().forEach(batch -> plan.add(List.copyOf(batch)));
        return plan;
    }

    public List<List<Integer>> plan(WorkflowDescriptor workflow, int maxParallelSteps) {
        return maxParallelSteps <= 1 ? sequential(workflow) : levels(workflow);
    }
}
