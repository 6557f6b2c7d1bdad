package io.datawrangle.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed recipe: ordered step lists for each section. Immutable; owned by one run.
 *
 * @param read            source steps
 * @param wrangles        transformation steps
 * @param write           destination steps
 * @param unknownSections top-level keys that are not section keys, reported by validation
 * @param source          where the recipe came from (file path or {@code "<string>"})
 */
public record Recipe(
        List<StepDescriptor> read,
        List<StepDescriptor> wrangles,
        List<StepDescriptor> write,
        List<String> unknownSections,
        String source) {

    public Recipe {
        read = List.copyOf(read);
        wrangles = List.copyOf(wrangles);
        write = List.copyOf(write);
        unknownSections = List.copyOf(unknownSections);
    }

    /** Returns the top-level steps of a section. */
    public List<StepDescriptor> steps(Section section) {
        return switch (section) {
            case READ -> read;
            case WRANGLE -> wrangles;
            case WRITE -> write;
        };
    }

    /** Every step, nested ones included, depth-first in declaration order. */
    public List<StepDescriptor> allSteps() {
        List<StepDescriptor> all = new ArrayList<>();
        for (Section section : Section.values()) {
            collect(steps(section), all);
        }
        return all;
    }

    private static void collect(List<StepDescriptor> steps, List<StepDescriptor> into) {
        for (StepDescriptor step : steps) {
            into.add(step);
            step.children().values().forEach(nested -> collect(nested, into));
        }
    }

    public boolean isEmpty() {
        return read.isEmpty() && wrangles.isEmpty() && write.isEmpty();
    }
}
