package io.datawrangle.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Location of a step inside a recipe: its section plus the chain of list indices leading to it,
 * rendered as e.g. {@code wrangles[2].steps[0]}.
 *
 * @param section  the top-level section
 * @param segments list key and index for each nesting level; the first segment is the section list
 */
public record StepPosition(Section section, List<Segment> segments) {

    /** One level of nesting: the list's key and the index within it. */
    public record Segment(String list, int index) {}

    public StepPosition {
        Objects.requireNonNull(section, "section must not be null");
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }
    }

    /** Position of the {@code index}-th top-level step of a section. */
    public static StepPosition of(Section section, int index) {
        return new StepPosition(section, List.of(new Segment(section.key(), index)));
    }

    /** Position of the {@code index}-th entry of the nested list {@code list} under this step. */
    public StepPosition child(String list, int index) {
        List<Segment> nested = new ArrayList<>(segments);
        nested.add(new Segment(list, index));
        return new StepPosition(section, nested);
    }

    /** Index of the enclosing top-level step within its section. */
    public int index() {
        return segments.get(0).index();
    }

    /** Nesting depth; top-level steps have depth 0. */
    public int depth() {
        return segments.size() - 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment.list()).append('[').append(segment.index()).append(']');
        }
        return sb.toString();
    }
}
