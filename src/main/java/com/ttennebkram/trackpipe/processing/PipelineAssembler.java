package com.ttennebkram.trackpipe.processing;

import com.ttennebkram.trackpipe.model.PipelineItem;
import com.ttennebkram.trackpipe.model.Transform;
import com.ttennebkram.trackpipe.model.Window;
import com.ttennebkram.trackpipe.model.WindowNamer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a flat pipeline declaration into an ordered list of Windows and checks
 * it can be run.
 *
 * A declaration is either all bare Transforms (wrapped into one implicit
 * window) or all Windows. Parameter labels must be unique within a window;
 * different windows may reuse labels since sliders are per window. Window
 * names must be unique within the pipeline.
 */
public final class PipelineAssembler {

    private PipelineAssembler() {
    }

    /**
     * Items split into windows and bare transforms, each in declaration order.
     */
    public static class Classification<I> {
        public final List<Window<I>> groups;
        public final List<Transform<I>> nonGroups;

        Classification(List<Window<I>> groups, List<Transform<I>> nonGroups) {
            this.groups = Collections.unmodifiableList(groups);
            this.nonGroups = Collections.unmodifiableList(nonGroups);
        }
    }

    /**
     * Collect, then validate.
     *
     * @throws PipelineConfigurationException if the declaration is ambiguous,
     *                                        holds invalid items, duplicate window
     *                                        names or duplicate labels
     */
    public static <I> List<Window<I>> assemble(List<? extends PipelineItem<I>> items, WindowNamer namer) {
        List<Window<I>> windows = collectWindows(items, namer);
        validateUniqueWindowNames(windows);
        validateNoLabelCollisions(windows);
        return windows;
    }

    /**
     * Split {@code items} into windows and bare transforms. Every window must
     * contain only transforms.
     */
    public static <I> Classification<I> classify(List<? extends PipelineItem<I>> items) {
        List<Window<I>> groups = new ArrayList<>();
        List<Transform<I>> nonGroups = new ArrayList<>();

        for (int i = 0; i < items.size(); i++) {
            PipelineItem<I> item = items.get(i);
            if (item == null) {
                throw new InvalidPipelineItemException(
                    "Item " + i + " is not a Transform or Window: items must be Transforms or Windows of Transforms");
            }
            item.match(
                window -> {
                    checkGroup(window);
                    groups.add(window);
                    return null;
                },
                transform -> {
                    nonGroups.add(transform);
                    return null;
                });
        }
        return new Classification<>(groups, nonGroups);
    }

    private static <I> void checkGroup(Window<I> window) {
        List<Transform<I>> transforms = window.getTransforms();
        for (int i = 0; i < transforms.size(); i++) {
            if (transforms.get(i) == null) {
                throw new InvalidPipelineItemException(
                    "Window '" + window.getName() + "' item " + i + " is not a Transform");
            }
        }
    }

    /**
     * All bare transforms become one implicit window; all windows are
     * returned as they are; a mixture fails.
     */
    public static <I> List<Window<I>> collectWindows(List<? extends PipelineItem<I>> items, WindowNamer namer) {
        Classification<I> split = classify(items);
        if (split.nonGroups.size() == items.size()) {
            Window<I> implicit = new Window<>(split.nonGroups, null, namer);
            return Collections.singletonList(implicit);
        }
        if (!split.groups.isEmpty() && !split.nonGroups.isEmpty()) {
            throw new MixedGroupingException(split.groups.size(), split.nonGroups.size());
        }
        return split.groups;
    }

    /**
     * Fail on the first window name that appears twice. Surfaces and sliders
     * are keyed by window name.
     */
    public static <I> void validateUniqueWindowNames(List<Window<I>> windows) {
        Set<String> seen = new HashSet<>();
        for (Window<I> window : windows) {
            if (!seen.add(window.getName())) {
                throw new DuplicateWindowNameException(window.getName());
            }
        }
    }

    /**
     * Fail on the first parameter label that appears twice within one window.
     */
    public static <I> void validateNoLabelCollisions(List<Window<I>> windows) {
        for (Window<I> window : windows) {
            Map<String, String> ownerByLabel = new HashMap<>();
            for (Transform<I> transform : window.getTransforms()) {
                for (String label : transform.getParameters().keySet()) {
                    String owner = ownerByLabel.putIfAbsent(label, transform.getName());
                    if (owner != null) {
                        throw new DuplicateParameterLabelException(
                            label, window.getName(), transform.getName(), owner);
                    }
                }
            }
        }
    }
}
