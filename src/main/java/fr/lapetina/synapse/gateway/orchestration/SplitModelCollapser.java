package fr.lapetina.synapse.gateway.orchestration;

import fr.lapetina.synapse.gateway.domain.model.ModelLoadState;
import fr.lapetina.synapse.gateway.domain.model.ModelStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Folds models reported as numbered parts ({@code <base>-<K>-of-<N>}) into one logical entry
 * per {@code (base, N)} group. Entries keep the order in which their group first appeared.
 */
public final class SplitModelCollapser {

    private static final Pattern SPLIT_ID = Pattern.compile("^(?<base>.+)-(?<part>\\d+)-of-(?<total>\\d+)$");

    private SplitModelCollapser() {
    }

    public static List<ModelView> collapse(List<ModelLoadState> states) {
        Map<String, List<Part>> groups = new LinkedHashMap<>();
        for (ModelLoadState state : states) {
            Part part = Part.of(state);
            groups.computeIfAbsent(part.groupKey(), k -> new ArrayList<>()).add(part);
        }

        List<ModelView> views = new ArrayList<>(groups.size());
        for (List<Part> group : groups.values()) {
            views.add(merge(group));
        }
        return views;
    }

    /**
     * Finds the logical entry that contains the given id, as a whole-group id or as one of its parts.
     */
    public static Optional<ModelView> find(List<ModelView> views, String modelId) {
        return views.stream()
                .filter(view -> view.id().equals(modelId) || view.contains(modelId))
                .findFirst();
    }

    private static ModelView merge(List<Part> group) {
        Part representative = group.get(0);
        ModelStatus status = ModelStatus.UNKNOWN;
        boolean failed = false;
        List<String> memberIds = new ArrayList<>(group.size());

        for (Part part : group) {
            if (part.number() < representative.number()) {
                representative = part;
            }
            status = ModelStatus.mostPermissive(status, part.state().status());
            failed |= part.state().failed();
            memberIds.add(part.state().id());
        }

        int parts = representative.total() > 0 ? representative.total() : 1;
        return new ModelView(representative.state().id(), status, failed,
                representative.state().args(), parts, memberIds);
    }

    /**
     * Group membership of one router entry. Regular models form a group of their own.
     */
    private record Part(ModelLoadState state, String base, int number, int total) {

        static Part of(ModelLoadState state) {
            Matcher matcher = SPLIT_ID.matcher(state.id());
            if (matcher.matches()) {
                try {
                    return new Part(state, matcher.group("base"),
                            Integer.parseInt(matcher.group("part")),
                            Integer.parseInt(matcher.group("total")));
                } catch (NumberFormatException e) {
                    // digits too long for an int: not a split id we understand
                    return new Part(state, state.id(), 0, 0);
                }
            }
            return new Part(state, state.id(), 0, 0);
        }

        String groupKey() {
            return total > 0 ? base + "\u0000" + total : state.id();
        }
    }
}
