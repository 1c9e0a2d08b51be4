package com.automaker.core.scheduler;

import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Orders features so that every feature comes after the features it depends on,
 * breaking ties by priority (lower number first, default 2).
 * <p>
 * Dependencies outside the given set do not constrain ordering. Features caught in a
 * dependency cycle are appended after the acyclic ones, still in priority order.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    static final int DEFAULT_PRIORITY = 2;

    private static final Comparator<Feature> BY_PRIORITY =
            Comparator.comparingInt(DependencyResolver::priorityOf);

    public List<Feature> order(List<Feature> features) {
        Map<String, Feature> byId = features.stream()
                .collect(Collectors.toMap(Feature::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<Feature>> dependents = new HashMap<>();
        for (Feature feature : byId.values()) {
            int degree = 0;
            for (String dep : feature.getDependencies()) {
                if (byId.containsKey(dep) && !dep.equals(feature.getId())) {
                    degree++;
                    dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(feature);
                }
            }
            inDegree.put(feature.getId(), degree);
        }

        PriorityQueue<Feature> ready = new PriorityQueue<>(BY_PRIORITY);
        byId.values().stream().filter(f -> inDegree.get(f.getId()) == 0).forEach(ready::add);

        List<Feature> ordered = new ArrayList<>(byId.size());
        Set<String> placed = new HashSet<>();
        while (!ready.isEmpty()) {
            Feature next = ready.poll();
            ordered.add(next);
            placed.add(next.getId());
            for (Feature dependent : dependents.getOrDefault(next.getId(), List.of())) {
                if (inDegree.merge(dependent.getId(), -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() < byId.size()) {
            List<Feature> cyclic = byId.values().stream()
                    .filter(f -> !placed.contains(f.getId()))
                    .sorted(BY_PRIORITY)
                    .toList();
            log.warn("Circular dependencies among features {}", cyclic.stream().map(Feature::getId).toList());
            ordered.addAll(cyclic);
        }
        return ordered;
    }

    /**
     * True when every dependency exists in {@code allFeatures} and is finished.
     * With {@code skipVerification}, a dependency waiting for review also counts as finished.
     */
    public boolean isSatisfied(Feature feature, List<Feature> allFeatures, boolean skipVerification) {
        if (feature.getDependencies().isEmpty()) {
            return true;
        }
        Map<String, Feature> byId = new HashMap<>();
        for (Feature f : allFeatures) {
            byId.putIfAbsent(f.getId(), f);
        }
        for (String dep : feature.getDependencies()) {
            Feature dependency = byId.get(dep);
            if (dependency == null || !isFinished(dependency.getStatus(), skipVerification)) {
                log.debug("Feature {} blocked by dependency {}", feature.getId(), dep);
                return false;
            }
        }
        return true;
    }

    private static boolean isFinished(String status, boolean skipVerification) {
        return FeatureStatus.COMPLETED.equals(status)
                || FeatureStatus.VERIFIED.equals(status)
                || (skipVerification && FeatureStatus.WAITING_APPROVAL.equals(status));
    }

    private static int priorityOf(Feature feature) {
        return feature.getPriority() != null ? feature.getPriority() : DEFAULT_PRIORITY;
    }
}
