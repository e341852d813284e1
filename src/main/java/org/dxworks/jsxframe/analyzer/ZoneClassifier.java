package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.model.Zone;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public class ZoneClassifier {

    private ZoneClassifier() {
    }

    /**
     * {@code STATIC} without dependencies, the shared zone when all dependencies agree,
     * {@code HYBRID} otherwise.
     */
    public static Zone classify(Set<DependencyAnalyzer.Dependency> deps) {
        if (deps.isEmpty()) {
            return Zone.STATIC;
        }
        EnumSet<Zone> zones = EnumSet.noneOf(Zone.class);
        for (DependencyAnalyzer.Dependency dep : deps) {
            zones.add(dep.zone());
        }
        if (zones.size() == 1) {
            return zones.iterator().next();
        }
        return Zone.HYBRID;
    }

    public static Zone classify(Expression expression, Map<String, Zone> stateTypes) {
        return classify(DependencyAnalyzer.analyze(expression, stateTypes));
    }
}
