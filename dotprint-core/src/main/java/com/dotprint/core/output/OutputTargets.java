package com.dotprint.core.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the {@link OutputTarget}s registered on the class path.
 */
public final class OutputTargets {

    private OutputTargets() {
    }

    /**
     * Loads all registered targets.
     *
     * @return targets in registration order
     */
    public static List<OutputTarget> all() {
        List<OutputTarget> targets = new ArrayList<>();
        ServiceLoader.load(OutputTarget.class).forEach(targets::add);
        return targets;
    }

    /**
     * Finds a target by identifier.
     *
     * @param id target identifier
     * @return the target, or empty if none is registered under the id
     */
    public static Optional<OutputTarget> find(String id) {
        return all().stream().filter(target -> target.getId().equalsIgnoreCase(id)).findFirst();
    }
}
