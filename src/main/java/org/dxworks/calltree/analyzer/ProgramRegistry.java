package org.dxworks.calltree.analyzer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered program sources keyed by normalized name, in registration order.
 * Re-registering a name replaces its source but keeps its original position.
 */
public final class ProgramRegistry {

    private final Map<String, String> sourcesByName = new LinkedHashMap<>();

    /**
     * @return the normalized key the source was stored under
     */
    public String put(String name, String sourceCode) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sourceCode, "sourceCode");
        String programName = ProgramNameNormalizer.normalize(name);
        sourcesByName.put(programName, sourceCode);
        return programName;
    }

    public Optional<String> sourceOf(String programName) {
        return Optional.ofNullable(sourcesByName.get(programName));
    }

    public boolean contains(String programName) {
        return sourcesByName.containsKey(programName);
    }

    public List<String> names() {
        return new ArrayList<>(sourcesByName.keySet());
    }

    public int size() {
        return sourcesByName.size();
    }

    public boolean isEmpty() {
        return sourcesByName.isEmpty();
    }

    public void clear() {
        sourcesByName.clear();
    }
}
