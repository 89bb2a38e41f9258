package io.hearthwarrio.locatium.core.classify;

/**
 * Maps a node-test tag name to a widget category label (archetype).
 * <p>
 * Implementations must be total: every input, including {@code "*"}, gets a label.
 */
@FunctionalInterface
public interface TagClassifier {

    /**
     * Classify a tag name.
     *
     * @param tagName node test text (case-insensitive)
     * @return category label, never null
     */
    String classify(String tagName);
}
