package io.hearthwarrio.locatium.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * GUI object locator produced from one path step.
 * <p>
 * Immutable: metadata is copied in and out.
 */
public final class Locator {

    private final String uid;
    private final ObjectNode metadata;
    private final String containerUid;

    public Locator(String uid, ObjectNode metadata, String containerUid) {
        this.uid = Objects.requireNonNull(uid, "uid must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null").deepCopy();
        this.containerUid = containerUid == null || containerUid.isEmpty() ? null : containerUid;
    }

    public String getUid() {
        return uid;
    }

    /**
     * Ordered scalar metadata (archetype, attributes, occurrence, visible).
     *
     * @return a copy, free to modify
     */
    public ObjectNode getMetadata() {
        return metadata.deepCopy();
    }

    /**
     * Text form of one metadata value.
     *
     * @param key metadata key
     * @return value as text, empty if the key is absent
     */
    public Optional<String> metadataText(String key) {
        JsonNode value = metadata.get(key);
        return value == null ? Optional.empty() : Optional.of(value.asText());
    }

    /**
     * UID of the locator emitted just before this one; empty for the first locator.
     */
    public Optional<String> getContainerUid() {
        return Optional.ofNullable(containerUid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Locator)) {
            return false;
        }
        Locator other = (Locator) o;
        return uid.equals(other.uid)
                && metadata.equals(other.metadata)
                && Objects.equals(containerUid, other.containerUid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, metadata, containerUid);
    }

    @Override
    public String toString() {
        return "Locator{" +
                "uid=" + uid +
                ", metadata=" + metadata +
                ", container=" + containerUid +
                '}';
    }
}
