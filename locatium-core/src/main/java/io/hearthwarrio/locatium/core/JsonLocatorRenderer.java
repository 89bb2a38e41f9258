package io.hearthwarrio.locatium.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * Renders locators as a JSON array for tools that cannot load object-map scripts:
 * {@code [{"uid": ..., "metadata": {...}, "container": "..."}]}.
 * <p>
 * The container is a quoted string here, so the output is always valid JSON.
 */
public final class JsonLocatorRenderer implements LocatorRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean pretty;

    public JsonLocatorRenderer() {
        this(true);
    }

    public JsonLocatorRenderer(boolean pretty) {
        this.pretty = pretty;
    }

    @Override
    public String render(List<Locator> locators) {
        Objects.requireNonNull(locators, "locators must not be null");

        ArrayNode array = MAPPER.createArrayNode();
        for (Locator locator : locators) {
            ObjectNode node = array.addObject();
            node.put("uid", locator.getUid());
            node.set("metadata", locator.getMetadata());
            locator.getContainerUid().ifPresent(c -> node.put(ObjectMapRenderer.CONTAINER_KEY, c));
        }

        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(array)
                    : MAPPER.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render locators as JSON", e);
        }
    }
}
