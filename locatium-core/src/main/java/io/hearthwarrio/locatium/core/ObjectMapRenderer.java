package io.hearthwarrio.locatium.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders locators as object-map declarations, one record per locator:
 * <pre>
 * div_QWidget_class_header = {
 *     "archetype": "QWidget",
 *     "class": "header",
 *     "visible": 1
 * }
 * </pre>
 * A container is written as the last field and references the other record by its bare
 * name ({@code "container": div_QWidget_class_header}), so the output is meant to be
 * loaded as a script module rather than parsed as JSON.
 */
public final class ObjectMapRenderer implements LocatorRenderer {

    public static final String CONTAINER_KEY = "container";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String render(List<Locator> locators) {
        Objects.requireNonNull(locators, "locators must not be null");

        StringBuilder sb = new StringBuilder(256 * Math.max(1, locators.size()));
        for (Locator locator : locators) {
            sb.append(locator.getUid()).append(" = ").append(body(locator)).append('\n');
        }
        return sb.toString();
    }

    private static String body(Locator locator) {
        StringWriter out = new StringWriter();
        try (JsonGenerator g = MAPPER.getFactory().createGenerator(out)) {
            g.setPrettyPrinter(new DeclarationPrettyPrinter());
            g.writeStartObject();

            ObjectNode metadata = locator.getMetadata();
            Iterator<Map.Entry<String, JsonNode>> fields = metadata.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                g.writeFieldName(field.getKey());
                MAPPER.writeTree(g, field.getValue());
            }

            if (locator.getContainerUid().isPresent()) {
                g.writeFieldName(CONTAINER_KEY);
                g.writeRawValue(locator.getContainerUid().get());
            }

            g.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot render locator " + locator.getUid(), e);
        }
        return out.toString();
    }

    /**
     * Four-space indentation and {@code "key": value} separators.
     */
    static final class DeclarationPrettyPrinter extends DefaultPrettyPrinter {

        private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");

        DeclarationPrettyPrinter() {
            indentObjectsWith(INDENTER);
            indentArraysWith(INDENTER);
        }

        private DeclarationPrettyPrinter(DeclarationPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new DeclarationPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
