package io.hearthwarrio.locatium.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JsonLocatorRendererTest {
    private final LocatorPipeline pipeline = LocatorPipeline.defaults().withRenderer(new JsonLocatorRenderer());

    @Test
    void rendersValidJsonWithQuotedContainer() throws Exception {
        String json = pipeline.declare("//form[@id='login']/textfield[@name='user']");

        JsonNode array = new ObjectMapper().readTree(json);
        assertEquals(2, array.size());

        JsonNode form = array.get(0);
        assertEquals("form_ModuleQT_id_login", form.get("uid").asText());
        assertEquals("login", form.get("metadata").get("id").asText());
        assertFalse(form.has("container"));

        JsonNode field = array.get(1);
        assertEquals("form_ModuleQT_id_login_textfield_TextFieldQT_name_user", field.get("uid").asText());
        assertEquals("form_ModuleQT_id_login", field.get("container").asText());
        assertEquals(1, field.get("metadata").get("visible").intValue());
    }

    @Test
    void compactModeHasNoLineBreaks() {
        String json = new JsonLocatorRenderer(false).render(LocatorPipeline.defaults().locate("//a/b"));

        assertFalse(json.contains("\n"));
        assertTrue(json.startsWith("[{\"uid\":\"a_QWidget\""), json);
    }
}
