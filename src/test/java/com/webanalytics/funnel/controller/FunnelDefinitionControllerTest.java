package com.webanalytics.funnel.controller;

import com.webanalytics.funnel.model.Website;
import com.webanalytics.funnel.store.InMemoryFunnelDefinitionStore;
import com.webanalytics.funnel.store.InMemoryWebsiteStore;
import com.webanalytics.funnel.testutil.TestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.webanalytics.funnel.testutil.TestFactory.WEBSITE;
import static com.webanalytics.funnel.testutil.TestFactory.definition;
import static com.webanalytics.funnel.testutil.TestFactory.pricingFunnel;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class FunnelDefinitionControllerTest {

    private static final String FUNNEL_JSON = """
            {"name":"Signup funnel","description":"pricing to purchase",
             "steps":[
               {"type":"PAGE_VIEW","target":"/pricing","name":"Pricing"},
               {"type":"EVENT","target":"signup_clicked","name":"Signup"},
               {"type":"CUSTOM","target":"purchase","name":"Purchase","conditions":{"plan":"pro"}}
             ],
             "filters":[{"field":"country","operator":"in","value":["US","CA"]}]}
            """;

    private final InMemoryFunnelDefinitionStore definitions = new InMemoryFunnelDefinitionStore();
    private final InMemoryWebsiteStore websites = new InMemoryWebsiteStore();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new FunnelDefinitionController(definitions, websites))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(TestFactory.objectMapper()))
                .build();
    }

    @Test
    void testCreateThenList() throws Exception {
        mockMvc.perform(post("/funnels").param("website_id", WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content(FUNNEL_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").exists())
                .andExpect(jsonPath("$.data.website_id").value(WEBSITE))
                .andExpect(jsonPath("$.data.steps", hasSize(3)));

        assertThat(definitions.listActive(WEBSITE)).hasSize(1);
        assertThat(definitions.listActive(WEBSITE).get(0).getSteps().get(2).getConditions())
                .containsEntry("plan", "pro");

        mockMvc.perform(get("/funnels").param("website_id", WEBSITE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].name").value("Signup funnel"));
    }

    @Test
    void testSingleStepFunnelIsRejected() throws Exception {
        String oneStep = """
                {"name":"Too short","steps":[{"type":"EVENT","target":"signup","name":"Signup"}]}
                """;

        mockMvc.perform(post("/funnels").param("website_id", WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content(oneStep))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false));
        assertThat(definitions.listActive(WEBSITE)).isEmpty();
    }

    @Test
    void testOverlongNameIsRejected() throws Exception {
        String body = FUNNEL_JSON.replace("Signup funnel", "x".repeat(101));

        mockMvc.perform(post("/funnels").param("website_id", WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void testMalformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/funnels").param("website_id", WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"steps\": ["))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testGetAndDelete() throws Exception {
        definitions.put("f1", definition(pricingFunnel()));

        mockMvc.perform(get("/funnels/f1").param("website_id", WEBSITE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.steps[0].type").value("PAGE_VIEW"));

        mockMvc.perform(delete("/funnels/f1").param("website_id", WEBSITE))
                .andExpect(status().isOk());

        mockMvc.perform(get("/funnels/f1").param("website_id", WEBSITE))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/funnels/f1").param("website_id", WEBSITE))
                .andExpect(status().isNotFound());
    }

    @Test
    void testRegisterWebsite() throws Exception {
        mockMvc.perform(put("/websites/" + WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"domain\":\"example.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(WEBSITE))
                .andExpect(jsonPath("$.data.domain").value("example.com"));

        assertThat(websites.findById(WEBSITE)).isPresent();

        mockMvc.perform(put("/websites/" + WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"domain\":\" \"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void testWebsiteUrlIsReducedToHost() throws Exception {
        mockMvc.perform(put("/websites/" + WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"domain\":\"https://shop.io\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.domain").value("shop.io"));

        mockMvc.perform(put("/websites/" + WEBSITE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"domain\":\"not a domain\"}"))
                .andExpect(status().isUnprocessableEntity());
        assertThat(websites.findById(WEBSITE)).contains(new Website(WEBSITE, "shop.io"));
    }
}
