package tech.noetzold.crisis_api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.RiskCategory;
import tech.noetzold.crisis_api.model.RiskPattern;
import tech.noetzold.crisis_api.repository.CrisisEventStore;
import tech.noetzold.crisis_api.repository.impl.InMemoryCrisisEventStore;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:crisis;DB_CLOSE_DELAY=-1",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "crisis.store.type=memory"
})
@AutoConfigureMockMvc
class CrisisApiApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private CrisisProperties props;

    @Autowired
    private CrisisEventStore store;

    @Test
    void configuredWeightsAndStoreAreBound() {
        assertEquals(7.0, props.getWeights().of(RiskCategory.SELF_HARM));
        assertEquals(3.0, props.getWeights().of(RiskPattern.FINALITY_STATEMENT));
        assertEquals(7, props.getWeights().getCategories().size());
        assertInstanceOf(InMemoryCrisisEventStore.class, store);
    }

    @Test
    void interveneOnHighRiskMessage() throws Exception {
        mvc.perform(post("/safety/intervene")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"it-1\",\"message\":\"I want to die, I keep thinking about suicide\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict.crisis_level", is(7)))
                .andExpect(jsonPath("$.verdict.crisis_type", is("suicide_risk")))
                .andExpect(jsonPath("$.verdict.urgency", is("immediate")))
                .andExpect(jsonPath("$.response.resources", hasSize(3)))
                .andExpect(jsonPath("$.response.emergency_contacts[0].number", is("80077")))
                .andExpect(jsonPath("$.response.follow_up_required", is(true)));

        mvc.perform(get("/safety/report").param("session_id", "it-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_crisis_events", is(1)))
                .andExpect(jsonPath("$.highest_crisis_level", is(7)));
    }

    @Test
    void healthShowsLoadedLexicon() throws Exception {
        mvc.perform(get("/safety/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.crisis_keywords_loaded", is(7)))
                .andExpect(jsonPath("$.emergency_resources_loaded", is(3)))
                .andExpect(jsonPath("$.crisis_thresholds.high", is(7)));
    }
}
