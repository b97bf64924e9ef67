package com.modelgate.modelgate_backend.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.modelgate.modelgate_backend.engine.ModelFetchException;
import com.modelgate.modelgate_backend.model.domain.CallerIdentity;
import com.modelgate.modelgate_backend.model.dto.DetailedModelsConfig;
import com.modelgate.modelgate_backend.model.dto.ModelsResult;
import com.modelgate.modelgate_backend.model.dto.PlainModelsConfig;
import com.modelgate.modelgate_backend.model.dto.Verbosity;
import com.modelgate.modelgate_backend.service.ModelsConfigService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ModelControllerTest {

  private final List<CallerIdentity> callers = new ArrayList<>();
  private final List<Verbosity> requested = new ArrayList<>();

  @Test
  void servesPlainMapByDefault() throws Exception {
    MockMvc mvc = mvc(new PlainModelsConfig(Map.of("groq", List.of("llama3-8b"))));

    mvc.perform(get("/api/models"))
        .andExpect(status().isOk())
        .andExpect(content().json("{\"groq\":[\"llama3-8b\"]}", true));

    assertEquals(List.of(Verbosity.PLAIN), requested);
    assertEquals(CallerIdentity.of(null, null), callers.get(0));
  }

  @Test
  void includeDetailsServesModelsAndDetails() throws Exception {
    MockMvc mvc = mvc(new DetailedModelsConfig(
        Map.of("groq", List.of("llama3-8b")),
        Map.of("llama3-8b", Map.of("context_window", 8192))));

    mvc.perform(get("/api/models").param("includeDetails", "true")
            .header("X-User-Id", "u-42")
            .header("X-User-Role", "ADMIN"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.models.groq[0]").value("llama3-8b"))
        .andExpect(jsonPath("$.modelDetails['llama3-8b'].context_window").value(8192));

    assertEquals(List.of(Verbosity.DETAILED), requested);
    assertEquals(new CallerIdentity("u-42", "ADMIN"), callers.get(0));
  }

  @Test
  void onlyTheLiteralTrueRequestsDetails() throws Exception {
    MockMvc mvc = mvc(PlainModelsConfig.EMPTY);

    mvc.perform(get("/api/models").param("includeDetails", "yes")).andExpect(status().isOk());
    mvc.perform(get("/api/models").param("includeDetails", "TRUE")).andExpect(status().isOk());

    assertEquals(List.of(Verbosity.PLAIN, Verbosity.PLAIN), requested);
  }

  @Test
  void resolutionFailureIsAServerError() throws Exception {
    ModelsConfigService failing = new ModelsConfigService(null, null, null) {
      @Override
      public ModelsResult loadModels(CallerIdentity caller, Verbosity verbosity) {
        throw new ModelFetchException("Failed to fetch models for endpoint 'groq': timeout");
      }
    };
    MockMvc mvc = MockMvcBuilders.standaloneSetup(new ModelController(failing)).build();

    mvc.perform(get("/api/models"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Failed to fetch models for endpoint 'groq': timeout"));
  }

  private MockMvc mvc(ModelsResult result) {
    ModelsConfigService service = new ModelsConfigService(null, null, null) {
      @Override
      public ModelsResult loadModels(CallerIdentity caller, Verbosity verbosity) {
        callers.add(caller);
        requested.add(verbosity);
        return result;
      }
    };
    return MockMvcBuilders.standaloneSetup(new ModelController(service)).build();
  }
}
