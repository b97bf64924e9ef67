package com.modelgate.modelgate_backend.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import com.modelgate.modelgate_backend.model.domain.CallerIdentity;
import com.modelgate.modelgate_backend.model.domain.DefaultModelEntry;
import com.modelgate.modelgate_backend.model.domain.EndpointConfig;
import com.modelgate.modelgate_backend.model.domain.EndpointModels;
import com.modelgate.modelgate_backend.model.dto.DetailedModelsConfig;
import com.modelgate.modelgate_backend.model.dto.ModelsResult;
import com.modelgate.modelgate_backend.model.dto.PlainModelsConfig;
import com.modelgate.modelgate_backend.model.dto.Verbosity;
import com.modelgate.modelgate_backend.model.fetch.FetchKey;
import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.FetchPlan;
import com.modelgate.modelgate_backend.model.fetch.FetchedModels;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultMergerTest {

  private static final FetchKey ONE = new FetchKey("https://one", "k1");
  private static final FetchKey TWO = new FetchKey("https://two", "k2");

  private final ResultMerger merger = new ResultMerger();

  @Test
  void scattersEachResultToEveryGroupMember() {
    FetchPlan plan = new FetchPlan();
    group(plan, ONE, "a", List.of());
    group(plan, ONE, "b", List.of("b-default"));

    ModelsResult result = merger.merge(plan, Map.of(ONE, FetchedModels.plain(List.of("m1"))), Verbosity.PLAIN);

    assertInstanceOf(PlainModelsConfig.class, result);
    assertEquals(Map.of("a", List.of("m1"), "b", List.of("m1")), result.models());
  }

  @Test
  void emptyOrMissingResultUsesEachMembersOwnDefaults() {
    FetchPlan plan = new FetchPlan();
    group(plan, ONE, "a", List.of("a-default"));
    group(plan, ONE, "b", null);
    group(plan, TWO, "c", List.of("c-default"));

    Map<FetchKey, FetchedModels> fetched = new LinkedHashMap<>();
    fetched.put(ONE, FetchedModels.plain(List.of()));

    ModelsResult result = merger.merge(plan, fetched, Verbosity.PLAIN);

    assertEquals(List.of("a-default"), result.models().get("a"));
    assertEquals(List.of(), result.models().get("b"));
    assertEquals(List.of("c-default"), result.models().get("c"));
  }

  @Test
  void staticEndpointsKeepTheirLists() {
    FetchPlan plan = new FetchPlan();
    EndpointConfig endpoint = endpoint("static", List.of("s"));
    plan.register("static", endpoint);
    plan.putStatic("static", List.of("s"));

    ModelsResult result = merger.merge(plan, Map.of(), Verbosity.PLAIN);

    assertEquals(Map.of("static", List.of("s")), result.models());
  }

  @Test
  void laterGroupWinsModelDetailCollisions() {
    FetchPlan plan = new FetchPlan();
    group(plan, ONE, "first", null);
    group(plan, TWO, "second", null);
    Map<FetchKey, FetchedModels> fetched = new LinkedHashMap<>();
    fetched.put(TWO, new FetchedModels(List.of("shared"), Map.of("shared", Map.of("from", "second"))));
    fetched.put(ONE, new FetchedModels(List.of("shared", "only-first"),
        Map.of("shared", Map.of("from", "first"), "only-first", Map.of("from", "first"))));

    DetailedModelsConfig result = assertInstanceOf(
        DetailedModelsConfig.class, merger.merge(plan, fetched, Verbosity.DETAILED));

    assertEquals(Map.of("from", "second"), result.modelDetails().get("shared"));
    assertEquals(Map.of("from", "first"), result.modelDetails().get("only-first"));
  }

  @Test
  void seedEntriesAreOverwrittenBySameNamedEndpoints() {
    FetchPlan plan = new FetchPlan();
    group(plan, ONE, "azureOpenAI", null);
    Map<String, List<String>> seed = new LinkedHashMap<>();
    seed.put("azureOpenAI", List.of("seeded"));
    seed.put("azureAssistants", List.of("kept"));

    ModelsResult result = merger.merge(
        plan, Map.of(ONE, FetchedModels.plain(List.of("fetched"))), Verbosity.PLAIN, seed);

    assertEquals(List.of("fetched"), result.models().get("azureOpenAI"));
    assertEquals(List.of("kept"), result.models().get("azureAssistants"));
  }

  private static void group(FetchPlan plan, FetchKey key, String name, List<String> defaults) {
    plan.register(name, endpoint(name, defaults));
    plan.addToGroup(key, new FetchParams(name, key.apiKey(), key.baseURL(),
        CallerIdentity.of(null, null), Map.of(), false, false), name);
  }

  private static EndpointConfig endpoint(String name, List<String> defaults) {
    List<DefaultModelEntry> entries = defaults == null
        ? null
        : defaults.stream().map(DefaultModelEntry::new).toList();
    return new EndpointConfig(name, "https://" + name, "k", null, false,
        new EndpointModels(true, entries, null));
  }
}
