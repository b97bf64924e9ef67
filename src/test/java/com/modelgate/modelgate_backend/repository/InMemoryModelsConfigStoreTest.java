package com.modelgate.modelgate_backend.repository;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.modelgate.modelgate_backend.model.dto.DetailedModelsConfig;
import com.modelgate.modelgate_backend.model.dto.PlainModelsConfig;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryModelsConfigStoreTest {

  private final InMemoryModelsConfigStore store = new InMemoryModelsConfigStore();

  @Test
  void returnsWhatWasStored() {
    PlainModelsConfig value = new PlainModelsConfig(Map.of("openAI", List.of("gpt-4o")));
    store.set("MODELS_CONFIG", value);

    assertSame(value, store.get("MODELS_CONFIG", PlainModelsConfig.class).orElseThrow());
  }

  @Test
  void absentKeyIsEmpty() {
    assertTrue(store.get("MODELS_CONFIG", PlainModelsConfig.class).isEmpty());
  }

  @Test
  void valueOfAnotherTypeIsEmpty() {
    store.set("MODELS_CONFIG", PlainModelsConfig.EMPTY);

    assertTrue(store.get("MODELS_CONFIG", DetailedModelsConfig.class).isEmpty());
  }

  @Test
  void lastWriteWins() {
    PlainModelsConfig second = new PlainModelsConfig(Map.of("b", List.of()));
    store.set("MODELS_CONFIG", new PlainModelsConfig(Map.of("a", List.of())));
    store.set("MODELS_CONFIG", second);

    assertSame(second, store.get("MODELS_CONFIG", PlainModelsConfig.class).orElseThrow());
  }
}
