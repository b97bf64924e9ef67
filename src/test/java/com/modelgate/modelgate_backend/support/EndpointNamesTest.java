package com.modelgate.modelgate_backend.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class EndpointNamesTest {

  @Test
  void ollamaIsCaseInsensitive() {
    assertEquals("ollama", EndpointNames.normalize("Ollama"));
    assertEquals("ollama", EndpointNames.normalize("OLLAMA"));
  }

  @Test
  void otherNamesAreKeptVerbatim() {
    assertEquals("OpenRouter", EndpointNames.normalize("OpenRouter"));
    assertEquals("ollama-remote", EndpointNames.normalize("ollama-remote"));
    assertNull(EndpointNames.normalize(null));
  }
}
