package com.modelgate.modelgate_backend.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvResolverTest {

  private final EnvResolver resolver = new EnvResolver(new MockEnvironment()
      .withProperty("API_KEY", "sk-live")
      .withProperty("HOST", "models.internal")
      .withProperty("KEY_$WEIRD", "a$b\\c"));

  @Test
  void literalsPassThrough() {
    assertEquals("https://api.example/v1", resolver.extractEnvVariable("https://api.example/v1"));
    assertNull(resolver.extractEnvVariable(null));
  }

  @Test
  void wholeValueReferenceResolves() {
    assertEquals("sk-live", resolver.extractEnvVariable("${API_KEY}"));
  }

  @Test
  void unsetReferenceKeepsConfiguredValue() {
    assertEquals("${MISSING}", resolver.extractEnvVariable("${MISSING}"));
  }

  @Test
  void embeddedReferencesResolveInPlace() {
    assertEquals("https://models.internal/v1/${MISSING}",
        resolver.extractEnvVariable("https://${HOST}/v1/${MISSING}"));
  }

  @Test
  void replacementCharactersAreTakenLiterally() {
    assertEquals("key=a$b\\c", resolver.extractEnvVariable("key=${KEY_$WEIRD}"));
  }

  @Test
  void recognisesUserProvidedSentinel() {
    assertTrue(resolver.isUserProvided("user_provided"));
    assertFalse(resolver.isUserProvided("sk-live"));
    assertFalse(resolver.isUserProvided(null));
  }
}
