package io.hartransformer.internal;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class PropertiesTest {
   @AfterEach
   public void clearProperties() {
      System.clearProperty(Properties.STACKTRACE);
      System.clearProperty(Properties.DENYLIST);
   }

   @Test
   public void testSystemPropertyFirst() {
      System.setProperty(Properties.DENYLIST, "/tmp/ignore");
      assertThat(Properties.get(Properties.DENYLIST, null)).isEqualTo("/tmp/ignore");
   }

   @Test
   public void testBoolean() {
      assertThat(Properties.getBoolean(Properties.STACKTRACE)).isFalse();
      System.setProperty(Properties.STACKTRACE, "true");
      assertThat(Properties.getBoolean(Properties.STACKTRACE)).isTrue();
   }

   @Test
   public void testEnvNames() {
      assertThat(Properties.envName(Properties.PLUGINS)).isEqualTo("TRANSFORMER_PLUGINS");
      assertThat(Properties.envName(Properties.DENYLIST)).isEqualTo("TRANSFORMER_DENYLIST");
   }
}
