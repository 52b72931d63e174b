package io.hartransformer.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.hartransformer.internal.Properties;

/**
 * Input paths and plugin names, combined from the command line and the environment.
 * <p>
 * Paths given on the command line replace those from {@value Properties#INPUT_PATHS}; plugins given on
 * the command line are appended to those from {@value Properties#PLUGINS}. Both properties accept a JSON
 * array or a comma-separated list.
 */
public final class TransformerConfig {
   private static final Logger log = LogManager.getLogger(TransformerConfig.class);
   private static final ObjectMapper MAPPER = new ObjectMapper();

   private final List<String> inputPaths;
   private final List<String> plugins;

   TransformerConfig(List<String> inputPaths, List<String> plugins) {
      this.inputPaths = Collections.unmodifiableList(inputPaths);
      this.plugins = Collections.unmodifiableList(plugins);
   }

   public static TransformerConfig read(List<String> cliPaths, List<String> cliPlugins) {
      List<String> paths = parseList(Properties.INPUT_PATHS, Properties.get(Properties.INPUT_PATHS, null));
      if (cliPaths != null && !cliPaths.isEmpty()) {
         if (!paths.isEmpty()) {
            log.warn("{} overwritten with command-line arguments", Properties.envName(Properties.INPUT_PATHS));
         }
         paths = new ArrayList<>(cliPaths);
      }
      List<String> plugins = parseList(Properties.PLUGINS, Properties.get(Properties.PLUGINS, null));
      if (cliPlugins != null && !cliPlugins.isEmpty()) {
         if (!plugins.isEmpty()) {
            log.warn("{} merged with command-line -p/--plugin options", Properties.envName(Properties.PLUGINS));
         }
         plugins.addAll(cliPlugins);
      }
      return new TransformerConfig(paths, plugins);
   }

   static List<String> parseList(String property, String value) {
      List<String> list = new ArrayList<>();
      if (value == null || value.isBlank()) {
         return list;
      }
      String trimmed = value.trim();
      if (trimmed.startsWith("[")) {
         try {
            list.addAll(MAPPER.readValue(trimmed, new TypeReference<List<String>>() {}));
         } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot parse " + property + " as a JSON array of strings: " + value, e);
         }
      } else {
         for (String item : trimmed.split(",")) {
            if (!item.isBlank()) {
               list.add(item.trim());
            }
         }
      }
      return list;
   }

   public List<String> inputPaths() {
      return inputPaths;
   }

   public List<String> plugins() {
      return plugins;
   }
}
