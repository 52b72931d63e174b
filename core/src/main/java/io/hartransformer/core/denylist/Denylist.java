package io.hartransformer.core.denylist;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Set of URL fragments; requests whose URL contains any of them are left out of the generated program.
 */
public final class Denylist {
   private static final Logger log = LogManager.getLogger(Denylist.class);
   public static final String DEFAULT_FILE = ".urlignore";
   private static final Denylist EMPTY = new Denylist(Collections.emptySet());

   private final Set<String> patterns;

   private Denylist(Set<String> patterns) {
      this.patterns = patterns;
   }

   public static Denylist empty() {
      return EMPTY;
   }

   public static Denylist of(String... patterns) {
      return of(Arrays.asList(patterns));
   }

   public static Denylist of(Collection<String> patterns) {
      Set<String> set = new LinkedHashSet<>();
      for (String pattern : patterns) {
         if (pattern != null && !pattern.isEmpty()) {
            set.add(pattern);
         }
      }
      return set.isEmpty() ? EMPTY : new Denylist(Collections.unmodifiableSet(set));
   }

   /**
    * Loads {@value #DEFAULT_FILE} from the current working directory.
    */
   public static Denylist fromWorkingDirectory() {
      return fromFile(Paths.get(System.getProperty("user.dir"), DEFAULT_FILE));
   }

   /**
    * One pattern per line; trailing whitespace is ignored, as are blank lines. A file that cannot be read
    * yields an empty denylist.
    */
   public static Denylist fromFile(Path file) {
      try {
         Set<String> patterns = new LinkedHashSet<>();
         for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String pattern = line.stripTrailing();
            if (!pattern.isEmpty()) {
               patterns.add(pattern);
            }
         }
         log.debug("Loaded {} denylist patterns from {}", patterns.size(), file);
         return of(patterns);
      } catch (IOException e) {
         log.debug("Could not read denylist file {}: {}", file, e.toString());
         return EMPTY;
      }
   }

   public boolean isDenied(String url) {
      for (String pattern : patterns) {
         if (url.contains(pattern)) {
            return true;
         }
      }
      return false;
   }

   public Set<String> patterns() {
      return patterns;
   }

   public boolean isEmpty() {
      return patterns.isEmpty();
   }

   @Override
   public String toString() {
      return "Denylist" + patterns;
   }
}
