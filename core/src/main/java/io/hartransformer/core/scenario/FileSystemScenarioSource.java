package io.hartransformer.core.scenario;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.hartransformer.core.har.HarReader;

/**
 * Lists a directory tree: directories become groups, regular files traces and <code>X.weight</code>
 * files the weight of sibling item <code>X</code>. Entries are sorted by file name.
 */
public class FileSystemScenarioSource implements ScenarioSource {
   private static final Logger log = LogManager.getLogger(FileSystemScenarioSource.class);
   public static final String WEIGHT_SUFFIX = ".weight";

   private final HarReader reader;

   public FileSystemScenarioSource() {
      this(new HarReader());
   }

   public FileSystemScenarioSource(HarReader reader) {
      this.reader = reader;
   }

   @Override
   public SourceNode list(String location) throws IOException {
      Path path = Paths.get(location);
      if (!Files.exists(path)) {
         throw new NoSuchFileException(location);
      }
      return list(path, location);
   }

   private SourceNode list(Path path, String origin) throws IOException {
      String name = path.getFileName() == null ? origin : path.getFileName().toString();
      if (!Files.isDirectory(path)) {
         return SourceNode.trace(name, origin, () -> reader.read(path));
      }
      List<SourceNode> children = new ArrayList<>();
      Map<String, SourceNode.WeightReader> weights = new LinkedHashMap<>();
      for (Path entry : entries(path)) {
         String fileName = entry.getFileName().toString();
         if (isWeightDeclaration(fileName) && Files.isRegularFile(entry)) {
            weights.put(SourceNode.stem(fileName), () -> Files.readString(entry, StandardCharsets.UTF_8));
         } else {
            children.add(listChild(entry));
         }
      }
      log.trace("Listed {}: {} items, {} weight declarations", origin, children.size(), weights.size());
      return SourceNode.group(name, origin, children, weights);
   }

   /**
    * A child directory that cannot be listed becomes a node failing on read, so that only this child
    * is skipped when the tree is built.
    */
   private SourceNode listChild(Path entry) {
      try {
         return list(entry, entry.toString());
      } catch (IOException e) {
         log.debug("Cannot list {}", entry, e);
         return SourceNode.trace(entry.getFileName().toString(), entry.toString(), () -> {
            throw e;
         });
      }
   }

   /**
    * Entries of <code>dir</code> sorted by file name.
    */
   List<Path> entries(Path dir) throws IOException {
      try (Stream<Path> stream = Files.list(dir)) {
         return stream.sorted((p1, p2) -> p1.getFileName().toString().compareTo(p2.getFileName().toString()))
               .collect(Collectors.toList());
      }
   }

   /**
    * <code>X.weight</code> with a non-empty <code>X</code>; a bare <code>.weight</code> is an ordinary file.
    */
   static boolean isWeightDeclaration(String fileName) {
      return fileName.endsWith(WEIGHT_SUFFIX) && fileName.length() > WEIGHT_SUFFIX.length();
   }
}
