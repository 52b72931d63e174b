package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Block of code kept as text, for constructs the other statements cannot express.
 * <p>
 * The block is normalized on construction: leading and trailing blank lines are dropped, tabs expanded
 * and the common indentation removed, so that it can be re-indented at any level.
 */
public final class OpaqueBlock extends Statement {
   private static final int TAB_SIZE = 8;

   private final List<String> block;

   public OpaqueBlock(String block) {
      this(block, Collections.emptyList());
   }

   public OpaqueBlock(String block, List<String> comments) {
      super(comments);
      if (block == null || block.isBlank()) {
         throw new IllegalArgumentException("OpaqueBlock must not be empty.");
      }
      this.block = normalize(block);
   }

   public List<String> block() {
      return block;
   }

   @Override
   public OpaqueBlock withComments(List<String> comments) {
      return new OpaqueBlock(String.join("\n", block), comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      List<Line> lines = new ArrayList<>();
      if (comments) {
         lines.addAll(commentLines(indentLevel));
      }
      for (String line : block) {
         lines.add(new Line(line, indentLevel));
      }
      return lines;
   }

   private static List<String> normalize(String text) {
      String[] raw = text.split("\\R", -1);
      int first = 0;
      int last = raw.length - 1;
      while (raw[first].isBlank()) {
         ++first;
      }
      while (raw[last].isBlank()) {
         --last;
      }
      List<String> lines = new ArrayList<>(last - first + 1);
      int indent = Integer.MAX_VALUE;
      for (int i = first; i <= last; ++i) {
         String line = expandTabs(raw[i]).stripTrailing();
         lines.add(line);
         if (!line.isEmpty()) {
            indent = Math.min(indent, line.length() - line.stripLeading().length());
         }
      }
      for (int i = 0; i < lines.size(); ++i) {
         String line = lines.get(i);
         lines.set(i, line.isEmpty() ? line : line.substring(indent));
      }
      return Collections.unmodifiableList(lines);
   }

   private static String expandTabs(String line) {
      if (line.indexOf('\t') < 0) {
         return line;
      }
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < line.length(); ++i) {
         char c = line.charAt(i);
         if (c == '\t') {
            sb.append(" ".repeat(TAB_SIZE - sb.length() % TAB_SIZE));
         } else {
            sb.append(c);
         }
      }
      return sb.toString();
   }

   @Override
   public boolean equals(Object o) {
      return super.equals(o) && block.equals(((OpaqueBlock) o).block);
   }

   @Override
   public int hashCode() {
      return Objects.hash(super.hashCode(), block);
   }

   @Override
   public String toString() {
      return "OpaqueBlock(" + block.size() + " lines)";
   }
}
