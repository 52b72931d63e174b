package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Something that executes without yielding a usable value. Unlike expressions, statements may span
 * multiple lines and can carry comments.
 * <p>
 * Statements are immutable: methods changing the comments return a copy.
 */
public abstract class Statement {
   private final List<String> comments;

   protected Statement(List<String> comments) {
      this.comments = resplit(comments);
   }

   /**
    * Comment lines attached to this statement, one element per line.
    */
   public List<String> comments() {
      return comments;
   }

   public abstract Statement withComments(List<String> comments);

   /**
    * All lines necessary to represent this statement.
    *
    * @param indentLevel Indentation of the least indented line of this statement.
    * @param comments    Whether comments attached to this statement (and nested ones) are rendered.
    * @return Lines in output order.
    */
   public abstract List<Line> lines(int indentLevel, boolean comments);

   public List<Line> lines() {
      return lines(0, true);
   }

   protected List<Line> commentLines(int indentLevel) {
      List<Line> lines = new ArrayList<>(comments.size());
      for (String comment : comments) {
         lines.add(new Line("# " + comment, indentLevel));
      }
      return lines;
   }

   /**
    * Attaches comments to <code>line</code>: inline when there is a single comment line,
    * on dedicated lines above otherwise.
    */
   protected List<Line> attachComment(Line line) {
      if (comments.isEmpty()) {
         return Collections.singletonList(line);
      } else if (comments.size() == 1) {
         return Collections.singletonList(line.withText(line.text() + "  # " + comments.get(0)));
      }
      List<Line> lines = commentLines(line.indentLevel());
      lines.add(line);
      return lines;
   }

   protected static List<Line> body(List<Statement> statements, int indentLevel, boolean comments) {
      List<Line> lines = new ArrayList<>();
      for (Statement statement : statements) {
         lines.addAll(statement.lines(indentLevel, comments));
      }
      if (lines.isEmpty()) {
         lines.add(new Line("pass", indentLevel));
      }
      return lines;
   }

   private static List<String> resplit(List<String> parts) {
      if (parts == null || parts.isEmpty()) {
         return Collections.emptyList();
      }
      List<String> lines = new ArrayList<>();
      for (String part : parts) {
         Collections.addAll(lines, part.split("\\R", -1));
      }
      return Collections.unmodifiableList(lines);
   }

   @Override
   public boolean equals(Object o) {
      return o != null && o.getClass() == getClass() && comments.equals(((Statement) o).comments);
   }

   @Override
   public int hashCode() {
      return Objects.hash(getClass(), comments);
   }
}
