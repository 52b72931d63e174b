package io.hartransformer.api.syntax;

import java.util.Objects;

/**
 * A line of text and its indentation level. Indentation is only applied when the line is rendered
 * so that nested statements do not need to copy strings at every scope.
 */
public final class Line {
   public static final String INDENT_UNIT = "    ";

   private final String text;
   private final int indentLevel;

   public Line(String text) {
      this(text, 0);
   }

   public Line(String text, int indentLevel) {
      if (indentLevel < 0) {
         throw new IllegalArgumentException("Negative indentation level: " + indentLevel);
      }
      this.text = Objects.requireNonNull(text);
      this.indentLevel = indentLevel;
   }

   public String text() {
      return text;
   }

   public int indentLevel() {
      return indentLevel;
   }

   public Line withText(String text) {
      return new Line(text, indentLevel);
   }

   @Override
   public String toString() {
      return INDENT_UNIT.repeat(indentLevel) + text;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Line)) {
         return false;
      }
      Line line = (Line) o;
      return indentLevel == line.indentLevel && text.equals(line.text);
   }

   @Override
   public int hashCode() {
      return Objects.hash(text, indentLevel);
   }
}
