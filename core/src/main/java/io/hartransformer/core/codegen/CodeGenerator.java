package io.hartransformer.core.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import io.hartransformer.api.syntax.Import;
import io.hartransformer.api.syntax.Line;
import io.hartransformer.api.syntax.Program;
import io.hartransformer.api.syntax.Statement;

/**
 * Serializes a {@link Program} into source lines.
 * <p>
 * Lines are produced lazily, one top-level statement at a time. Top-level statements are separated by
 * an empty line, except for consecutive imports. The output depends only on the program.
 */
public class CodeGenerator {
   private final boolean comments;

   public CodeGenerator() {
      this(true);
   }

   public CodeGenerator(boolean comments) {
      this.comments = comments;
   }

   /**
    * @return Single-use iterator over the lines of <code>program</code>, without line terminators.
    */
   public Iterator<String> lines(Program program) {
      return new LineIterator(program.statements());
   }

   /**
    * Writes all lines separated by <code>\n</code>, without a trailing line terminator.
    */
   public void write(Program program, Writer writer) throws IOException {
      Iterator<String> it = lines(program);
      while (it.hasNext()) {
         writer.write(it.next());
         if (it.hasNext()) {
            writer.write('\n');
         }
      }
      writer.flush();
   }

   public String toText(Program program) {
      StringWriter writer = new StringWriter();
      try {
         write(program, writer);
      } catch (IOException e) {
         throw new UncheckedIOException(e);
      }
      return writer.toString();
   }

   private class LineIterator implements Iterator<String> {
      private final List<Statement> statements;
      private int nextStatement;
      private Iterator<Line> current = Collections.emptyIterator();

      LineIterator(List<Statement> statements) {
         this.statements = statements;
      }

      @Override
      public boolean hasNext() {
         while (!current.hasNext()) {
            if (nextStatement >= statements.size()) {
               return false;
            }
            Statement statement = statements.get(nextStatement);
            List<Line> lines = statement.lines(0, comments);
            if (nextStatement > 0 && !(statement instanceof Import && statements.get(nextStatement - 1) instanceof Import)) {
               lines = withSeparator(lines);
            }
            current = lines.iterator();
            ++nextStatement;
         }
         return true;
      }

      @Override
      public String next() {
         if (!hasNext()) {
            throw new NoSuchElementException();
         }
         return current.next().toString();
      }

      private List<Line> withSeparator(List<Line> lines) {
         if (lines.isEmpty()) {
            return lines;
         }
         Line[] copy = new Line[lines.size() + 1];
         copy[0] = new Line("");
         for (int i = 0; i < lines.size(); ++i) {
            copy[i + 1] = lines.get(i);
         }
         return List.of(copy);
      }
   }
}
