package io.hartransformer.api.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ProgramTest {
   private static final Statement A = new Standalone(new Symbol("a"));
   private static final Statement B = new Standalone(new Symbol("b"));
   private static final Statement C = new Standalone(new Symbol("c"));

   @Test
   public void testModificationsReturnCopies() {
      Program program = Program.empty().append(A);
      Program appended = program.append(B);
      assertThat(program.statements()).containsExactly(A);
      assertThat(appended.statements()).containsExactly(A, B);
      assertThat(appended.prepend(C).statements()).containsExactly(C, A, B);
      assertThat(appended.insert(1, C).statements()).containsExactly(A, C, B);
      assertThat(appended.replace(0, C).statements()).containsExactly(C, B);
      assertThat(appended.size()).isEqualTo(2);
   }

   @Test
   public void testMap() {
      Program program = new Program(List.of(A, B));
      Program commented = program.map(s -> s.withComments(List.of("note")));
      assertThat(commented.statements()).allSatisfy(s -> assertThat(s.comments()).containsExactly("note"));
      assertThat(program).isEqualTo(new Program(List.of(A, B)));
   }
}
