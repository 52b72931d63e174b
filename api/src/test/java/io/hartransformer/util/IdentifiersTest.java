package io.hartransformer.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class IdentifiersTest {
   @Test
   public void testValidIdentifierUnchanged() {
      assertThat(Identifiers.toIdentifier("abc")).isEqualTo("abc");
      assertThat(Identifiers.toIdentifier("GET_a_b")).isEqualTo("GET_a_b");
      assertThat(Identifiers.toIdentifier("_x9")).isEqualTo("_x9");
   }

   @Test
   public void testInvalidCharactersReplaced() {
      assertThat(Identifiers.toIdentifier("a-b")).isEqualTo("a_b_31588593");
      assertThat(Identifiers.toIdentifier("www.example.com")).isEqualTo("www_example_com_810681837");
      assertThat(Identifiers.toIdentifier("/api/v1")).isEqualTo("_api_v1_152306240");
   }

   @Test
   public void testLeadingDigit() {
      assertThat(Identifiers.toIdentifier("1abc")).isEqualTo("_1abc_51511640");
   }

   @Test
   public void testInputLookingLikeChecksum() {
      assertThat(Identifiers.toIdentifier("abc_12")).isEqualTo("abc_12_124977641");
   }

   @Test
   public void testNoCollisionBetweenReplacedCharacters() {
      String dash = Identifiers.toIdentifier("a-b");
      String dot = Identifiers.toIdentifier("a.b");
      assertThat(dash).isNotEqualTo(dot);
      assertThat(Identifiers.toIdentifier(dash)).isNotEqualTo(dash);
   }

   @Test
   public void testResultsAreIdentifiers() {
      for (String input : new String[]{ "a-b", "1abc", "scenario-1", "/", "ěščř", "x y z" }) {
         assertThat(Identifiers.isIdentifier(Identifiers.toIdentifier(input))).as(input).isTrue();
      }
      assertThat(Identifiers.isIdentifier("9a")).isFalse();
      assertThat(Identifiers.isIdentifier("a.b")).isFalse();
   }
}
