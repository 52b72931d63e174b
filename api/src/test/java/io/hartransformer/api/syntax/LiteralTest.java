package io.hartransformer.api.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class LiteralTest {
   @Test
   public void testSimpleValues() {
      assertThat(Literal.of(null)).hasToString("None");
      assertThat(new Literal(true)).hasToString("True");
      assertThat(new Literal(false)).hasToString("False");
      assertThat(new Literal(42)).hasToString("42");
      assertThat(new Literal(-7L)).hasToString("-7");
   }

   @Test
   public void testStringQuotes() {
      assertThat(new Literal("abc")).hasToString("'abc'");
      assertThat(new Literal("it's")).hasToString("\"it's\"");
      assertThat(new Literal("a'b\"c")).hasToString("'a\\'b\"c'");
      assertThat(new Literal("say \"hi\"")).hasToString("'say \"hi\"'");
   }

   @Test
   public void testStringEscapes() {
      assertThat(new Literal("a\nb\tc\rd")).hasToString("'a\\nb\\tc\\rd'");
      assertThat(new Literal("back\\slash")).hasToString("'back\\\\slash'");
      assertThat(new Literal("\u0001")).hasToString("'\\x01'");
      assertThat(new Literal("ěščř")).hasToString("'ěščř'");
   }

   @Test
   public void testBytes() {
      assertThat(new Literal("a=1&b=2".getBytes(StandardCharsets.UTF_8))).hasToString("b'a=1&b=2'");
      assertThat(new Literal(new byte[]{ 0, (byte) 0xff, '\n' })).hasToString("b'\\x00\\xff\\n'");
      assertThat(Literal.bytes("it's")).hasToString("b\"it's\"");
      assertThat(Literal.bytes("ě")).hasToString("b'\\xc4\\x9b'");
   }

   @Test
   public void testFloats() {
      assertThat(new Literal(1.0)).hasToString("1.0");
      assertThat(new Literal(100.0)).hasToString("100.0");
      assertThat(new Literal(123.456)).hasToString("123.456");
      assertThat(new Literal(0.0001)).hasToString("0.0001");
      assertThat(new Literal(1.5e-5)).hasToString("1.5e-05");
      assertThat(new Literal(1e15)).hasToString("1000000000000000.0");
      assertThat(new Literal(1e16)).hasToString("1e+16");
      assertThat(new Literal(-2.5e100)).hasToString("-2.5e+100");
      assertThat(new Literal(-0.0)).hasToString("-0.0");
      assertThat(new Literal(Double.NaN)).hasToString("float('nan')");
      assertThat(new Literal(Double.NEGATIVE_INFINITY)).hasToString("-float('inf')");
   }

   @Test
   public void testTuples() {
      assertThat(new Literal(Literal.Tuple.of())).hasToString("()");
      assertThat(new Literal(Literal.Tuple.of(1))).hasToString("(1,)");
      assertThat(new Literal(Literal.Tuple.of(1, "a", null))).hasToString("(1, 'a', None)");
   }

   @Test
   public void testCollections() {
      assertThat(new Literal(List.of(1, 2))).hasToString("[1, 2]");
      assertThat(new Literal(Collections.emptyList())).hasToString("[]");
      assertThat(new Literal(Collections.emptySet())).hasToString("set()");
      assertThat(new Literal(new LinkedHashSet<>(Arrays.asList("x", "y")))).hasToString("{'x', 'y'}");
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("b", 1);
      map.put("a", Arrays.asList(true, null));
      assertThat(new Literal(map)).hasToString("{'b': 1, 'a': [True, None]}");
      assertThat(new Literal(Collections.emptyMap())).hasToString("{}");
   }

   @Test
   public void testNestedExpressions() {
      assertThat(new Literal(List.of(new Symbol("Root")))).hasToString("[Root]");
      assertThat(new Literal(Map.of("k", new FString("{x}")))).hasToString("{'k': f'{x}'}");
   }

   @Test
   public void testUnsupportedValue() {
      assertThatThrownBy(() -> new Literal(new Object()).toString()).isInstanceOf(IllegalArgumentException.class);
   }

   @Test
   public void testEquality() {
      assertThat(Literal.bytes("abc")).isEqualTo(Literal.bytes("abc"));
      assertThat(Literal.bytes("abc").hashCode()).isEqualTo(Literal.bytes("abc").hashCode());
      assertThat(new Literal("abc")).isNotEqualTo(new Literal("abd"));
   }
}
