package io.hartransformer.api.syntax;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Python literal built from a Java value.
 * <p>
 * Supported values: <code>null</code> (<code>None</code>), {@link Boolean}, integral and floating point
 * {@link Number}s, {@link CharSequence} and {@link Character} (<code>str</code>), <code>byte[]</code>
 * (<code>bytes</code>), {@link List} (<code>list</code>), {@link Tuple} (<code>tuple</code>), {@link Set}
 * (<code>set</code>), {@link Map} (<code>dict</code>, iteration order preserved) and nested
 * {@link Expression}s, which are rendered as they are.
 */
public final class Literal extends Expression {
   public static final Literal NONE = new Literal(null);

   private final Object value;

   public Literal(Object value) {
      this.value = value;
   }

   public static Literal of(Object value) {
      return value == null ? NONE : new Literal(value);
   }

   public Object value() {
      return value;
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      repr(sb, value);
      return sb.toString();
   }

   static void repr(StringBuilder sb, Object value) {
      if (value == null) {
         sb.append("None");
      } else if (value instanceof Boolean) {
         sb.append((Boolean) value ? "True" : "False");
      } else if (value instanceof Double || value instanceof Float) {
         sb.append(reprFloat(((Number) value).doubleValue()));
      } else if (value instanceof BigDecimal) {
         sb.append(reprFloat(((BigDecimal) value).doubleValue()));
      } else if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
         sb.append(value);
      } else if (value instanceof CharSequence || value instanceof Character) {
         reprString(sb, value.toString());
      } else if (value instanceof byte[]) {
         reprBytes(sb, (byte[]) value);
      } else if (value instanceof Expression) {
         sb.append(value);
      } else if (value instanceof Tuple) {
         List<Object> items = ((Tuple) value).items;
         sb.append('(');
         join(sb, items.iterator());
         if (items.size() == 1) {
            sb.append(',');
         }
         sb.append(')');
      } else if (value instanceof List) {
         sb.append('[');
         join(sb, ((List<?>) value).iterator());
         sb.append(']');
      } else if (value instanceof Set) {
         Set<?> set = (Set<?>) value;
         if (set.isEmpty()) {
            sb.append("set()");
         } else {
            sb.append('{');
            join(sb, set.iterator());
            sb.append('}');
         }
      } else if (value instanceof Map) {
         sb.append('{');
         boolean first = true;
         for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!first) {
               sb.append(", ");
            }
            first = false;
            repr(sb, entry.getKey());
            sb.append(": ");
            repr(sb, entry.getValue());
         }
         sb.append('}');
      } else if (value instanceof Collection) {
         sb.append('[');
         join(sb, ((Collection<?>) value).iterator());
         sb.append(']');
      } else {
         throw new IllegalArgumentException("Cannot represent " + value.getClass().getName() + " as a literal: " + value);
      }
   }

   private static void join(StringBuilder sb, Iterator<?> it) {
      while (it.hasNext()) {
         repr(sb, it.next());
         if (it.hasNext()) {
            sb.append(", ");
         }
      }
   }

   static String reprFloat(double d) {
      if (Double.isNaN(d)) {
         return "float('nan')";
      } else if (Double.isInfinite(d)) {
         return d > 0 ? "float('inf')" : "-float('inf')";
      } else if (d == 0) {
         return 1 / d < 0 ? "-0.0" : "0.0";
      }
      String sign = d < 0 ? "-" : "";
      BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
      String digits = decimal.unscaledValue().toString();
      int exponent = digits.length() - 1 - decimal.scale();
      if (exponent < -4 || exponent >= 16) {
         StringBuilder sb = new StringBuilder(sign).append(digits.charAt(0));
         if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
         }
         sb.append('e').append(exponent < 0 ? '-' : '+');
         int abs = Math.abs(exponent);
         if (abs < 10) {
            sb.append('0');
         }
         return sb.append(abs).toString();
      }
      String plain = decimal.toPlainString();
      return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
   }

   static void reprString(StringBuilder sb, String str) {
      char quote = str.indexOf('\'') >= 0 && str.indexOf('"') < 0 ? '"' : '\'';
      sb.append(quote);
      for (int i = 0; i < str.length(); ++i) {
         char c = str.charAt(i);
         if (c == quote || c == '\\') {
            sb.append('\\').append(c);
         } else if (c == '\n') {
            sb.append("\\n");
         } else if (c == '\r') {
            sb.append("\\r");
         } else if (c == '\t') {
            sb.append("\\t");
         } else if (Character.isISOControl(c) || c == '\u00a0') {
            sb.append(String.format("\\x%02x", (int) c));
         } else if (c == '\u2028' || c == '\u2029') {
            sb.append(String.format("\\u%04x", (int) c));
         } else {
            sb.append(c);
         }
      }
      sb.append(quote);
   }

   static void reprBytes(StringBuilder sb, byte[] bytes) {
      boolean hasSingle = false;
      boolean hasDouble = false;
      for (byte b : bytes) {
         hasSingle |= b == '\'';
         hasDouble |= b == '"';
      }
      char quote = hasSingle && !hasDouble ? '"' : '\'';
      sb.append("b").append(quote);
      for (byte b : bytes) {
         int c = b & 0xFF;
         if (c == quote || c == '\\') {
            sb.append('\\').append((char) c);
         } else if (c == '\n') {
            sb.append("\\n");
         } else if (c == '\r') {
            sb.append("\\r");
         } else if (c == '\t') {
            sb.append("\\t");
         } else if (c < 0x20 || c >= 0x7f) {
            sb.append(String.format("\\x%02x", c));
         } else {
            sb.append((char) c);
         }
      }
      sb.append(quote);
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      Object other = ((Literal) o).value;
      if (value instanceof byte[] && other instanceof byte[]) {
         return Arrays.equals((byte[]) value, (byte[]) other);
      }
      return Objects.equals(value, other);
   }

   @Override
   public int hashCode() {
      return value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value);
   }

   /**
    * Convenience for <code>bytes</code> literals from text.
    */
   public static Literal bytes(String text) {
      return new Literal(text.getBytes(StandardCharsets.UTF_8));
   }

   /**
    * Immutable sequence rendered as a Python <code>tuple</code>.
    */
   public static final class Tuple {
      private final List<Object> items;

      private Tuple(List<Object> items) {
         this.items = items;
      }

      public static Tuple of(Object... items) {
         return new Tuple(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items))));
      }

      public static Tuple of(List<?> items) {
         return new Tuple(Collections.unmodifiableList(new ArrayList<>(items)));
      }

      public List<Object> items() {
         return items;
      }

      @Override
      public boolean equals(Object o) {
         return o instanceof Tuple && items.equals(((Tuple) o).items);
      }

      @Override
      public int hashCode() {
         return items.hashCode();
      }

      @Override
      public String toString() {
         StringBuilder sb = new StringBuilder();
         repr(sb, this);
         return sb.toString();
      }
   }
}
