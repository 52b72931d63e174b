package io.hartransformer.api.syntax;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Function call with positional arguments followed by named ones: <code>f(a, b, x=c)</code>.
 * Named arguments are rendered in insertion order.
 */
public final class FunctionCall extends Expression {
   private final String name;
   private final List<Expression> positionalArgs;
   private final Map<String, Expression> namedArgs;

   public FunctionCall(String name) {
      this(name, Collections.emptyList(), Collections.emptyMap());
   }

   public FunctionCall(String name, List<Expression> positionalArgs) {
      this(name, positionalArgs, Collections.emptyMap());
   }

   public FunctionCall(String name, List<Expression> positionalArgs, Map<String, Expression> namedArgs) {
      this.name = Objects.requireNonNull(name);
      this.positionalArgs = List.copyOf(positionalArgs);
      this.namedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs));
   }

   public String name() {
      return name;
   }

   public List<Expression> positionalArgs() {
      return positionalArgs;
   }

   public Map<String, Expression> namedArgs() {
      return namedArgs;
   }

   public FunctionCall withNamedArg(String key, Expression value) {
      Map<String, Expression> copy = new LinkedHashMap<>(namedArgs);
      copy.put(key, value);
      return new FunctionCall(name, positionalArgs, copy);
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder(name).append('(');
      boolean first = true;
      for (Expression arg : positionalArgs) {
         if (!first) {
            sb.append(", ");
         }
         first = false;
         sb.append(arg);
      }
      for (Map.Entry<String, Expression> entry : namedArgs.entrySet()) {
         if (!first) {
            sb.append(", ");
         }
         first = false;
         sb.append(entry.getKey()).append('=').append(entry.getValue());
      }
      return sb.append(')').toString();
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      FunctionCall other = (FunctionCall) o;
      return name.equals(other.name) && positionalArgs.equals(other.positionalArgs) && namedArgs.equals(other.namedArgs);
   }

   @Override
   public int hashCode() {
      return Objects.hash(name, positionalArgs, namedArgs);
   }
}
