package io.hartransformer.api.syntax;

import java.util.Objects;

/**
 * Binary operation such as <code>a == b</code> or <code>x in y</code>. Operands that are binary operations
 * themselves are parenthesized; no precedence analysis is attempted.
 */
public final class BinaryOp extends Expression {
   private final Expression lhs;
   private final String op;
   private final Expression rhs;

   public BinaryOp(Expression lhs, String op, Expression rhs) {
      this.lhs = Objects.requireNonNull(lhs);
      this.op = Objects.requireNonNull(op);
      this.rhs = Objects.requireNonNull(rhs);
   }

   public Expression lhs() {
      return lhs;
   }

   public String op() {
      return op;
   }

   public Expression rhs() {
      return rhs;
   }

   @Override
   public String toString() {
      return operand(lhs) + " " + op + " " + operand(rhs);
   }

   private static String operand(Expression e) {
      return e instanceof BinaryOp ? "(" + e + ")" : e.toString();
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      BinaryOp other = (BinaryOp) o;
      return lhs.equals(other.lhs) && op.equals(other.op) && rhs.equals(other.rhs);
   }

   @Override
   public int hashCode() {
      return Objects.hash(lhs, op, rhs);
   }
}
