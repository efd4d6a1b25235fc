package regexnfa.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Stack;

/**
 * Shunting-yard conversion of a normalized infix expression into postfix.
 *
 * <p>Every concatenation in the input must already be explicit (see
 * {@link Normalizer}). Binary operators are left-associative and the Kleene
 * star, being a unary postfix operator, goes straight to the output.
 *
 * <p>Unbalanced parentheses are handled according to the converter's mode:
 * a lenient converter drops them (an unmatched {@code )} is a no-op and an
 * unmatched {@code (} is discarded at the end), while a strict converter
 * throws {@link MalformedExpressionException}.
 */
public final class PostfixConverter {

  // Operators waiting on the stack, with their position for error reporting
  private record Pending(Operator operator, int index) { }

  /**
   * Whether unbalanced parentheses are reported instead of dropped.
   */
  public final boolean strict;

  public PostfixConverter(boolean strict) {
    this.strict = strict;
  }

  public static PostfixConverter lenient() {
    return new PostfixConverter(false);
  }

  public static PostfixConverter strict() {
    return new PostfixConverter(true);
  }

  /**
   * Convert a normalized expression into postfix order.
   *
   * @param normalized infix expression with explicit concatenations
   * @return tokens in postfix order, without any parentheses
   * @throws MalformedExpressionException if strict and the parentheses do not balance
   */
  public List<Token> convert(String normalized) throws MalformedExpressionException {
    final var output = new ArrayList<Token>();
    final var stack = new Stack<Pending>();

    int i = 0;
    while (i < normalized.length()) {
      final int index = i;
      final int codePoint = normalized.codePointAt(i);
      i += Character.charCount(codePoint);

      if (Character.isWhitespace(codePoint)) {
        continue;
      }

      final Optional<Operator> operator = Operator.fromCodePoint(codePoint);
      if (operator.isEmpty()) {
        output.add(new Literal(codePoint));
        continue;
      }

      final Operator op = operator.get();
      switch (op) {
        case OPEN_GROUP:
          stack.push(new Pending(op, index));
          break;

        case CLOSE_GROUP:
          while (!stack.isEmpty() && stack.peek().operator() != Operator.OPEN_GROUP) {
            output.add(stack.pop().operator());
          }
          if (!stack.isEmpty()) {
            stack.pop();
          } else if (strict) {
            throw new MalformedExpressionException(op, normalized, index);
          }
          break;

        case KLEENE_STAR:
          output.add(op);
          break;

        default:
          while (!stack.isEmpty()
              && stack.peek().operator() != Operator.OPEN_GROUP
              && stack.peek().operator().precedence >= op.precedence) {
            output.add(stack.pop().operator());
          }
          stack.push(new Pending(op, index));
          break;
      }
    }

    while (!stack.isEmpty()) {
      final Pending pending = stack.pop();
      if (pending.operator() == Operator.OPEN_GROUP) {
        if (strict) {
          throw new MalformedExpressionException(Operator.OPEN_GROUP, normalized, pending.index());
        }
      } else {
        output.add(pending.operator());
      }
    }

    output.trimToSize();
    return Collections.unmodifiableList(output);
  }
}
