package com.github.phasegraph.expression;

import java.math.BigInteger;

import com.github.phasegraph.GraphException;
import com.github.phasegraph.GraphException.Code;
import com.github.phasegraph.Value;

/**
 * Recursive-descent parser, lowest to highest precedence:
 * 
 * <pre>
 * Or      := And ('||' And)*
 * And     := Not ('&amp;&amp;' Not)*
 * Not     := '!' Not | Cmp
 * Cmp     := Primary (CmpOp Primary)?
 * Primary := '(' Or ')' | BOOL | NUM | STRING | IDENT
 * </pre>
 */
final class Parser {
  private final String source;
  private final Lexer lexer;
  private Token current;

  Parser(final String source) {
    this.source = source;
    this.lexer = new Lexer(source);
  }

  ExprNode parse() throws GraphException {
    current = lexer.next();
    if (current.getKind() == Token.Kind.END) {
      throw new GraphException(Code.COMPILE_FAILURE, "Empty expression");
    }
    final ExprNode root = parseOr();
    if (current.getKind() != Token.Kind.END) {
      throw failure("Unexpected " + current);
    }
    return root;
  }

  private ExprNode parseOr() throws GraphException {
    ExprNode left = parseAnd();
    while (current.isOperator("||")) {
      advance();
      left = new ExprNode.Or(left, parseAnd());
    }
    return left;
  }

  private ExprNode parseAnd() throws GraphException {
    ExprNode left = parseNot();
    while (current.isOperator("&&")) {
      advance();
      left = new ExprNode.And(left, parseNot());
    }
    return left;
  }

  private ExprNode parseNot() throws GraphException {
    if (current.isOperator("!")) {
      advance();
      return new ExprNode.Not(parseNot());
    }
    return parseCmp();
  }

  private ExprNode parseCmp() throws GraphException {
    final ExprNode left = parsePrimary();
    if (current.getKind() == Token.Kind.OP) {
      final CompareOp op = CompareOp.fromSymbol(current.getText());
      if (op != null) {
        advance();
        return new ExprNode.Cmp(op, left, parsePrimary());
      }
    }
    return left;
  }

  private ExprNode parsePrimary() throws GraphException {
    final Token token = current;
    switch (token.getKind()) {
      case LP:
        advance();
        final ExprNode inner = parseOr();
        if (current.getKind() != Token.Kind.RP) {
          throw failure("Expected ')' but found " + current);
        }
        advance();
        return inner;
      case BOOL:
        advance();
        return new ExprNode.Literal(Value.of(token.getText().equals("true")));
      case NUM:
        advance();
        return new ExprNode.Literal(number(token.getText()));
      case STR:
        advance();
        return new ExprNode.Literal(Value.of(token.getText()));
      case ID:
        advance();
        return new ExprNode.Identifier(token.getText());
      default:
        throw failure("Unexpected " + token);
    }
  }

  /**
   * Digits alone are INT64 unless they overflow a long, in which case they widen to FLOAT64 like
   * any literal with a dot.
   */
  private Value number(final String text) throws GraphException {
    try {
      if (text.indexOf('.') < 0) {
        final BigInteger integral = new BigInteger(text);
        return integral.bitLength() < Long.SIZE ? Value.of(integral.longValue())
            : Value.of(integral.doubleValue());
      }
      return Value.of(Double.parseDouble(text));
    } catch (NumberFormatException badNumber) {
      throw new GraphException(Code.COMPILE_FAILURE,
          "Invalid numeric literal " + text + " in: " + source, badNumber);
    }
  }

  private void advance() throws GraphException {
    current = lexer.next();
  }

  private GraphException failure(final String message) {
    return new GraphException(Code.COMPILE_FAILURE, message + " in: " + source);
  }
}
