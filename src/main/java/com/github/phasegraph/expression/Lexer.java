package com.github.phasegraph.expression;

import com.github.phasegraph.GraphException;
import com.github.phasegraph.GraphException.Code;

/**
 * Splits a guard expression into tokens on demand.
 * 
 * Notes:<br>
 * 1. identifiers start with a letter or underscore and may continue with letters, digits,
 * underscores and dots, so {@code properties.health} is a single identifier<br>
 * 2. a '-' immediately followed by a digit is scanned as part of the numeric literal<br>
 * 3. numeric literals carry at most one dot<br>
 * 4. string literals are double-quoted with no escapes<br>
 * 5. two-character operators win over their one-character prefixes<br>
 */
final class Lexer {
  private static final String[] twoCharOperators = {"&&", "||", "==", "!=", "<=", ">="};

  private final String source;
  private int position;

  Lexer(final String source) {
    this.source = source;
  }

  Token next() throws GraphException {
    while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
      position++;
    }
    if (position >= source.length()) {
      return Token.END;
    }
    final char c = source.charAt(position);
    if (isLetter(c) || c == '_') {
      return identifier();
    }
    if (isDigit(c) || (c == '-' && position + 1 < source.length()
        && isDigit(source.charAt(position + 1)))) {
      return number();
    }
    if (c == '"') {
      return string();
    }
    for (final String operator : twoCharOperators) {
      if (source.startsWith(operator, position)) {
        position += 2;
        return new Token(Token.Kind.OP, operator);
      }
    }
    switch (c) {
      case '<':
      case '>':
      case '!':
        position++;
        return new Token(Token.Kind.OP, String.valueOf(c));
      case '(':
        position++;
        return new Token(Token.Kind.LP, "(");
      case ')':
        position++;
        return new Token(Token.Kind.RP, ")");
      default:
        throw new GraphException(Code.COMPILE_FAILURE,
            String.format("Unexpected character '%c' at %d in: %s", c, position, source));
    }
  }

  private Token identifier() {
    final int start = position++;
    while (position < source.length()) {
      final char c = source.charAt(position);
      if (!isLetter(c) && !isDigit(c) && c != '_' && c != '.') {
        break;
      }
      position++;
    }
    final String text = source.substring(start, position);
    if (text.equals("true") || text.equals("false")) {
      return new Token(Token.Kind.BOOL, text);
    }
    return new Token(Token.Kind.ID, text);
  }

  private Token number() {
    final int start = position;
    if (source.charAt(position) == '-') {
      position++;
    }
    boolean seenDot = false;
    while (position < source.length()) {
      final char c = source.charAt(position);
      if (c == '.' && !seenDot) {
        seenDot = true;
      } else if (!isDigit(c)) {
        break;
      }
      position++;
    }
    return new Token(Token.Kind.NUM, source.substring(start, position));
  }

  // ASCII only, other scripts are unexpected characters
  private static boolean isLetter(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }

  private Token string() throws GraphException {
    final int start = ++position;
    while (position < source.length() && source.charAt(position) != '"') {
      position++;
    }
    if (position >= source.length()) {
      throw new GraphException(Code.COMPILE_FAILURE,
          "Unterminated string literal starting at " + (start - 1) + " in: " + source);
    }
    final String text = source.substring(start, position);
    position++;
    return new Token(Token.Kind.STR, text);
  }
}
