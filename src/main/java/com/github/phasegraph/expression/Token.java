package com.github.phasegraph.expression;

/**
 * Lexical token of a guard expression. {@code text} carries the identifier, literal or operator
 * exactly as scanned, without the quotes for strings.
 */
final class Token {
  static final Token END = new Token(Kind.END, "");

  private final Kind kind;
  private final String text;

  Token(final Kind kind, final String text) {
    this.kind = kind;
    this.text = text;
  }

  Kind getKind() {
    return kind;
  }

  String getText() {
    return text;
  }

  boolean isOperator(final String operator) {
    return kind == Kind.OP && text.equals(operator);
  }

  @Override
  public String toString() {
    return kind == Kind.END ? "end of expression" : kind + "[" + text + "]";
  }

  static enum Kind {
    ID, NUM, STR, BOOL, OP, LP, RP, END
  }
}
