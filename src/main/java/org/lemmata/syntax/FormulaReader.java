/*
 * Copyright 2025 The Lemmata Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lemmata.syntax;

import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.jspecify.annotations.Nullable;
import org.lemmata.syntax.FormulaParser.ExprContext;
import org.lemmata.syntax.FormulaParser.FormulaContext;
import org.lemmata.syntax.FormulaParser.ParenUnitContext;
import org.lemmata.syntax.FormulaParser.SymbolUnitContext;
import org.lemmata.syntax.FormulaParser.UnitContext;

/**
 * Reads formula text such as "{@code ( ph -> ps ) -> -. ch}" into an {@link Expr}.
 *
 * <p>The grammar only distinguishes symbols and parenthesized groups; operators are then recognized
 * using the {@link Notation}s declared by the skeleton. Symbols without a notation are read as
 * variables. Spellings are not resolved here, so aliases such as "{@code →}" may be used freely and
 * are left for the {@link ExprCompiler} to map.
 *
 * <p>A symbol the skeleton doesn't declare at all, found where an infix operator is expected, is
 * read as a right-associative binary operator with the lowest binding power. For example "{@code p
 * → q}" with no alias "{@code →}" reads as {@code →(p, q)}, which then fails to resolve when
 * compiled.
 */
public final class FormulaReader {
  private static final Notation UNDECLARED_OPERATOR = Notation.infix(1, Notation.Assoc.RIGHT);

  private final Skeleton skeleton;

  public FormulaReader(Skeleton skeleton) {
    this.skeleton = skeleton;
  }

  public Skeleton skeleton() {
    return skeleton;
  }

  /** Parses {@code text}, which must contain exactly one formula. */
  public Expr read(String text) {
    return read(CharStreams.fromString(text));
  }

  public Expr read(CharStream input) {
    return new ExprVisitor().visit(parse(input));
  }

  /** Parses formula text, throwing a ParseError if it is not well formed. */
  static FormulaContext parse(CharStream input) {
    // Throw ParseErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new ParseError(msg, lineNum, charPositionInLine);
          }
        };
    FormulaLexer lexer = new FormulaLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    FormulaParser parser = new FormulaParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.formula();
  }

  @FormatMethod
  private static ParseError error(Token token, String format, Object... args) {
    return new ParseError(
        String.format(format, args), token.getLine(), token.getCharPositionInLine());
  }

  /**
   * Builds an Expr from each expr node. Units are consumed directly by {@link #visitExpr}, so any
   * other node type reaching {@link #defaultResult} is a bug.
   */
  private class ExprVisitor extends FormulaBaseVisitor<Expr> {
    @Override
    protected Expr defaultResult() {
      throw new AssertionError();
    }

    @Override
    public Expr visitFormula(FormulaContext ctx) {
      return visit(ctx.expr());
    }

    @Override
    public Expr visitExpr(ExprContext ctx) {
      List<Item> items = new ArrayList<>();
      for (UnitContext unit : ctx.unit()) {
        if (unit instanceof ParenUnitContext paren) {
          items.add(new Item(null, visit(paren.expr()), paren.getStart()));
        } else {
          Token symbol = ((SymbolUnitContext) unit).SYMBOL().getSymbol();
          items.add(new Item(symbol.getText(), null, symbol));
        }
      }
      return new OperatorParser(items, ctx.getStop()).parseAll();
    }
  }

  /** Either a symbol or an already-parsed parenthesized group. */
  private static class Item {
    final @Nullable String symbol;
    final @Nullable Expr group;
    final Token start;

    Item(@Nullable String symbol, @Nullable Expr group, Token start) {
      this.symbol = symbol;
      this.group = group;
      this.start = start;
    }
  }

  /** A precedence-climbing parser over the items of a single expr node. */
  private class OperatorParser {
    final List<Item> items;
    final Token end;
    int pos;

    OperatorParser(List<Item> items, Token end) {
      this.items = items;
      this.end = end;
    }

    Expr parseAll() {
      Expr result = parseExpr(1);
      if (pos < items.size()) {
        Item item = items.get(pos);
        throw error(item.start, "Unexpected '%s'", item.start.getText());
      }
      return result;
    }

    /**
     * Parses a sequence of operands joined by infix operators whose binding power is at least
     * {@code minBindingPower}.
     */
    Expr parseExpr(int minBindingPower) {
      Expr left = parseOperand();
      // The binding power of the most recent non-associative operator at this level, or zero.
      int nonAssocBindingPower = 0;
      while (pos < items.size()) {
        Item item = items.get(pos);
        Notation notation = notation(item);
        if (notation == null && item.symbol != null && !skeleton.declares(item.symbol)) {
          notation = UNDECLARED_OPERATOR;
        }
        if (notation == null
            || notation.fixity != Notation.Fixity.INFIX
            || notation.bindingPower < minBindingPower) {
          break;
        } else if (notation.bindingPower == nonAssocBindingPower) {
          throw error(item.start, "Operator '%s' cannot be chained", item.symbol);
        }
        pos++;
        int rightBindingPower =
            (notation.assoc == Notation.Assoc.RIGHT)
                ? notation.bindingPower
                : notation.bindingPower + 1;
        Expr right = parseExpr(rightBindingPower);
        left = Expr.apply(item.symbol, left, right);
        nonAssocBindingPower =
            (notation.assoc == Notation.Assoc.NONE) ? notation.bindingPower : 0;
      }
      return left;
    }

    /** Parses a group, a variable, or a prefix operator application. */
    Expr parseOperand() {
      if (pos == items.size()) {
        throw error(end, "Missing operand after '%s'", end.getText());
      }
      Item item = items.get(pos++);
      if (item.group != null) {
        return item.group;
      }
      Notation notation = notation(item);
      if (notation == null) {
        return Expr.var(item.symbol);
      } else if (notation.fixity == Notation.Fixity.INFIX) {
        throw error(item.start, "Missing left operand of '%s'", item.symbol);
      }
      int arity = skeleton.operandCount(item.symbol);
      List<Expr> operands = new ArrayList<>(arity);
      for (int i = 1; i < arity; i++) {
        operands.add(parseOperand());
      }
      // The last operand extends as far as the operator's binding power allows.
      operands.add(parseExpr(notation.bindingPower));
      return Expr.apply(item.symbol, operands);
    }

    @Nullable Notation notation(Item item) {
      return (item.symbol == null) ? null : skeleton.notation(item.symbol);
    }
  }
}
