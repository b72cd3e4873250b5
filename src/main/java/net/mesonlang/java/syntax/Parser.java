// Copyright 2026 The Mesonlang Java Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.mesonlang.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parser is a recursive-descent parser for build files.
 *
 * <p>There is one method per precedence level, lowest to highest: ternary, {@code or}, {@code
 * and}, comparison, {@code +}, {@code -}, {@code %}, {@code *}, {@code /}, unary, postfix (call,
 * method call, index) and primary. Assignment is a statement, not an expression.
 *
 * <p>Each arithmetic level recurses once into itself for its right operand, so {@code a - b - c}
 * parses as {@code a - (b - c)}. Existing build files depend on this grouping.
 *
 * <p>The parser stops at the first error: build files with syntax errors are not evaluated, so
 * there is no use for a partial tree.
 */
final class Parser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    /** The top-level block of the parsed file. Empty if there were errors. */
    final CodeBlock root;

    /** The comments from the parsed file. */
    final ImmutableList<Comment> comments;

    // Errors encountered during scanning or parsing.
    // These lists are ultimately owned by BuildFile.
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs,
        CodeBlock root,
        ImmutableList<Comment> comments,
        List<SyntaxError> errors) {
      this.locs = locs;
      this.root = Preconditions.checkNotNull(root);
      this.comments = Preconditions.checkNotNull(comments);
      this.errors = errors;
    }
  }

  // Thrown after the first error has been recorded, to unwind to the entry point.
  private static final class AbortParse extends RuntimeException {
    AbortParse() {
      super(null, null, false, false);
    }
  }

  private static final EnumSet<TokenKind> BLOCK_END_SET =
      EnumSet.of(
          TokenKind.EOF, TokenKind.ELIF, TokenKind.ELSE, TokenKind.ENDIF, TokenKind.ENDFOREACH);

  private static final EnumSet<TokenKind> COMPARISON_SET =
      EnumSet.of(
          TokenKind.EQUALS_EQUALS,
          TokenKind.NOT_EQUALS,
          TokenKind.LESS,
          TokenKind.LESS_EQUALS,
          TokenKind.GREATER,
          TokenKind.GREATER_EQUALS,
          TokenKind.IN);

  private final Lexer token; // token.kind is a prettier alias for lexer.kind
  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  // True while parsing the branches of an unparenthesized conditional expression.
  private boolean inTernary;

  // Number of enclosing foreach loops.
  private int loopDepth;

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, Object value) {
    return kind == TokenKind.STRING
        ? StringLiteral.quote((String) value)
        : value == null ? kind.toString() : value.toString();
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors);
    CodeBlock root;
    try {
      parser.nextToken();
      root = parser.parseFileInput();
    } catch (AbortParse ex) {
      root = new CodeBlock(lexer.locs, 0, ImmutableList.of(), lexer.locs.size());
    }
    return new ParseResult(lexer.locs, root, lexer.getComments(), errors);
  }

  /** Parses an expression, possibly preceded or followed by newlines. */
  static Expression parseExpression(ParserInput input) throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors);
    Expression result = null;
    try {
      parser.nextToken();
      parser.skipNewlines();
      result = parser.parseExpression();
      parser.skipNewlines();
      parser.expect(TokenKind.EOF);
    } catch (AbortParse ex) {
      // error recorded
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  // Records a parse error at the given offset and returns the exception that unwinds the parser.
  @FormatMethod
  private AbortParse syntaxError(int offset, String format, Object... args) {
    Location location = locs.getLocation(offset);
    errors.add(
        new SyntaxError(
            SyntaxError.Kind.PARSE,
            location,
            String.format(format, args),
            locs.getLineText(location.line()),
            null,
            null));
    return new AbortParse();
  }

  // Records an error for a block whose closing keyword is missing.
  private AbortParse unterminatedBlock(int blockOffset, TokenKind close) {
    Location location = locs.getLocation(token.start);
    Location blockStart = locs.getLocation(blockOffset);
    errors.add(
        new SyntaxError(
            SyntaxError.Kind.UNTERMINATED_BLOCK,
            location,
            String.format("Expecting %s got %s.", close, tokenString(token.kind, token.value)),
            locs.getLineText(location.line()),
            blockStart,
            locs.getLineText(blockStart.line())));
    return new AbortParse();
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      throw syntaxError(
          token.start, "Expecting %s got %s.", kind, tokenString(token.kind, token.value));
    }
    return nextToken();
  }

  // Consumes the current token and returns the start offset of the consumed token.
  // Lexical errors are fatal.
  private int nextToken() {
    int prev = token.start;
    int errorCount = errors.size();
    lexer.nextToken();
    if (errors.size() > errorCount) {
      throw new AbortParse();
    }
    return prev;
  }

  private void skipNewlines() {
    while (token.kind == TokenKind.NEWLINE) {
      nextToken();
    }
  }

  // file_input = statement_list EOF
  private CodeBlock parseFileInput() {
    ImmutableList<Statement> statements = parseStatementList();
    if (token.kind != TokenKind.EOF) {
      throw syntaxError(token.start, "Unexpected %s outside of any block.", token.kind);
    }
    return new CodeBlock(locs, 0, statements, locs.size());
  }

  // statement_list = {NEWLINE | statement (NEWLINE | EOF)}
  // Stops at EOF or at a keyword that closes or continues a block.
  private ImmutableList<Statement> parseStatementList() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (BLOCK_END_SET.contains(token.kind)) {
        return list.build();
      }
      list.add(parseStatement());
      if (token.kind != TokenKind.NEWLINE && token.kind != TokenKind.EOF) {
        throw syntaxError(
            token.start, "Expecting newline got %s.", tokenString(token.kind, token.value));
      }
    }
  }

  // statement = if_stmt | foreach_stmt | flow_stmt | assignment | expr
  private Statement parseStatement() {
    switch (token.kind) {
      case IF:
        return parseIfStatement();
      case FOREACH:
        return parseForeachStatement();
      case BREAK:
      case CONTINUE:
        return parseFlowStatement();
      default:
        return parseSimpleStatement();
    }
  }

  // assignment = IDENTIFIER ('=' | '+=') expr
  private Statement parseSimpleStatement() {
    Expression lhs = parseExpression();
    if (token.kind == TokenKind.EQUALS || token.kind == TokenKind.PLUS_EQUALS) {
      boolean augmented = token.kind == TokenKind.PLUS_EQUALS;
      if (!(lhs instanceof Identifier)) {
        throw syntaxError(
            lhs.getStartOffset(),
            augmented
                ? "Plusassignment target must be an id."
                : "Assignment target must be an id.");
      }
      int opOffset = nextToken();
      Expression rhs = parseExpression();
      return new AssignmentStatement(
          locs, (Identifier) lhs, augmented ? TokenKind.PLUS : null, opOffset, rhs);
    }
    return new ExpressionStatement(locs, lhs);
  }

  private FlowStatement parseFlowStatement() {
    TokenKind kind = token.kind;
    if (loopDepth == 0) {
      throw syntaxError(token.start, "%s statement outside of a foreach loop.", kind);
    }
    int offset = nextToken();
    return new FlowStatement(locs, kind, offset);
  }

  // Consumes the newline ending the header of a block. A header at end of file leaves the block
  // unterminated.
  private void expectBlockHeaderEnd(int blockOffset, TokenKind close) {
    if (token.kind == TokenKind.EOF) {
      throw unterminatedBlock(blockOffset, close);
    }
    expect(TokenKind.NEWLINE);
  }

  // Parses the statements of a block body up to its closing or continuing keyword.
  private CodeBlock parseBody(int bodyStart, int blockOffset, TokenKind close) {
    ImmutableList<Statement> statements = parseStatementList();
    if (token.kind == TokenKind.EOF) {
      throw unterminatedBlock(blockOffset, close);
    }
    return new CodeBlock(locs, bodyStart, statements, token.start);
  }

  // if_stmt = IF expr NEWLINE body {ELIF expr NEWLINE body} [ELSE NEWLINE body] ENDIF
  private IfStatement parseIfStatement() {
    int ifOffset = token.start;
    ImmutableList.Builder<IfStatement.Conditional> arms = ImmutableList.builder();
    IfStatement.Else elseArm = null;
    do {
      TokenKind keyword = token.kind;
      int keywordOffset = nextToken();
      Expression condition = parseExpression();
      expectBlockHeaderEnd(ifOffset, TokenKind.ENDIF);
      CodeBlock body = parseBody(condition.getEndOffset(), ifOffset, TokenKind.ENDIF);
      arms.add(new IfStatement.Conditional(locs, keyword, keywordOffset, condition, body));
    } while (token.kind == TokenKind.ELIF);
    if (token.kind == TokenKind.ELSE) {
      int elseOffset = nextToken();
      expectBlockHeaderEnd(ifOffset, TokenKind.ENDIF);
      CodeBlock body =
          parseBody(
              elseOffset + TokenKind.ELSE.toString().length(), ifOffset, TokenKind.ENDIF);
      elseArm = new IfStatement.Else(locs, elseOffset, body);
    }
    if (token.kind != TokenKind.ENDIF) {
      throw unterminatedBlock(ifOffset, TokenKind.ENDIF);
    }
    int endifOffset = nextToken();
    return new IfStatement(locs, arms.build(), elseArm, endifOffset);
  }

  // foreach_stmt = FOREACH IDENTIFIER [',' IDENTIFIER] ':' expr NEWLINE body ENDFOREACH
  private ForeachStatement parseForeachStatement() {
    int foreachOffset = nextToken();
    ImmutableList.Builder<Identifier> vars = ImmutableList.builder();
    vars.add(parseIdent());
    if (token.kind == TokenKind.COMMA) {
      nextToken();
      vars.add(parseIdent());
    }
    expect(TokenKind.COLON);
    Expression iterable = parseExpression();
    expectBlockHeaderEnd(foreachOffset, TokenKind.ENDFOREACH);
    loopDepth++;
    CodeBlock body = parseBody(iterable.getEndOffset(), foreachOffset, TokenKind.ENDFOREACH);
    loopDepth--;
    if (token.kind != TokenKind.ENDFOREACH) {
      throw unterminatedBlock(foreachOffset, TokenKind.ENDFOREACH);
    }
    int endOffset = nextToken();
    return new ForeachStatement(locs, foreachOffset, vars.build(), iterable, body, endOffset);
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      throw syntaxError(
          token.start, "Expecting identifier got %s.", tokenString(token.kind, token.value));
    }
    String name = (String) token.value;
    int offset = nextToken();
    return new Identifier(locs, name, offset);
  }

  // expr = or_expr ['?' expr ':' expr]
  // A conditional may not appear unparenthesized in a branch of another conditional.
  private Expression parseExpression() {
    Expression condition = parseOrExpression();
    if (token.kind != TokenKind.QUESTION) {
      return condition;
    }
    if (inTernary) {
      throw syntaxError(condition.getStartOffset(), "Nested ternary operators are not allowed.");
    }
    nextToken();
    inTernary = true;
    Expression thenCase = parseExpression();
    expect(TokenKind.COLON);
    Expression elseCase = parseExpression();
    inTernary = false;
    return new ConditionalExpression(locs, condition, thenCase, elseCase);
  }

  // Parses an expression enclosed in brackets, where a conditional may appear again.
  private Expression parseBracketedExpression() {
    boolean saved = inTernary;
    inTernary = false;
    Expression e = parseExpression();
    inTernary = saved;
    return e;
  }

  // or_expr = and_expr {OR and_expr}
  private Expression parseOrExpression() {
    Expression x = parseAndExpression();
    while (token.kind == TokenKind.OR) {
      int opOffset = nextToken();
      Expression y = parseAndExpression();
      x = new BinaryOperatorExpression(locs, x, TokenKind.OR, opOffset, y);
    }
    return x;
  }

  // and_expr = comparison {AND comparison}
  private Expression parseAndExpression() {
    Expression x = parseComparison();
    while (token.kind == TokenKind.AND) {
      int opOffset = nextToken();
      Expression y = parseComparison();
      x = new BinaryOperatorExpression(locs, x, TokenKind.AND, opOffset, y);
    }
    return x;
  }

  // comparison = sum [comp_op sum]
  // comp_op = '==' | '!=' | '<' | '<=' | '>' | '>=' | IN | NOT IN
  private Expression parseComparison() {
    Expression x = parseSum();
    TokenKind op;
    int opOffset;
    if (COMPARISON_SET.contains(token.kind)) {
      op = token.kind;
      opOffset = nextToken();
    } else if (token.kind == TokenKind.NOT) {
      op = TokenKind.NOT_IN;
      opOffset = nextToken();
      expect(TokenKind.IN);
    } else {
      return x;
    }
    Expression y = parseSum();
    return new BinaryOperatorExpression(locs, x, op, opOffset, y);
  }

  // sum = difference ['+' sum]
  private Expression parseSum() {
    Expression x = parseDifference();
    if (token.kind != TokenKind.PLUS) {
      return x;
    }
    int opOffset = nextToken();
    return new BinaryOperatorExpression(locs, x, TokenKind.PLUS, opOffset, parseSum());
  }

  // difference = modulus ['-' difference]
  private Expression parseDifference() {
    Expression x = parseModulus();
    if (token.kind != TokenKind.MINUS) {
      return x;
    }
    int opOffset = nextToken();
    return new BinaryOperatorExpression(locs, x, TokenKind.MINUS, opOffset, parseDifference());
  }

  // modulus = product ['%' modulus]
  private Expression parseModulus() {
    Expression x = parseProduct();
    if (token.kind != TokenKind.PERCENT) {
      return x;
    }
    int opOffset = nextToken();
    return new BinaryOperatorExpression(locs, x, TokenKind.PERCENT, opOffset, parseModulus());
  }

  // product = quotient ['*' product]
  private Expression parseProduct() {
    Expression x = parseQuotient();
    if (token.kind != TokenKind.STAR) {
      return x;
    }
    int opOffset = nextToken();
    return new BinaryOperatorExpression(locs, x, TokenKind.STAR, opOffset, parseProduct());
  }

  // quotient = unary ['/' quotient]
  private Expression parseQuotient() {
    Expression x = parseUnary();
    if (token.kind != TokenKind.SLASH) {
      return x;
    }
    int opOffset = nextToken();
    return new BinaryOperatorExpression(locs, x, TokenKind.SLASH, opOffset, parseQuotient());
  }

  // unary = (NOT | '-') postfix | postfix
  private Expression parseUnary() {
    if (token.kind == TokenKind.NOT || token.kind == TokenKind.MINUS) {
      TokenKind op = token.kind;
      int opOffset = nextToken();
      return new UnaryOperatorExpression(locs, op, opOffset, parsePostfix());
    }
    return parsePostfix();
  }

  // postfix = primary [call_suffix] {'.' IDENTIFIER call_suffix | '[' expr ']'}
  private Expression parsePostfix() {
    Expression e = parsePrimary();
    if (token.kind == TokenKind.LPAREN) {
      if (!(e instanceof Identifier)) {
        throw syntaxError(e.getStartOffset(), "Function call must be applied to plain id");
      }
      int lparenOffset = nextToken();
      ArgumentList args = parseArguments(lparenOffset);
      int rparenOffset = expect(TokenKind.RPAREN);
      e = new CallExpression(locs, (Identifier) e, lparenOffset, args, rparenOffset);
    }
    while (true) {
      if (token.kind == TokenKind.DOT) {
        int dotOffset = nextToken();
        if (token.kind != TokenKind.IDENTIFIER) {
          throw syntaxError(token.start, "Method name must be plain id");
        }
        Identifier method = parseIdent();
        int lparenOffset = expect(TokenKind.LPAREN);
        ArgumentList args = parseArguments(lparenOffset);
        int rparenOffset = expect(TokenKind.RPAREN);
        e = new MethodCallExpression(locs, e, dotOffset, method, args, rparenOffset);
      } else if (token.kind == TokenKind.LBRACKET) {
        int lbracketOffset = nextToken();
        Expression key = parseBracketedExpression();
        int rbracketOffset = expect(TokenKind.RBRACKET);
        e = new IndexExpression(locs, e, lbracketOffset, key, rbracketOffset);
      } else {
        return e;
      }
    }
  }

  // arguments = [argument {',' argument} [',']]
  // argument = expr | IDENTIFIER ':' expr
  // Leaves the closing parenthesis as the current token.
  private ArgumentList parseArguments(int lparenOffset) {
    ImmutableList.Builder<Argument> list = ImmutableList.builder();
    Set<String> keywords = new HashSet<>();
    boolean orderError = false;
    while (token.kind != TokenKind.RPAREN) {
      Expression e = parseBracketedExpression();
      if (token.kind == TokenKind.COLON) {
        if (!(e instanceof Identifier)) {
          throw syntaxError(e.getStartOffset(), "Keyword argument must be a plain identifier.");
        }
        Identifier id = (Identifier) e;
        nextToken();
        Expression value = parseBracketedExpression();
        if (!keywords.add(id.getName())) {
          logger.atWarning().log(
              "%s: keyword argument '%s' defined multiple times; the last value is used",
              id.getStartLocation(),
              id.getName());
        }
        list.add(new Argument.Keyword(locs, id, value));
      } else {
        if (!keywords.isEmpty()) {
          orderError = true;
        }
        list.add(new Argument.Positional(locs, e));
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    return new ArgumentList(locs, lparenOffset + 1, list.build(), token.start, orderError);
  }

  // primary = '(' expr ')' | '[' [expr {',' expr} [',']] ']' | '{' [entry {',' entry} [',']] '}'
  //         | atom
  private Expression parsePrimary() {
    switch (token.kind) {
      case LPAREN:
        {
          int lparenOffset = nextToken();
          Expression x = parseBracketedExpression();
          int rparenOffset = expect(TokenKind.RPAREN);
          return new ParenthesizedExpression(locs, lparenOffset, x, rparenOffset);
        }
      case LBRACKET:
        {
          int lbracketOffset = nextToken();
          ImmutableList.Builder<Expression> elems = ImmutableList.builder();
          while (token.kind != TokenKind.RBRACKET) {
            elems.add(parseBracketedExpression());
            if (token.kind != TokenKind.COMMA) {
              break;
            }
            nextToken();
          }
          int rbracketOffset = expect(TokenKind.RBRACKET);
          return new ListExpression(locs, lbracketOffset, elems.build(), rbracketOffset);
        }
      case LBRACE:
        {
          int lbraceOffset = nextToken();
          ImmutableList.Builder<DictExpression.Entry> entries = ImmutableList.builder();
          while (token.kind != TokenKind.RBRACE) {
            Expression key = parseBracketedExpression();
            int colonOffset = expect(TokenKind.COLON);
            Expression value = parseBracketedExpression();
            entries.add(new DictExpression.Entry(locs, key, colonOffset, value));
            if (token.kind != TokenKind.COMMA) {
              break;
            }
            nextToken();
          }
          int rbraceOffset = expect(TokenKind.RBRACE);
          return new DictExpression(locs, lbraceOffset, entries.build(), rbraceOffset);
        }
      default:
        return parseAtom();
    }
  }

  // atom = TRUE | FALSE | IDENTIFIER | INT | STRING | FSTRING
  private Expression parseAtom() {
    switch (token.kind) {
      case TRUE:
      case FALSE:
        {
          boolean value = token.kind == TokenKind.TRUE;
          int offset = nextToken();
          return new BooleanLiteral(locs, offset, value);
        }
      case IDENTIFIER:
        return parseIdent();
      case INT:
        {
          IntLiteral literal = new IntLiteral(locs, token.raw, token.start, (Long) token.value);
          nextToken();
          return literal;
        }
      case STRING:
        {
          StringLiteral literal =
              new StringLiteral(
                  locs, token.start, (String) token.value, token.end, token.multiline);
          nextToken();
          return literal;
        }
      case FSTRING:
        {
          FormatStringLiteral literal =
              new FormatStringLiteral(
                  locs, token.start, (String) token.value, token.end, token.multiline);
          nextToken();
          return literal;
        }
      default:
        throw syntaxError(
            token.start, "Expecting expression got %s.", tokenString(token.kind, token.value));
    }
  }
}
