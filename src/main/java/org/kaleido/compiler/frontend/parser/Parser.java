package org.kaleido.compiler.frontend.parser;

import org.kaleido.compiler.api.CompilerErrorCode;
import org.kaleido.compiler.api.Result;
import org.kaleido.compiler.api.SourceInfo;
import org.kaleido.compiler.frontend.lexer.Lexer;
import org.kaleido.compiler.frontend.lexer.Token;
import org.kaleido.compiler.frontend.lexer.TokenType;
import org.kaleido.compiler.frontend.parser.ast.BinaryOpNode;
import org.kaleido.compiler.frontend.parser.ast.CallNode;
import org.kaleido.compiler.frontend.parser.ast.ExprNode;
import org.kaleido.compiler.frontend.parser.ast.FunctionNode;
import org.kaleido.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kaleido.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleido.compiler.frontend.parser.ast.VariableRefNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A recursive-descent parser with one token of lookahead. It pulls tokens from the
 * {@link Lexer} on demand and parses binary expressions by precedence climbing.
 * <pre>
 * primary    := number | identifier | identifier '(' (expression (',' expression)*)? ')' | '(' expression ')'
 * expression := primary (operator primary)*
 * prototype  := identifier '(' identifier* ')'
 * definition := 'def' prototype expression
 * extern     := 'extern' prototype
 * toplevel   := expression
 * </pre>
 * Every production returns a {@link Result}; on failure no partial tree is returned and the
 * current token is left where the error was detected, so the caller can resynchronize.
 */
public class Parser {

    private final Lexer lexer;
    private final PrecedenceTable precedences;
    private Token current;

    /**
     * Constructs a new Parser.
     * @param lexer The token source.
     * @param precedences The binary operators and their precedences.
     */
    public Parser(Lexer lexer, PrecedenceTable precedences) {
        this.lexer = lexer;
        this.precedences = precedences;
    }

    /**
     * Returns the lookahead token, reading the first token of the input on first use.
     * @return The current token.
     */
    public Token current() {
        if (current == null) {
            current = lexer.nextToken();
        }
        return current;
    }

    /**
     * Consumes the current token and reads the next one as the new lookahead.
     * @return The new current token.
     */
    public Token advance() {
        current();
        current = lexer.nextToken();
        return current;
    }

    /**
     * Parses a full expression: a primary followed by any binary-operator continuations.
     * @return The expression tree.
     */
    public Result<ExprNode> parseExpression() {
        Result<ExprNode> lhs = parsePrimary();
        if (lhs.isError()) {
            return lhs;
        }
        return parseBinOpRhs(0, lhs.value());
    }

    /**
     * Parses {@code identifier '(' identifier* ')'}.
     * @return The prototype.
     */
    public Result<PrototypeNode> parsePrototype() {
        Token nameToken = current();
        if (nameToken.type() != TokenType.IDENTIFIER) {
            return Result.error(CompilerErrorCode.EXPECTED_FUNCTION_NAME,
                    "Expected function name in prototype", nameToken.source());
        }
        String name = nameToken.text();

        if (!advance().isChar('(')) {
            return Result.error(CompilerErrorCode.EXPECTED_OPEN_PAREN_IN_PROTOTYPE,
                    "Expected '(' in prototype", current.source());
        }

        List<String> parameters = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        while (advance().type() == TokenType.IDENTIFIER) {
            if (!seen.add(current.text())) {
                return Result.error(CompilerErrorCode.DUPLICATE_PARAMETER,
                        "Duplicate parameter '" + current.text() + "' in prototype of '" + name + "'",
                        current.source());
            }
            parameters.add(current.text());
        }

        if (!current.isChar(')')) {
            return Result.error(CompilerErrorCode.EXPECTED_CLOSE_PAREN_IN_PROTOTYPE,
                    "Expected ')' in prototype", current.source());
        }
        advance(); // consume ')'

        return Result.ok(new PrototypeNode(name, parameters, nameToken.source()));
    }

    /**
     * Parses {@code 'def' prototype expression}. The current token must be {@code def}.
     * @return The function with its body.
     */
    public Result<FunctionNode> parseDefinition() {
        advance(); // consume 'def'
        Result<PrototypeNode> proto = parsePrototype();
        if (proto.isError()) {
            return proto.propagate();
        }
        return parseExpression().map(body -> new FunctionNode(proto.value(), body));
    }

    /**
     * Parses {@code 'extern' prototype}. The current token must be {@code extern}.
     * @return The declared prototype.
     */
    public Result<PrototypeNode> parseExtern() {
        advance(); // consume 'extern'
        return parsePrototype();
    }

    /**
     * Parses a bare expression and wraps it in an anonymous, zero-argument function.
     * @return The anonymous function.
     */
    public Result<FunctionNode> parseTopLevelExpression() {
        SourceInfo start = current().source();
        return parseExpression().map(body -> new FunctionNode(PrototypeNode.anonymous(start), body));
    }

    private Result<ExprNode> parsePrimary() {
        Token token = current();
        switch (token.type()) {
            case IDENTIFIER:
                return parseIdentifierExpression();
            case NUMBER:
                return parseNumberExpression();
            default:
                if (token.isChar('(')) {
                    return parseParenExpression();
                }
                return Result.error(CompilerErrorCode.UNEXPECTED_TOKEN_IN_EXPRESSION,
                        "unknown token when expecting an expression: '" + describe(token) + "'", token.source());
        }
    }

    private Result<ExprNode> parseNumberExpression() {
        Token number = current;
        advance(); // consume the number
        return Result.ok(new NumberLiteralNode(number.numberValue(), number.source()));
    }

    private Result<ExprNode> parseParenExpression() {
        advance(); // consume '('
        Result<ExprNode> inner = parseExpression();
        if (inner.isError()) {
            return inner;
        }
        if (!current.isChar(')')) {
            return Result.error(CompilerErrorCode.EXPECTED_CLOSING_PAREN, "expected ')'", current.source());
        }
        advance(); // consume ')'
        return inner;
    }

    private Result<ExprNode> parseIdentifierExpression() {
        Token identifier = current;
        advance(); // consume the identifier

        if (!current.isChar('(')) {
            return Result.ok(new VariableRefNode(identifier.text(), identifier.source()));
        }

        advance(); // consume '('
        List<ExprNode> arguments = new ArrayList<>();
        if (!current.isChar(')')) {
            while (true) {
                Result<ExprNode> argument = parseExpression();
                if (argument.isError()) {
                    return argument;
                }
                arguments.add(argument.value());

                if (current.isChar(')')) {
                    break;
                }
                if (!current.isChar(',')) {
                    return Result.error(CompilerErrorCode.EXPECTED_ARGUMENT_SEPARATOR,
                            "Expected ')' or ',' in argument list", current.source());
                }
                advance(); // consume ','
            }
        }
        advance(); // consume ')'

        return Result.ok(new CallNode(identifier.text(), arguments, identifier.source()));
    }

    /**
     * Precedence climbing: folds {@code (operator primary)*} into {@code lhs} as long as the
     * next operator binds at least as tightly as {@code minPrecedence}.
     */
    private Result<ExprNode> parseBinOpRhs(int minPrecedence, ExprNode lhs) {
        while (true) {
            int tokenPrecedence = precedences.precedenceOf(current);
            if (tokenPrecedence < minPrecedence) {
                return Result.ok(lhs);
            }

            Token operator = current;
            advance(); // consume the operator

            Result<ExprNode> rhs = parsePrimary();
            if (rhs.isError()) {
                return rhs;
            }

            // A tighter-binding operator after the operand takes the operand as its own left side first.
            int nextPrecedence = precedences.precedenceOf(current);
            if (tokenPrecedence < nextPrecedence) {
                rhs = parseBinOpRhs(tokenPrecedence + 1, rhs.value());
                if (rhs.isError()) {
                    return rhs;
                }
            }

            lhs = new BinaryOpNode(operator.charValue(), lhs, rhs.value(), operator.source());
        }
    }

    private static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "<end of input>" : token.text();
    }
}
