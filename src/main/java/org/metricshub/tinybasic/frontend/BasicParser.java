package org.metricshub.tinybasic.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * TinyBasic
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.List;
import org.metricshub.tinybasic.frontend.ast.ArithmeticOperator;
import org.metricshub.tinybasic.frontend.ast.BinaryExpression;
import org.metricshub.tinybasic.frontend.ast.Command;
import org.metricshub.tinybasic.frontend.ast.CommandStatement;
import org.metricshub.tinybasic.frontend.ast.Expression;
import org.metricshub.tinybasic.frontend.ast.IfStatement;
import org.metricshub.tinybasic.frontend.ast.InputStatement;
import org.metricshub.tinybasic.frontend.ast.JumpStatement;
import org.metricshub.tinybasic.frontend.ast.LetStatement;
import org.metricshub.tinybasic.frontend.ast.Line;
import org.metricshub.tinybasic.frontend.ast.LiteralExpression;
import org.metricshub.tinybasic.frontend.ast.PrintItem;
import org.metricshub.tinybasic.frontend.ast.PrintStatement;
import org.metricshub.tinybasic.frontend.ast.RelationOperator;
import org.metricshub.tinybasic.frontend.ast.RemStatement;
import org.metricshub.tinybasic.frontend.ast.SimpleStatement;
import org.metricshub.tinybasic.frontend.ast.Statement;
import org.metricshub.tinybasic.frontend.ast.UnaryExpression;
import org.metricshub.tinybasic.frontend.ast.UnaryOperator;
import org.metricshub.tinybasic.frontend.ast.VariableExpression;

/**
 * Converts one line of TinyBasic source into a {@link Line}.
 * <p>
 * The grammar, as written, makes the right operand of a binary operator a
 * full expression, which would read <code>2*3+4</code> as
 * <code>2*(3+4)</code>. This parser accepts the same sentences but layers the
 * expression rules so that <code>*</code> and <code>/</code> bind tighter
 * than <code>+</code> and <code>-</code>, all four associate to the left,
 * and unary signs bind tightest.
 * <p>
 * An instance is not thread-safe but may be reused for any number of lines.
 */
public class BasicParser {

	private List<Token> tokens;
	private int index;
	private Token token;

	/**
	 * Parses one source line.
	 *
	 * @param source the text of the line
	 * @return the parsed line, or {@code null} if the line is blank
	 * @throws ParserException if the line does not follow the grammar
	 */
	public Line parseLine(String source) {
		start(source);
		if (token.getKind() == TokenKind.EOL) {
			return null;
		}
		return LINE(source);
	}

	/**
	 * Parses a standalone arithmetic expression that must span the whole text.
	 *
	 * @param source the expression text
	 * @return the expression tree
	 * @throws ParserException if the text is not exactly one expression
	 */
	public Expression parseExpression(String source) {
		start(source);
		Expression expression = EXPRESSION();
		lexer(TokenKind.EOL, "end of expression");
		return expression;
	}

	private void start(String source) {
		tokens = Lexer.tokenize(source);
		index = 0;
		token = tokens.get(0);
	}

	private Token lexer() {
		Token previous = token;
		if (index < tokens.size() - 1) {
			index++;
		}
		token = tokens.get(index);
		return previous;
	}

	private Token lexer(TokenKind expectedToken, String expected) {
		if (token.getKind() != expectedToken) {
			throw new ParserException(expected, token);
		}
		return lexer();
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// LINE : NUMBER [STATEMENT] EOL | STATEMENT EOL
	Line LINE(String source) {
		int number = Line.IMMEDIATE;
		if (token.getKind() == TokenKind.NUMBER) {
			Token numberToken = lexer();
			number = numberToken.getValue();
			if (number < 1 || number > Line.MAX_NUMBER) {
				throw new ParserException(
						"Line number must be between 1 and " + Line.MAX_NUMBER + ". Got " + number,
						numberToken.getColumn());
			}
			if (token.getKind() == TokenKind.EOL) {
				return new Line(number, null, source);
			}
		}
		Statement statement = STATEMENT(number == Line.IMMEDIATE);
		lexer(TokenKind.EOL, "end of line");
		return new Line(number, statement, source);
	}

	// STATEMENT : PRINT PRINT_LIST
	// | IF EXPRESSION RELOP EXPRESSION THEN STATEMENT
	// | INPUT VAR_LIST
	// | LET VAR = EXPRESSION
	// | GOTO EXPRESSION
	// | GOSUB EXPRESSION
	// | RETURN | END | CLS | REM text
	// | RUN | LIST | NEW | HELP | LOAD | SAVE (immediate mode only)
	Statement STATEMENT(boolean allowCommands) {
		Token keyword = token;
		switch (keyword.getKind()) {
		case KW_PRINT:
			lexer();
			return new PrintStatement(PRINT_LIST());
		case KW_IF:
			lexer();
			return IF_STATEMENT();
		case KW_INPUT:
			lexer();
			return new InputStatement(VAR_LIST());
		case KW_LET: {
			lexer();
			char variable = VAR();
			lexer(TokenKind.EQ, "=");
			return new LetStatement(variable, EXPRESSION());
		}
		case KW_GOTO:
			lexer();
			return new JumpStatement(false, EXPRESSION());
		case KW_GOSUB:
			lexer();
			return new JumpStatement(true, EXPRESSION());
		case KW_RETURN:
			lexer();
			return SimpleStatement.RETURN;
		case KW_END:
			lexer();
			return SimpleStatement.END;
		case KW_CLS:
			lexer();
			return SimpleStatement.CLS;
		case KW_REM:
			lexer();
			return new RemStatement(lexer(TokenKind.REMARK, "comment").getText());
		case KW_RUN:
			return COMMAND(Command.RUN, allowCommands);
		case KW_LIST:
			return COMMAND(Command.LIST, allowCommands);
		case KW_NEW:
			return COMMAND(Command.NEW, allowCommands);
		case KW_HELP:
			return COMMAND(Command.HELP, allowCommands);
		case KW_LOAD:
			return COMMAND(Command.LOAD, allowCommands);
		case KW_SAVE:
			return COMMAND(Command.SAVE, allowCommands);
		default:
			throw new ParserException("statement keyword", keyword);
		}
	}

	Statement COMMAND(Command command, boolean allowCommands) {
		if (!allowCommands) {
			throw new ParserException(command + " is only allowed in immediate mode", token.getColumn());
		}
		lexer();
		return CommandStatement.of(command);
	}

	// PRINT_LIST : (STRING | EXPRESSION) [, (STRING | EXPRESSION)]...
	List<PrintItem> PRINT_LIST() {
		List<PrintItem> items = new ArrayList<PrintItem>();
		items.add(PRINT_ITEM());
		while (token.getKind() == TokenKind.COMMA) {
			lexer();
			items.add(PRINT_ITEM());
		}
		return items;
	}

	PrintItem PRINT_ITEM() {
		if (token.getKind() == TokenKind.STRING) {
			return PrintItem.text(lexer().getText());
		}
		return PrintItem.expression(EXPRESSION("string or expression"));
	}

	// IF_STATEMENT : EXPRESSION RELOP EXPRESSION THEN STATEMENT
	Statement IF_STATEMENT() {
		Expression left = EXPRESSION();
		RelationOperator relation = RELOP();
		Expression right = EXPRESSION();
		lexer(TokenKind.KW_THEN, "THEN");
		return new IfStatement(left, relation, right, STATEMENT(false));
	}

	// RELOP : < [> | =] | > [< | =] | =
	RelationOperator RELOP() {
		switch (token.getKind()) {
		case EQ:
			lexer();
			return RelationOperator.EQUAL;
		case NE:
			lexer();
			return RelationOperator.NOT_EQUAL;
		case LT:
			lexer();
			return RelationOperator.LESS_THAN;
		case LE:
			lexer();
			return RelationOperator.LESS_THAN_OR_EQUAL;
		case GT:
			lexer();
			return RelationOperator.GREATER_THAN;
		case GE:
			lexer();
			return RelationOperator.GREATER_THAN_OR_EQUAL;
		default:
			throw new ParserException("relation operator", token);
		}
	}

	// VAR_LIST : VAR [, VAR]...
	List<Character> VAR_LIST() {
		List<Character> variables = new ArrayList<Character>();
		variables.add(VAR());
		while (token.getKind() == TokenKind.COMMA) {
			lexer();
			variables.add(VAR());
		}
		return variables;
	}

	// VAR : A | B | ... | Z
	char VAR() {
		Token name = lexer(TokenKind.WORD, "variable");
		return variableName(name);
	}

	private static char variableName(Token name) {
		String text = name.getText();
		if (text.length() != 1 || text.charAt(0) < 'A' || text.charAt(0) > 'Z') {
			throw new ParserException("Invalid variable name " + text, name.getColumn());
		}
		return text.charAt(0);
	}

	// EXPRESSION : TERM [(+ | -) TERM]...
	Expression EXPRESSION() {
		return EXPRESSION("expression");
	}

	Expression EXPRESSION(String expected) {
		Expression left = TERM(expected);
		while (token.getKind() == TokenKind.PLUS || token.getKind() == TokenKind.MINUS) {
			ArithmeticOperator operator = lexer().getKind() == TokenKind.PLUS ? ArithmeticOperator.ADD : ArithmeticOperator.SUBTRACT;
			left = new BinaryExpression(operator, left, TERM("expression"));
		}
		return left;
	}

	// TERM : UNARY [(* | /) UNARY]...
	Expression TERM(String expected) {
		Expression left = UNARY(expected);
		while (token.getKind() == TokenKind.MULT || token.getKind() == TokenKind.DIVIDE) {
			ArithmeticOperator operator = lexer().getKind() == TokenKind.MULT ? ArithmeticOperator.MULTIPLY : ArithmeticOperator.DIVIDE;
			left = new BinaryExpression(operator, left, UNARY("expression"));
		}
		return left;
	}

	// UNARY : (+ | -) UNARY | FACTOR
	Expression UNARY(String expected) {
		if (token.getKind() == TokenKind.PLUS) {
			lexer();
			return new UnaryExpression(UnaryOperator.PLUS, UNARY(expected));
		}
		if (token.getKind() == TokenKind.MINUS) {
			lexer();
			return new UnaryExpression(UnaryOperator.MINUS, UNARY(expected));
		}
		return FACTOR(expected);
	}

	// FACTOR : VAR | NUMBER | ( EXPRESSION )
	Expression FACTOR(String expected) {
		switch (token.getKind()) {
		case WORD:
			return new VariableExpression(variableName(lexer()));
		case NUMBER:
			return new LiteralExpression(lexer().getValue());
		case OPEN_PAREN: {
			lexer();
			Expression inner = EXPRESSION();
			lexer(TokenKind.CLOSE_PAREN, ")");
			return inner;
		}
		default:
			throw new ParserException(expected, token);
		}
	}

	// CHECKSTYLE.ON: MethodName
}
