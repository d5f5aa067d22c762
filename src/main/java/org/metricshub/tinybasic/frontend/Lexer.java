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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits one line of TinyBasic source into {@link Token}s.
 * <p>
 * The lexer keeps no state from one line to the next. Whitespace only
 * separates tokens. Integer literals carry no sign, the parser deals with
 * unary <code>+</code> and <code>-</code>. Everything following
 * <code>REM</code> is returned verbatim as a single {@link TokenKind#REMARK}.
 * The returned list always ends with an {@link TokenKind#EOL} token.
 */
public class Lexer {

	/**
	 * Contains a mapping of TinyBasic keywords to their
	 * token values.
	 * <p>
	 * Keywords are upper case only.
	 */
	private static final Map<String, TokenKind> KEYWORDS = new HashMap<String, TokenKind>();

	static {
		// statements
		KEYWORDS.put("PRINT", TokenKind.KW_PRINT);
		KEYWORDS.put("IF", TokenKind.KW_IF);
		KEYWORDS.put("THEN", TokenKind.KW_THEN);
		KEYWORDS.put("INPUT", TokenKind.KW_INPUT);
		KEYWORDS.put("LET", TokenKind.KW_LET);
		KEYWORDS.put("GOTO", TokenKind.KW_GOTO);
		KEYWORDS.put("GOSUB", TokenKind.KW_GOSUB);
		KEYWORDS.put("RETURN", TokenKind.KW_RETURN);
		KEYWORDS.put("END", TokenKind.KW_END);
		KEYWORDS.put("REM", TokenKind.KW_REM);
		KEYWORDS.put("CLS", TokenKind.KW_CLS);

		// immediate-mode commands
		KEYWORDS.put("RUN", TokenKind.KW_RUN);
		KEYWORDS.put("LIST", TokenKind.KW_LIST);
		KEYWORDS.put("NEW", TokenKind.KW_NEW);
		KEYWORDS.put("HELP", TokenKind.KW_HELP);
		KEYWORDS.put("LOAD", TokenKind.KW_LOAD);
		KEYWORDS.put("SAVE", TokenKind.KW_SAVE);
	}

	private final String source;
	private int pos;
	private int c;
	private int start;
	private final StringBuilder text = new StringBuilder();

	/**
	 * @param source one line of source text, without its line terminator
	 */
	public Lexer(String source) {
		this.source = source == null ? "" : source;
	}

	/**
	 * Convenience method for {@code new Lexer(line).tokenize()}.
	 *
	 * @param line one line of source text
	 * @return the tokens of the line, ending with EOL
	 */
	public static List<Token> tokenize(String line) {
		return new Lexer(line).tokenize();
	}

	/**
	 * Reads the whole line. Each call starts over from the first character.
	 *
	 * @return an unmodifiable list of tokens, ending with EOL
	 * @throws LexerException on an unrecognized character, an unterminated
	 *         string or an integer literal overflow
	 */
	public List<Token> tokenize() {
		pos = 0;
		c = charAt(0);
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = lexer();
			tokens.add(token);
			if (token.getKind() == TokenKind.KW_REM) {
				tokens.add(remark());
			}
		} while (token.getKind() != TokenKind.EOL);
		return Collections.unmodifiableList(tokens);
	}

	private int charAt(int index) {
		return index < source.length() ? source.charAt(index) : -1;
	}

	private void read() {
		text.append((char) c);
		c = charAt(++pos);
	}

	private void skipWhitespaces() {
		while (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
			c = charAt(++pos);
		}
	}

	private Token token(TokenKind kind) {
		return new Token(kind, text.toString(), 0, start + 1);
	}

	private Token lexer() {
		skipWhitespaces();
		text.setLength(0);
		start = pos;
		if (c < 0) {
			return token(TokenKind.EOL);
		}
		if (c == '+') {
			read();
			return token(TokenKind.PLUS);
		}
		if (c == '-') {
			read();
			return token(TokenKind.MINUS);
		}
		if (c == '*') {
			read();
			return token(TokenKind.MULT);
		}
		if (c == '/') {
			read();
			return token(TokenKind.DIVIDE);
		}
		if (c == '(') {
			read();
			return token(TokenKind.OPEN_PAREN);
		}
		if (c == ')') {
			read();
			return token(TokenKind.CLOSE_PAREN);
		}
		if (c == ',') {
			read();
			return token(TokenKind.COMMA);
		}
		if (c == '=') {
			read();
			return token(TokenKind.EQ);
		}
		if (c == '<') {
			read();
			if (c == '=') {
				read();
				return token(TokenKind.LE);
			} else if (c == '>') {
				read();
				return token(TokenKind.NE);
			}
			return token(TokenKind.LT);
		}
		if (c == '>') {
			read();
			if (c == '=') {
				read();
				return token(TokenKind.GE);
			} else if (c == '<') {
				// classic Tiny BASIC spelling of <>
				read();
				return token(TokenKind.NE);
			}
			return token(TokenKind.GT);
		}
		if (c == '"') {
			return readString();
		}
		if (c >= '0' && c <= '9') {
			return readNumber();
		}
		if (isLetter(c)) {
			while (isLetter(c)) {
				read();
			}
			TokenKind keyword = KEYWORDS.get(text.toString());
			return token(keyword != null ? keyword : TokenKind.WORD);
		}
		throw new LexerException("Invalid character: '" + (char) c + "'", pos + 1);
	}

	private static boolean isLetter(int ch) {
		return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
	}

	private Token readNumber() {
		long value = 0;
		while (c >= '0' && c <= '9') {
			value = value * 10 + (c - '0');
			if (value > Integer.MAX_VALUE) {
				throw new LexerException("Integer literal out of range", start + 1);
			}
			read();
		}
		return new Token(TokenKind.NUMBER, text.toString(), (int) value, start + 1);
	}

	private Token readString() {
		// skip the opening quote
		c = charAt(++pos);
		while (c >= 0 && c != '"') {
			read();
		}
		if (c < 0) {
			throw new LexerException("Unterminated string: \"" + text, source.length() + 1);
		}
		c = charAt(++pos);
		return token(TokenKind.STRING);
	}

	private Token remark() {
		skipWhitespaces();
		start = pos;
		String comment = source.substring(Math.min(pos, source.length()));
		pos = source.length();
		c = -1;
		return new Token(TokenKind.REMARK, comment, 0, start + 1);
	}
}
