package my.finstatements.app.expression;

import my.finstatements.app.errors.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for {@code + - * /}, parentheses, unary minus, numbers,
 * identifiers and {@code @<order>} references.
 */
public class ExpressionParser {

	enum TokenType {
		NUMBER,
		IDENTIFIER,
		ORDER_REF,
		OPERATOR,
		LPAREN,
		RPAREN,
		END
	}

	record Token(TokenType type, String text, int position) {
	}

	public ExpressionNode parse(String expression) {
		if (expression == null || expression.isBlank()) {
			throw new ValidationException("Expression must not be empty");
		}
		Cursor cursor = new Cursor(tokenize(expression));
		ExpressionNode node = parseAddSub(cursor);
		Token trailing = cursor.peek();
		if (trailing.type() != TokenType.END) {
			throw unexpected(trailing);
		}
		return node;
	}

	List<Token> tokenize(String expression) {
		List<Token> tokens = new ArrayList<>();
		int i = 0;
		while (i < expression.length()) {
			char c = expression.charAt(i);
			if (Character.isWhitespace(c)) {
				i++;
			} else if (Character.isDigit(c) || c == '.') {
				int start = i;
				while (i < expression.length() && (Character.isDigit(expression.charAt(i)) || expression.charAt(i) == '.')) {
					i++;
				}
				tokens.add(new Token(TokenType.NUMBER, expression.substring(start, i), start));
			} else if (c == '@') {
				int start = i++;
				while (i < expression.length() && Character.isDigit(expression.charAt(i))) {
					i++;
				}
				if (i == start + 1) {
					throw new ValidationException("Invalid order reference at position " + start);
				}
				tokens.add(new Token(TokenType.ORDER_REF, expression.substring(start + 1, i), start));
			} else if (Character.isLetter(c) || c == '_') {
				int start = i;
				while (i < expression.length()
						&& (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_')) {
					i++;
				}
				tokens.add(new Token(TokenType.IDENTIFIER, expression.substring(start, i), start));
			} else if (c == '+' || c == '-' || c == '*' || c == '/') {
				tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i++));
			} else if (c == '(') {
				tokens.add(new Token(TokenType.LPAREN, "(", i++));
			} else if (c == ')') {
				tokens.add(new Token(TokenType.RPAREN, ")", i++));
			} else {
				throw new ValidationException("Unexpected character '" + c + "' at position " + i);
			}
		}
		tokens.add(new Token(TokenType.END, "", expression.length()));
		return tokens;
	}

	private ExpressionNode parseAddSub(Cursor cursor) {
		ExpressionNode left = parseMulDiv(cursor);
		while (cursor.isOperator('+') || cursor.isOperator('-')) {
			char operator = cursor.next().text().charAt(0);
			left = new ExpressionNode.Binary(operator, left, parseMulDiv(cursor));
		}
		return left;
	}

	private ExpressionNode parseMulDiv(Cursor cursor) {
		ExpressionNode left = parseUnary(cursor);
		while (cursor.isOperator('*') || cursor.isOperator('/')) {
			char operator = cursor.next().text().charAt(0);
			left = new ExpressionNode.Binary(operator, left, parseUnary(cursor));
		}
		return left;
	}

	private ExpressionNode parseUnary(Cursor cursor) {
		if (cursor.isOperator('-')) {
			cursor.next();
			return new ExpressionNode.Negate(parseUnary(cursor));
		}
		if (cursor.isOperator('+')) {
			cursor.next();
			return parseUnary(cursor);
		}
		return parsePrimary(cursor);
	}

	private ExpressionNode parsePrimary(Cursor cursor) {
		Token token = cursor.next();
		switch (token.type()) {
			case NUMBER:
				try {
					return new ExpressionNode.NumberLiteral(Double.parseDouble(token.text()));
				} catch (NumberFormatException ex) {
					throw unexpected(token);
				}
			case IDENTIFIER:
				return new ExpressionNode.VariableRef(token.text());
			case ORDER_REF:
				return new ExpressionNode.OrderRef(Integer.parseInt(token.text()));
			case LPAREN:
				ExpressionNode inner = parseAddSub(cursor);
				if (cursor.peek().type() != TokenType.RPAREN) {
					throw new ValidationException("Missing closing parenthesis at position " + cursor.peek().position());
				}
				cursor.next();
				return inner;
			default:
				throw unexpected(token);
		}
	}

	private ValidationException unexpected(Token token) {
		if (token.type() == TokenType.END) {
			return new ValidationException("Unexpected end of expression at position " + token.position());
		}
		return new ValidationException("Unexpected token '" + token.text() + "' at position " + token.position());
	}

	private static final class Cursor {
		private final List<Token> tokens;
		private int index;

		Cursor(List<Token> tokens) {
			this.tokens = tokens;
		}

		Token peek() {
			return tokens.get(index);
		}

		Token next() {
			Token token = tokens.get(index);
			if (token.type() != TokenType.END) {
				index++;
			}
			return token;
		}

		boolean isOperator(char operator) {
			Token token = peek();
			return token.type() == TokenType.OPERATOR && token.text().charAt(0) == operator;
		}
	}
}
