package theoremis.lexer;

public enum MathTokenType {
	NUMBER,
	IDENT,
	COMMAND,
	LBRACE,
	RBRACE,
	LPAREN,
	RPAREN,
	LBRACKET,
	RBRACKET,
	PLUS,
	MINUS,
	STAR,
	SLASH,
	CARET,
	UNDERSCORE,
	EQUALS,
	LT,
	GT,
	COMMA,
	PIPE,
	AMPERSAND,
	EOF,
}
