package org.vexpand.ast;

/**
 * Operators carried by {@link BinaryArithmeticNode}. The symbol is the textual form used in
 * tree dumps and in the JSON interchange format.
 */
public enum BinaryOperator
{
	SHIFT_LEFT("<<"),
	SHIFT_RIGHT(">>"),
	ADD("+"),
	SUB("-"),
	MULT("*"),
	DIV("/"),
	MOD("%"),

	BITWISE_OR("|"),
	BITWISE_XOR("^"),
	BITWISE_AND("&"),

	EQUAL("=="),
	NOT_EQUAL("!="),
	BIGGER_THAN(">"),
	BIGGER_EQUAL_THAN(">="),
	SMALLER_THAN("<"),
	SMALLER_EQUAL_THAN("<="),

	OR("or"),
	AND("and");

	private final String symbol;

	BinaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public boolean isComparison()
	{
		return ordinal() >= EQUAL.ordinal() && ordinal() <= SMALLER_EQUAL_THAN.ordinal();
	}

	public static BinaryOperator fromSymbol(String symbol)
	{
		for (BinaryOperator op : values())
		{
			if (op.symbol.equals(symbol))
			{
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown binary operator: " + symbol);
	}
}
