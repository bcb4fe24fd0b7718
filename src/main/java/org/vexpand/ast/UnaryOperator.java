package org.vexpand.ast;

/**
 * Operators carried by {@link UnaryArithmeticNode}.
 */
public enum UnaryOperator
{
	SUB("-"),
	ABS("abs"),
	BITWISE_NOT("~"),
	NOT("not");

	private final String symbol;

	UnaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public static UnaryOperator fromSymbol(String symbol)
	{
		for (UnaryOperator op : values())
		{
			if (op.symbol.equals(symbol))
			{
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown unary operator: " + symbol);
	}
}
