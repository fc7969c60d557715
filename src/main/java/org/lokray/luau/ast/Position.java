package org.lokray.luau.ast;

import java.util.Objects;

/**
 * A zero-based line/column position in a source file.
 */
public final class Position implements Comparable<Position>
{
	private final int line;
	private final int column;

	public Position(int line, int column)
	{
		this.line = line;
		this.column = column;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public int compareTo(Position other)
	{
		if (line != other.line)
		{
			return Integer.compare(line, other.line);
		}
		return Integer.compare(column, other.column);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (obj == null || getClass() != obj.getClass())
		{
			return false;
		}
		Position that = (Position) obj;
		return line == that.line && column == that.column;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(line, column);
	}

	@Override
	public String toString()
	{
		return line + ":" + column;
	}
}
