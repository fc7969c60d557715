package org.lokray.luau.ast;

import java.util.Objects;

/**
 * A half-open source range [begin, end).
 */
public final class Location
{
	public static final Location NONE = new Location(new Position(0, 0), new Position(0, 0));

	private final Position begin;
	private final Position end;

	public Location(Position begin, Position end)
	{
		this.begin = begin;
		this.end = end;
	}

	public Location(int beginLine, int beginColumn, int endLine, int endColumn)
	{
		this(new Position(beginLine, beginColumn), new Position(endLine, endColumn));
	}

	/**
	 * A zero-length location at {@code position}.
	 */
	public static Location at(Position position)
	{
		return new Location(position, position);
	}

	public Position getBegin()
	{
		return begin;
	}

	public Position getEnd()
	{
		return end;
	}

	public boolean contains(Position position)
	{
		return begin.compareTo(position) <= 0 && position.compareTo(end) < 0;
	}

	public boolean containsClosed(Position position)
	{
		return begin.compareTo(position) <= 0 && position.compareTo(end) <= 0;
	}

	public boolean encloses(Location other)
	{
		return begin.compareTo(other.begin) <= 0 && end.compareTo(other.end) >= 0;
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
		Location that = (Location) obj;
		return begin.equals(that.begin) && end.equals(that.end);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(begin, end);
	}

	@Override
	public String toString()
	{
		return begin + "-" + end;
	}
}
