package org.lokray.luau.semantic.type;

import java.util.Objects;

/**
 * The type of exactly one boolean or string value.
 */
public class SingletonType implements Type
{
	private final Object value;

	private SingletonType(Object value)
	{
		this.value = value;
	}

	public static SingletonType ofBoolean(boolean value)
	{
		return new SingletonType(value);
	}

	public static SingletonType ofString(String value)
	{
		return new SingletonType(value);
	}

	public boolean isBoolean()
	{
		return value instanceof Boolean;
	}

	public boolean isString()
	{
		return value instanceof String;
	}

	public Object getValue()
	{
		return value;
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof SingletonType other && Objects.equals(value, other.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hashCode(value);
	}

	@Override
	public String getName()
	{
		return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
	}
}
