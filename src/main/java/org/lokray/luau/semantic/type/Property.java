package org.lokray.luau.semantic.type;

import org.lokray.luau.ast.Location;

/**
 * A table or class member with independent read and write types. A missing side is null.
 */
public class Property
{
	private final TypeId readTy;
	private final TypeId writeTy;
	private final Location location;

	private Property(TypeId readTy, TypeId writeTy, Location location)
	{
		this.readTy = readTy;
		this.writeTy = writeTy;
		this.location = location;
	}

	public static Property rw(TypeId ty)
	{
		return new Property(ty, ty, null);
	}

	public static Property rw(TypeId ty, Location location)
	{
		return new Property(ty, ty, location);
	}

	public static Property readonly(TypeId ty)
	{
		return new Property(ty, null, null);
	}

	public static Property create(TypeId readTy, TypeId writeTy)
	{
		return new Property(readTy, writeTy, null);
	}

	public TypeId getReadTy()
	{
		return readTy;
	}

	public TypeId getWriteTy()
	{
		return writeTy;
	}

	public Location getLocation()
	{
		return location;
	}

	/**
	 * The read type, or the write type for a write-only member.
	 */
	public TypeId type()
	{
		return readTy != null ? readTy : writeTy;
	}
}
