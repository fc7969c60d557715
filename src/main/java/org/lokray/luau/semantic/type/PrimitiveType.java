package org.lokray.luau.semantic.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType NIL = new PrimitiveType("nil");
	public static final PrimitiveType BOOLEAN = new PrimitiveType("boolean");
	public static final PrimitiveType NUMBER = new PrimitiveType("number");
	public static final PrimitiveType STRING = new PrimitiveType("string");
	public static final PrimitiveType THREAD = new PrimitiveType("thread");
	public static final PrimitiveType BUFFER = new PrimitiveType("buffer");
	public static final PrimitiveType FUNCTION = new PrimitiveType("function");
	public static final PrimitiveType TABLE = new PrimitiveType("table");

	// Names reported by type() / typeof() for each primitive
	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new LinkedHashMap<>();
		map.put("nil", NIL);
		map.put("boolean", BOOLEAN);
		map.put("number", NUMBER);
		map.put("string", STRING);
		map.put("thread", THREAD);
		map.put("buffer", BUFFER);
		map.put("function", FUNCTION);
		map.put("table", TABLE);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	public static Map<String, PrimitiveType> getAllPrimitiveKeywords()
	{
		return KEYWORD_TO_TYPE_MAP;
	}

	private final String name;

	private PrimitiveType(String name)
	{
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}
}
