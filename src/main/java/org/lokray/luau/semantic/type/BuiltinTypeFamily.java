package org.lokray.luau.semantic.type;

/**
 * Deferred type-level computations the solver reduces once their arguments are known.
 */
public enum BuiltinTypeFamily
{
	NOT("not"),
	LEN("len"),
	UNM("unm"),
	ADD("add"),
	SUB("sub"),
	MUL("mul"),
	DIV("div"),
	IDIV("idiv"),
	POW("pow"),
	MOD("mod"),
	CONCAT("concat"),
	AND("and"),
	OR("or"),
	LT("lt"),
	LE("le"),
	EQ("eq"),
	REFINE("refine"),
	UNION("union"),
	INTERSECT("intersect"),
	SINGLETON("singleton");

	private final String familyName;

	BuiltinTypeFamily(String familyName)
	{
		this.familyName = familyName;
	}

	public String getFamilyName()
	{
		return familyName;
	}
}
