package org.lokray.luau.semantic.type;

import org.lokray.luau.ast.Location;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.TypeFun;

import java.util.List;
import java.util.Map;

/**
 * The persistent builtin terms shared by every module. None of these handles may be mutated.
 */
public class BuiltinTypes
{
	private final TypeArena arena = new TypeArena(true);

	public final TypeId nilType;
	public final TypeId numberType;
	public final TypeId stringType;
	public final TypeId booleanType;
	public final TypeId threadType;
	public final TypeId bufferType;
	public final TypeId functionType;
	public final TypeId tableType;
	public final TypeId classType;
	public final TypeId trueType;
	public final TypeId falseType;
	public final TypeId anyType;
	public final TypeId unknownType;
	public final TypeId neverType;
	public final TypeId errorType;
	public final TypeId falsyType;
	public final TypeId truthyType;

	public final TypePackId emptyTypePack;
	public final TypePackId anyTypePack;
	public final TypePackId errorTypePack;

	public BuiltinTypes()
	{
		// --- Primitives ---
		nilType = arena.addType(PrimitiveType.NIL);
		numberType = arena.addType(PrimitiveType.NUMBER);
		stringType = arena.addType(PrimitiveType.STRING);
		booleanType = arena.addType(PrimitiveType.BOOLEAN);
		threadType = arena.addType(PrimitiveType.THREAD);
		bufferType = arena.addType(PrimitiveType.BUFFER);
		functionType = arena.addType(PrimitiveType.FUNCTION);
		tableType = arena.addType(PrimitiveType.TABLE);
		classType = arena.addType(new ClassType("class", null, null, "@luau", Location.NONE));

		// --- Singletons and top/bottom ---
		trueType = arena.addType(SingletonType.ofBoolean(true));
		falseType = arena.addType(SingletonType.ofBoolean(false));
		anyType = arena.addType(AnyType.INSTANCE);
		unknownType = arena.addType(UnknownType.INSTANCE);
		neverType = arena.addType(NeverType.INSTANCE);
		errorType = arena.addType(ErrorType.INSTANCE);

		falsyType = arena.addType(new UnionType(List.of(falseType, nilType)));
		truthyType = arena.addType(new NegationType(falsyType));

		// --- Packs ---
		emptyTypePack = arena.addTypePack(new TypePack(List.of(), null));
		anyTypePack = arena.addTypePack(new VariadicTypePack(anyType));
		errorTypePack = arena.addTypePack(ErrorTypePack.INSTANCE);
	}

	public TypeId errorRecoveryType()
	{
		return errorType;
	}

	public TypePackId errorRecoveryTypePack()
	{
		return errorTypePack;
	}

	public TypeId forPrimitive(PrimitiveType primitive)
	{
		if (primitive == PrimitiveType.NIL)
		{
			return nilType;
		}
		if (primitive == PrimitiveType.BOOLEAN)
		{
			return booleanType;
		}
		if (primitive == PrimitiveType.NUMBER)
		{
			return numberType;
		}
		if (primitive == PrimitiveType.STRING)
		{
			return stringType;
		}
		if (primitive == PrimitiveType.THREAD)
		{
			return threadType;
		}
		if (primitive == PrimitiveType.BUFFER)
		{
			return bufferType;
		}
		if (primitive == PrimitiveType.FUNCTION)
		{
			return functionType;
		}
		return tableType;
	}

	/**
	 * A fresh prelude scope that names the builtin types. Callers add their own global
	 * bindings before handing it to a generator.
	 */
	public Scope createGlobalScope()
	{
		Scope scope = new Scope(anyTypePack);
		for (Map.Entry<String, PrimitiveType> entry : PrimitiveType.getAllPrimitiveKeywords().entrySet())
		{
			// function and table are only reachable through type() results
			if (entry.getValue() != PrimitiveType.FUNCTION && entry.getValue() != PrimitiveType.TABLE)
			{
				scope.getExportedTypeBindings().put(entry.getKey(), new TypeFun(forPrimitive(entry.getValue())));
			}
		}
		scope.getExportedTypeBindings().put("any", new TypeFun(anyType));
		scope.getExportedTypeBindings().put("unknown", new TypeFun(unknownType));
		scope.getExportedTypeBindings().put("never", new TypeFun(neverType));
		return scope;
	}
}
