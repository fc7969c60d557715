package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.semantic.constraint.PackSubtypeConstraint;
import org.lokray.luau.semantic.symbol.Binding;
import org.lokray.luau.semantic.symbol.GenericTypeDefinition;
import org.lokray.luau.semantic.symbol.GenericTypePackDefinition;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.type.AnyType;
import org.lokray.luau.semantic.type.BoundType;
import org.lokray.luau.semantic.type.BoundTypePack;
import org.lokray.luau.semantic.type.FreeType;
import org.lokray.luau.semantic.type.FunctionArgument;
import org.lokray.luau.semantic.type.FunctionDefinition;
import org.lokray.luau.semantic.type.FunctionType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePack;
import org.lokray.luau.semantic.type.TypePackId;
import org.lokray.luau.semantic.type.TypeUtils;
import org.lokray.luau.semantic.type.UnionType;
import org.lokray.luau.semantic.type.VariadicTypePack;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds function types from function literals and checks their bodies.
 */
class SignatureBuilder
{
	private final ConstraintGenerator gen;

	SignatureBuilder(ConstraintGenerator gen)
	{
		this.gen = gen;
	}

	/**
	 * Creates the signature and body scopes of {@code fn} and its function type. Parameters
	 * without annotations take their types from {@code expectedType} when it is a function,
	 * otherwise they get fresh types.
	 *
	 * @param originalName location of the name the function is assigned to, or null
	 */
	FunctionSignature checkFunctionSignature(Scope parent, AstExpr.Function fn, TypeId expectedType, Location originalName)
	{
		TypeId expected = expectedType == null ? null : expectedType.follow();

		Scope signatureScope = gen.childScope(fn, parent);
		TypePackId returnType = gen.freshTypePack(signatureScope);
		signatureScope.setReturnType(returnType);
		Scope bodyScope = gen.childScope(fn.body, signatureScope);

		List<TypeId> genericTypes = new ArrayList<>();
		List<TypePackId> genericTypePacks = new ArrayList<>();
		if (!fn.generics.isEmpty() || !fn.genericPacks.isEmpty())
		{
			for (GenericTypeDefinition def : gen.types.createGenerics(signatureScope, fn.generics, false, true).values())
			{
				genericTypes.add(def.ty());
			}
			for (GenericTypePackDefinition def : gen.types.createGenericPacks(signatureScope, fn.genericPacks, false, true).values())
			{
				genericTypePacks.add(def.tp());
			}
			// Explicit generics take precedence over anything the context suggests.
			expected = null;
		}

		FunctionType expectedFunction = expectedFunctionOf(expected);
		TypePack expectedArgPack = null;
		if (expectedFunction != null)
		{
			expectedArgPack = TypeUtils.extendTypePack(expectedFunction.getArgTypes(), fn.args.size());
			genericTypes = new ArrayList<>(expectedFunction.getGenerics());
			genericTypePacks = new ArrayList<>(expectedFunction.getGenericPacks());
		}

		List<TypeId> argTypes = new ArrayList<>();
		List<FunctionArgument> argNames = new ArrayList<>();

		if (fn.self != null)
		{
			TypeId selfType = gen.freshType(signatureScope);
			argTypes.add(selfType);
			argNames.add(new FunctionArgument("self", fn.self.location));
			bindParameter(signatureScope, fn.self, selfType);
		}

		for (int i = 0; i < fn.args.size(); i++)
		{
			AstLocal local = fn.args.get(i);
			TypeId argTy;
			if (local.annotation != null)
			{
				argTy = gen.types.resolveType(signatureScope, local.annotation, false, true);
			}
			else if (expectedArgPack != null && i < expectedArgPack.getHead().size())
			{
				argTy = expectedArgPack.getHead().get(i);
			}
			else
			{
				argTy = gen.freshType(signatureScope);
			}
			argTypes.add(argTy);
			argNames.add(new FunctionArgument(local.name, local.location));
			bindParameter(signatureScope, local, argTy);
		}

		TypePackId varargPack;
		if (fn.vararg)
		{
			if (fn.varargAnnotation != null)
			{
				varargPack = gen.types.resolveTypePack(signatureScope, fn.varargAnnotation, false, true);
			}
			else if (expectedArgPack != null && expectedArgPack.getTail() != null
					&& expectedArgPack.getTail().follow().is(VariadicTypePack.class))
			{
				varargPack = expectedArgPack.getTail();
			}
			else
			{
				varargPack = gen.builtinTypes.anyTypePack;
			}
			signatureScope.setVarargPack(varargPack);
			bodyScope.setVarargPack(varargPack);
		}
		else
		{
			varargPack = gen.arena.addTypePack(new VariadicTypePack(gen.builtinTypes.anyType, true));
			// A function without ... cannot read the varargs of an enclosing function.
			signatureScope.setVarargPack(null);
			bodyScope.setVarargPack(null);
		}

		if (fn.returnAnnotation != null)
		{
			TypePackId annotatedRetType = gen.types.resolveTypePack(signatureScope, fn.returnAnnotation, false, true);
			returnType.emplace(new BoundTypePack(annotatedRetType));
		}
		else if (expectedFunction != null)
		{
			returnType.emplace(new BoundTypePack(expectedFunction.getRetTypes()));
		}

		TypePackId argPack = gen.addTypePack(argTypes, varargPack);
		FunctionType actualFunction = new FunctionType(parent, argPack, returnType);
		actualFunction.getGenerics().addAll(genericTypes);
		actualFunction.getGenericPacks().addAll(genericTypePacks);
		actualFunction.getArgNames().addAll(argNames);
		actualFunction.setHasSelf(fn.self != null);
		actualFunction.setDefinition(new FunctionDefinition(
				gen.module.getName(),
				fn.location,
				fn.vararg ? fn.varargLocation : null,
				originalName != null ? originalName : Location.at(fn.location.getBegin())));

		TypeId actualFunctionType = gen.addType(actualFunction);
		gen.module.getAstTypes().put(fn, actualFunctionType);

		if (expected != null && expected.is(FreeType.class))
		{
			bindFreeType(expected, actualFunctionType);
		}

		return new FunctionSignature(actualFunctionType, signatureScope, bodyScope);
	}

	/**
	 * Visits the body of {@code fn} in its body scope. A body that can fall off its end
	 * returns nothing.
	 */
	void checkFunctionBody(Scope scope, AstExpr.Function fn)
	{
		ControlFlow cf = gen.statements.visitBlockWithoutChildScope(scope, fn.body);
		if (cf == ControlFlow.NONE)
		{
			gen.addConstraint(scope, fn.location, new PackSubtypeConstraint(gen.builtinTypes.emptyTypePack, scope.getReturnType()));
		}
	}

	private void bindParameter(Scope signatureScope, AstLocal local, TypeId ty)
	{
		signatureScope.getBindings().put(Symbol.local(local), new Binding(ty, local.location));
		Def def = gen.dfg.getDef(local);
		signatureScope.getLvalueTypes().put(def, ty);
		signatureScope.getRvalueRefinements().put(def, ty);
	}

	private FunctionType expectedFunctionOf(TypeId expected)
	{
		if (expected == null)
		{
			return null;
		}
		if (TypeUtils.isOptional(expected) && !expected.is(AnyType.class))
		{
			UnionType union = expected.get(UnionType.class);
			if (union != null)
			{
				for (TypeId option : union.getOptions())
				{
					FunctionType fn = option.follow().get(FunctionType.class);
					if (fn != null)
					{
						return fn;
					}
				}
			}
			return null;
		}
		return expected.get(FunctionType.class);
	}

	/**
	 * Unifies the expected free type with the function just built, binding whichever side
	 * belongs to the inner scope.
	 */
	private void bindFreeType(TypeId a, TypeId b)
	{
		FreeType af = a.get(FreeType.class);
		FreeType bf = b.get(FreeType.class);

		if (af == null && bf == null)
		{
			return;
		}
		if (af == null)
		{
			b.emplace(new BoundType(a));
			return;
		}
		if (bf == null)
		{
			a.emplace(new BoundType(b));
			return;
		}
		if (Scope.subsumes(bf.getScope(), af.getScope()))
		{
			a.emplace(new BoundType(b));
		}
		else if (Scope.subsumes(af.getScope(), bf.getScope()))
		{
			b.emplace(new BoundType(a));
		}
	}
}
