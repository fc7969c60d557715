package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstArgumentName;
import org.lokray.luau.ast.AstGenericType;
import org.lokray.luau.ast.AstGenericTypePack;
import org.lokray.luau.ast.AstType;
import org.lokray.luau.ast.AstTypeList;
import org.lokray.luau.ast.AstTypeOrPack;
import org.lokray.luau.ast.AstTypePack;
import org.lokray.luau.semantic.constraint.TypeAliasExpansionConstraint;
import org.lokray.luau.semantic.error.GenericError;
import org.lokray.luau.semantic.error.UnknownSymbol;
import org.lokray.luau.semantic.symbol.GenericTypeDefinition;
import org.lokray.luau.semantic.symbol.GenericTypePackDefinition;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.TypeFun;
import org.lokray.luau.semantic.type.FunctionArgument;
import org.lokray.luau.semantic.type.FunctionType;
import org.lokray.luau.semantic.type.GenericType;
import org.lokray.luau.semantic.type.GenericTypePack;
import org.lokray.luau.semantic.type.IntersectionType;
import org.lokray.luau.semantic.type.PendingExpansionType;
import org.lokray.luau.semantic.type.Property;
import org.lokray.luau.semantic.type.SingletonType;
import org.lokray.luau.semantic.type.TableIndexer;
import org.lokray.luau.semantic.type.TableState;
import org.lokray.luau.semantic.type.TableType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;
import org.lokray.luau.semantic.type.UnionType;
import org.lokray.luau.semantic.type.VariadicTypePack;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts type annotations into type terms.
 */
class TypeResolver implements AstType.Visitor<TypeId, TypeResolver.Request>, AstTypePack.Visitor<TypePackId, TypeResolver.Request>
{
	/**
	 * @param inTypeArguments       true while resolving the arguments of a generic alias, where
	 *                              expansion is left to the enclosing reference
	 * @param replaceErrorWithFresh resolve unknown names to fresh types instead of the error type
	 */
	record Request(Scope scope, boolean inTypeArguments, boolean replaceErrorWithFresh)
	{
	}

	private static final String MAGIC_ICE = "_luau_ice";
	private static final String MAGIC_PRINT = "_luau_print";

	private final ConstraintGenerator gen;

	TypeResolver(ConstraintGenerator gen)
	{
		this.gen = gen;
	}

	// --- Entry points ---

	TypeId resolveType(Scope scope, AstType type, boolean inTypeArguments)
	{
		return resolveType(scope, type, inTypeArguments, false);
	}

	TypeId resolveType(Scope scope, AstType type, boolean inTypeArguments, boolean replaceErrorWithFresh)
	{
		try (RecursionCounter.Entry entry = gen.recursion.enter())
		{
			if (entry.isExceeded())
			{
				gen.reportCodeTooComplex(type.location);
				return gen.builtinTypes.errorRecoveryType();
			}
			TypeId result = type.accept(this, new Request(scope, inTypeArguments, replaceErrorWithFresh));
			gen.module.getAstResolvedTypes().put(type, result);
			return result;
		}
	}

	TypePackId resolveTypePack(Scope scope, AstTypePack pack, boolean inTypeArguments)
	{
		return resolveTypePack(scope, pack, inTypeArguments, false);
	}

	TypePackId resolveTypePack(Scope scope, AstTypePack pack, boolean inTypeArguments, boolean replaceErrorWithFresh)
	{
		TypePackId result = pack.accept(this, new Request(scope, inTypeArguments, replaceErrorWithFresh));
		gen.module.getAstResolvedTypePacks().put(pack, result);
		return result;
	}

	TypePackId resolveTypePack(Scope scope, AstTypeList list, boolean inTypeArguments)
	{
		return resolveTypePack(scope, list, inTypeArguments, false);
	}

	TypePackId resolveTypePack(Scope scope, AstTypeList list, boolean inTypeArguments, boolean replaceErrorWithFresh)
	{
		List<TypeId> head = new ArrayList<>();
		for (AstType type : list.types)
		{
			head.add(resolveType(scope, type, inTypeArguments, replaceErrorWithFresh));
		}
		TypePackId tail = null;
		if (list.tailType != null)
		{
			tail = resolveTypePack(scope, list.tailType, inTypeArguments, replaceErrorWithFresh);
		}
		return gen.addTypePack(head, tail);
	}

	// --- Generics ---

	/**
	 * Declares the generic type parameters of an alias or function in {@code scope}. With
	 * {@code useCache} a parameter already created for the same name in the parent scope is
	 * reused, which keeps alias parameters stable between the alias prepass and the alias
	 * itself.
	 */
	Map<String, GenericTypeDefinition> createGenerics(Scope scope, List<AstGenericType> generics, boolean useCache, boolean addTypes)
	{
		Map<String, GenericTypeDefinition> result = new LinkedHashMap<>();
		Map<String, TypeId> cache = scope.getParent() != null ? scope.getParent().getTypeAliasTypeParameters() : scope.getTypeAliasTypeParameters();
		for (AstGenericType generic : generics)
		{
			TypeId genericTy = useCache ? cache.get(generic.name) : null;
			if (genericTy == null)
			{
				genericTy = gen.addType(new GenericType(scope, generic.name));
				cache.put(generic.name, genericTy);
			}

			TypeId defaultTy = null;
			if (generic.defaultValue != null)
			{
				defaultTy = resolveType(scope, generic.defaultValue, false);
			}

			if (addTypes)
			{
				scope.getPrivateTypeBindings().put(generic.name, new TypeFun(genericTy));
			}
			result.put(generic.name, new GenericTypeDefinition(genericTy, defaultTy));
		}
		return result;
	}

	Map<String, GenericTypePackDefinition> createGenericPacks(Scope scope, List<AstGenericTypePack> generics, boolean useCache, boolean addTypes)
	{
		Map<String, GenericTypePackDefinition> result = new LinkedHashMap<>();
		Map<String, TypePackId> cache = scope.getParent() != null ? scope.getParent().getTypeAliasTypePackParameters() : scope.getTypeAliasTypePackParameters();
		for (AstGenericTypePack generic : generics)
		{
			TypePackId genericTp = useCache ? cache.get(generic.name) : null;
			if (genericTp == null)
			{
				genericTp = gen.arena.addTypePack(new GenericTypePack(scope, generic.name));
				cache.put(generic.name, genericTp);
			}

			TypePackId defaultTp = null;
			if (generic.defaultValue != null)
			{
				defaultTp = resolveTypePack(scope, generic.defaultValue, false);
			}

			if (addTypes)
			{
				scope.getPrivateTypePackBindings().put(generic.name, genericTp);
			}
			result.put(generic.name, new GenericTypePackDefinition(genericTp, defaultTp));
		}
		return result;
	}

	// --- Types ---

	@Override
	public TypeId visitReference(AstType.Reference ref, Request req)
	{
		if (gen.options.isMagicTypes() && ref.prefix == null)
		{
			if (MAGIC_ICE.equals(ref.name))
			{
				throw gen.ice.ice("_luau_ice encountered", ref.location);
			}
			if (MAGIC_PRINT.equals(ref.name))
			{
				if (ref.parameters.size() != 1 || ref.parameters.get(0).type == null)
				{
					gen.reportError(ref.location, new GenericError("_luau_print requires one generic parameter"));
					return gen.builtinTypes.errorRecoveryType();
				}
				return resolveType(req.scope(), ref.parameters.get(0).type, req.inTypeArguments());
			}
		}

		Optional<TypeFun> alias = ref.prefix != null
				? req.scope().lookupImportedType(ref.prefix, ref.name)
				: req.scope().lookupType(ref.name);

		if (alias.isEmpty())
		{
			return req.replaceErrorWithFresh() ? gen.freshType(req.scope()) : gen.builtinTypes.errorRecoveryType();
		}

		TypeFun typeFun = alias.get();
		if (!typeFun.isGeneric())
		{
			return typeFun.getType();
		}

		List<TypeId> parameters = new ArrayList<>();
		List<TypePackId> packParameters = new ArrayList<>();
		for (AstTypeOrPack parameter : ref.parameters)
		{
			if (parameter.type != null)
			{
				parameters.add(resolveType(req.scope(), parameter.type, true));
			}
			else
			{
				packParameters.add(resolveTypePack(req.scope(), parameter.typePack, true));
			}
		}

		TypeId result = gen.addType(new PendingExpansionType(ref.prefix, ref.name, parameters, packParameters));
		// Arguments are expanded together with the reference that contains them.
		if (!req.inTypeArguments())
		{
			gen.addConstraint(req.scope(), ref.location, new TypeAliasExpansionConstraint(result));
		}
		return result;
	}

	@Override
	public TypeId visitTable(AstType.Table table, Request req)
	{
		Map<String, Property> props = new LinkedHashMap<>();
		for (AstType.TableProp prop : table.props)
		{
			TypeId propTy = resolveType(req.scope(), prop.type, req.inTypeArguments());
			switch (prop.access)
			{
				case READ -> props.put(prop.name, Property.readonly(propTy));
				case WRITE ->
				{
					gen.reportError(prop.location, new GenericError("write keyword is illegal here"));
					props.put(prop.name, Property.rw(propTy, prop.location));
				}
				default -> props.put(prop.name, Property.rw(propTy, prop.location));
			}
		}

		TableIndexer indexer = null;
		if (table.indexer != null)
		{
			switch (table.indexer.access)
			{
				case READ -> gen.reportError(table.indexer.location, new GenericError("read keyword is illegal here"));
				case WRITE -> gen.reportError(table.indexer.location, new GenericError("write keyword is illegal here"));
				default -> indexer = new TableIndexer(
						resolveType(req.scope(), table.indexer.indexType, req.inTypeArguments()),
						resolveType(req.scope(), table.indexer.resultType, req.inTypeArguments()));
			}
		}

		return gen.addType(new TableType(props, indexer, TableState.SEALED, req.scope()));
	}

	@Override
	public TypeId visitFunction(AstType.Function fn, Request req)
	{
		Scope signatureScope = req.scope();
		List<TypeId> genericTypes = new ArrayList<>();
		List<TypePackId> genericPacks = new ArrayList<>();

		if (!fn.generics.isEmpty() || !fn.genericPacks.isEmpty())
		{
			signatureScope = gen.childScope(fn, req.scope());
			for (GenericTypeDefinition def : createGenerics(signatureScope, fn.generics, false, true).values())
			{
				genericTypes.add(def.ty());
			}
			for (GenericTypePackDefinition def : createGenericPacks(signatureScope, fn.genericPacks, false, true).values())
			{
				genericPacks.add(def.tp());
			}
		}

		TypePackId argTypes = resolveTypePack(signatureScope, fn.argTypes, req.inTypeArguments(), req.replaceErrorWithFresh());
		TypePackId returnTypes = resolveTypePack(signatureScope, fn.returnTypes, req.inTypeArguments(), req.replaceErrorWithFresh());

		FunctionType ftv = new FunctionType(req.scope(), argTypes, returnTypes);
		ftv.getGenerics().addAll(genericTypes);
		ftv.getGenericPacks().addAll(genericPacks);
		ftv.setCheckedFunction(fn.checkedFunction);
		for (AstArgumentName argName : fn.argNames)
		{
			ftv.getArgNames().add(argName == null ? null : new FunctionArgument(argName.name, argName.location));
		}
		return gen.addType(ftv);
	}

	@Override
	public TypeId visitTypeof(AstType.Typeof type, Request req)
	{
		return gen.expressions.check(req.scope(), type.expr).ty();
	}

	@Override
	public TypeId visitUnion(AstType.Union union, Request req)
	{
		List<TypeId> options = new ArrayList<>();
		for (AstType part : union.types)
		{
			options.add(resolveType(req.scope(), part, req.inTypeArguments()));
		}
		return gen.addType(new UnionType(options));
	}

	@Override
	public TypeId visitIntersection(AstType.Intersection intersection, Request req)
	{
		List<TypeId> parts = new ArrayList<>();
		for (AstType part : intersection.types)
		{
			parts.add(resolveType(req.scope(), part, req.inTypeArguments()));
		}
		return gen.addType(new IntersectionType(parts));
	}

	@Override
	public TypeId visitSingletonBool(AstType.SingletonBool type, Request req)
	{
		return type.value ? gen.builtinTypes.trueType : gen.builtinTypes.falseType;
	}

	@Override
	public TypeId visitSingletonString(AstType.SingletonString type, Request req)
	{
		return gen.addType(SingletonType.ofString(type.value));
	}

	@Override
	public TypeId visitError(AstType.Error type, Request req)
	{
		return req.replaceErrorWithFresh() ? gen.freshType(req.scope()) : gen.builtinTypes.errorRecoveryType();
	}

	// --- Packs ---

	@Override
	public TypePackId visitExplicit(AstTypePack.Explicit pack, Request req)
	{
		return resolveTypePack(req.scope(), pack.typeList, req.inTypeArguments(), req.replaceErrorWithFresh());
	}

	@Override
	public TypePackId visitVariadic(AstTypePack.Variadic pack, Request req)
	{
		TypeId element = resolveType(req.scope(), pack.variadicType, req.inTypeArguments(), req.replaceErrorWithFresh());
		return gen.arena.addTypePack(new VariadicTypePack(element));
	}

	@Override
	public TypePackId visitGeneric(AstTypePack.Generic pack, Request req)
	{
		Optional<TypePackId> found = req.scope().lookupPack(pack.genericName);
		if (found.isPresent())
		{
			return found.get();
		}
		gen.reportError(pack.location, new UnknownSymbol(pack.genericName, UnknownSymbol.Context.TYPE));
		return gen.builtinTypes.errorRecoveryTypePack();
	}
}
