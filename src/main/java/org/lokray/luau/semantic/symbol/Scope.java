package org.lokray.luau.semantic.symbol;

import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;
import org.lokray.luau.util.InternalCompilerError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A lexical region with its value bindings, type aliases and the current type of every
 * definition written or narrowed inside it. Lookups walk the parent chain.
 */
public class Scope
{
	private final Scope parent;
	private final List<Scope> children = new ArrayList<>();
	private Location location = Location.NONE;

	// --- Values ---
	private final Map<Symbol, Binding> bindings = new LinkedHashMap<>();
	private final Map<Def, TypeId> lvalueTypes = new LinkedHashMap<>();
	private final Map<Def, TypeId> rvalueRefinements = new LinkedHashMap<>();

	// --- Types ---
	private final Map<String, TypeFun> exportedTypeBindings = new LinkedHashMap<>();
	private final Map<String, TypeFun> privateTypeBindings = new LinkedHashMap<>();
	private final Map<String, TypePackId> privateTypePackBindings = new LinkedHashMap<>();
	private final Map<String, Location> typeAliasLocations = new LinkedHashMap<>();
	private final Map<String, Map<String, TypeFun>> importedTypeBindings = new LinkedHashMap<>();
	private final Map<String, String> importedModules = new LinkedHashMap<>();
	// Generic parameters of the aliases declared directly in this scope, reused across passes
	private final Map<String, TypeId> typeAliasTypeParameters = new LinkedHashMap<>();
	private final Map<String, TypePackId> typeAliasTypePackParameters = new LinkedHashMap<>();

	private TypePackId returnType;
	private TypePackId varargPack;

	/**
	 * Creates a top-level scope with no parent.
	 */
	public Scope(TypePackId returnType)
	{
		this.parent = null;
		this.returnType = returnType;
	}

	/**
	 * Creates a nested scope. The caller links it into {@code parent} with {@link #addChild}.
	 */
	public Scope(Scope parent)
	{
		this.parent = parent;
		this.returnType = parent.returnType;
		this.varargPack = parent.varargPack;
	}

	public void addChild(Scope child)
	{
		if (child.parent != this)
		{
			throw new InternalCompilerError("Scope is not a child of this scope");
		}
		for (Scope existing : children)
		{
			if (existing == child)
			{
				throw new InternalCompilerError("Scope registered twice as a child");
			}
		}
		children.add(child);
	}

	// --- Binding lookups ---

	public Optional<TypeId> lookup(Symbol symbol)
	{
		return lookupEx(symbol).map(found -> found.binding().getTypeId());
	}

	public Optional<BindingLookup> lookupEx(Symbol symbol)
	{
		for (Scope s = this; s != null; s = s.parent)
		{
			Binding binding = s.bindings.get(symbol);
			if (binding != null)
			{
				return Optional.of(new BindingLookup(binding, s));
			}
		}
		return Optional.empty();
	}

	// --- Definition lookups ---

	/**
	 * The narrowed type of {@code def} if any scope up the chain refined it, otherwise its
	 * current assigned type.
	 */
	public Optional<TypeId> lookup(Def def)
	{
		for (Scope s = this; s != null; s = s.parent)
		{
			TypeId refined = s.rvalueRefinements.get(def);
			if (refined != null)
			{
				return Optional.of(refined);
			}
			TypeId assigned = s.lvalueTypes.get(def);
			if (assigned != null)
			{
				return Optional.of(assigned);
			}
		}
		return Optional.empty();
	}

	public Optional<TypeId> lookupUnrefinedType(Def def)
	{
		for (Scope s = this; s != null; s = s.parent)
		{
			TypeId assigned = s.lvalueTypes.get(def);
			if (assigned != null)
			{
				return Optional.of(assigned);
			}
		}
		return Optional.empty();
	}

	public Optional<DefLookup> lookupEx(Def def)
	{
		for (Scope s = this; s != null; s = s.parent)
		{
			TypeId assigned = s.lvalueTypes.get(def);
			if (assigned != null)
			{
				return Optional.of(new DefLookup(assigned, s));
			}
			TypeId refined = s.rvalueRefinements.get(def);
			if (refined != null)
			{
				return Optional.of(new DefLookup(refined, s));
			}
		}
		return Optional.empty();
	}

	// --- Type lookups ---

	public Optional<TypeFun> lookupType(String name)
	{
		for (Scope s = this; s != null; s = s.parent)
		{
			TypeFun privateType = s.privateTypeBindings.get(name);
			if (privateType != null)
			{
				return Optional.of(privateType);
			}
			TypeFun exportedType = s.exportedTypeBindings.get(name);
			if (exportedType != null)
			{
				return Optional.of(exportedType);
			}
		}
		return Optional.empty();
	}

	public Optional<TypeFun> lookupImportedType(String moduleAlias, String name)
	{
		for (Scope s = this; s != null; s = s.parent)
		{
			Map<String, TypeFun> imported = s.importedTypeBindings.get(moduleAlias);
			if (imported != null)
			{
				return Optional.ofNullable(imported.get(name));
			}
		}
		return Optional.empty();
	}

	public Optional<TypePackId> lookupPack(String name)
	{
		for (Scope s = this; s != null; s = s.parent)
		{
			TypePackId pack = s.privateTypePackBindings.get(name);
			if (pack != null)
			{
				return Optional.of(pack);
			}
		}
		return Optional.empty();
	}

	// --- Merging child state ---

	/**
	 * Copies every assignment made in {@code child} into this scope.
	 */
	public void inheritAssignments(Scope child)
	{
		lvalueTypes.putAll(child.lvalueTypes);
	}

	/**
	 * Copies the narrowings made in {@code child} for definitions this scope already knows.
	 */
	public void inheritRefinements(Scope child)
	{
		for (Map.Entry<Def, TypeId> entry : child.rvalueRefinements.entrySet())
		{
			if (lookup(entry.getKey()).isPresent())
			{
				rvalueRefinements.put(entry.getKey(), entry.getValue());
			}
		}
	}

	/**
	 * True if {@code left} is {@code right} or one of its ancestors.
	 */
	public static boolean subsumes(Scope left, Scope right)
	{
		for (Scope s = right; s != null; s = s.parent)
		{
			if (s == left)
			{
				return true;
			}
		}
		return false;
	}

	// --- Getters ---

	public Scope getParent()
	{
		return parent;
	}

	public List<Scope> getChildren()
	{
		return Collections.unmodifiableList(children);
	}

	public Location getLocation()
	{
		return location;
	}

	public void setLocation(Location location)
	{
		this.location = location;
	}

	public Map<Symbol, Binding> getBindings()
	{
		return bindings;
	}

	public Map<Def, TypeId> getLvalueTypes()
	{
		return lvalueTypes;
	}

	public Map<Def, TypeId> getRvalueRefinements()
	{
		return rvalueRefinements;
	}

	public Map<String, TypeFun> getExportedTypeBindings()
	{
		return exportedTypeBindings;
	}

	public Map<String, TypeFun> getPrivateTypeBindings()
	{
		return privateTypeBindings;
	}

	public Map<String, TypePackId> getPrivateTypePackBindings()
	{
		return privateTypePackBindings;
	}

	public Map<String, Location> getTypeAliasLocations()
	{
		return typeAliasLocations;
	}

	public Map<String, Map<String, TypeFun>> getImportedTypeBindings()
	{
		return importedTypeBindings;
	}

	public Map<String, String> getImportedModules()
	{
		return importedModules;
	}

	public Map<String, TypeId> getTypeAliasTypeParameters()
	{
		return typeAliasTypeParameters;
	}

	public Map<String, TypePackId> getTypeAliasTypePackParameters()
	{
		return typeAliasTypePackParameters;
	}

	public TypePackId getReturnType()
	{
		return returnType;
	}

	public void setReturnType(TypePackId returnType)
	{
		this.returnType = returnType;
	}

	public TypePackId getVarargPack()
	{
		return varargPack;
	}

	public void setVarargPack(TypePackId varargPack)
	{
		this.varargPack = varargPack;
	}

	public record BindingLookup(Binding binding, Scope scope)
	{
	}

	public record DefLookup(TypeId type, Scope scope)
	{
	}
}
