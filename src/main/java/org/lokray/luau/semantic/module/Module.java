package org.lokray.luau.semantic.module;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstNode;
import org.lokray.luau.ast.AstType;
import org.lokray.luau.ast.AstTypePack;
import org.lokray.luau.ast.Location;
import org.lokray.luau.ast.Position;
import org.lokray.luau.semantic.error.TypeError;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.TypeFun;
import org.lokray.luau.semantic.type.TypeArena;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything constraint generation records about one module: the per-node annotations later
 * passes read, the scopes, the module's exports and the diagnostics.
 */
public class Module
{
	private final String name;
	private final TypeArena internalTypes = new TypeArena();

	// --- Per-node annotations ---
	private final Map<AstExpr, TypeId> astTypes = new LinkedHashMap<>();
	private final Map<AstExpr, TypePackId> astTypePacks = new LinkedHashMap<>();
	private final Map<AstExpr, TypeId> astExpectedTypes = new LinkedHashMap<>();
	private final Map<AstExpr, TypeId> astOriginalCallTypes = new LinkedHashMap<>();
	private final Map<AstExpr, TypeId> astOverloadResolvedTypes = new LinkedHashMap<>();
	private final Map<AstType, TypeId> astResolvedTypes = new LinkedHashMap<>();
	private final Map<AstTypePack, TypePackId> astResolvedTypePacks = new LinkedHashMap<>();
	private final Map<AstNode, Scope> astScopes = new LinkedHashMap<>();
	private final Map<AstExpr, TypeId> astForInNextTypes = new LinkedHashMap<>();

	// --- Module surface ---
	private final Map<String, TypeId> declaredGlobals = new LinkedHashMap<>();
	private final Map<String, TypeFun> exportedTypeBindings = new LinkedHashMap<>();
	private final List<ScopeEntry> scopes = new ArrayList<>();
	private final List<TypeError> errors = new ArrayList<>();

	public Module(String name)
	{
		this.name = name;
	}

	/**
	 * The innermost scope whose location contains {@code position}.
	 */
	public Optional<Scope> findScopeAtPosition(Position position)
	{
		Location bestLocation = null;
		Scope bestScope = null;
		for (ScopeEntry entry : scopes)
		{
			Location location = entry.location();
			if (!location.contains(position))
			{
				continue;
			}
			if (bestLocation == null || location.getBegin().compareTo(bestLocation.getBegin()) >= 0)
			{
				bestLocation = location;
				bestScope = entry.scope();
			}
		}
		return Optional.ofNullable(bestScope);
	}

	/**
	 * The module's root scope; empty before generation has started.
	 */
	public Optional<Scope> getModuleScope()
	{
		return scopes.isEmpty() ? Optional.empty() : Optional.of(scopes.get(0).scope());
	}

	// --- Getters ---

	public String getName()
	{
		return name;
	}

	public TypeArena getInternalTypes()
	{
		return internalTypes;
	}

	public Map<AstExpr, TypeId> getAstTypes()
	{
		return astTypes;
	}

	public Map<AstExpr, TypePackId> getAstTypePacks()
	{
		return astTypePacks;
	}

	public Map<AstExpr, TypeId> getAstExpectedTypes()
	{
		return astExpectedTypes;
	}

	public Map<AstExpr, TypeId> getAstOriginalCallTypes()
	{
		return astOriginalCallTypes;
	}

	public Map<AstExpr, TypeId> getAstOverloadResolvedTypes()
	{
		return astOverloadResolvedTypes;
	}

	public Map<AstType, TypeId> getAstResolvedTypes()
	{
		return astResolvedTypes;
	}

	public Map<AstTypePack, TypePackId> getAstResolvedTypePacks()
	{
		return astResolvedTypePacks;
	}

	public Map<AstNode, Scope> getAstScopes()
	{
		return astScopes;
	}

	public Map<AstExpr, TypeId> getAstForInNextTypes()
	{
		return astForInNextTypes;
	}

	public Map<String, TypeId> getDeclaredGlobals()
	{
		return declaredGlobals;
	}

	public Map<String, TypeFun> getExportedTypeBindings()
	{
		return exportedTypeBindings;
	}

	public List<ScopeEntry> getScopes()
	{
		return scopes;
	}

	public List<TypeError> getErrors()
	{
		return errors;
	}

	public record ScopeEntry(Location location, Scope scope)
	{
	}
}
