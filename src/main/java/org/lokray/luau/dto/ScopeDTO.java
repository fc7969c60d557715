package org.lokray.luau.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ScopeDTO
{
	public int index;
	public Integer parent;
	public String location;
	public Map<String, String> bindings = new LinkedHashMap<>();
	public List<String> typeAliases = new ArrayList<>();
	public String returnType;
	public List<Integer> children = new ArrayList<>();
}
