package org.lokray.luau.dto;

import java.util.ArrayList;
import java.util.List;

public class ConstraintDTO
{
	public int index;
	public String kind;
	public String location;
	public int scope;
	public String payload;
	public List<Integer> dependencies = new ArrayList<>();
}
