package org.lokray.luau.dto;

public class ErrorDTO
{
	public String moduleName;
	public String kind;
	public String message;
	public String location;
}
