package org.vexpand.dto;

import com.google.gson.annotations.SerializedName;

public enum NodeKind
{
	@SerializedName("block") BLOCK,
	@SerializedName("assignment") ASSIGNMENT,
	@SerializedName("binary") BINARY_ARITHMETIC,
	@SerializedName("unary") UNARY_ARITHMETIC,
	@SerializedName("memory") MEMORY_VECTOR,
	@SerializedName("static") STATIC_VECTOR,
	@SerializedName("immediate") IMMEDIATE,
	@SerializedName("load") LOAD,
	@SerializedName("store") STORE,
	@SerializedName("arrayRead") ARRAY_READ,
	@SerializedName("arrayWrite") ARRAY_WRITE
}
