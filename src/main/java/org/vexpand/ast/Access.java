package org.vexpand.ast;

/**
 * Whether a memory reference is read from or written to.
 */
public enum Access
{
	READ,
	WRITE
}
