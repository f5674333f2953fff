package bclift.lift;

import bclift.symbol.FormalInfo;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A function to lift: its instructions in address order, and its formals.
 */
public final class FunctionUnit {
	private final String name;
	private final ImmutableList<FunctionInstruction> instructions;
	private final ImmutableList<FormalInfo> formals;
	private final String stackPointer;

	public FunctionUnit(String name, List<FunctionInstruction> instructions, List<FormalInfo> formals, String stackPointer) {
		this.name = name;
		this.instructions = ImmutableList.copyOf(instructions);
		this.formals = ImmutableList.copyOf(formals);
		this.stackPointer = stackPointer;
	}

	public FunctionUnit(String name, List<FunctionInstruction> instructions, List<FormalInfo> formals) {
		this(name, instructions, formals, LiftEngine.DEFAULT_STACK_POINTER);
	}

	public String getName() {
		return this.name;
	}

	public ImmutableList<FunctionInstruction> getInstructions() {
		return this.instructions;
	}

	public ImmutableList<FormalInfo> getFormals() {
		return this.formals;
	}

	public String getStackPointer() {
		return this.stackPointer;
	}

	@Override
	public String toString() {
		return this.name + "()";
	}
}
