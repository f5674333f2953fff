package bclift.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A function type.
 */
public final class FunType extends AbstractNode implements Typ {
	private final Typ returnType;
	private final ImmutableList<FunArg> args;
	private final boolean varArgs;

	FunType(int id, Typ returnType, List<FunArg> args, boolean varArgs) {
		super(id);
		this.returnType = returnType;
		this.args = ImmutableList.copyOf(args);
		this.varArgs = varArgs;
	}

	public Typ getReturnType() {
		return this.returnType;
	}

	public ImmutableList<FunArg> getArgs() {
		return this.args;
	}

	/**
	 * @return Whether the function is variadic.
	 */
	public boolean isVarArgs() {
		return this.varArgs;
	}

	@Override
	List<?> components() {
		return List.of(this.returnType, this.args, this.varArgs);
	}
}
