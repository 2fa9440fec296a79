package stablematching;

import java.io.Serializable;

/**
 * Names one process of a run: its role plus its index in that role's population.
 * The printed form (proposer-3, acceptor-0, coordinator) is also the actor name.
 */
public final class ProcessAddress implements Serializable {
	private static final long serialVersionUID = 1L;

	public static final ProcessAddress COORDINATOR = new ProcessAddress(Role.COORDINATOR, 0);

	private final Role role;
	private final int index;

	private ProcessAddress(Role role, int index) {
		this.role = role;
		this.index = index;
	}

	public static ProcessAddress proposer(int index) {
		return new ProcessAddress(Role.PROPOSER, index);
	}

	public static ProcessAddress acceptor(int index) {
		return new ProcessAddress(Role.ACCEPTOR, index);
	}

	public Role role() {
		return role;
	}

	public int index() {
		return index;
	}

	@Override
	public boolean equals(Object other) {
		if (other == this) return true;
		if (!(other instanceof ProcessAddress)) return false;
		ProcessAddress x = (ProcessAddress) other;
		return this.role == x.role && this.index == x.index;
	}

	@Override
	public int hashCode() {
		return role.hashCode() * 31 + index;
	}

	@Override
	public String toString() {
		if (role == Role.COORDINATOR) {
			return role.label();
		}
		return role.label() + "-" + index;
	}
}
