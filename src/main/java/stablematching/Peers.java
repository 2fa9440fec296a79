package stablematching;

import java.io.Serializable;

import akka.actor.ActorRef;

/**
 * Address book of one run: the actor behind every proposer, acceptor and the
 * coordinator. Handed to each process in its Setup message.
 */
public final class Peers implements Serializable {
	private static final long serialVersionUID = 1L;

	private final String run;
	private final ActorRef[] proposers;
	private final ActorRef[] acceptors;
	private final ActorRef coordinator;

	public Peers(String run, ActorRef[] proposers, ActorRef[] acceptors, ActorRef coordinator) {
		if (proposers.length != acceptors.length) {
			throw new InvalidConfigurationException("run " + run + " has " + proposers.length
					+ " proposers but " + acceptors.length + " acceptors");
		}
		this.run = run;
		//clones the arrays so we are not passing around a reference to the caller's copy
		this.proposers = proposers.clone();
		this.acceptors = acceptors.clone();
		this.coordinator = coordinator;
	}

	/** name of the run these peers belong to */
	public String run() {
		return run;
	}

	public int size() {
		return proposers.length;
	}

	/**
	 * Finds the actor behind an address.
	 *
	 * @throws CommunicationFailureException if no such process exists in this run
	 */
	public ActorRef resolve(ProcessAddress address) {
		ActorRef ref;
		switch (address.role()) {
			case PROPOSER:
				ref = lookup(proposers, address);
				break;
			case ACCEPTOR:
				ref = lookup(acceptors, address);
				break;
			default:
				ref = coordinator;
				break;
		}
		if (ref == null) {
			throw new CommunicationFailureException("no process " + address + " in run " + run);
		}
		return ref;
	}

	private static ActorRef lookup(ActorRef[] refs, ProcessAddress address) {
		int i = address.index();
		return i >= 0 && i < refs.length ? refs[i] : null;
	}
}
