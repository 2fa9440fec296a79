package stablematching;

import stablematching.Messages.EngagedNotify;
import stablematching.Messages.ProtocolMessage;
import stablematching.Messages.Terminate;

/**
 * Detects the end of a run by counting. Every acceptor reports her first engagement
 * exactly once and never becomes free again, so n reports mean every acceptor holds a
 * distinct proposer and no breakup is left to happen. At that point TERMINATE goes to
 * every proposer and acceptor.
 */
public final class TerminationCoordinator {
	private final int size;
	private final Channel channel;
	private final boolean[] notified;
	private int engagedCount;
	private boolean terminated;

	public TerminationCoordinator(int size, Channel channel) {
		if (size <= 0) {
			throw new InvalidConfigurationException("population size must be positive, got " + size);
		}
		this.size = size;
		this.channel = channel;
		this.notified = new boolean[size];
	}

	/**
	 * @throws ProtocolViolationException on anything but a first ENGAGED_NOTIFY from a known acceptor
	 */
	public void receive(ProtocolMessage message) {
		if (!(message instanceof EngagedNotify)) {
			throw new ProtocolViolationException(ProcessAddress.COORDINATOR, "cannot handle " + message);
		}
		int acceptor = ((EngagedNotify) message).acceptorId;
		if (acceptor < 0 || acceptor >= size) {
			throw new ProtocolViolationException(ProcessAddress.COORDINATOR,
					"ENGAGED_NOTIFY from unknown acceptor-" + acceptor);
		}
		if (notified[acceptor]) {
			throw new ProtocolViolationException(ProcessAddress.COORDINATOR,
					"second ENGAGED_NOTIFY from acceptor-" + acceptor);
		}
		notified[acceptor] = true;
		engagedCount++;
		if (engagedCount == size) {
			broadcastTerminate();
		}
	}

	private void broadcastTerminate() {
		for (int i = 0; i < size; i++) {
			channel.send(ProcessAddress.proposer(i), new Terminate());
		}
		for (int i = 0; i < size; i++) {
			channel.send(ProcessAddress.acceptor(i), new Terminate());
		}
		terminated = true;
	}

	public int engagedCount() {
		return engagedCount;
	}

	public boolean isTerminated() {
		return terminated;
	}
}
