package stablematching;

import stablematching.Messages.Accept;
import stablematching.Messages.Breakup;
import stablematching.Messages.EngagedNotify;
import stablematching.Messages.ProtocolMessage;
import stablematching.Messages.Proposal;
import stablematching.Messages.Reject;

/**
 * State machine of one acceptor. Accepts the first proposal she gets, and after that
 * only trades up: a suitor she ranks strictly higher than her partner gets an ACCEPT
 * and the partner a BREAKUP, anyone else a REJECT. Her partner's rank therefore never
 * gets worse, and she never becomes free again once engaged.
 *
 * <p>The coordinator hears from her exactly once, on her first ACCEPT.
 *
 * <p>Not thread-safe, owned by a single actor.
 */
public final class Acceptor {
	public enum Status {
		FREE, ENGAGED, TERMINATED
	}

	public static final int NONE = -1;

	private final int id;
	private final ProcessAddress self;
	private final PreferenceTable preferences;
	private final Channel channel;

	private Status status = Status.FREE;
	private int partner = NONE;
	private boolean notifiedCoordinator;
	private int acceptances;

	public Acceptor(int id, PreferenceTable preferences, Channel channel) {
		this.id = id;
		this.self = ProcessAddress.acceptor(id);
		this.preferences = preferences;
		this.channel = channel;
	}

	/**
	 * Handles one inbound message. After TERMINATE the acceptor is frozen and
	 * ignores everything.
	 *
	 * @throws ProtocolViolationException if the message makes no sense for an acceptor
	 */
	public void receive(ProtocolMessage message) {
		if (status == Status.TERMINATED) {
			return;
		}
		switch (message.type()) {
			case PROPOSAL:
				onProposal((Proposal) message);
				break;
			case TERMINATE:
				status = Status.TERMINATED;
				break;
			default:
				throw new ProtocolViolationException(self, "cannot handle " + message);
		}
	}

	private void onProposal(Proposal proposal) {
		int suitor = proposal.proposerId;
		if (!preferences.contains(suitor)) {
			throw new ProtocolViolationException(self, "proposal from unknown proposer-" + suitor);
		}
		if (status == Status.FREE) {
			accept(suitor);
			if (notifiedCoordinator == false) {
				notifiedCoordinator = true;
				channel.send(ProcessAddress.COORDINATOR, new EngagedNotify(id));
			}
		} else if (suitor == partner) {
			throw new ProtocolViolationException(self, "second proposal from current partner proposer-" + suitor);
		} else if (preferences.prefers(suitor, partner)) {
			//suitor is preferred over current, dump the current AND accept the suitor
			channel.send(ProcessAddress.proposer(partner), new Breakup(id));
			accept(suitor);
		} else {
			channel.send(ProcessAddress.proposer(suitor), new Reject(id));
		}
	}

	private void accept(int suitor) {
		partner = suitor;
		status = Status.ENGAGED;
		acceptances++;
		channel.send(ProcessAddress.proposer(suitor), new Accept(id));
	}

	public int id() {
		return id;
	}

	public ProcessAddress address() {
		return self;
	}

	public Status status() {
		return status;
	}

	/** the proposer this acceptor is engaged to, or NONE */
	public int partner() {
		return partner;
	}

	public boolean hasNotifiedCoordinator() {
		return notifiedCoordinator;
	}

	/** number of ACCEPTs sent so far */
	public int acceptances() {
		return acceptances;
	}
}
