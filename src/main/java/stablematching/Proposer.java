package stablematching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stablematching.Messages.AcceptorMessage;
import stablematching.Messages.ProtocolMessage;
import stablematching.Messages.Proposal;

/**
 * State machine of one proposer. Works down its preference list one proposal at a
 * time until an acceptor keeps it, and goes back to proposing whenever it is dumped.
 *
 * <p>The cursor only moves forward: past an acceptor who rejected this proposer and
 * past one who dumped it, so no acceptor is ever proposed to twice and the proposer
 * sends at most n proposals over the run. Every inbound message is dispatched on its
 * type, so a BREAKUP is handled whatever response the proposer is waiting for.
 *
 * <p>Not thread-safe, owned by a single actor.
 */
public final class Proposer {
	public enum Status {
		FREE, AWAITING_RESPONSE, ENGAGED, TERMINATED
	}

	public static final int NONE = -1;

	private static final Logger LOG = LoggerFactory.getLogger(Proposer.class);

	private final int id;
	private final ProcessAddress self;
	private final PreferenceTable preferences;
	private final Channel channel;

	private Status status = Status.FREE;
	//position in preferences of the next (or the pending, or the current) acceptor
	private int cursor;
	private int pending = NONE;
	private int partner = NONE;
	private int proposalsSent;
	private boolean terminateRequested;

	public Proposer(int id, PreferenceTable preferences, Channel channel) {
		this.id = id;
		this.self = ProcessAddress.proposer(id);
		this.preferences = preferences;
		this.channel = channel;
	}

	/**
	 * Sends the first proposal.
	 */
	public void start() {
		if (status != Status.FREE || proposalsSent > 0) {
			throw new ProtocolViolationException(self, "started twice");
		}
		proposeNext();
	}

	/**
	 * Handles one inbound message. After TERMINATE the proposer is frozen and
	 * ignores everything.
	 *
	 * @throws ProtocolViolationException if the message makes no sense in the current state
	 */
	public void receive(ProtocolMessage message) {
		if (status == Status.TERMINATED) {
			return;
		}
		switch (message.type()) {
			case ACCEPT:
				onAccept((AcceptorMessage) message);
				break;
			case REJECT:
				onReject((AcceptorMessage) message);
				break;
			case BREAKUP:
				onBreakup((AcceptorMessage) message);
				break;
			case TERMINATE:
				onTerminate();
				break;
			default:
				throw new ProtocolViolationException(self, "cannot handle " + message + " while " + status);
		}
	}

	private void proposeNext() {
		if (cursor >= preferences.size()) {
			throw new ProtocolViolationException(self, "exhausted all " + preferences.size()
					+ " candidates and is still free");
		}
		pending = preferences.candidateAt(cursor);
		status = Status.AWAITING_RESPONSE;
		proposalsSent++;
		channel.send(ProcessAddress.acceptor(pending), new Proposal(id));
	}

	private void onAccept(AcceptorMessage accept) {
		expectResponse(accept);
		partner = pending;
		pending = NONE;
		status = Status.ENGAGED;
		if (terminateRequested) {
			status = Status.TERMINATED;
		}
	}

	private void onReject(AcceptorMessage reject) {
		expectResponse(reject);
		if (terminateRequested) {
			throw new ProtocolViolationException(self, "rejected by acceptor-" + pending + " after TERMINATE");
		}
		pending = NONE;
		cursor++;
		status = Status.FREE;
		proposeNext();
	}

	private void expectResponse(AcceptorMessage response) {
		if (status != Status.AWAITING_RESPONSE || response.acceptorId != pending) {
			throw new ProtocolViolationException(self, "unexpected " + response + " while " + status
					+ (pending == NONE ? "" : " waiting on acceptor-" + pending));
		}
	}

	private void onBreakup(AcceptorMessage breakup) {
		if (status == Status.ENGAGED && breakup.acceptorId == partner) {
			//dumped, move past her and try the next one
			partner = NONE;
			cursor++;
			status = Status.FREE;
			proposeNext();
		} else if (status == Status.AWAITING_RESPONSE && breakup.acceptorId != pending) {
			//an earlier partner's breakup, already superseded; the pending proposal still stands
			LOG.warn("{} received a stale BREAKUP from acceptor-{} while waiting on acceptor-{}",
					self, breakup.acceptorId, pending);
		} else {
			throw new ProtocolViolationException(self, "unexpected " + breakup + " while " + status);
		}
	}

	/*
	 * The last ACCEPT of a run can still be in flight when TERMINATE arrives,
	 * in that case wait for it before freezing
	 */
	private void onTerminate() {
		if (status == Status.AWAITING_RESPONSE) {
			terminateRequested = true;
		} else {
			status = Status.TERMINATED;
		}
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

	/** the acceptor this proposer is engaged to, or NONE */
	public int partner() {
		return partner;
	}

	public int cursor() {
		return cursor;
	}

	public int proposalsSent() {
		return proposalsSent;
	}
}
