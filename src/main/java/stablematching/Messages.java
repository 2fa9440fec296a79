/*
 * Stable Matching - message classes
 *
 * Every message exchanged during a run. The protocol messages (PROPOSAL, ACCEPT, REJECT,
 * BREAKUP, ENGAGED_NOTIFY, TERMINATE) carry their type tag and the address of the process
 * that sent them. The control messages are only used between a MatchingSession and the
 * processes it creates: setting them up, starting the proposers and collecting the
 * final partners.
 */
package stablematching;

import java.io.Serializable;

public final class Messages {

	private Messages() {
	}

	//---------------------PROTOCOL MESSAGES---------------------
	/**
	 * Base of every protocol message: a type tag plus the sender's address.
	 */
	public static abstract class ProtocolMessage implements Serializable {
		private static final long serialVersionUID = 1L;
		public final ProcessAddress sender;

		protected ProtocolMessage(ProcessAddress sender) {
			this.sender = sender;
		}

		public abstract MessageType type();

		@Override
		public String toString() {
			return type() + " from " + sender;
		}
	}

	/**
	 * Sent by a proposer to the next acceptor on its preference list,
	 * the payload is the proposer's own id
	 */
	public static class Proposal extends ProtocolMessage {
		private static final long serialVersionUID = 1L;
		public final int proposerId;

		public Proposal(int proposerId) {
			super(ProcessAddress.proposer(proposerId));
			this.proposerId = proposerId;
		}

		@Override
		public MessageType type() {
			return MessageType.PROPOSAL;
		}
	}

	/**
	 * Everything an acceptor sends carries the acceptor's id so the receiver can tell
	 * a response to its pending proposal apart from a breakup by an earlier partner.
	 */
	public static abstract class AcceptorMessage extends ProtocolMessage {
		private static final long serialVersionUID = 1L;
		public final int acceptorId;

		protected AcceptorMessage(int acceptorId) {
			super(ProcessAddress.acceptor(acceptorId));
			this.acceptorId = acceptorId;
		}
	}

	/** proposal accepted */
	public static class Accept extends AcceptorMessage {
		private static final long serialVersionUID = 1L;

		public Accept(int acceptorId) {
			super(acceptorId);
		}

		@Override
		public MessageType type() {
			return MessageType.ACCEPT;
		}
	}

	/** proposal rejected, the proposer moves on to his next candidate */
	public static class Reject extends AcceptorMessage {
		private static final long serialVersionUID = 1L;

		public Reject(int acceptorId) {
			super(acceptorId);
		}

		@Override
		public MessageType type() {
			return MessageType.REJECT;
		}
	}

	/** the acceptor has left this proposer for someone she ranks higher */
	public static class Breakup extends AcceptorMessage {
		private static final long serialVersionUID = 1L;

		public Breakup(int acceptorId) {
			super(acceptorId);
		}

		@Override
		public MessageType type() {
			return MessageType.BREAKUP;
		}
	}

	/** sent to the coordinator once per acceptor, on her first ACCEPT */
	public static class EngagedNotify extends AcceptorMessage {
		private static final long serialVersionUID = 1L;

		public EngagedNotify(int acceptorId) {
			super(acceptorId);
		}

		@Override
		public MessageType type() {
			return MessageType.ENGAGED_NOTIFY;
		}
	}

	/** broadcast by the coordinator once every acceptor has been engaged */
	public static class Terminate extends ProtocolMessage {
		private static final long serialVersionUID = 1L;

		public Terminate() {
			super(ProcessAddress.COORDINATOR);
		}

		@Override
		public MessageType type() {
			return MessageType.TERMINATE;
		}
	}

	//---------------------CONTROL MESSAGES---------------------
	/**
	 * Sent by the session to every process before the run starts, hands over the
	 * address book of the run. Each process answers with a Ready.
	 */
	public static class Setup implements Serializable {
		private static final long serialVersionUID = 1L;
		public final Peers peers;

		public Setup(Peers peers) {
			this.peers = peers;
		}
	}

	/**
	 * Reply to Setup, once every process is ready the session starts the proposers
	 */
	public static class Ready implements Serializable {
		private static final long serialVersionUID = 1L;
		public final ProcessAddress process;

		public Ready(ProcessAddress process) {
			this.process = process;
		}
	}

	/**
	 * Tells a proposer it can send its first proposal
	 */
	public static class Start implements Serializable {
		private static final long serialVersionUID = 1L;
	}

	/**
	 * Sent by every proposer and acceptor to the session on TERMINATE,
	 * partner is -1 if the process ended up without one
	 */
	public static class FinalPartner implements Serializable {
		private static final long serialVersionUID = 1L;
		public final ProcessAddress process;
		public final int partner;
		public final int proposalsSent;

		public FinalPartner(ProcessAddress process, int partner, int proposalsSent) {
			this.process = process;
			this.partner = partner;
			this.proposalsSent = proposalsSent;
		}
	}

	/**
	 * Asks a fresh session to run the protocol, answered with a MatchingResult
	 * or a Status.Failure carrying the reason the run was aborted
	 */
	public static class Solve implements Serializable {
		private static final long serialVersionUID = 1L;
	}
}
