package stablematching;

import akka.actor.ActorRef;
import akka.event.EventStream;
import akka.event.LoggingAdapter;
import stablematching.Messages.ProtocolMessage;

/**
 * Channel over Akka actor references. Local Akka delivery between one sender and one
 * receiver is reliable and keeps send order, and the receiving actor's mailbox is the
 * single inbound queue every message type goes through.
 *
 * Each send is also logged as a trace line and published on the event stream as a TraceEvent.
 */
final class ActorChannel implements Channel {
	private final ProcessAddress self;
	private final ActorRef selfRef;
	private final Peers peers;
	private final EventStream events;
	private final LoggingAdapter log;

	ActorChannel(ProcessAddress self, ActorRef selfRef, Peers peers, EventStream events, LoggingAdapter log) {
		this.self = self;
		this.selfRef = selfRef;
		this.peers = peers;
		this.events = events;
		this.log = log;
	}

	@Override
	public void send(ProcessAddress to, ProtocolMessage message) {
		ActorRef target = peers.resolve(to);
		MessageType type = message.type();
		if (type.isTraced()) {
			log.info("{} {} {}", self, type.verb(), to);
		} else if (log.isDebugEnabled()) {
			log.debug("{} {} {}", self, type.verb(), to);
		}
		//published first so an observer has the event before the receiver can react to it
		events.publish(new TraceEvent(peers.run(), type, self, to));
		target.tell(message, selfRef);
	}
}
