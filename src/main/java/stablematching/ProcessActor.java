package stablematching;

import akka.actor.AbstractActor;
import akka.actor.ActorRef;
import akka.event.Logging;
import akka.event.LoggingAdapter;
import stablematching.Messages.Ready;
import stablematching.Messages.Setup;

/**
 * Abstract class that holds the setup handshake shared by the ProposerActor, AcceptorActor
 * and CoordinatorActor. Until a Setup arrives the actor only understands Setup; it then
 * builds its channel from the peers, answers Ready to whoever sent the Setup (the session)
 * and switches to the behaviour returned by {@link #running()}.
 */
public abstract class ProcessActor extends AbstractActor {
	protected final LoggingAdapter log = Logging.getLogger(getContext().getSystem(), this);
	protected final ProcessAddress address;
	//the session that set this process up, final reports go back to it
	protected ActorRef session;

	protected ProcessActor(ProcessAddress address) {
		this.address = address;
	}

	@Override
	public Receive createReceive() {
		return receiveBuilder()
				.match(Setup.class, this::onSetup)
				.build();
	}

	private void onSetup(Setup message) {
		this.session = getSender();
		Peers peers = message.peers;
		Channel channel = new ActorChannel(address, getSelf(), peers,
				getContext().getSystem().getEventStream(), log);
		setup(channel);
		log.debug("{} set up for run {}", address, peers.run());
		getContext().become(running());
		session.tell(new Ready(address), getSelf());
	}

	/** creates the process's state machine around the channel */
	protected abstract void setup(Channel channel);

	/** behaviour once set up */
	protected abstract Receive running();

	/** behaviour once the process has terminated: everything is dropped */
	protected Receive frozen() {
		return receiveBuilder()
				.matchAny(message -> log.debug("{} ignoring {} after TERMINATE", address, message))
				.build();
	}
}
